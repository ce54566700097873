package com.nana.contacts.service;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.importer.ImportDecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ExecuteRequest - The candidates of a previewed file plus the user's
 * decisions for them.
 */
public final class ExecuteRequest {

    private final List<CandidateRecord> contacts;
    private final List<ImportDecision>  actions;

    public ExecuteRequest(List<CandidateRecord> contacts, List<ImportDecision> actions) {
        this.contacts = contacts == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(contacts));
        this.actions  = actions == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public List<CandidateRecord> getContacts()  { return contacts; }
    public List<ImportDecision> getActions()    { return actions; }

    @Override
    public String toString() {
        return "ExecuteRequest{contacts=" + contacts.size()
               + ", actions=" + actions.size() + "}";
    }
}
