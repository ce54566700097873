package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ParseResult - Candidates retained by the parser plus its diagnostics.
 */
public final class ParseResult {

    private final List<CandidateRecord> candidates;
    private final ParseDiagnostics      diagnostics;

    ParseResult(List<CandidateRecord> candidates, ParseDiagnostics diagnostics) {
        this.candidates  = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.diagnostics = diagnostics;
    }

    /** @return identifiable candidates in file order */
    public List<CandidateRecord> getCandidates() { return candidates; }

    public ParseDiagnostics getDiagnostics()     { return diagnostics; }

    @Override
    public String toString() {
        return "ParseResult{candidates=" + candidates.size()
               + ", " + diagnostics + "}";
    }
}
