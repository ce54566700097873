package com.nana.contacts.service;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.importer.ParseDiagnostics.RowError;
import com.nana.contacts.importer.ValidationFinding;
import com.nana.contacts.importer.match.DuplicateMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ImportPreview - Everything the user needs to decide what to import.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   contacts           - every retained candidate, in file order
 *   duplicates         - probable matches with stored contacts
 *   validationWarnings - advisory findings; there are never blocking errors
 *   totalRows          - number of retained candidates
 *   parseWarnings      - unmapped columns and dropped rows
 *   parseErrors        - rows that could not be read at all
 * </pre>
 */
public final class ImportPreview {

    private final List<CandidateRecord>   contacts;
    private final List<DuplicateMatch>    duplicates;
    private final List<ValidationFinding> validationWarnings;
    private final List<String>            parseWarnings;
    private final List<RowError>          parseErrors;

    public ImportPreview(List<CandidateRecord> contacts,
                         List<DuplicateMatch> duplicates,
                         List<ValidationFinding> validationWarnings,
                         List<String> parseWarnings,
                         List<RowError> parseErrors) {
        this.contacts           = copy(contacts);
        this.duplicates         = copy(duplicates);
        this.validationWarnings = copy(validationWarnings);
        this.parseWarnings      = copy(parseWarnings);
        this.parseErrors        = copy(parseErrors);
    }

    public List<CandidateRecord> getContacts()              { return contacts; }
    public List<DuplicateMatch> getDuplicates()             { return duplicates; }
    public List<ValidationFinding> getValidationWarnings()  { return validationWarnings; }
    public List<String> getParseWarnings()                  { return parseWarnings; }
    public List<RowError> getParseErrors()                  { return parseErrors; }

    public int getTotalRows() {
        return contacts.size();
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(list));
    }

    @Override
    public String toString() {
        return "ImportPreview{totalRows=" + contacts.size()
               + ", duplicates=" + duplicates.size()
               + ", warnings=" + validationWarnings.size() + "}";
    }
}
