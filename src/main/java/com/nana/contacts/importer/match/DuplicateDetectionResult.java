package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * DuplicateDetectionResult - Matches found plus the candidates left unmatched.
 */
public final class DuplicateDetectionResult {

    private final List<DuplicateMatch>  duplicates;
    private final List<CandidateRecord> unique;

    public DuplicateDetectionResult(List<DuplicateMatch> duplicates,
                                    List<CandidateRecord> unique) {
        this.duplicates = Collections.unmodifiableList(new ArrayList<>(duplicates));
        this.unique     = Collections.unmodifiableList(new ArrayList<>(unique));
    }

    /** @return matches in pass order, then candidate order */
    public List<DuplicateMatch> getDuplicates()   { return duplicates; }

    /** @return unmatched candidates in input order */
    public List<CandidateRecord> getUnique()      { return unique; }

    @Override
    public String toString() {
        return "DuplicateDetectionResult{duplicates=" + duplicates.size()
               + ", unique=" + unique.size() + "}";
    }
}
