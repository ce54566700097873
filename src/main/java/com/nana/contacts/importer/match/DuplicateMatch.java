package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;

/**
 * DuplicateMatch - Pairs an incoming candidate with the stored contact it
 * probably duplicates.
 *
 * <p>There is at most one match per candidate row.
 */
public final class DuplicateMatch {

    private final CandidateRecord candidate;
    private final Contact         existing;
    private final MatchType       matchType;
    private final MatchConfidence confidence;
    private final double          similarity;

    public DuplicateMatch(CandidateRecord candidate,
                          Contact existing,
                          MatchType matchType,
                          MatchConfidence confidence,
                          double similarity) {
        this.candidate  = candidate;
        this.existing   = existing;
        this.matchType  = matchType;
        this.confidence = confidence;
        this.similarity = similarity;
    }

    public CandidateRecord getCandidate()    { return candidate; }
    public Contact getExisting()             { return existing; }
    public long getExistingId()              { return existing.getId(); }
    public MatchType getMatchType()          { return matchType; }
    public MatchConfidence getConfidence()   { return confidence; }

    /** @return 1.0 for exact passes, the name similarity for fuzzy matches */
    public double getSimilarity()            { return similarity; }

    public int getRowNumber()                { return candidate.getRowNumber(); }

    @Override
    public String toString() {
        return "DuplicateMatch{row=" + candidate.getRowNumber()
               + ", existingId=" + existing.getId()
               + ", type=" + matchType
               + ", confidence=" + confidence
               + String.format(", similarity=%.2f", similarity) + "}";
    }
}
