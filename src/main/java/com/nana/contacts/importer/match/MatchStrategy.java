package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;

import java.util.List;
import java.util.Optional;

/**
 * MatchStrategy - One pass of the duplicate detector.
 *
 * <p>The detector runs its strategies in order and hands each one only the
 * candidates no earlier pass matched. Implementations must be stateless.
 */
public interface MatchStrategy {

    /** @return the match type this pass reports */
    MatchType getMatchType();

    /**
     * Looks for the stored contact this candidate duplicates.
     *
     * @param candidate the incoming record
     * @param existing  all stored contacts, sorted by ascending id
     * @return the match, or empty when this pass finds none
     */
    Optional<DuplicateMatch> findMatch(CandidateRecord candidate, List<Contact> existing);
}
