package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;

import java.util.List;
import java.util.Optional;

/**
 * ExactNameMatchStrategy - Equality of normalized full names.
 *
 * @see NameNormalizer#normalize(String)
 */
public class ExactNameMatchStrategy implements MatchStrategy {

    @Override
    public MatchType getMatchType() {
        return MatchType.NAME;
    }

    @Override
    public Optional<DuplicateMatch> findMatch(CandidateRecord candidate, List<Contact> existing) {
        String name = NameNormalizer.normalize(candidate.getFullName());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        for (Contact contact : existing) {
            if (name.equals(NameNormalizer.normalize(contact.getFullName()))) {
                return Optional.of(new DuplicateMatch(candidate, contact,
                        MatchType.NAME, MatchConfidence.EXACT, 1.0));
            }
        }
        return Optional.empty();
    }
}
