package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;

import java.util.List;
import java.util.Optional;

/**
 * EmailMatchStrategy - Case-insensitive email equality.
 */
public class EmailMatchStrategy implements MatchStrategy {

    @Override
    public MatchType getMatchType() {
        return MatchType.EMAIL;
    }

    @Override
    public Optional<DuplicateMatch> findMatch(CandidateRecord candidate, List<Contact> existing) {
        String email = normalize(candidate.getEmail());
        if (email.isEmpty()) {
            return Optional.empty();
        }
        for (Contact contact : existing) {
            if (email.equals(normalize(contact.getEmail()))) {
                return Optional.of(new DuplicateMatch(candidate, contact,
                        MatchType.EMAIL, MatchConfidence.EXACT, 1.0));
            }
        }
        return Optional.empty();
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase();
    }
}
