package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import com.nana.contacts.repository.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * DuplicateDetector - Finds which incoming candidates already exist.
 *
 * <p>PASSES:
 * The detector runs an ordered list of {@link MatchStrategy} passes. Each
 * pass sees only the candidates no earlier pass matched, so a candidate
 * matched by email never reaches the name passes. The default order is
 * {@link EmailMatchStrategy}, {@link ExactNameMatchStrategy},
 * {@link FuzzyNameMatchStrategy}.
 *
 * <p>SNAPSHOT:
 * Stored contacts are read once per {@link #detect} call and sorted by
 * ascending id, which fixes the tie-break order of every pass. The snapshot
 * may be stale by the time the caller executes its decisions.
 *
 * <p>Incoming candidates are never compared with each other.
 */
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final ContactRepository   repository;
    private final List<MatchStrategy> strategies;

    /**
     * @param repository source of stored contacts; must not be null
     */
    public DuplicateDetector(ContactRepository repository) {
        this(repository, defaultStrategies());
    }

    /**
     * @param repository source of stored contacts; must not be null
     * @param strategies passes to run, in order; must not be empty
     */
    public DuplicateDetector(ContactRepository repository, List<MatchStrategy> strategies) {
        if (repository == null) {
            throw new IllegalArgumentException("ContactRepository must not be null.");
        }
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one MatchStrategy is required.");
        }
        this.repository = repository;
        this.strategies = List.copyOf(strategies);
    }

    /** @return email, exact name, fuzzy name */
    public static List<MatchStrategy> defaultStrategies() {
        return List.of(
                new EmailMatchStrategy(),
                new ExactNameMatchStrategy(),
                new FuzzyNameMatchStrategy());
    }

    /**
     * Matches candidates against the stored contacts.
     *
     * @param candidates parsed candidates in file order
     * @return matches plus the unmatched candidates
     * @throws ContactRepository.RepositoryException if the store cannot be read
     */
    public DuplicateDetectionResult detect(List<CandidateRecord> candidates) {
        List<Contact> existing = new ArrayList<>(repository.findAll());
        existing.sort(Comparator.comparingLong(Contact::getId));

        List<DuplicateMatch>  duplicates = new ArrayList<>();
        List<CandidateRecord> remaining  = new ArrayList<>(candidates);

        for (MatchStrategy strategy : strategies) {
            List<CandidateRecord> stillUnmatched = new ArrayList<>();
            int before = duplicates.size();

            for (CandidateRecord candidate : remaining) {
                Optional<DuplicateMatch> match = strategy.findMatch(candidate, existing);
                if (match.isPresent()) {
                    duplicates.add(match.get());
                } else {
                    stillUnmatched.add(candidate);
                }
            }

            log.debug("{} pass matched {} of {} candidates.",
                    strategy.getMatchType(), duplicates.size() - before, remaining.size());
            remaining = stillUnmatched;
        }

        log.info("Duplicate detection: {} candidates, {} stored contacts, {} matches.",
                candidates.size(), existing.size(), duplicates.size());
        return new DuplicateDetectionResult(duplicates, remaining);
    }
}
