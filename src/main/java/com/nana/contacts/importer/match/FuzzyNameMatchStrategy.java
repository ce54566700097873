package com.nana.contacts.importer.match;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * FuzzyNameMatchStrategy - Best-scoring stored name above a threshold.
 *
 * <p>SCORING:
 * Both names are normalized and must be at least {@value #MIN_NAME_LENGTH}
 * characters. The stored contact with the strictly highest
 * {@link NameNormalizer#similarity} wins, provided it reaches
 * {@value #MATCH_THRESHOLD}. On a tie the first contact seen keeps the match,
 * and contacts arrive sorted by ascending id.
 *
 * <p>CONFIDENCE:
 * {@link MatchConfidence#HIGH} from {@value #HIGH_CONFIDENCE_THRESHOLD},
 * {@link MatchConfidence#MEDIUM} below it.
 */
public class FuzzyNameMatchStrategy implements MatchStrategy {

    private static final Logger log = LoggerFactory.getLogger(FuzzyNameMatchStrategy.class);

    public static final int    MIN_NAME_LENGTH           = 3;
    public static final double MATCH_THRESHOLD           = 0.8;
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.9;

    @Override
    public MatchType getMatchType() {
        return MatchType.FUZZY_NAME;
    }

    @Override
    public Optional<DuplicateMatch> findMatch(CandidateRecord candidate, List<Contact> existing) {
        String name = NameNormalizer.normalize(candidate.getFullName());
        if (name.length() < MIN_NAME_LENGTH) {
            return Optional.empty();
        }

        Contact best = null;
        double bestScore = 0.0;

        for (Contact contact : existing) {
            String existingName = NameNormalizer.normalize(contact.getFullName());
            if (existingName.length() < MIN_NAME_LENGTH) {
                continue;
            }
            double score = NameNormalizer.similarity(name, existingName);
            if (score > bestScore && score >= MATCH_THRESHOLD) {
                bestScore = score;
                best = contact;
            }
        }

        if (best == null) {
            return Optional.empty();
        }

        MatchConfidence confidence = bestScore >= HIGH_CONFIDENCE_THRESHOLD
                ? MatchConfidence.HIGH : MatchConfidence.MEDIUM;
        log.debug("Row {} fuzzy-matched contact id={} (score {}).",
                candidate.getRowNumber(), best.getId(), bestScore);
        return Optional.of(new DuplicateMatch(candidate, best,
                MatchType.FUZZY_NAME, confidence, bestScore));
    }
}
