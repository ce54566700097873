package com.nana.contacts.importer.match;

/**
 * MatchConfidence - How sure the detector is that a candidate already exists.
 *
 * <p>{@link #EXACT} comes from the email and exact-name passes;
 * {@link #HIGH} and {@link #MEDIUM} from the fuzzy-name pass, split at a
 * similarity of 0.9.
 */
public enum MatchConfidence {

    EXACT,
    HIGH,
    MEDIUM;

    /** @return the lowercase name used in JSON bodies */
    public String getWireName() {
        return name().toLowerCase();
    }
}
