package com.nana.contacts.importer.match;

/**
 * MatchType - Which pass of the duplicate detector produced a match.
 */
public enum MatchType {

    EMAIL("email"),
    NAME("name"),
    FUZZY_NAME("fuzzy_name");

    private final String wireName;

    MatchType(String wireName) {
        this.wireName = wireName;
    }

    /** @return the lowercase name used in JSON bodies */
    public String getWireName() {
        return wireName;
    }
}
