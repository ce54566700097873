package com.nana.contacts.importer;

/**
 * ImportAction - What to do with one candidate row.
 */
public enum ImportAction {

    /** Leave the store untouched for this row. */
    SKIP,

    /** Merge the candidate into an existing contact. */
    UPDATE,

    /** Insert the candidate as a new contact. */
    CREATE;

    /** @return the lowercase name used in JSON bodies */
    public String getWireName() {
        return name().toLowerCase();
    }

    /**
     * Case-insensitive lookup.
     *
     * @param value wire or enum name
     * @return the matching action
     * @throws IllegalArgumentException if the value names no action
     */
    public static ImportAction fromString(String value) {
        if (value != null) {
            for (ImportAction action : values()) {
                if (action.name().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown import action: " + value);
    }
}
