package com.nana.contacts.domain;

/**
 * ContactField - The semantic fields a contact row can carry.
 *
 * <p>Each constant knows three spellings of itself:
 * <ul>
 *   <li>{@link #getJsonName()} - the camelCase key used on the wire
 *       (e.g., {@code fullName}).</li>
 *   <li>{@link #getColumnName()} - the column in the {@code contacts}
 *       table (e.g., {@code full_name}).</li>
 *   <li>{@link #getDisplayName()} - a label for reports and log lines.</li>
 * </ul>
 *
 * <p>Declaration order matters: header-to-field resolution in
 * {@link com.nana.contacts.importer.ColumnAliases} walks the fields in this
 * order and takes the first one whose alias matches.
 */
public enum ContactField {

    FULL_NAME("fullName", "full_name", "Full Name"),
    FIRST_NAME("firstName", "first_name", "First Name"),
    LAST_NAME("lastName", "last_name", "Last Name"),
    EMAIL("email", "email", "Email"),
    PHONE("phone", "phone", "Phone"),
    ORGANIZATION("organization", "organization", "Organization"),
    JOB_TITLE("jobTitle", "job_title", "Job Title"),
    ADDRESS("address", "address", "Address"),
    NOTES("notes", "notes", "Notes");

    private final String jsonName;
    private final String columnName;
    private final String displayName;

    ContactField(String jsonName, String columnName, String displayName) {
        this.jsonName    = jsonName;
        this.columnName  = columnName;
        this.displayName = displayName;
    }

    /** @return the camelCase key used in JSON bodies */
    public String getJsonName()    { return jsonName; }

    /** @return the SQL column name in the contacts table */
    public String getColumnName()  { return columnName; }

    /** @return human-readable label */
    public String getDisplayName() { return displayName; }

    @Override
    public String toString() {
        return displayName;
    }
}
