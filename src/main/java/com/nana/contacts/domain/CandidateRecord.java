package com.nana.contacts.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CandidateRecord - One contact row extracted from an import file.
 *
 * <p>A candidate is not yet persisted. It is created once per parse pass by
 * {@link com.nana.contacts.importer.CsvContactParser}, read by the validator
 * and the duplicate detector, and referenced by {@link #getRowNumber()} when
 * the caller submits its per-row decisions.
 *
 * <p>IMMUTABILITY:
 * Instances are built through {@link Builder} and never change afterwards.
 * Blank values are stored as {@code null} so every consumer can treat
 * "absent" and "empty" the same way.
 *
 * <p>ROW NUMBER:
 * 1-based position of the row among the non-blank data lines of the file,
 * header excluded. It is the stable identity of the row for one import
 * session.
 */
public final class CandidateRecord {

    private final int rowNumber;
    private final Map<ContactField, String> values;
    private final Map<String, String> rawFields;

    private CandidateRecord(Builder builder) {
        this.rowNumber = builder.rowNumber;
        EnumMap<ContactField, String> copy = new EnumMap<>(ContactField.class);
        copy.putAll(builder.values);
        this.values    = Collections.unmodifiableMap(copy);
        this.rawFields = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.rawFields));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return 1-based data row number (header excluded) */
    public int getRowNumber()         { return rowNumber; }

    public String getFullName()       { return values.get(ContactField.FULL_NAME); }
    public String getFirstName()      { return values.get(ContactField.FIRST_NAME); }
    public String getLastName()       { return values.get(ContactField.LAST_NAME); }
    public String getEmail()          { return values.get(ContactField.EMAIL); }
    public String getPhone()          { return values.get(ContactField.PHONE); }
    public String getOrganization()   { return values.get(ContactField.ORGANIZATION); }
    public String getJobTitle()       { return values.get(ContactField.JOB_TITLE); }
    public String getAddress()        { return values.get(ContactField.ADDRESS); }
    public String getNotes()          { return values.get(ContactField.NOTES); }

    /**
     * Returns the value of one semantic field.
     *
     * @param field the field to read
     * @return the trimmed, non-blank value, or {@code null} if absent
     */
    public String get(ContactField field) {
        return values.get(field);
    }

    /** @return true if the field carries a value */
    public boolean has(ContactField field) {
        return values.containsKey(field);
    }

    /** @return unmodifiable copy of all present field values, in field order */
    public Map<ContactField, String> getValues() {
        return values;
    }

    /**
     * Original column name to original string value, in header order.
     * Kept verbatim for audit, including columns that mapped to no field.
     *
     * @return unmodifiable ordered map
     */
    public Map<String, String> getRawFields() {
        return rawFields;
    }

    /**
     * A record is identifiable when it carries a full name, an email or a
     * phone number. Only identifiable records leave the parser.
     *
     * @return true if at least one identifying field is present
     */
    public boolean isIdentifiable() {
        return has(ContactField.FULL_NAME)
                || has(ContactField.EMAIL)
                || has(ContactField.PHONE);
    }

    public static Builder builder(int rowNumber) {
        return new Builder(rowNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateRecord other)) return false;
        return rowNumber == other.rowNumber
                && values.equals(other.values)
                && rawFields.equals(other.rawFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, values, rawFields);
    }

    @Override
    public String toString() {
        return "CandidateRecord{row=" + rowNumber
               + ", fullName='" + getFullName() + "'"
               + ", email='" + getEmail() + "'}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Builder - Mutable accumulator used while a row is being extracted.
     */
    public static final class Builder {

        private final int rowNumber;
        private final EnumMap<ContactField, String> values =
                new EnumMap<>(ContactField.class);
        private final Map<String, String> rawFields = new LinkedHashMap<>();

        private Builder(int rowNumber) {
            this.rowNumber = rowNumber;
        }

        /**
         * Sets a field value. The value is trimmed; a null or blank value
         * clears the field.
         *
         * @param field the field to set
         * @param value the raw value
         * @return this builder for chaining
         */
        public Builder set(ContactField field, String value) {
            String trimmed = value == null ? null : value.trim();
            if (trimmed == null || trimmed.isEmpty()) {
                values.remove(field);
            } else {
                values.put(field, trimmed);
            }
            return this;
        }

        public Builder fullName(String value)     { return set(ContactField.FULL_NAME, value); }
        public Builder firstName(String value)    { return set(ContactField.FIRST_NAME, value); }
        public Builder lastName(String value)     { return set(ContactField.LAST_NAME, value); }
        public Builder email(String value)        { return set(ContactField.EMAIL, value); }
        public Builder phone(String value)        { return set(ContactField.PHONE, value); }
        public Builder organization(String value) { return set(ContactField.ORGANIZATION, value); }
        public Builder jobTitle(String value)     { return set(ContactField.JOB_TITLE, value); }
        public Builder address(String value)      { return set(ContactField.ADDRESS, value); }
        public Builder notes(String value)        { return set(ContactField.NOTES, value); }

        /**
         * Records one original column value verbatim.
         *
         * @param columnName header text as it appeared in the file
         * @param value      the cell value (null stored as empty string)
         * @return this builder for chaining
         */
        public Builder rawField(String columnName, String value) {
            rawFields.put(columnName, value == null ? "" : value);
            return this;
        }

        /** @return the current value of a field, or null */
        public String get(ContactField field) {
            return values.get(field);
        }

        public CandidateRecord build() {
            return new CandidateRecord(this);
        }
    }
}
