package com.nana.contacts.domain;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;

/**
 * Contact - A contact record as held by the persistent store.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   id         - Auto-incremented surrogate PK from SQLite (0 = unsaved)
 *   vcardId    - Stable external identifier (the vCard UID)
 *   fullName .. notes - The nine semantic contact fields
 *   vcardData  - Serialized vCard text for the external repository
 *   createdAt  - Timestamp of record creation
 *   updatedAt  - Timestamp of last modification
 * </pre>
 *
 * <p>The semantic fields are also reachable generically through
 * {@link #get(ContactField)} and {@link #set(ContactField, String)}, which
 * the import executor uses to merge candidate values into an existing row.
 */
public class Contact {

    /**
     * Format used for serialising timestamps to/from SQLite TEXT columns.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private long id;
    private String vcardId;
    private final EnumMap<ContactField, String> fields =
            new EnumMap<>(ContactField.class);
    private String vcardData;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Contact() {
    }

    /**
     * Copy constructor.
     *
     * @param other contact to copy; must not be null
     */
    public Contact(Contact other) {
        this.id        = other.id;
        this.vcardId   = other.vcardId;
        this.fields.putAll(other.fields);
        this.vcardData = other.vcardData;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    // -----------------------------------------------------------------------
    // GENERIC FIELD ACCESS
    // -----------------------------------------------------------------------

    /**
     * @param field semantic field
     * @return stored value, or null when absent
     */
    public String get(ContactField field) {
        return fields.get(field);
    }

    /**
     * Sets a semantic field. Null or blank clears it.
     *
     * @param field semantic field
     * @param value new value
     */
    public void set(ContactField field, String value) {
        if (value == null || value.isBlank()) {
            fields.remove(field);
        } else {
            fields.put(field, value.trim());
        }
    }

    /** @return a copy of the present semantic field values */
    public Map<ContactField, String> getFields() {
        return new EnumMap<>(fields);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public long getId()                       { return id; }
    public void setId(long id)                { this.id = id; }

    public String getVcardId()                { return vcardId; }
    public void setVcardId(String vcardId)    { this.vcardId = vcardId; }

    public String getFullName()               { return get(ContactField.FULL_NAME); }
    public void setFullName(String v)         { set(ContactField.FULL_NAME, v); }

    public String getFirstName()              { return get(ContactField.FIRST_NAME); }
    public void setFirstName(String v)        { set(ContactField.FIRST_NAME, v); }

    public String getLastName()               { return get(ContactField.LAST_NAME); }
    public void setLastName(String v)         { set(ContactField.LAST_NAME, v); }

    public String getEmail()                  { return get(ContactField.EMAIL); }
    public void setEmail(String v)            { set(ContactField.EMAIL, v); }

    public String getPhone()                  { return get(ContactField.PHONE); }
    public void setPhone(String v)            { set(ContactField.PHONE, v); }

    public String getOrganization()           { return get(ContactField.ORGANIZATION); }
    public void setOrganization(String v)     { set(ContactField.ORGANIZATION, v); }

    public String getJobTitle()               { return get(ContactField.JOB_TITLE); }
    public void setJobTitle(String v)         { set(ContactField.JOB_TITLE, v); }

    public String getAddress()                { return get(ContactField.ADDRESS); }
    public void setAddress(String v)          { set(ContactField.ADDRESS, v); }

    public String getNotes()                  { return get(ContactField.NOTES); }
    public void setNotes(String v)            { set(ContactField.NOTES, v); }

    public String getVcardData()              { return vcardData; }
    public void setVcardData(String vcardData) { this.vcardData = vcardData; }

    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime t) { this.createdAt = t; }

    public LocalDateTime getUpdatedAt()       { return updatedAt; }
    public void setUpdatedAt(LocalDateTime t) { this.updatedAt = t; }

    // -----------------------------------------------------------------------
    // OBJECT CONTRACT
    // -----------------------------------------------------------------------

    /**
     * Two persisted contacts are equal when their surrogate ids match.
     * Unsaved contacts (id 0) are only equal to themselves.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Contact other)) return false;
        return id != 0 && id == other.id;
    }

    @Override
    public int hashCode() {
        return id != 0 ? Long.hashCode(id) : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "Contact{id=" + id
               + ", vcardId='" + vcardId + "'"
               + ", fullName='" + getFullName() + "'"
               + ", email='" + getEmail() + "'}";
    }
}
