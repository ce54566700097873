package com.nana.contacts.vcard;

/**
 * ExternalRecord - A contact as the external directory stores it.
 */
public final class ExternalRecord {

    private final String externalId;
    private final String serializedForm;

    public ExternalRecord(String externalId, String serializedForm) {
        this.externalId     = externalId;
        this.serializedForm = serializedForm;
    }

    /** @return the vCard UID */
    public String getExternalId()      { return externalId; }

    /** @return the vCard 3.0 text, CRLF separated */
    public String getSerializedForm()  { return serializedForm; }

    @Override
    public String toString() {
        return "ExternalRecord{externalId='" + externalId + "'}";
    }
}
