package com.nana.contacts.vcard;

import com.nana.contacts.domain.ContactField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VCardSerializerTest {

    private final VCardSerializer serializer = new VCardSerializer();

    private static Map<ContactField, String> fields() {
        Map<ContactField, String> fields = new EnumMap<>(ContactField.class);
        fields.put(ContactField.FULL_NAME, "Ada Lovelace");
        fields.put(ContactField.FIRST_NAME, "Ada");
        fields.put(ContactField.LAST_NAME, "Lovelace");
        fields.put(ContactField.EMAIL, "ada@example.com");
        fields.put(ContactField.PHONE, "555-123-4567");
        fields.put(ContactField.ORGANIZATION, "Analytical Engines");
        fields.put(ContactField.JOB_TITLE, "Countess");
        fields.put(ContactField.ADDRESS, "12 St James's Square");
        fields.put(ContactField.NOTES, "First line\nSecond line");
        return fields;
    }

    @Test
    @DisplayName("a full contact renders every property in order, CRLF separated")
    void toExternalRecord_allFields() {
        ExternalRecord record = serializer.toExternalRecord("uid-1", fields());

        assertEquals("uid-1", record.getExternalId());
        assertEquals(String.join("\r\n",
                "BEGIN:VCARD",
                "VERSION:3.0",
                "UID:uid-1",
                "FN:Ada Lovelace",
                "N:Lovelace;Ada;;;",
                "EMAIL;TYPE=INTERNET:ada@example.com",
                "TEL;TYPE=CELL:555-123-4567",
                "ORG:Analytical Engines",
                "TITLE:Countess",
                "ADR;TYPE=HOME:;;12 St James's Square;;;;",
                "NOTE:First line\\nSecond line",
                "END:VCARD"), record.getSerializedForm());
    }

    @Test
    @DisplayName("optional properties are omitted and FN defaults to Unknown")
    void toExternalRecord_minimal() {
        Map<ContactField, String> fields = new EnumMap<>(ContactField.class);
        fields.put(ContactField.EMAIL, "x@y.com");

        String vcard = serializer.toExternalRecord("uid-2", fields).getSerializedForm();

        assertTrue(vcard.contains("FN:Unknown\r\n"));
        assertTrue(vcard.contains("N:;;;;\r\n"));
        assertFalse(vcard.contains("TEL"));
        assertFalse(vcard.contains("NOTE"));
    }

    @Test
    @DisplayName("without an existing id a new UID is generated")
    void toExternalRecord_newUid() {
        ExternalRecord first  = serializer.toExternalRecord(null, fields());
        ExternalRecord second = serializer.toExternalRecord("  ", fields());

        assertTrue(first.getExternalId().matches("\\d+-[0-9a-z]+"));
        assertNotEquals(first.getExternalId(), second.getExternalId());
        assertTrue(first.getSerializedForm().contains("UID:" + first.getExternalId()));
    }

    @Test
    @DisplayName("extractUid reads the UID line back")
    void extractUid_roundTrip() {
        ExternalRecord record = serializer.toExternalRecord("abc-123", fields());

        assertEquals("abc-123", serializer.extractUid(record.getSerializedForm()));
        assertNull(serializer.extractUid("BEGIN:VCARD\r\nEND:VCARD"));
        assertNull(serializer.extractUid(null));
    }
}
