package com.nana.contacts.vcard;

import com.nana.contacts.domain.ContactField;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VCardSerializer - Renders contact fields as a vCard 3.0 card.
 *
 * <p>OUTPUT SHAPE:
 * <pre>
 *   BEGIN:VCARD
 *   VERSION:3.0
 *   UID:&lt;external id&gt;
 *   FN:&lt;full name, or Unknown&gt;
 *   N:&lt;last&gt;;&lt;first&gt;;;;
 *   EMAIL;TYPE=INTERNET:...   (when present)
 *   TEL;TYPE=CELL:...         (when present)
 *   ORG:...                   (when present)
 *   TITLE:...                 (when present)
 *   ADR;TYPE=HOME:;;&lt;address&gt;;;;;   (when present)
 *   NOTE:...                  (when present)
 *   END:VCARD
 * </pre>
 * Lines are joined with CRLF. Line breaks inside values are written as the
 * two characters {@code \n}.
 *
 * <p>A new UID has the form {@code <epochMillis>-<random base36>}.
 */
public class VCardSerializer {

    static final String CRLF = "\r\n";
    static final String DEFAULT_FULL_NAME = "Unknown";

    private static final Pattern UID_LINE   = Pattern.compile("(?m)^UID:(.+)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final SecureRandom random = new SecureRandom();

    /**
     * Builds the external representation of a contact.
     *
     * @param existingExternalId UID to keep; null or blank mints a new one
     * @param fields             present field values; absent keys are omitted
     * @return the UID and the serialized card
     */
    public ExternalRecord toExternalRecord(String existingExternalId,
                                           Map<ContactField, String> fields) {
        String uid = existingExternalId != null && !existingExternalId.isBlank()
                ? existingExternalId.trim() : generateUid();

        String fullName = value(fields, ContactField.FULL_NAME);
        List<String> lines = new ArrayList<>();
        lines.add("BEGIN:VCARD");
        lines.add("VERSION:3.0");
        lines.add("UID:" + uid);
        lines.add("FN:" + (fullName.isEmpty() ? DEFAULT_FULL_NAME : fullName));
        lines.add("N:" + value(fields, ContactField.LAST_NAME) + ";"
                  + value(fields, ContactField.FIRST_NAME) + ";;;");

        addIfPresent(lines, "EMAIL;TYPE=INTERNET:", value(fields, ContactField.EMAIL), "");
        addIfPresent(lines, "TEL;TYPE=CELL:",       value(fields, ContactField.PHONE), "");
        addIfPresent(lines, "ORG:",                 value(fields, ContactField.ORGANIZATION), "");
        addIfPresent(lines, "TITLE:",               value(fields, ContactField.JOB_TITLE), "");
        addIfPresent(lines, "ADR;TYPE=HOME:;;",     value(fields, ContactField.ADDRESS), ";;;;");
        addIfPresent(lines, "NOTE:",                value(fields, ContactField.NOTES), "");

        lines.add("END:VCARD");
        return new ExternalRecord(uid, String.join(CRLF, lines));
    }

    /**
     * Reads the UID back out of a serialized card.
     *
     * @param serialized vCard text
     * @return the trimmed UID, or null when the card has none
     */
    public String extractUid(String serialized) {
        if (serialized == null) {
            return null;
        }
        Matcher m = UID_LINE.matcher(serialized.replace("\r", ""));
        return m.find() ? m.group(1).trim() : null;
    }

    String generateUid() {
        return System.currentTimeMillis() + "-" + Long.toString(random.nextLong() >>> 1, 36);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static void addIfPresent(List<String> lines, String prefix,
                                     String value, String suffix) {
        if (!value.isEmpty()) {
            lines.add(prefix + value + suffix);
        }
    }

    private static String value(Map<ContactField, String> fields, ContactField field) {
        String v = fields == null ? null : fields.get(field);
        if (v == null || v.isBlank()) {
            return "";
        }
        return LINE_BREAK.matcher(v.trim()).replaceAll("\\\\n");
    }
}
