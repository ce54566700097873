package com.nana.contacts.importer;

import com.nana.contacts.domain.ContactField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ColumnAliases - Immutable header-name to field mapping table.
 *
 * <p>Import files come from many tools (spreadsheet exports, address books,
 * CRM dumps) and name their columns differently. This table lists, per
 * {@link ContactField}, the header spellings that should resolve to it.
 *
 * <p>NORMALIZATION:
 * Both headers and aliases are trimmed, lower-cased and have every run of
 * underscores, whitespace and hyphens collapsed to a single space, so
 * {@code E_Mail}, {@code e-mail} and {@code E Mail} compare equal. Any other
 * punctuation is dropped: {@code First.Name} becomes {@code firstname}.
 *
 * <p>RESOLUTION ORDER:
 * <ol>
 *   <li>Exact pass: the first field (declaration order) with an alias equal
 *       to the normalized header.</li>
 *   <li>Containment pass: the first field with an alias that contains the
 *       header, or is contained in it.</li>
 * </ol>
 * The exact pass keeps {@code First Name} away from the {@code name} alias
 * of {@link ContactField#FULL_NAME}.
 */
public final class ColumnAliases {

    private static final Pattern SEPARATORS  = Pattern.compile("[_\\s-]+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N} ]");
    private static final Pattern SPACES      = Pattern.compile(" {2,}");

    private final Map<ContactField, List<String>> aliases;

    private ColumnAliases(Map<ContactField, List<String>> aliases) {
        EnumMap<ContactField, List<String>> copy = new EnumMap<>(ContactField.class);
        aliases.forEach((field, list) -> {
            List<String> normalized = new ArrayList<>();
            for (String alias : list) {
                String n = normalize(alias);
                if (!n.isEmpty()) {
                    normalized.add(n);
                }
            }
            copy.put(field, Collections.unmodifiableList(normalized));
        });
        this.aliases = Collections.unmodifiableMap(copy);
    }

    // -----------------------------------------------------------------------
    // FACTORIES
    // -----------------------------------------------------------------------

    /**
     * @return the built-in alias table
     */
    public static ColumnAliases defaults() {
        return builder()
                .add(ContactField.FULL_NAME,
                        "full name", "fullname", "name", "display name", "displayname")
                .add(ContactField.FIRST_NAME,
                        "first name", "firstname", "first", "given name", "givenname")
                .add(ContactField.LAST_NAME,
                        "last name", "lastname", "last", "family name", "familyname", "surname")
                .add(ContactField.EMAIL,
                        "email", "e-mail", "email address", "emailaddress", "mail")
                .add(ContactField.PHONE,
                        "phone", "telephone", "tel", "mobile", "cell", "phone number", "phonenumber")
                .add(ContactField.ORGANIZATION,
                        "organization", "org", "company", "employer", "workplace")
                .add(ContactField.JOB_TITLE,
                        "job title", "jobtitle", "title", "position", "role", "job")
                .add(ContactField.ADDRESS,
                        "address", "street", "street address", "streetaddress", "location")
                .add(ContactField.NOTES,
                        "notes", "note", "comments", "comment", "remarks", "description")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Resolves one header cell to a field.
     *
     * @param header raw header text
     * @return the matching field, or {@code null} when nothing matches
     */
    public ContactField resolve(String header) {
        String normalized = normalize(header);
        if (normalized.isEmpty()) {
            return null;
        }
        for (Map.Entry<ContactField, List<String>> entry : aliases.entrySet()) {
            if (entry.getValue().contains(normalized)) {
                return entry.getKey();
            }
        }
        for (Map.Entry<ContactField, List<String>> entry : aliases.entrySet()) {
            for (String alias : entry.getValue()) {
                if (normalized.contains(alias) || alias.contains(normalized)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    /** @return the normalized aliases of one field, empty if none */
    public List<String> aliasesFor(ContactField field) {
        return aliases.getOrDefault(field, List.of());
    }

    /**
     * Normalizes a header or alias for comparison: lowercase, runs of
     * {@code _}, whitespace and {@code -} become one space, any other
     * punctuation is dropped.
     *
     * @param name raw text, may be null
     * @return the normalized form, never null
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String spaced = SEPARATORS.matcher(name.trim().toLowerCase()).replaceAll(" ");
        String stripped = PUNCTUATION.matcher(spaced).replaceAll("");
        return SPACES.matcher(stripped).replaceAll(" ").trim();
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    public static final class Builder {

        private final EnumMap<ContactField, List<String>> aliases =
                new EnumMap<>(ContactField.class);

        private Builder() {
        }

        public Builder add(ContactField field, String... names) {
            List<String> list = aliases.computeIfAbsent(field, f -> new ArrayList<>());
            Collections.addAll(list, names);
            return this;
        }

        public ColumnAliases build() {
            return new ColumnAliases(aliases);
        }
    }
}
