package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.ContactField;
import com.nana.contacts.importer.ParseDiagnostics.RowError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * CsvContactParser - Turns loosely structured CSV text into candidate records.
 *
 * <p>INPUT TOLERANCE:
 * <ul>
 *   <li>Unknown column order and naming: headers are resolved through the
 *       injected {@link ColumnAliases}.</li>
 *   <li>UTF-8 BOM at the start of the text.</li>
 *   <li>CRLF and LF line endings; blank lines are dropped before rows are
 *       numbered.</li>
 *   <li>Quoted fields with embedded commas and {@code ""} escapes.</li>
 *   <li>Short rows: missing trailing values read as empty.</li>
 * </ul>
 *
 * <p>Quoted fields may not span lines. Each physical line is one row.
 *
 * <p>ROW NUMBERING:
 * The first non-blank line is the header. Data rows are numbered from 1 in
 * the order they appear among the remaining non-blank lines.
 *
 * <p>The parser has no side effects and holds no per-call state, so one
 * instance can be shared.
 */
public class CsvContactParser {

    private static final Logger log = LoggerFactory.getLogger(CsvContactParser.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    static final String MSG_EMPTY_FILE = "CSV file is empty";
    static final String MSG_TOO_FEW_LINES =
            "CSV must have at least a header row and one data row";
    static final String MSG_SKIPPED_ROW =
            "Row %d: Skipped - no identifying information (name, email, or phone)";
    static final String MSG_UNMAPPED_COLUMNS =
            "Unmapped columns found: %s. These will be ignored.";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // -----------------------------------------------------------------------
    // DEPENDENCY
    // -----------------------------------------------------------------------

    private final ColumnAliases aliases;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /** Creates a parser over {@link ColumnAliases#defaults()}. */
    public CsvContactParser() {
        this(ColumnAliases.defaults());
    }

    /**
     * @param aliases header resolution table; must not be null
     */
    public CsvContactParser(ColumnAliases aliases) {
        if (aliases == null) {
            throw new IllegalArgumentException("ColumnAliases must not be null.");
        }
        this.aliases = aliases;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Parses the full text of an import file.
     *
     * <p>PROCESSING PIPELINE:
     * <ol>
     *   <li>Reject empty text and text without a data line.</li>
     *   <li>Resolve the header row to a column-to-field map and report every
     *       unresolved column in one warning.</li>
     *   <li>Split each data row, fill the record, reconcile the name parts.</li>
     *   <li>Drop rows with no name, email or phone, with a warning.</li>
     * </ol>
     *
     * @param rawText the decoded file content; null is treated as empty
     * @return candidates plus diagnostics; never null
     */
    public ParseResult parse(String rawText) {
        List<CandidateRecord> candidates = new ArrayList<>();
        List<RowError>        errors     = new ArrayList<>();
        List<String>          warnings   = new ArrayList<>();

        String text = rawText == null ? "" : stripBom(rawText);
        if (text.isBlank()) {
            errors.add(new RowError(0, MSG_EMPTY_FILE));
            return new ParseResult(candidates, new ParseDiagnostics(errors, warnings));
        }

        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.split(text, -1)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.size() < 2) {
            errors.add(new RowError(0, MSG_TOO_FEW_LINES));
            return new ParseResult(candidates, new ParseDiagnostics(errors, warnings));
        }

        List<String> headers = parseCsvRow(lines.get(0));
        Map<ContactField, Integer> columnIndex = buildColumnIndexMap(headers, warnings);

        for (int i = 1; i < lines.size(); i++) {
            int rowNumber = i;
            try {
                List<String> values = parseCsvRow(lines.get(i));
                CandidateRecord candidate =
                        mapRow(rowNumber, headers, values, columnIndex);

                if (candidate.isIdentifiable()) {
                    candidates.add(candidate);
                } else {
                    warnings.add(String.format(MSG_SKIPPED_ROW, rowNumber));
                }
            } catch (RuntimeException ex) {
                log.warn("Row {} could not be parsed: {}", rowNumber, ex.getMessage());
                errors.add(new RowError(rowNumber,
                        ex.getMessage() != null ? ex.getMessage() : "Failed to parse row"));
            }
        }

        log.debug("Parsed {} candidates from {} data lines ({} warnings, {} errors).",
                candidates.size(), lines.size() - 1, warnings.size(), errors.size());
        return new ParseResult(candidates, new ParseDiagnostics(errors, warnings));
    }

    /**
     * Splits one CSV line into trimmed field values.
     *
     * <p>Outside quotes a comma ends the field. A double quote toggles the
     * quoted state; inside quotes a doubled quote is a literal quote. An
     * unclosed quote runs to the end of the line.
     *
     * @param line the raw line
     * @return field values, never null; an empty line yields one empty field
     */
    public List<String> parseCsvRow(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null) {
            return fields;
        }

        StringBuilder currentField = new StringBuilder();
        boolean inQuotes = false;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < length && line.charAt(i + 1) == '"') {
                    currentField.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(currentField.toString().trim());
                currentField.setLength(0);
            } else {
                currentField.append(c);
            }
        }
        fields.add(currentField.toString().trim());

        if (inQuotes) {
            log.debug("Unclosed quoted field in line: {}", truncate(line, 60));
        }
        return fields;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - HEADER MAPPING
    // -----------------------------------------------------------------------

    /**
     * Maps each resolvable header to its column index. When two columns
     * resolve to the same field the later column wins.
     */
    private Map<ContactField, Integer> buildColumnIndexMap(List<String> headers,
                                                           List<String> warnings) {
        Map<ContactField, Integer> map = new EnumMap<>(ContactField.class);
        List<String> unmapped = new ArrayList<>();

        for (int i = 0; i < headers.size(); i++) {
            ContactField field = aliases.resolve(headers.get(i));
            if (field != null) {
                map.put(field, i);
            } else {
                unmapped.add(headers.get(i));
            }
        }

        if (!unmapped.isEmpty()) {
            warnings.add(String.format(MSG_UNMAPPED_COLUMNS, String.join(", ", unmapped)));
        }
        log.debug("Column index map: {}", map);
        return map;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - ROW MAPPING
    // -----------------------------------------------------------------------

    private CandidateRecord mapRow(int rowNumber,
                                   List<String> headers,
                                   List<String> values,
                                   Map<ContactField, Integer> columnIndex) {
        CandidateRecord.Builder builder = CandidateRecord.builder(rowNumber);

        for (int i = 0; i < headers.size(); i++) {
            builder.rawField(headers.get(i), i < values.size() ? values.get(i) : "");
        }

        columnIndex.forEach((field, idx) ->
                builder.set(field, idx < values.size() ? values.get(idx) : null));

        reconcileNames(builder);
        return builder.build();
    }

    /**
     * Fills in whichever side of the name is missing.
     * <ul>
     *   <li>No full name, some parts: full name is the parts joined.</li>
     *   <li>Full name, no parts: the last token is the last name and the
     *       rest is the first name; a single token is the first name.</li>
     * </ul>
     */
    private void reconcileNames(CandidateRecord.Builder builder) {
        String fullName  = builder.get(ContactField.FULL_NAME);
        String firstName = builder.get(ContactField.FIRST_NAME);
        String lastName  = builder.get(ContactField.LAST_NAME);

        if (fullName == null && (firstName != null || lastName != null)) {
            StringBuilder joined = new StringBuilder();
            if (firstName != null) joined.append(firstName);
            if (lastName != null) {
                if (joined.length() > 0) joined.append(' ');
                joined.append(lastName);
            }
            builder.fullName(joined.toString());
            return;
        }

        if (fullName != null && firstName == null && lastName == null) {
            String[] parts = WHITESPACE.split(fullName.trim());
            if (parts.length >= 2) {
                builder.lastName(parts[parts.length - 1]);
                builder.firstName(String.join(" ",
                        Arrays.copyOf(parts, parts.length - 1)));
            } else {
                builder.firstName(parts[0]);
            }
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE - UTILITIES
    // -----------------------------------------------------------------------

    private static String stripBom(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static String truncate(String s, int maxLength) {
        if (s.length() <= maxLength) return s;
        return s.substring(0, maxLength - 3) + "...";
    }
}
