package com.nana.contacts.importer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ParseDiagnostics - Errors and warnings produced by one parse pass.
 *
 * <p>Errors are row-scoped ({@code row 0} means the whole file); warnings are
 * free text such as the unmapped-columns notice or a dropped-row notice.
 */
public final class ParseDiagnostics {

    private final List<RowError> errors;
    private final List<String>   warnings;

    ParseDiagnostics(List<RowError> errors, List<String> warnings) {
        this.errors   = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<RowError> getErrors()  { return errors; }
    public List<String> getWarnings()  { return warnings; }

    public boolean hasErrors()         { return !errors.isEmpty(); }

    @Override
    public String toString() {
        return "ParseDiagnostics{errors=" + errors.size()
               + ", warnings=" + warnings.size() + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowError
    // -----------------------------------------------------------------------

    /**
     * One row-scoped parse error.
     */
    public static final class RowError {

        private final int    row;
        private final String message;

        public RowError(int row, String message) {
            this.row     = row;
            this.message = message == null ? "" : message;
        }

        /** @return 1-based data row, or 0 for a file-level error */
        public int getRow()         { return row; }
        public String getMessage()  { return message; }

        @Override
        public String toString() {
            return row == 0 ? message : "Row " + row + ": " + message;
        }
    }
}
