package com.nana.contacts.importer;

import java.util.Objects;

/**
 * ValidationFinding - One advisory finding about one candidate row.
 *
 * <p>Findings are always warnings: they are shown to the user in the preview
 * and never block an import. {@code field} is the JSON name of the field
 * ({@code email}, {@code phone}, ...) or {@code name} for the
 * missing-identification check.
 */
public final class ValidationFinding {

    private final int    row;
    private final String field;
    private final String message;

    public ValidationFinding(int row, String field, String message) {
        this.row     = row;
        this.field   = field;
        this.message = message;
    }

    public int getRow()         { return row; }
    public String getField()    { return field; }
    public String getMessage()  { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationFinding other)) return false;
        return row == other.row
                && Objects.equals(field, other.field)
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, field, message);
    }

    @Override
    public String toString() {
        return "Row " + row + " [" + field + "]: " + message;
    }
}
