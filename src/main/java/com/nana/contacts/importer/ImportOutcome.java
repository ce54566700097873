package com.nana.contacts.importer;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ImportOutcome - Immutable result of one import execution.
 *
 * <p>Counts created, updated and skipped rows and lists every row that
 * failed, in processing order. Because the batch is all-or-nothing, any
 * failure means nothing was committed: the counters then describe what
 * would have been written.
 *
 * <p>Built row by row through {@link Builder} while the executor runs.
 */
public final class ImportOutcome {

    // -----------------------------------------------------------------------
    // DISPLAY FORMATTER
    // -----------------------------------------------------------------------

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final LocalDateTime     completedAt;
    private final int               created;
    private final int               updated;
    private final int               skipped;
    private final List<RowFailure>  failures;
    private final boolean           committed;

    private ImportOutcome(Builder builder) {
        this.completedAt = builder.completedAt != null
                ? builder.completedAt : LocalDateTime.now();
        this.created   = builder.created;
        this.updated   = builder.updated;
        this.skipped   = builder.skipped;
        this.failures  = Collections.unmodifiableList(new ArrayList<>(builder.failures));
        this.committed = builder.committed;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public LocalDateTime getCompletedAt() { return completedAt; }
    public int getCreated()               { return created; }
    public int getUpdated()               { return updated; }
    public int getSkipped()               { return skipped; }

    /** @return failed rows in processing order */
    public List<RowFailure> getFailures() { return failures; }

    /** @return true when no row failed */
    public boolean isSuccess()            { return failures.isEmpty(); }

    /** @return true when the batch was committed to the store */
    public boolean isCommitted()          { return committed; }

    /**
     * @return a one-line summary (e.g., "Imported 3 new, updated 1, skipped 2.")
     */
    public String getSummary() {
        if (isSuccess()) {
            if (created == 0 && updated == 0) {
                return String.format("Nothing imported. %d rows skipped.", skipped);
            }
            return String.format("Imported %d new, updated %d, skipped %d.",
                    created, updated, skipped);
        }
        return String.format("Import rolled back. %d of %d rows failed; no changes were saved.",
                failures.size(), created + updated + skipped + failures.size());
    }

    // -----------------------------------------------------------------------
    // REPORT TEXT GENERATION
    // -----------------------------------------------------------------------

    /**
     * Renders a plain-text report.
     *
     * <p>STRUCTURE:
     * <pre>
     * ============================================================
     *  Contacts Plus - Import Report
     * ============================================================
     *  Source File   : contacts.json
     *  Completed At  : 2025-01-15 14:32:00
     *  Created       : 3
     *  Updated       : 1
     *  Skipped       : 2
     *  Failed        : 1
     *  Committed     : no
     * ------------------------------------------------------------
     *  FAILED ROWS:
     * ------------------------------------------------------------
     *  Row 4     | No existing contact with id 99
     * ============================================================
     *  All changes rolled back.
     * ============================================================
     * </pre>
     *
     * @param sourceName file name shown in the header; null prints "Unknown"
     * @return the report as a multi-line string
     */
    public String toReportText(String sourceName) {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" Contacts Plus - Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Source File",
                sourceName != null ? sourceName : "Unknown"));
        sb.append(String.format(" %-14s: %s%n", "Completed At",
                completedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-14s: %d%n", "Created",   created));
        sb.append(String.format(" %-14s: %d%n", "Updated",   updated));
        sb.append(String.format(" %-14s: %d%n", "Skipped",   skipped));
        sb.append(String.format(" %-14s: %d%n", "Failed",    failures.size()));
        sb.append(String.format(" %-14s: %s%n", "Committed", committed ? "yes" : "no"));
        sb.append(line60d).append("\n");

        if (failures.isEmpty()) {
            sb.append(" All rows processed successfully.\n");
        } else {
            sb.append(" FAILED ROWS:\n");
            sb.append(line60d).append("\n");
            for (RowFailure failure : failures) {
                sb.append(String.format(" Row %-5d | %s%n",
                        failure.getRowNumber(), failure.getMessage()));
            }
        }

        sb.append(line60).append("\n");
        sb.append(committed ? " Import committed.\n" : " All changes rolled back.\n");
        sb.append(line60).append("\n");

        return sb.toString();
    }

    /** @return the report with no source name */
    public String toReportText() {
        return toReportText(null);
    }

    @Override
    public String toString() {
        return "ImportOutcome{created=" + created
               + ", updated=" + updated
               + ", skipped=" + skipped
               + ", failed=" + failures.size()
               + ", committed=" + committed + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowFailure
    // -----------------------------------------------------------------------

    /**
     * One row that could not be applied.
     */
    public static final class RowFailure {

        private final int    rowNumber;
        private final String message;

        public RowFailure(int rowNumber, String message) {
            this.rowNumber = rowNumber;
            this.message   = message == null ? "" : message;
        }

        public int getRowNumber()   { return rowNumber; }
        public String getMessage()  { return message; }

        @Override
        public String toString() {
            return "RowFailure{row=" + rowNumber + ", error='" + message + "'}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Builder - Mutable accumulator filled while the batch runs.
     */
    public static final class Builder {

        private LocalDateTime completedAt;
        private int           created   = 0;
        private int           updated   = 0;
        private int           skipped   = 0;
        private boolean       committed = false;
        private final List<RowFailure> failures = new ArrayList<>();

        public Builder addCreated() {
            created++;
            return this;
        }

        public Builder addUpdated() {
            updated++;
            return this;
        }

        public Builder addSkipped() {
            skipped++;
            return this;
        }

        public Builder addFailure(int rowNumber, String message) {
            failures.add(new RowFailure(rowNumber, message));
            return this;
        }

        public Builder committed(boolean committed) {
            this.committed = committed;
            return this;
        }

        public Builder completedAt(LocalDateTime completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }

        public ImportOutcome build() {
            return new ImportOutcome(this);
        }
    }
}
