package com.nana.contacts.importer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ImportOutcomeTest {

    private static final LocalDateTime COMPLETED = LocalDateTime.of(2025, 1, 15, 14, 32, 0);

    @Test
    @DisplayName("summary of a committed batch counts every action")
    void summary_committed() {
        ImportOutcome outcome = new ImportOutcome.Builder()
                .addCreated().addCreated().addCreated()
                .addUpdated()
                .addSkipped().addSkipped()
                .committed(true)
                .build();

        assertTrue(outcome.isSuccess());
        assertEquals("Imported 3 new, updated 1, skipped 2.", outcome.getSummary());
    }

    @Test
    @DisplayName("summary of an all-skip batch says nothing was imported")
    void summary_allSkipped() {
        ImportOutcome outcome = new ImportOutcome.Builder()
                .addSkipped().addSkipped().committed(true).build();

        assertEquals("Nothing imported. 2 rows skipped.", outcome.getSummary());
    }

    @Test
    @DisplayName("summary of a failed batch reports the rollback")
    void summary_rolledBack() {
        ImportOutcome outcome = new ImportOutcome.Builder()
                .addCreated().addCreated()
                .addFailure(3, "No existing contact with id 99")
                .build();

        assertFalse(outcome.isSuccess());
        assertFalse(outcome.isCommitted());
        assertEquals("Import rolled back. 1 of 3 rows failed; no changes were saved.",
                outcome.getSummary());
    }

    @Test
    @DisplayName("report text lists counters and failed rows")
    void toReportText_listsFailures() {
        ImportOutcome outcome = new ImportOutcome.Builder()
                .addCreated()
                .addFailure(4, "No existing contact with id 99")
                .completedAt(COMPLETED)
                .build();

        String report = outcome.toReportText("request.json");

        assertTrue(report.contains("Contacts Plus - Import Report"));
        assertTrue(report.contains("Source File   : request.json"));
        assertTrue(report.contains("Completed At  : 2025-01-15 14:32:00"));
        assertTrue(report.contains("Failed        : 1"));
        assertTrue(report.contains("Committed     : no"));
        assertTrue(report.contains("Row 4     | No existing contact with id 99"));
        assertTrue(report.contains("All changes rolled back."));
    }

    @Test
    @DisplayName("report text of a clean batch has no failure section")
    void toReportText_clean() {
        String report = new ImportOutcome.Builder()
                .addCreated().committed(true).build().toReportText();

        assertTrue(report.contains("Source File   : Unknown"));
        assertTrue(report.contains("All rows processed successfully."));
        assertTrue(report.contains("Import committed."));
        assertFalse(report.contains("FAILED ROWS"));
    }

    @Test
    @DisplayName("failures are exposed read-only")
    void failures_unmodifiable() {
        ImportOutcome outcome = new ImportOutcome.Builder().addFailure(1, "x").build();

        assertThrows(UnsupportedOperationException.class,
                () -> outcome.getFailures().add(new ImportOutcome.RowFailure(2, "y")));
    }
}
