package com.nana.contacts.service;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import com.nana.contacts.importer.ImportDecision;
import com.nana.contacts.importer.ImportOutcome;
import com.nana.contacts.importer.match.MatchType;
import com.nana.contacts.repository.ContactRepository;
import com.nana.contacts.util.AppConfig;
import com.nana.contacts.util.AppLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ContactImportServiceImpl} wired with the real import
 * components over a mocked {@link ContactRepository}.
 */
@ExtendWith(MockitoExtension.class)
class ContactImportServiceImplTest {

    @Mock
    private ContactRepository mockRepository;

    private ContactImportService service;

    @BeforeEach
    void setUp() {
        service = new ContactImportServiceImpl(mockRepository, AppConfig.fromProperties(null));
    }

    private static ImportUpload csv(String name, String content) {
        return new ImportUpload(name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    // ======================================================================
    // NESTED TEST CLASS 1: rejected uploads
    // ======================================================================

    @Nested
    @DisplayName("Rejected uploads")
    class RejectionTests {

        @Test
        @DisplayName("a missing upload is rejected")
        void preview_noUpload_rejected() {
            ImportRejectedException ex = assertThrows(ImportRejectedException.class,
                    () -> service.preview(null));
            assertEquals(ContactImportService.MSG_NO_FILE, ex.getError());

            ex = assertThrows(ImportRejectedException.class,
                    () -> service.preview(new ImportUpload("a.csv", "text/csv", null)));
            assertEquals("No file provided", ex.getError());
        }

        @Test
        @DisplayName("a non-CSV file is rejected")
        void preview_notCsv_rejected() {
            ImportRejectedException ex = assertThrows(ImportRejectedException.class,
                    () -> service.preview(new ImportUpload("contacts.txt", "text/plain",
                            "Name\nAda".getBytes(StandardCharsets.UTF_8))));

            assertEquals("File must be a CSV file", ex.getError());
            verifyNoInteractions(mockRepository);
        }

        @ParameterizedTest
        @CsvSource({
                "contacts.CSV, application/octet-stream",
                "export,       text/csv; charset=utf-8"
        })
        @DisplayName("a .csv name or a text/csv type is enough")
        void preview_csvByNameOrType_accepted(String name, String type) throws Exception {
            when(mockRepository.findAll()).thenReturn(List.of());

            ImportPreview preview = service.preview(new ImportUpload(name, type,
                    "Name\nAda".getBytes(StandardCharsets.UTF_8)));

            assertEquals(1, preview.getTotalRows());
        }

        @Test
        @DisplayName("a file over the configured limit is rejected")
        void preview_tooLarge_rejected() {
            Properties props = new Properties();
            props.setProperty(AppConfig.KEY_IMPORT_MAX_FILE_BYTES, "8");
            ContactImportService small = new ContactImportServiceImpl(
                    mockRepository, AppConfig.fromProperties(props));

            ImportRejectedException ex = assertThrows(ImportRejectedException.class,
                    () -> small.preview(csv("big.csv", "Name\nAda Lovelace")));

            assertEquals("File exceeds the maximum import size of 8 bytes", ex.getError());
        }

        @Test
        @DisplayName("a file with parse errors and no contacts is rejected with details")
        void preview_unparseable_rejectedWithDetails() {
            ImportRejectedException ex = assertThrows(ImportRejectedException.class,
                    () -> service.preview(csv("one-line.csv", "Name,Email")));

            assertEquals("Failed to parse CSV", ex.getError());
            assertEquals(List.of("CSV must have at least a header row and one data row"),
                    ex.getDetails());
            assertEquals("Failed to parse CSV: CSV must have at least a header row and one data row",
                    ex.getMessage());
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 2: preview content
    // ======================================================================

    @Nested
    @DisplayName("Preview")
    class PreviewTests {

        @Test
        @DisplayName("preview combines candidates, duplicates and warnings")
        void preview_fullPipeline() throws Exception {
            Contact grace = new Contact();
            grace.setId(3);
            grace.setFullName("Grace Hopper");
            grace.setEmail("grace@navy.mil");
            when(mockRepository.findAll()).thenReturn(List.of(grace));

            ImportPreview preview = service.preview(csv("people.csv", String.join("\n",
                    "Name,E-Mail,Phone,Hobby",
                    "Ada Lovelace,ada@example,555-1234,Poetry",
                    "G Hopper,GRACE@navy.mil,,",
                    ",,,Chess")));

            assertEquals(2, preview.getTotalRows());
            assertEquals(1, preview.getDuplicates().size());
            assertEquals(MatchType.EMAIL, preview.getDuplicates().get(0).getMatchType());
            assertEquals(2, preview.getDuplicates().get(0).getRowNumber());
            assertEquals(2, preview.getValidationWarnings().size());
            assertEquals(List.of(
                    "Unmapped columns found: Hobby. These will be ignored.",
                    "Row 3: Skipped - no identifying information (name, email, or phone)"),
                    preview.getParseWarnings());
            assertTrue(preview.getParseErrors().isEmpty());
            verify(mockRepository, never()).create(any());
        }

        @Test
        @DisplayName("a file whose rows are all dropped is a valid, empty preview")
        void preview_allRowsDropped_emptyPreview() throws Exception {
            when(mockRepository.findAll()).thenReturn(List.of());

            ImportPreview preview = service.preview(csv("orgs.csv", "Name,Company\n,Acme"));

            assertEquals(0, preview.getTotalRows());
            assertEquals(1, preview.getParseWarnings().size());
        }

        @Test
        @DisplayName("the operation context is cleared after the call")
        void preview_clearsOperationContext() throws Exception {
            when(mockRepository.findAll()).thenReturn(List.of());

            service.preview(csv("a.csv", "Name\nAda"));

            assertNull(MDC.get(AppLogger.MDC_OPERATION));
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 3: execute
    // ======================================================================

    @Nested
    @DisplayName("Execute")
    class ExecuteTests {

        @Test
        @DisplayName("execute applies the decisions through the executor")
        void execute_delegates() {
            ExecuteRequest request = new ExecuteRequest(
                    List.of(CandidateRecord.builder(1).fullName("Ada").build(),
                            CandidateRecord.builder(2).fullName("Grace").build()),
                    List.of(ImportDecision.create(1)));

            ImportOutcome outcome = service.execute(request);

            assertEquals(1, outcome.getCreated());
            assertEquals(1, outcome.getSkipped());
            assertTrue(outcome.isCommitted());
            verify(mockRepository).create(any());
            assertNull(MDC.get(AppLogger.MDC_OPERATION));
        }

        @Test
        @DisplayName("a null request is rejected")
        void execute_null_throws() {
            assertThrows(IllegalArgumentException.class, () -> service.execute(null));
        }
    }
}
