package com.nana.contacts.app;

import com.nana.contacts.importer.ImportExecutionException;
import com.nana.contacts.importer.ImportOutcome;
import com.nana.contacts.repository.ContactRepository.RepositoryException;
import com.nana.contacts.service.ContactImportService;
import com.nana.contacts.service.ExecuteRequest;
import com.nana.contacts.service.ImportPreview;
import com.nana.contacts.service.ImportRejectedException;
import com.nana.contacts.service.ImportUpload;
import com.nana.contacts.util.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the {@link ContactsPlusApp} command dispatch over a mocked
 * {@link ContactImportService}.
 */
@ExtendWith(MockitoExtension.class)
class ContactsPlusAppTest {

    @Mock
    private ContactImportService mockService;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ContactsPlusApp app;

    @BeforeEach
    void setUp() {
        app = buildApp(AppConfig.fromProperties(null));
    }

    private ContactsPlusApp buildApp(AppConfig config) {
        return new ContactsPlusApp(mockService, config,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static final String REQUEST_JSON = """
            { "contacts": [ { "rowNumber": 1, "fullName": "Ada" } ],
              "actions":  [ { "action": "create", "rowNumber": 1 } ] }
            """;

    // ======================================================================
    // NESTED TEST CLASS 1: dispatch
    // ======================================================================

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("wrong argument count prints usage")
        void run_noArgs_usage() {
            assertEquals(ContactsPlusApp.EXIT_REJECTED, app.run(new String[0]));
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
            verifyNoInteractions(mockService);
        }

        @Test
        @DisplayName("an unknown command prints usage")
        void run_unknownCommand_usage() {
            assertEquals(ContactsPlusApp.EXIT_REJECTED, app.run(new String[]{"export", "x.csv"}));
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown command: export"));
        }

        @Test
        @DisplayName("the report file sits next to the request with a fixed suffix")
        void reportPathFor_replacesExtension() {
            Path report = ContactsPlusApp.reportPathFor(Paths.get("/data/imports/batch.json"));

            assertEquals(Paths.get("/data/imports/batch_import_report.txt"), report);
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 2: preview command
    // ======================================================================

    @Nested
    @DisplayName("preview")
    class PreviewCommandTests {

        @Test
        @DisplayName("prints the preview JSON and exits 0")
        void preview_ok() throws Exception {
            Path csv = write("people.csv", "Name\nAda");
            when(mockService.preview(any())).thenReturn(
                    new ImportPreview(List.of(), List.of(), List.of(), List.of(), List.of()));

            assertEquals(ContactsPlusApp.EXIT_OK, app.run(new String[]{"preview", csv.toString()}));

            assertTrue(stdout().contains("\"totalRows\" : 0"));
            ArgumentCaptor<ImportUpload> captor = ArgumentCaptor.forClass(ImportUpload.class);
            verify(mockService).preview(captor.capture());
            assertEquals("people.csv", captor.getValue().getFileName());
            assertEquals(8, captor.getValue().getSize());
        }

        @Test
        @DisplayName("a missing file reaches the service as an upload without content")
        void preview_missingFile_noBytes() throws Exception {
            when(mockService.preview(any())).thenThrow(
                    new ImportRejectedException(ContactImportService.MSG_NO_FILE));

            int code = app.run(new String[]{"preview", tempDir.resolve("absent.csv").toString()});

            assertEquals(ContactsPlusApp.EXIT_REJECTED, code);
            assertTrue(stdout().contains("\"error\" : \"No file provided\""));
            ArgumentCaptor<ImportUpload> captor = ArgumentCaptor.forClass(ImportUpload.class);
            verify(mockService).preview(captor.capture());
            assertNull(captor.getValue().getBytes());
        }

        @Test
        @DisplayName("an infrastructure failure exits 2 with an error body")
        void preview_storeFailure_exit2() throws Exception {
            Path csv = write("people.csv", "Name\nAda");
            when(mockService.preview(any())).thenThrow(new RepositoryException("database is locked"));

            assertEquals(ContactsPlusApp.EXIT_FAILURE, app.run(new String[]{"preview", csv.toString()}));
            assertTrue(stdout().contains("Failed to process CSV file"));
            assertTrue(stdout().contains("database is locked"));
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 3: execute command
    // ======================================================================

    @Nested
    @DisplayName("execute")
    class ExecuteCommandTests {

        @Test
        @DisplayName("a committed import exits 0 and writes the report file")
        void execute_ok_writesReport() throws Exception {
            Path request = write("batch.json", REQUEST_JSON);
            when(mockService.execute(any())).thenReturn(
                    new ImportOutcome.Builder().addCreated().committed(true).build());

            assertEquals(ContactsPlusApp.EXIT_OK, app.run(new String[]{"execute", request.toString()}));

            assertTrue(stdout().contains("\"created\" : 1"));
            Path report = tempDir.resolve("batch_import_report.txt");
            assertTrue(Files.exists(report));
            assertTrue(Files.readString(report).contains("Import committed."));

            ArgumentCaptor<ExecuteRequest> captor = ArgumentCaptor.forClass(ExecuteRequest.class);
            verify(mockService).execute(captor.capture());
            assertEquals(1, captor.getValue().getContacts().size());
        }

        @Test
        @DisplayName("row failures exit 1")
        void execute_rowFailures_exit1() throws Exception {
            Path request = write("batch.json", REQUEST_JSON);
            when(mockService.execute(any())).thenReturn(
                    new ImportOutcome.Builder().addFailure(1, "boom").build());

            assertEquals(ContactsPlusApp.EXIT_REJECTED,
                    app.run(new String[]{"execute", request.toString()}));
            assertTrue(stdout().contains("\"success\" : false"));
        }

        @Test
        @DisplayName("no report file is written when reports are disabled")
        void execute_reportDisabled_noFile() throws Exception {
            Properties props = new Properties();
            props.setProperty(AppConfig.KEY_IMPORT_REPORT_ENABLED, "false");
            ContactsPlusApp quiet = buildApp(AppConfig.fromProperties(props));
            Path request = write("batch.json", REQUEST_JSON);
            when(mockService.execute(any())).thenReturn(
                    new ImportOutcome.Builder().addSkipped().committed(true).build());

            quiet.run(new String[]{"execute", request.toString()});

            assertFalse(Files.exists(tempDir.resolve("batch_import_report.txt")));
        }

        @Test
        @DisplayName("a malformed request exits 1 without calling the service")
        void execute_malformed_exit1() throws Exception {
            Path request = write("batch.json", "{ not json");

            assertEquals(ContactsPlusApp.EXIT_REJECTED,
                    app.run(new String[]{"execute", request.toString()}));
            assertTrue(stdout().contains("Invalid import request"));
            verify(mockService, never()).execute(any());
        }

        @Test
        @DisplayName("a transaction failure exits 2")
        void execute_transactionFailure_exit2() throws Exception {
            Path request = write("batch.json", REQUEST_JSON);
            when(mockService.execute(any())).thenThrow(new ImportExecutionException(
                    "Failed to begin import transaction.", new RepositoryException("locked")));

            assertEquals(ContactsPlusApp.EXIT_FAILURE,
                    app.run(new String[]{"execute", request.toString()}));
            assertTrue(stdout().contains("Failed to execute import"));
        }
    }
}
