package com.nana.contacts.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.nana.contacts.importer.ImportOutcome;
import com.nana.contacts.json.ImportJsonCodec;
import com.nana.contacts.repository.SqliteContactRepository;
import com.nana.contacts.service.ContactImportService;
import com.nana.contacts.service.ContactImportServiceImpl;
import com.nana.contacts.service.ExecuteRequest;
import com.nana.contacts.service.ImportPreview;
import com.nana.contacts.service.ImportRejectedException;
import com.nana.contacts.service.ImportUpload;
import com.nana.contacts.util.AppConfig;
import com.nana.contacts.util.AppLogger;
import com.nana.contacts.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.List;

/**
 * ContactsPlusApp - Command-line entry point for CSV contact imports.
 *
 * <p>COMMANDS:
 * <pre>
 *   preview &lt;file.csv&gt;       parse, validate and match; prints preview JSON
 *   execute &lt;request.json&gt;   apply decisions; prints outcome JSON
 * </pre>
 *
 * <p>EXIT CODES: 0 success, 1 rejected input or failed rows, 2 an
 * infrastructure failure.
 *
 * <p>{@link #main} is the composition root: it opens the database, wires the
 * service and shuts everything down when the command returns.
 */
public class ContactsPlusApp {

    private static final Logger log = LoggerFactory.getLogger(ContactsPlusApp.class);

    public static final int EXIT_OK       = 0;
    public static final int EXIT_REJECTED = 1;
    public static final int EXIT_FAILURE  = 2;

    static final String CMD_PREVIEW = "preview";
    static final String CMD_EXECUTE = "execute";

    static final String USAGE =
            "Usage: contacts-plus preview <file.csv> | execute <request.json>";

    static final String MSG_PREVIEW_FAILED  = "Failed to process CSV file";
    static final String MSG_EXECUTE_FAILED  = "Failed to execute import";
    static final String MSG_INVALID_REQUEST = "Invalid import request";
    static final String MSG_UNREADABLE_FILE = "Failed to read file";

    static final String REPORT_SUFFIX = "_import_report.txt";

    // -----------------------------------------------------------------------
    // DEPENDENCIES
    // -----------------------------------------------------------------------

    private final ContactImportService service;
    private final AppConfig            config;
    private final PrintStream          out;
    private final PrintStream          err;

    public ContactsPlusApp(ContactImportService service,
                           AppConfig config,
                           PrintStream out,
                           PrintStream err) {
        if (service == null || config == null) {
            throw new IllegalArgumentException("Service and config must not be null.");
        }
        this.service = service;
        this.config  = config;
        this.out     = out;
        this.err     = err;
    }

    // -----------------------------------------------------------------------
    // COMMAND DISPATCH
    // -----------------------------------------------------------------------

    /**
     * Runs one command.
     *
     * @param args command name and its file argument
     * @return the process exit code
     */
    public int run(String[] args) {
        if (args == null || args.length != 2) {
            err.println(USAGE);
            return EXIT_REJECTED;
        }
        Path file = Paths.get(args[1]);
        try {
            switch (args[0]) {
                case CMD_PREVIEW:
                    return preview(file);
                case CMD_EXECUTE:
                    return execute(file);
                default:
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_REJECTED;
            }
        } catch (IOException ex) {
            log.error("Failed to write command output.", ex);
            return EXIT_FAILURE;
        }
    }

    // -----------------------------------------------------------------------
    // PREVIEW
    // -----------------------------------------------------------------------

    private int preview(Path csvFile) throws IOException {
        byte[] bytes;
        try {
            bytes = Files.isRegularFile(csvFile) ? Files.readAllBytes(csvFile) : null;
        } catch (IOException ex) {
            log.warn("Could not read '{}': {}", csvFile, ex.getMessage());
            print(ImportJsonCodec.errorBody(MSG_UNREADABLE_FILE, List.of(ex.getMessage())));
            return EXIT_REJECTED;
        }

        ImportUpload upload = new ImportUpload(
                csvFile.getFileName().toString(), null, bytes);
        try {
            ImportPreview preview = service.preview(upload);
            print(ImportJsonCodec.toJson(preview));
            return EXIT_OK;

        } catch (ImportRejectedException ex) {
            log.info("Preview rejected: {}", ex.getMessage());
            print(ImportJsonCodec.toJson(ex));
            return EXIT_REJECTED;

        } catch (RuntimeException ex) {
            log.error("Preview of '{}' failed.", csvFile, ex);
            AppLogger.logErrorEvent("CSV_PREVIEW_FAILED", "file=" + csvFile, ex);
            print(ImportJsonCodec.errorBody(MSG_PREVIEW_FAILED, detailsOf(ex)));
            return EXIT_FAILURE;
        }
    }

    // -----------------------------------------------------------------------
    // EXECUTE
    // -----------------------------------------------------------------------

    private int execute(Path requestFile) throws IOException {
        ExecuteRequest request;
        try {
            String json = Files.readString(requestFile, StandardCharsets.UTF_8);
            request = ImportJsonCodec.readExecuteRequest(json);
        } catch (IOException ex) {
            log.warn("Rejected execute request '{}': {}", requestFile, ex.getMessage());
            print(ImportJsonCodec.errorBody(MSG_INVALID_REQUEST, detailsOf(ex)));
            return EXIT_REJECTED;
        }

        ImportOutcome outcome;
        try {
            outcome = service.execute(request);
        } catch (RuntimeException ex) {
            log.error("Execute of '{}' failed.", requestFile, ex);
            print(ImportJsonCodec.errorBody(MSG_EXECUTE_FAILED, detailsOf(ex)));
            return EXIT_FAILURE;
        }

        print(ImportJsonCodec.toJson(outcome));
        if (config.isImportReportEnabled()) {
            writeReportFile(outcome, requestFile);
        }
        return outcome.isSuccess() ? EXIT_OK : EXIT_REJECTED;
    }

    /**
     * Writes {@code <name>_import_report.txt} next to the request file.
     * A failed write is logged; the outcome is already final.
     */
    private void writeReportFile(ImportOutcome outcome, Path requestFile) {
        Path reportPath = reportPathFor(requestFile);
        try {
            Files.writeString(reportPath,
                    outcome.toReportText(requestFile.getFileName().toString()),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            log.info("Import report written to: {}", reportPath);
        } catch (IOException ex) {
            log.error("Failed to write import report file.", ex);
        }
    }

    static Path reportPathFor(Path requestFile) {
        String name = requestFile.getFileName().toString();
        String baseName = name.contains(".")
                ? name.substring(0, name.lastIndexOf('.'))
                : name;
        Path parent = requestFile.toAbsolutePath().getParent();
        return parent.resolve(baseName + REPORT_SUFFIX);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private void print(JsonNode node) throws IOException {
        out.println(ImportJsonCodec.writeString(node));
    }

    private static List<String> detailsOf(Exception ex) {
        return ex.getMessage() == null ? List.of() : List.of(ex.getMessage());
    }

    // -----------------------------------------------------------------------
    // MAIN METHOD
    // -----------------------------------------------------------------------

    public static void main(String[] args) {
        LocalDateTime startTime = LocalDateTime.now();
        AppLogger.applyRootLevel(AppConfig.getInstance().getLogLevel());
        AppLogger.setSessionContext(AppLogger.generateSessionId());
        AppLogger.logStartup();

        DatabaseManager databaseManager = null;
        int exitCode;
        try {
            AppConfig config = AppConfig.getInstance();
            databaseManager  = DatabaseManager.getInstance();
            ContactImportService service = new ContactImportServiceImpl(
                    new SqliteContactRepository(databaseManager), config);

            exitCode = new ContactsPlusApp(service, config, System.out, System.err).run(args);

        } catch (DatabaseManager.DatabaseInitException ex) {
            log.error("Fatal error during application startup.", ex);
            AppLogger.logErrorEvent("APP_STARTUP_FAILED", "", ex);
            System.err.println("Contacts Plus could not start: " + ex.getMessage()
                    + "\nPlease check the log file at: " + AppLogger.getLogFilePath());
            exitCode = EXIT_FAILURE;

        } finally {
            if (databaseManager != null) {
                databaseManager.shutdown();
            }
            AppLogger.logShutdown(startTime);
            AppLogger.clearAllContext();
        }
        System.exit(exitCode);
    }
}
