package com.nana.contacts.service;

import com.nana.contacts.importer.CsvContactParser;
import com.nana.contacts.importer.FieldValidator;
import com.nana.contacts.importer.ImportExecutor;
import com.nana.contacts.importer.ImportOutcome;
import com.nana.contacts.importer.ParseDiagnostics.RowError;
import com.nana.contacts.importer.ParseResult;
import com.nana.contacts.importer.ValidationFinding;
import com.nana.contacts.importer.match.DuplicateDetectionResult;
import com.nana.contacts.importer.match.DuplicateDetector;
import com.nana.contacts.repository.ContactRepository;
import com.nana.contacts.util.AppConfig;
import com.nana.contacts.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ContactImportServiceImpl - Wires the import components together.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Reject uploads the user must fix before anything is parsed.</li>
 *   <li>Run parser, validator and duplicate detector for a preview.</li>
 *   <li>Hand an execute request to the {@link ImportExecutor}.</li>
 *   <li>Tag log output of each call with its MDC operation.</li>
 * </ul>
 *
 * <p>Components are injected through the constructor; the
 * {@link #ContactImportServiceImpl(ContactRepository, AppConfig)} shortcut
 * builds the default ones over a repository.
 */
public class ContactImportServiceImpl implements ContactImportService {

    private static final Logger log = LoggerFactory.getLogger(ContactImportServiceImpl.class);

    private static final String CSV_EXTENSION    = ".csv";
    private static final String CSV_CONTENT_TYPE = "text/csv";

    // -----------------------------------------------------------------------
    // DEPENDENCIES
    // -----------------------------------------------------------------------

    private final CsvContactParser  parser;
    private final FieldValidator    validator;
    private final DuplicateDetector detector;
    private final ImportExecutor    executor;
    private final AppConfig         config;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * Builds the default components over one repository.
     *
     * @param repository contact store; must not be null
     * @param config     application settings; must not be null
     */
    public ContactImportServiceImpl(ContactRepository repository, AppConfig config) {
        this(new CsvContactParser(),
             new FieldValidator(),
             new DuplicateDetector(repository),
             new ImportExecutor(repository),
             config);
    }

    public ContactImportServiceImpl(CsvContactParser parser,
                                    FieldValidator validator,
                                    DuplicateDetector detector,
                                    ImportExecutor executor,
                                    AppConfig config) {
        if (parser == null || validator == null || detector == null
                || executor == null || config == null) {
            throw new IllegalArgumentException("Import components must not be null.");
        }
        this.parser    = parser;
        this.validator = validator;
        this.detector  = detector;
        this.executor  = executor;
        this.config    = config;
    }

    // -----------------------------------------------------------------------
    // PREVIEW
    // -----------------------------------------------------------------------

    @Override
    public ImportPreview preview(ImportUpload upload) throws ImportRejectedException {
        AppLogger.setOperationContext(AppLogger.OP_CSV_PREVIEW);
        try {
            checkUpload(upload);

            String text = new String(upload.getBytes(), StandardCharsets.UTF_8);
            ParseResult parsed = parser.parse(text);

            List<RowError> parseErrors = parsed.getDiagnostics().getErrors();
            if (parsed.getCandidates().isEmpty() && parsed.getDiagnostics().hasErrors()) {
                List<String> details = new ArrayList<>();
                for (RowError error : parseErrors) {
                    details.add(error.toString());
                }
                AppLogger.logWarningEvent("CSV_PREVIEW_REJECTED",
                        "file=" + upload.getFileName() + " errors=" + details.size());
                throw new ImportRejectedException(MSG_PARSE_FAILED, details);
            }

            List<ValidationFinding> findings = validator.validate(parsed.getCandidates());
            DuplicateDetectionResult matches = detector.detect(parsed.getCandidates());

            ImportPreview preview = new ImportPreview(
                    parsed.getCandidates(),
                    matches.getDuplicates(),
                    findings,
                    parsed.getDiagnostics().getWarnings(),
                    parseErrors);

            AppLogger.logEvent("CSV_PREVIEW",
                    "file=" + upload.getFileName()
                    + " rows=" + preview.getTotalRows()
                    + " duplicates=" + preview.getDuplicates().size()
                    + " warnings=" + findings.size());
            return preview;

        } finally {
            AppLogger.clearOperationContext();
        }
    }

    private void checkUpload(ImportUpload upload) throws ImportRejectedException {
        if (upload == null || upload.getBytes() == null) {
            throw new ImportRejectedException(MSG_NO_FILE);
        }
        if (!isCsv(upload)) {
            log.debug("Rejected non-CSV upload: {}", upload);
            throw new ImportRejectedException(MSG_NOT_CSV);
        }
        long maxBytes = config.getMaxImportFileBytes();
        if (upload.getSize() > maxBytes) {
            throw new ImportRejectedException(String.format(MSG_FILE_TOO_LARGE, maxBytes));
        }
    }

    private static boolean isCsv(ImportUpload upload) {
        String name = upload.getFileName();
        if (name != null && name.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION)) {
            return true;
        }
        String type = upload.getContentType();
        return type != null && type.toLowerCase(Locale.ROOT).startsWith(CSV_CONTENT_TYPE);
    }

    // -----------------------------------------------------------------------
    // EXECUTE
    // -----------------------------------------------------------------------

    @Override
    public ImportOutcome execute(ExecuteRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("ExecuteRequest must not be null.");
        }
        AppLogger.setOperationContext(AppLogger.OP_CSV_IMPORT_EXECUTE);
        try {
            log.info("Executing import of {} candidates with {} decisions.",
                    request.getContacts().size(), request.getActions().size());
            return executor.execute(request.getContacts(), request.getActions());
        } finally {
            AppLogger.clearOperationContext();
        }
    }
}
