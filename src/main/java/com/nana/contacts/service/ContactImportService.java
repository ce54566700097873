package com.nana.contacts.service;

import com.nana.contacts.importer.ImportExecutionException;
import com.nana.contacts.importer.ImportOutcome;

/**
 * ContactImportService - The two calls of a bulk CSV import.
 *
 * <p>A caller first {@link #preview previews} a file, shows the user the
 * probable duplicates and warnings, collects one decision per row and then
 * {@link #execute executes} the batch. The two calls share no state: the
 * execute request carries the candidates back.
 */
public interface ContactImportService {

    String MSG_NO_FILE        = "No file provided";
    String MSG_NOT_CSV        = "File must be a CSV file";
    String MSG_FILE_TOO_LARGE = "File exceeds the maximum import size of %d bytes";
    String MSG_PARSE_FAILED   = "Failed to parse CSV";

    /**
     * Parses, validates and matches an uploaded file. Nothing is written.
     *
     * @param upload the uploaded file
     * @return candidates, duplicates and all diagnostics
     * @throws ImportRejectedException if there is no file, it is not a CSV,
     *         it is too large, or not a single contact could be read from it
     */
    ImportPreview preview(ImportUpload upload) throws ImportRejectedException;

    /**
     * Applies the decisions of a previewed file as one transaction.
     *
     * @param request candidates and per-row decisions
     * @return the outcome; row failures show as {@code success == false}
     * @throws ImportExecutionException if the transaction itself fails
     */
    ImportOutcome execute(ExecuteRequest request);
}
