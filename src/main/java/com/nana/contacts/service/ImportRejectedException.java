package com.nana.contacts.service;

import java.util.Collections;
import java.util.List;

/**
 * ImportRejectedException - The whole request was refused before any work.
 *
 * <p>Thrown for input the user can correct: no file, a file that is not a
 * CSV, a file over the size limit, or a file the parser could not read a
 * single contact from. {@link #getError()} is the short headline and
 * {@link #getDetails()} the optional supporting lines, mirroring the
 * {@code {error, details}} body of a rejected request.
 */
public class ImportRejectedException extends Exception {

    private final String       error;
    private final List<String> details;

    public ImportRejectedException(String error) {
        this(error, Collections.emptyList());
    }

    /**
     * @param error   short description
     * @param details supporting lines; null treated as none
     */
    public ImportRejectedException(String error, List<String> details) {
        super(buildMessage(error, details));
        this.error   = error;
        this.details = details == null
                ? Collections.emptyList() : List.copyOf(details);
    }

    public String getError()           { return error; }

    /** @return unmodifiable detail lines, possibly empty */
    public List<String> getDetails()   { return details; }

    private static String buildMessage(String error, List<String> details) {
        if (details == null || details.isEmpty()) {
            return error;
        }
        return error + ": " + String.join("; ", details);
    }
}
