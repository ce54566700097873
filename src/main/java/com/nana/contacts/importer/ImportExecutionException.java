package com.nana.contacts.importer;

/**
 * ImportExecutionException - The import transaction itself failed.
 *
 * <p>Raised when the store cannot begin, commit or roll back the batch.
 * Row-level problems never raise it; they are reported in
 * {@link ImportOutcome#getFailures()}.
 */
public class ImportExecutionException extends RuntimeException {

    public ImportExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
