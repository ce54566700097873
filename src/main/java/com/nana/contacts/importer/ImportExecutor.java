package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import com.nana.contacts.domain.ContactField;
import com.nana.contacts.repository.ContactRepository;
import com.nana.contacts.repository.ContactRepository.RepositoryException;
import com.nana.contacts.util.AppLogger;
import com.nana.contacts.vcard.ExternalRecord;
import com.nana.contacts.vcard.VCardSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ImportExecutor - Applies the caller's per-row decisions to the store.
 *
 * <p>PROCESSING PIPELINE:
 * <ol>
 *   <li>Index decisions by row number; a later decision for the same row
 *       replaces an earlier one.</li>
 *   <li>Open one transaction for the whole batch.</li>
 *   <li>For each candidate in order: skip, merge into an existing contact,
 *       or insert a new one. A row that fails is recorded and the loop goes
 *       on.</li>
 *   <li>Commit if no row failed, otherwise roll everything back.</li>
 * </ol>
 *
 * <p>UPDATE MERGE:
 * Values present on the candidate overwrite the stored values; fields the
 * candidate leaves empty keep what is stored. The stored vCard UID is kept.
 *
 * <p>Infrastructure failures (begin, commit, rollback) surface as
 * {@link ImportExecutionException}; they never appear as row failures.
 */
public class ImportExecutor {

    private static final Logger log = LoggerFactory.getLogger(ImportExecutor.class);

    static final String MSG_UPDATE_REQUIRES_ID =
            "Update action requires an existing contact id";
    static final String MSG_NO_EXISTING_CONTACT = "No existing contact with id %d";

    private final ContactRepository repository;
    private final VCardSerializer   serializer;

    public ImportExecutor(ContactRepository repository) {
        this(repository, new VCardSerializer());
    }

    /**
     * @param repository contact store; must not be null
     * @param serializer vCard renderer; must not be null
     */
    public ImportExecutor(ContactRepository repository, VCardSerializer serializer) {
        if (repository == null) {
            throw new IllegalArgumentException("ContactRepository must not be null.");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("VCardSerializer must not be null.");
        }
        this.repository = repository;
        this.serializer = serializer;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Executes the batch.
     *
     * @param candidates every candidate of the import session
     * @param decisions  the caller's decisions; rows without one are skipped
     * @return the outcome; {@code committed} is true only when no row failed
     * @throws ImportExecutionException if the transaction cannot be begun,
     *         committed or rolled back
     */
    public ImportOutcome execute(List<CandidateRecord> candidates,
                                 List<ImportDecision> decisions) {
        Map<Integer, ImportDecision> decisionsByRow = new HashMap<>();
        if (decisions != null) {
            for (ImportDecision decision : decisions) {
                decisionsByRow.put(decision.getRowNumber(), decision);
            }
        }

        ImportOutcome.Builder outcome = new ImportOutcome.Builder();

        try {
            repository.beginTransaction();
        } catch (RepositoryException ex) {
            AppLogger.logErrorEvent("CSV_IMPORT_BEGIN_FAILED",
                    "candidates=" + candidates.size(), ex);
            throw new ImportExecutionException("Failed to begin import transaction.", ex);
        }

        try {
            for (CandidateRecord candidate : candidates) {
                ImportDecision decision = decisionsByRow.get(candidate.getRowNumber());
                if (decision == null || decision.getAction() == ImportAction.SKIP) {
                    outcome.addSkipped();
                    continue;
                }
                try {
                    applyDecision(candidate, decision, outcome);
                } catch (RuntimeException rowEx) {
                    String message = rowEx.getMessage() != null
                            ? rowEx.getMessage() : "Failed to import row";
                    log.warn("Row {} failed ({}): {}",
                            candidate.getRowNumber(), decision.getAction(), message);
                    outcome.addFailure(candidate.getRowNumber(), message);
                }
            }

            if (outcome.hasFailures()) {
                repository.rollback();
                outcome.committed(false);
            } else {
                repository.commit();
                outcome.committed(true);
            }

        } catch (RuntimeException transactionEx) {
            log.error("Import transaction failed - attempting rollback.", transactionEx);
            try {
                repository.rollback();
            } catch (RuntimeException rollbackEx) {
                log.error("Rollback also failed.", rollbackEx);
                transactionEx.addSuppressed(rollbackEx);
            }
            AppLogger.logErrorEvent("CSV_IMPORT_TRANSACTION_FAILED",
                    "candidates=" + candidates.size(), transactionEx);
            throw new ImportExecutionException("Import transaction failed.", transactionEx);
        }

        ImportOutcome result = outcome.build();
        if (result.isCommitted()) {
            AppLogger.logEvent("CSV_IMPORT_COMMITTED", result.toString());
        } else {
            AppLogger.logWarningEvent("CSV_IMPORT_ROLLED_BACK", result.toString());
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - ROW APPLICATION
    // -----------------------------------------------------------------------

    private void applyDecision(CandidateRecord candidate,
                               ImportDecision decision,
                               ImportOutcome.Builder outcome) {
        switch (decision.getAction()) {
            case UPDATE -> {
                applyUpdate(candidate, decision.getExistingId());
                outcome.addUpdated();
            }
            case CREATE -> {
                applyCreate(candidate);
                outcome.addCreated();
            }
            default -> outcome.addSkipped();
        }
    }

    private void applyUpdate(CandidateRecord candidate, Long existingId) {
        if (existingId == null) {
            throw new IllegalArgumentException(MSG_UPDATE_REQUIRES_ID);
        }
        Contact existing = repository.findById(existingId)
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format(MSG_NO_EXISTING_CONTACT, existingId)));

        Contact merged = new Contact(existing);
        for (Map.Entry<ContactField, String> entry : candidate.getValues().entrySet()) {
            merged.set(entry.getKey(), entry.getValue());
        }

        ExternalRecord record = serializer.toExternalRecord(
                existing.getVcardId(), merged.getFields());
        merged.setVcardId(record.getExternalId());
        merged.setVcardData(record.getSerializedForm());

        repository.update(merged);
        log.debug("Row {} merged into contact id={}.", candidate.getRowNumber(), existingId);
    }

    private void applyCreate(CandidateRecord candidate) {
        Contact contact = new Contact();
        for (Map.Entry<ContactField, String> entry : candidate.getValues().entrySet()) {
            contact.set(entry.getKey(), entry.getValue());
        }

        ExternalRecord record = serializer.toExternalRecord(null, contact.getFields());
        contact.setVcardId(record.getExternalId());
        contact.setVcardData(record.getSerializedForm());

        repository.create(contact);
        log.debug("Row {} created as contact id={}.", candidate.getRowNumber(), contact.getId());
    }
}
