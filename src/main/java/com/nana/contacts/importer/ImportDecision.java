package com.nana.contacts.importer;

/**
 * ImportDecision - The caller's choice for one candidate row.
 *
 * <p>{@code existingId} is required for {@link ImportAction#UPDATE} and
 * ignored otherwise. Rows with no decision are skipped.
 */
public final class ImportDecision {

    private final int          rowNumber;
    private final ImportAction action;
    private final Long         existingId;

    public ImportDecision(int rowNumber, ImportAction action, Long existingId) {
        if (action == null) {
            throw new IllegalArgumentException("ImportAction must not be null.");
        }
        this.rowNumber  = rowNumber;
        this.action     = action;
        this.existingId = existingId;
    }

    public static ImportDecision skip(int rowNumber) {
        return new ImportDecision(rowNumber, ImportAction.SKIP, null);
    }

    public static ImportDecision create(int rowNumber) {
        return new ImportDecision(rowNumber, ImportAction.CREATE, null);
    }

    public static ImportDecision update(int rowNumber, long existingId) {
        return new ImportDecision(rowNumber, ImportAction.UPDATE, existingId);
    }

    public int getRowNumber()          { return rowNumber; }
    public ImportAction getAction()    { return action; }

    /** @return the contact to update, or null */
    public Long getExistingId()        { return existingId; }

    @Override
    public String toString() {
        return "ImportDecision{row=" + rowNumber + ", action=" + action
               + (existingId != null ? ", existingId=" + existingId : "") + "}";
    }
}
