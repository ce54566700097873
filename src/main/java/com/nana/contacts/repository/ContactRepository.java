package com.nana.contacts.repository;

import com.nana.contacts.domain.Contact;

import java.util.List;
import java.util.Optional;

/**
 * ContactRepository - Repository Layer Interface
 *
 * <p>The contract between the import pipeline and the contact store. The
 * pipeline depends only on this interface, so tests drive it with a Mockito
 * mock or with {@link SqliteContactRepository} over an in-memory database.
 *
 * <p>EXCEPTION STRATEGY:
 * Every method may throw {@link RepositoryException}, an unchecked wrapper
 * around {@link java.sql.SQLException}.
 *
 * <p>TRANSACTIONS:
 * Writes run in auto-commit mode unless the caller has opened a transaction
 * with {@link #beginTransaction()}. Transactions do not nest.
 */
public interface ContactRepository {

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    /**
     * Inserts a contact. Sets its generated {@code id} and its
     * {@code createdAt} / {@code updatedAt} timestamps.
     *
     * @param contact the contact to insert; {@code vcardId} and
     *                {@code vcardData} must be set
     * @throws RepositoryException on a constraint violation or SQL error
     */
    void create(Contact contact);

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    /**
     * @return every stored contact, ordered by ascending id; never null
     * @throws RepositoryException if the query fails
     */
    List<Contact> findAll();

    /**
     * @param id surrogate key
     * @return the contact, or empty if no row has that id
     * @throws RepositoryException if the query fails
     */
    Optional<Contact> findById(long id);

    // -----------------------------------------------------------------------
    // UPDATE
    // -----------------------------------------------------------------------

    /**
     * Rewrites every mutable column of the row with the contact's id and
     * refreshes {@code updatedAt}.
     *
     * @param contact the contact to write; {@code id} must be &gt; 0
     * @throws RepositoryException if no row matches or any SQL error occurs
     */
    void update(Contact contact);

    // -----------------------------------------------------------------------
    // DELETE
    // -----------------------------------------------------------------------

    /**
     * @param id surrogate key of the row to remove
     * @throws RepositoryException if no row matches or any SQL error occurs
     */
    void delete(long id);

    // -----------------------------------------------------------------------
    // TRANSACTIONS
    // -----------------------------------------------------------------------

    /**
     * Opens a transaction on the shared connection.
     *
     * @throws RepositoryException if a transaction is already open or the
     *         connection refuses
     */
    void beginTransaction();

    /**
     * @throws RepositoryException if no transaction is open or the commit fails
     */
    void commit();

    /**
     * Rolls back the open transaction. Does nothing when none is open.
     *
     * @throws RepositoryException if the rollback fails
     */
    void rollback();

    boolean isInTransaction();

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * RepositoryException - Unchecked wrapper for store failures.
     */
    class RepositoryException extends RuntimeException {

        public RepositoryException(String message, Throwable cause) {
            super(message, cause);
        }

        public RepositoryException(String message) {
            super(message);
        }
    }
}
