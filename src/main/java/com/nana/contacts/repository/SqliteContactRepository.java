package com.nana.contacts.repository;

import com.nana.contacts.domain.Contact;
import com.nana.contacts.domain.ContactField;
import com.nana.contacts.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SqliteContactRepository - {@link ContactRepository} over SQLite.
 *
 * <p>ARCHITECTURAL RULES ENFORCED HERE:
 * <ul>
 *   <li>All SQL lives in this class, as named constants.</li>
 *   <li>All SQL uses prepared statements.</li>
 *   <li>Every {@link SQLException} is wrapped in
 *       {@link ContactRepository.RepositoryException}.</li>
 * </ul>
 *
 * <p>The nine contact columns are bound and read in {@link ContactField}
 * declaration order by {@link #bindFields} and {@link #mapRow}.
 *
 * <p>TRANSACTIONS:
 * Transaction state belongs to the {@link DatabaseManager}, since every
 * repository over it shares one connection. This repository registers itself
 * as the owner on {@link #beginTransaction()}; a second begin from any
 * repository over the same manager fails until the owner commits or rolls
 * back. {@link #commit()} and {@link #rollback()} always restore
 * auto-commit, even when they fail.
 */
public class SqliteContactRepository implements ContactRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteContactRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT = """
            INSERT INTO contacts
                (vcard_id, full_name, first_name, last_name, email, phone,
                 organization, job_title, address, notes,
                 vcard_data, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_ALL = """
            SELECT * FROM contacts
            ORDER BY id ASC
            """;

    private static final String SQL_FIND_BY_ID = """
            SELECT * FROM contacts
            WHERE id = ?
            """;

    private static final String SQL_UPDATE = """
            UPDATE contacts SET
                vcard_id     = ?,
                full_name    = ?,
                first_name   = ?,
                last_name    = ?,
                email        = ?,
                phone        = ?,
                organization = ?,
                job_title    = ?,
                address      = ?,
                notes        = ?,
                vcard_data   = ?,
                updated_at   = ?
            WHERE id = ?
            """;

    private static final String SQL_DELETE =
            "DELETE FROM contacts WHERE id = ?";

    // -----------------------------------------------------------------------
    // STATE
    // -----------------------------------------------------------------------

    private final DatabaseManager databaseManager;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /** Creates a repository over the application database. */
    public SqliteContactRepository() {
        this(DatabaseManager.getInstance());
    }

    /**
     * @param databaseManager connection owner; must not be null
     */
    public SqliteContactRepository(DatabaseManager databaseManager) {
        if (databaseManager == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.databaseManager = databaseManager;
        log.debug("SqliteContactRepository instantiated over {}.", databaseManager.getJdbcUrl());
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private Connection conn() {
        return databaseManager.getConnection();
    }

    private Contact mapRow(ResultSet rs) throws SQLException {
        Contact contact = new Contact();
        contact.setId(rs.getLong("id"));
        contact.setVcardId(rs.getString("vcard_id"));
        for (ContactField field : ContactField.values()) {
            contact.set(field, rs.getString(field.getColumnName()));
        }
        contact.setVcardData(rs.getString("vcard_data"));
        contact.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        contact.setUpdatedAt(parseTimestamp(rs.getString("updated_at")));
        return contact;
    }

    /**
     * Binds vcard_id and the nine contact columns starting at index 1.
     *
     * @return the next free parameter index
     */
    private int bindFields(PreparedStatement ps, Contact contact) throws SQLException {
        int idx = 1;
        ps.setString(idx++, contact.getVcardId());
        for (ContactField field : ContactField.values()) {
            ps.setString(idx++, contact.get(field));
        }
        return idx;
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, Contact.TIMESTAMP_FORMAT);
        } catch (Exception ex) {
            log.warn("Failed to parse timestamp '{}'; leaving it empty.", value);
            return null;
        }
    }

    private String formatTimestamp(LocalDateTime dt) {
        return (dt == null ? LocalDateTime.now() : dt).format(Contact.TIMESTAMP_FORMAT);
    }

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    @Override
    public void create(Contact contact) {
        log.debug("Creating contact: {}", contact);

        LocalDateTime now = LocalDateTime.now().withNano(0);
        if (contact.getCreatedAt() == null) {
            contact.setCreatedAt(now);
        }
        contact.setUpdatedAt(now);

        try (PreparedStatement ps = conn().prepareStatement(
                SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {

            int idx = bindFields(ps, contact);
            ps.setString(idx++, contact.getVcardData());
            ps.setString(idx++, formatTimestamp(contact.getCreatedAt()));
            ps.setString(idx,   formatTimestamp(contact.getUpdatedAt()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    contact.setId(keys.getLong(1));
                    log.info("Contact saved with DB id={}.", contact.getId());
                }
            }

        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to create contact: " + contact.getVcardId(), ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public List<Contact> findAll() {
        List<Contact> contacts = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ALL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                contacts.add(mapRow(rs));
            }
            log.debug("findAll() returned {} contacts.", contacts.size());
            return contacts;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to retrieve all contacts.", ex);
        }
    }

    @Override
    public Optional<Contact> findById(long id) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_ID)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to find contact by id: " + id, ex);
        }
    }

    // -----------------------------------------------------------------------
    // UPDATE
    // -----------------------------------------------------------------------

    @Override
    public void update(Contact contact) {
        log.debug("Updating contact id={}.", contact.getId());

        contact.setUpdatedAt(LocalDateTime.now().withNano(0));

        try (PreparedStatement ps = conn().prepareStatement(SQL_UPDATE)) {

            int idx = bindFields(ps, contact);
            ps.setString(idx++, contact.getVcardData());
            ps.setString(idx++, formatTimestamp(contact.getUpdatedAt()));
            ps.setLong(idx,     contact.getId());

            int affected = ps.executeUpdate();
            if (affected == 0) {
                throw new RepositoryException(
                        "Update affected 0 rows - no contact found with id: "
                        + contact.getId());
            }

            log.info("Contact id={} updated successfully.", contact.getId());

        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to update contact id: " + contact.getId(), ex);
        }
    }

    // -----------------------------------------------------------------------
    // DELETE
    // -----------------------------------------------------------------------

    @Override
    public void delete(long id) {
        log.debug("Deleting contact id={}.", id);

        try (PreparedStatement ps = conn().prepareStatement(SQL_DELETE)) {
            ps.setLong(1, id);

            int affected = ps.executeUpdate();
            if (affected == 0) {
                throw new RepositoryException(
                        "Delete affected 0 rows - no contact found with id: " + id);
            }

            log.info("Contact id={} deleted.", id);

        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to delete contact with id: " + id, ex);
        }
    }

    // -----------------------------------------------------------------------
    // TRANSACTIONS
    // -----------------------------------------------------------------------

    @Override
    public void beginTransaction() {
        try {
            databaseManager.beginTransaction(this);
        } catch (IllegalStateException ex) {
            throw new RepositoryException(ex.getMessage(), ex);
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to begin transaction.", ex);
        }
    }

    @Override
    public void commit() {
        try {
            databaseManager.commitTransaction(this);
        } catch (IllegalStateException ex) {
            throw new RepositoryException("No transaction is open.", ex);
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to commit transaction.", ex);
        }
    }

    @Override
    public void rollback() {
        try {
            databaseManager.rollbackTransaction(this);
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to roll back transaction.", ex);
        }
    }

    @Override
    public boolean isInTransaction() {
        return databaseManager.isTransactionOwner(this);
    }
}
