package com.nana.contacts.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager - Owner of the single SQLite connection.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Resolve the database file from {@link AppConfig#KEY_DATABASE_PATH}
 *       and create its parent directory.</li>
 *   <li>Open and hold one shared {@link Connection} with WAL, foreign keys
 *       and a busy timeout.</li>
 *   <li>Create the {@code contacts} table and its indexes.</li>
 *   <li>Track the schema version and apply forward-only migrations.</li>
 *   <li>Own the connection's transaction state: at most one owner may hold
 *       an open transaction at a time.</li>
 * </ul>
 *
 * <p>The application uses the {@link #getInstance()} singleton. Tests open
 * their own unshared instance with {@link #open(String)}, typically over
 * {@code jdbc:sqlite::memory:}.
 */
public final class DatabaseManager {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /**
     * Increment whenever DDL changes and add the step to
     * {@link #applyMigration(int)}.
     */
    private static final int CURRENT_SCHEMA_VERSION = 2;

    private static final String PRAGMA_WAL  = "PRAGMA journal_mode=WAL;";
    private static final String PRAGMA_FK   = "PRAGMA foreign_keys=ON;";
    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    // -----------------------------------------------------------------------
    // SINGLETON INSTANCE
    // -----------------------------------------------------------------------

    private static DatabaseManager instance;

    private Connection connection;

    private final String jdbcUrl;

    /** Database file, or null for an in-memory database. */
    private final Path dbPath;

    /** Holder of the open transaction, or null in auto-commit mode. */
    private Object transactionOwner;

    // -----------------------------------------------------------------------
    // CONSTRUCTOR
    // -----------------------------------------------------------------------

    private DatabaseManager(String jdbcUrl, Path dbPath) {
        this.jdbcUrl = jdbcUrl;
        this.dbPath  = dbPath;
        log.info("Database URL resolved to: {}", jdbcUrl);

        try {
            initializeDirectory();
            openConnection();
            configurePragmas();
            initializeSchema();
            runMigrations();
        } catch (SQLException | IOException ex) {
            throw new DatabaseInitException(
                    "Failed to initialize the database at: " + jdbcUrl, ex);
        }
    }

    // -----------------------------------------------------------------------
    // PUBLIC STATIC ACCESS
    // -----------------------------------------------------------------------

    /**
     * Returns the application-wide manager over the configured database
     * file, creating it on first call.
     *
     * @return the shared DatabaseManager
     * @throws DatabaseInitException if initialization failed
     */
    public static synchronized DatabaseManager getInstance() {
        if (instance == null) {
            Path path = AppConfig.getInstance().getDatabasePath().toAbsolutePath();
            instance = new DatabaseManager(JDBC_PREFIX + path, path);
        }
        return instance;
    }

    /**
     * Opens a new, unshared manager over the given JDBC URL.
     *
     * @param jdbcUrl a {@code jdbc:sqlite:} URL
     * @return an initialized manager; the caller owns its shutdown
     * @throws DatabaseInitException if initialization failed
     */
    public static DatabaseManager open(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(JDBC_PREFIX)) {
            throw new IllegalArgumentException("Not a SQLite JDBC URL: " + jdbcUrl);
        }
        return new DatabaseManager(jdbcUrl, null);
    }

    /**
     * Returns the shared connection, reopening a file database whose
     * connection was closed.
     *
     * @return the open, configured JDBC connection
     * @throws DatabaseInitException if the connection cannot be reopened
     */
    public Connection getConnection() {
        try {
            if (connection == null || connection.isClosed()) {
                log.warn("Connection was closed or null - attempting to reopen.");
                openConnection();
                configurePragmas();
            }
        } catch (SQLException ex) {
            throw new DatabaseInitException("Failed to reopen database connection.", ex);
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Checkpoints the WAL and closes the connection.
     */
    public synchronized void shutdown() {
        transactionOwner = null;
        if (connection != null) {
            try {
                if (!connection.isClosed()) {
                    try (Statement st = connection.createStatement()) {
                        st.execute("PRAGMA wal_checkpoint(TRUNCATE);");
                    }
                    connection.close();
                    log.info("Database connection closed successfully.");
                }
            } catch (SQLException ex) {
                log.error("Error closing database connection during shutdown.", ex);
            }
        }
    }

    // -----------------------------------------------------------------------
    // TRANSACTIONS
    // -----------------------------------------------------------------------

    /**
     * Switches the shared connection out of auto-commit on behalf of
     * {@code owner}.
     *
     * @param owner the party that will commit or roll back; must not be null
     * @throws IllegalStateException if any owner already holds a transaction
     * @throws SQLException if auto-commit cannot be switched off
     */
    public synchronized void beginTransaction(Object owner) throws SQLException {
        if (owner == null) {
            throw new IllegalArgumentException("Transaction owner must not be null.");
        }
        if (transactionOwner != null) {
            throw new IllegalStateException(
                    "A transaction is already open on this connection.");
        }
        getConnection().setAutoCommit(false);
        transactionOwner = owner;
        log.debug("Transaction started by {}.", owner);
    }

    /**
     * Commits the transaction held by {@code owner}. Auto-commit is restored
     * even when the commit fails.
     *
     * @throws IllegalStateException if {@code owner} holds no transaction
     * @throws SQLException if the commit fails
     */
    public synchronized void commitTransaction(Object owner) throws SQLException {
        if (owner == null || transactionOwner != owner) {
            throw new IllegalStateException("No transaction is open for this owner.");
        }
        try {
            connection.commit();
            log.debug("Transaction committed.");
        } finally {
            endTransaction();
        }
    }

    /**
     * Rolls back the transaction held by {@code owner}. Does nothing when
     * {@code owner} holds none; another owner's transaction is left alone.
     *
     * @return true if a transaction was rolled back
     * @throws SQLException if the rollback fails
     */
    public synchronized boolean rollbackTransaction(Object owner) throws SQLException {
        if (owner == null || transactionOwner != owner) {
            return false;
        }
        try {
            connection.rollback();
            log.debug("Transaction rolled back.");
            return true;
        } finally {
            endTransaction();
        }
    }

    /**
     * @param owner the party to check
     * @return true if {@code owner} holds the open transaction
     */
    public synchronized boolean isTransactionOwner(Object owner) {
        return owner != null && transactionOwner == owner;
    }

    /** @return true if any owner holds an open transaction */
    public synchronized boolean isInTransaction() {
        return transactionOwner != null;
    }

    private void endTransaction() {
        transactionOwner = null;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException acEx) {
            log.error("Failed to re-enable auto-commit after transaction.", acEx);
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        if (dbPath == null || dbPath.getParent() == null) {
            return;
        }
        Path dir = dbPath.getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created application data directory: {}", dir.toAbsolutePath());
        }
    }

    private void openConnection() throws SQLException {
        connection = DriverManager.getConnection(jdbcUrl);

        DatabaseMetaData meta = connection.getMetaData();
        log.info("Connected to SQLite {} via driver {}",
                meta.getDatabaseProductVersion(),
                meta.getDriverVersion());
    }

    private void configurePragmas() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_WAL);
            st.execute(PRAGMA_FK);
            st.execute(PRAGMA_BUSY);
            log.debug("SQLite PRAGMAs configured: WAL mode, FK enforcement, busy timeout.");
        }
    }

    /**
     * Creates the version 1 tables if they do not already exist. Later
     * versions are reached through {@link #runMigrations()}.
     */
    private void initializeSchema() throws SQLException {
        log.info("Running schema initialization (CREATE TABLE IF NOT EXISTS)...");

        try (Statement st = connection.createStatement()) {

            // ----------------------------------------------------------
            // TABLE: contacts
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS contacts (
                    id           INTEGER PRIMARY KEY AUTOINCREMENT,
                    vcard_id     TEXT    NOT NULL UNIQUE,
                    full_name    TEXT,
                    first_name   TEXT,
                    last_name    TEXT,
                    email        TEXT,
                    phone        TEXT,
                    organization TEXT,
                    job_title    TEXT,
                    address      TEXT,
                    notes        TEXT,
                    vcard_data   TEXT    NOT NULL,
                    created_at   TEXT    NOT NULL,
                    updated_at   TEXT    NOT NULL
                );
                """);

            // ----------------------------------------------------------
            // TABLE: schema_version
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version     INTEGER NOT NULL
                );
                """);

            log.info("Schema initialization complete.");
        }
    }

    /**
     * Forward-only migration: a fresh database starts at version 1 and is
     * walked up to {@link #CURRENT_SCHEMA_VERSION} one step at a time.
     */
    private void runMigrations() throws SQLException {
        int storedVersion = getStoredSchemaVersion();

        if (storedVersion == -1) {
            insertSchemaVersion(1);
            storedVersion = 1;
            log.info("First launch detected. Schema version set to 1.");
        }

        if (storedVersion == CURRENT_SCHEMA_VERSION) {
            log.debug("Schema is up to date at version {}.", CURRENT_SCHEMA_VERSION);
            return;
        }

        log.info("Migrating schema from version {} to {}.", storedVersion, CURRENT_SCHEMA_VERSION);
        for (int v = storedVersion + 1; v <= CURRENT_SCHEMA_VERSION; v++) {
            applyMigration(v);
        }
        updateSchemaVersion(CURRENT_SCHEMA_VERSION);
        log.info("Schema migration complete. Now at version {}.", CURRENT_SCHEMA_VERSION);
    }

    private int getStoredSchemaVersion() throws SQLException {
        String sql = "SELECT version FROM schema_version LIMIT 1;";
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return rs.getInt("version");
            }
            return -1;
        }
    }

    private void insertSchemaVersion(int version) throws SQLException {
        String sql = "INSERT INTO schema_version (version) VALUES (?);";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    private void updateSchemaVersion(int version) throws SQLException {
        String sql = "UPDATE schema_version SET version = ?;";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    /**
     * Each step must be additive only.
     *
     * @param targetVersion the version being applied
     */
    private void applyMigration(int targetVersion) throws SQLException {
        log.info("Applying migration to schema version {}...", targetVersion);
        try (Statement st = connection.createStatement()) {
            switch (targetVersion) {
                case 2 -> {
                    st.execute("CREATE INDEX IF NOT EXISTS idx_contacts_email ON contacts(email);");
                    st.execute("CREATE INDEX IF NOT EXISTS idx_contacts_full_name ON contacts(full_name);");
                    st.execute("CREATE INDEX IF NOT EXISTS idx_contacts_vcard_id ON contacts(vcard_id);");
                }
                default -> log.warn("No migration defined for version {}. Skipping.", targetVersion);
            }
        }
    }

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * Thrown when the database cannot be opened or initialized.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
