package com.nana.contacts.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * AppConfig - Application Configuration Manager
 *
 * <p>LAYERING (later wins):
 * <ol>
 *   <li>Built-in defaults.</li>
 *   <li>{@code contacts-plus.properties} on the classpath.</li>
 *   <li>The user file
 *       {@code <APPDATA|user.home>/Contacts_Plus/contacts-plus.properties}.</li>
 *   <li>System properties with the same key.</li>
 * </ol>
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String KEY_DATABASE_PATH        = "database.path";
    public static final String KEY_IMPORT_MAX_FILE_BYTES = "import.max.file.bytes";
    public static final String KEY_IMPORT_REPORT_ENABLED = "import.report.enabled";
    public static final String KEY_LOG_LEVEL             = "logging.level";

    static final String APP_DATA_DIR    = "Contacts_Plus";
    static final String PROPERTIES_FILE = "contacts-plus.properties";

    private static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024 * 1024;

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_DATABASE_PATH,
                appDataDirectory().resolve("contacts_plus.db").toString());
        DEFAULTS.setProperty(KEY_IMPORT_MAX_FILE_BYTES, Long.toString(DEFAULT_MAX_FILE_BYTES));
        DEFAULTS.setProperty(KEY_IMPORT_REPORT_ENABLED, "true");
        DEFAULTS.setProperty(KEY_LOG_LEVEL,             "INFO");
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig();
        }
        return instance;
    }

    /**
     * Builds a config from the defaults plus the given overrides only.
     * No classpath, user file or system properties are read.
     *
     * @param overrides values to apply over the defaults
     * @return a new, unshared config
     */
    public static AppConfig fromProperties(Properties overrides) {
        Properties props = new Properties(DEFAULTS);
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                props.setProperty(key, overrides.getProperty(key));
            }
        }
        return new AppConfig(props, null);
    }

    private final Properties props;
    private final Path propertiesFilePath;

    private AppConfig() {
        propertiesFilePath = appDataDirectory().resolve(PROPERTIES_FILE);
        props = new Properties(DEFAULTS);
        loadClasspathProperties();
        loadUserProperties();
        applySystemProperties();
        log.info("AppConfig loaded. Properties file: {}", propertiesFilePath.toAbsolutePath());
    }

    private AppConfig(Properties props, Path propertiesFilePath) {
        this.props = props;
        this.propertiesFilePath = propertiesFilePath;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException ex) {
            log.warn("Config key '{}' is not a number: '{}'.", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException ex) {
            log.warn("Config key '{}' is not a number: '{}'.", key, val);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    public Path getDatabasePath() {
        return Paths.get(getString(KEY_DATABASE_PATH));
    }

    public long getMaxImportFileBytes() {
        return getLong(KEY_IMPORT_MAX_FILE_BYTES, DEFAULT_MAX_FILE_BYTES);
    }

    public boolean isImportReportEnabled() {
        return getBoolean(KEY_IMPORT_REPORT_ENABLED);
    }

    /** @return the configured root log level name, e.g. "INFO" */
    public String getLogLevel() {
        return getString(KEY_LOG_LEVEL);
    }

    /** @return the user properties file, or null for configs built in memory */
    public Path getPropertiesFilePath() {
        return propertiesFilePath;
    }

    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    /**
     * @return {@code <APPDATA|user.home>/Contacts_Plus}
     */
    public static Path appDataDirectory() {
        String appData = System.getenv("APPDATA");
        if (appData == null || appData.isBlank()) appData = System.getProperty("user.home");
        return Paths.get(appData, APP_DATA_DIR);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private void loadClasspathProperties() {
        try (InputStream in = AppConfig.class.getClassLoader()
                .getResourceAsStream(PROPERTIES_FILE)) {
            if (in == null) {
                log.debug("No classpath {} found; using defaults.", PROPERTIES_FILE);
                return;
            }
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load classpath properties: {}", ex.getMessage());
        }
    }

    private void loadUserProperties() {
        if (!Files.exists(propertiesFilePath)) {
            log.debug("User properties file not found; using defaults.");
            return;
        }
        try (InputStream in = Files.newInputStream(propertiesFilePath)) {
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load user properties: {}", ex.getMessage());
        }
    }

    private void applySystemProperties() {
        for (String key : DEFAULTS.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
    }
}
