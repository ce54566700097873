package com.nana.contacts.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private static AppConfig with(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return AppConfig.fromProperties(props);
    }

    @Test
    @DisplayName("defaults apply when nothing is overridden")
    void fromProperties_defaults() {
        AppConfig config = AppConfig.fromProperties(null);

        assertEquals(5L * 1024 * 1024, config.getMaxImportFileBytes());
        assertTrue(config.isImportReportEnabled());
        assertEquals("INFO", config.getString(AppConfig.KEY_LOG_LEVEL));
        assertTrue(config.getDatabasePath().endsWith(Paths.get("Contacts_Plus", "contacts_plus.db")));
        assertNull(config.getPropertiesFilePath());
    }

    @Test
    @DisplayName("overrides replace defaults")
    void fromProperties_overrides() {
        AppConfig config = with(AppConfig.KEY_IMPORT_MAX_FILE_BYTES, "1024");

        assertEquals(1024L, config.getMaxImportFileBytes());
    }

    @Test
    @DisplayName("a malformed number falls back to the default")
    void getLong_malformed_default() {
        AppConfig config = with(AppConfig.KEY_IMPORT_MAX_FILE_BYTES, "lots");

        assertEquals(5L * 1024 * 1024, config.getMaxImportFileBytes());
        assertEquals(7, config.getInt(AppConfig.KEY_IMPORT_MAX_FILE_BYTES, 7));
        assertEquals(3, config.getInt("missing.key", 3));
    }

    @ParameterizedTest
    @CsvSource({"true, true", "YES, true", "1, true", "false, false", "no, false", "maybe, false"})
    @DisplayName("booleans accept true, yes and 1")
    void getBoolean(String raw, boolean expected) {
        assertEquals(expected, with(AppConfig.KEY_IMPORT_REPORT_ENABLED, raw).isImportReportEnabled());
    }

    @Test
    @DisplayName("set changes a value at runtime")
    void set_overridesValue() {
        AppConfig config = AppConfig.fromProperties(null);
        config.set(AppConfig.KEY_IMPORT_REPORT_ENABLED, "false");

        assertFalse(config.isImportReportEnabled());
    }
}
