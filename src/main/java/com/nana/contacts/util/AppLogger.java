package com.nana.contacts.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - Logging Utility
 *
 * <p>Per-class logging stays the usual
 * {@code LoggerFactory.getLogger(MyClass.class)}. This class adds what sits
 * above it:
 * <ul>
 *   <li>Startup and shutdown banners marking session boundaries.</li>
 *   <li>Structured business events: {@code [EVENT] NAME | details}.</li>
 *   <li>MDC operation and session context, printed by the Logback pattern
 *       on every line logged inside the scope.</li>
 *   <li>Applying the configured root level, so a {@code logging.level} set in
 *       the user properties file takes effect.</li>
 * </ul>
 *
 * <p>EXAMPLE USAGE:
 * <pre>
 *     AppLogger.setOperationContext(AppLogger.OP_CSV_PREVIEW);
 *     try {
 *         // every log line here carries operation=CSV_PREVIEW
 *     } finally {
 *         AppLogger.clearOperationContext();
 *     }
 * </pre>
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final Logger APP_LOG =
            LoggerFactory.getLogger("com.nana.contacts.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String MDC_OPERATION = "operation";
    public static final String MDC_SESSION   = "session";

    public static final String OP_CSV_PREVIEW        = "CSV_PREVIEW";
    public static final String OP_CSV_IMPORT_EXECUTE = "CSV_IMPORT_EXECUTE";

    private static final String APP_VERSION = "1.0.0-SNAPSHOT";
    private static final String APP_NAME    = "Contacts Plus";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs the session start banner with JVM and OS details.
     */
    public static void logStartup() {
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {} v{}", APP_NAME, APP_VERSION);
        APP_LOG.info("  Starting up - {}",
                LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:    {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:      {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info("  AppData: {}", AppConfig.appDataDirectory());
        APP_LOG.info(separator);
    }

    /**
     * Logs the session end banner.
     *
     * @param startTime when the session started; null reports zero duration
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long seconds = 0;
        if (startTime != null) {
            seconds = Duration.between(startTime, LocalDateTime.now()).getSeconds();
        }
        long hours   = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs    = seconds % 60;

        APP_LOG.info(separator);
        APP_LOG.info("  {} shutting down - {}",
                APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Session duration: {}h {}m {}s", hours, minutes, secs);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // LEVEL CONFIGURATION
    // -----------------------------------------------------------------------

    /**
     * Sets the Logback root logger level. {@code logback.xml} only sees the
     * bundled properties and system properties; this applies the value
     * {@link AppConfig} resolved from all of its layers.
     *
     * @param levelName a level name such as "DEBUG"; blank or unknown names
     *                  fall back to INFO
     * @return the level applied, or null when Logback is not the SLF4J backend
     */
    public static String applyRootLevel(String levelName) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            APP_LOG.warn("Logging backend is {}; log level '{}' not applied.",
                    factory.getClass().getName(), levelName);
            return null;
        }
        Level level = Level.toLevel(levelName == null ? null : levelName.trim(), Level.INFO);
        ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        return level.toString();
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName short label (e.g., "CSV_IMPORT_COMMITTED")
     * @param details   additional context
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Tags the current thread's log lines with an operation name until
     * {@link #clearOperationContext()} is called.
     *
     * @param operationName e.g. {@link #OP_CSV_PREVIEW}
     */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }

    public static void setSessionContext(String sessionId) {
        MDC.put(MDC_SESSION, sessionId);
    }

    public static void clearAllContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_SESSION);
    }

    // -----------------------------------------------------------------------
    // LOG FILE PATH RESOLUTION
    // -----------------------------------------------------------------------

    /**
     * Mirrors the file appender path in {@code logback.xml}.
     *
     * @return the active log file path
     */
    public static Path getLogFilePath() {
        return AppConfig.appDataDirectory().resolve("logs").resolve("contacts_plus.log");
    }

    /**
     * @return a timestamp-based session id (e.g., "SESSION-20250115-143200")
     */
    public static String generateSessionId() {
        return "SESSION-" + LocalDateTime.now()
                .format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
    }
}
