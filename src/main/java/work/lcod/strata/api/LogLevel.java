package work.lcod.strata.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the command line, mapped onto SLF4J simple logger levels.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String simpleLoggerValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Sets the process-wide default level; only effective before the first logger is created.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerValue());
    }
}
