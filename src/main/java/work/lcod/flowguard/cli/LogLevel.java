package work.lcod.flowguard.cli;

import java.util.Locale;

/**
 * Log thresholds accepted by {@code --log-level}, mapped onto slf4j-simple level names.
 */
enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Must run before the first logger is created; slf4j-simple reads its level once.
     */
    void apply() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, name().toLowerCase(Locale.ROOT));
    }
}
