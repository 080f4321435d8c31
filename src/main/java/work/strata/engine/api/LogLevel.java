package work.strata.engine.api;

import java.util.Locale;

/**
 * Engine log thresholds, lowest to highest severity. {@code FATAL} is the silent default.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("fatal");

    private final String tag;

    LogLevel(String tag) {
        this.tag = tag;
    }

    /**
     * Lower-case name printed in front of each log line.
     */
    public String tag() {
        return tag;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("warning".equals(normalized)) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.tag.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + value);
    }

    public boolean includes(LogLevel other) {
        return other.ordinal() >= ordinal();
    }
}
