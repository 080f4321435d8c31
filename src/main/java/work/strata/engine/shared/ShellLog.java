package work.strata.engine.shared;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Supplier;
import work.strata.engine.api.LogLevel;

/**
 * Process-wide log sink writing {@code [level] message} lines to standard error.
 */
public final class ShellLog {
    private static volatile LogLevel threshold = LogLevel.FATAL;
    private static volatile PrintStream sink = System.err;

    private ShellLog() {}

    public static void setThreshold(LogLevel level) {
        threshold = Objects.requireNonNull(level, "level");
    }

    public static LogLevel threshold() {
        return threshold;
    }

    static void redirect(PrintStream stream) {
        sink = stream == null ? System.err : stream;
    }

    public static boolean isEnabled(LogLevel level) {
        return threshold.includes(level);
    }

    public static void log(LogLevel level, String message) {
        if (isEnabled(level)) {
            sink.println("[" + level.tag() + "] " + message);
        }
    }

    public static void trace(Supplier<String> message) {
        if (isEnabled(LogLevel.TRACE)) {
            log(LogLevel.TRACE, message.get());
        }
    }

    public static void debug(Supplier<String> message) {
        if (isEnabled(LogLevel.DEBUG)) {
            log(LogLevel.DEBUG, message.get());
        }
    }

    public static void info(String message) {
        log(LogLevel.INFO, message);
    }

    public static void warn(String message) {
        log(LogLevel.WARN, message);
    }

    public static void error(String message) {
        log(LogLevel.ERROR, message);
    }
}
