package work.strata.engine.cli;

import java.time.Duration;
import picocli.CommandLine;
import work.strata.engine.api.LogLevel;
import work.strata.engine.shared.DurationParser;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new StrataCommand())
            .registerConverter(LogLevel.class, Main::logLevel)
            .registerConverter(Duration.class, Main::duration)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    private static LogLevel logLevel(String raw) {
        try {
            return LogLevel.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }

    private static Duration duration(String raw) {
        try {
            return DurationParser.parse(raw).orElse(Duration.ZERO);
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() == null ? "Invalid duration: " + raw : ex.getMessage());
        }
    }
}
