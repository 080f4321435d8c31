package work.strata.engine.cli;

import picocli.CommandLine;
import work.strata.engine.protocol.ShellError;

/**
 * Prints a failed run as a single line. Shell errors keep their diagnostic code so scripts can match on it;
 * {@code -Dstrata.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "strata.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(summarize(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        commandLine.getErr().flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String summarize(Throwable ex) {
        if (ex instanceof ShellError shellError) {
            return "error[" + shellError.code() + "]: " + shellError.describe();
        }
        var cause = ex;
        while (cause.getMessage() == null && cause.getCause() != null) {
            cause = cause.getCause();
        }
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
