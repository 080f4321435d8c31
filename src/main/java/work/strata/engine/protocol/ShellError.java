package work.strata.engine.protocol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Failure raised (or carried inside {@link Value.Error}) by the engine. Every instance has a {@link Kind},
 * a title, at least one labelled span where one is known, and an optional help line such as a
 * nearest-match suggestion.
 */
public final class ShellError extends RuntimeException {
    private final Kind kind;
    private final List<Label> labels;
    private final String help;

    private ShellError(Kind kind, String message, List<Label> labels, String help, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.labels = List.copyOf(labels);
        this.help = help;
    }

    public static ShellError of(Kind kind, String label, Span span) {
        return new ShellError(kind, kind.title(), List.of(new Label(label, span)), null, null);
    }

    public Kind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }

    public List<Label> labels() {
        return labels;
    }

    public Optional<String> help() {
        return Optional.ofNullable(help);
    }

    /**
     * First labelled span, or {@link Span#unknown()} for span-less errors (I/O, engine failures).
     */
    public Span span() {
        return labels.isEmpty() ? Span.unknown() : labels.get(0).span();
    }

    public ShellError withHelp(String newHelp) {
        return new ShellError(kind, getMessage(), labels, newHelp, getCause());
    }

    /**
     * Single-line rendering: title, labels and help. Used for logs and {@code intoString}.
     */
    public String describe() {
        var builder = new StringBuilder(getMessage());
        for (var label : labels) {
            builder.append(" [").append(label.text()).append(" @ ").append(label.span()).append(']');
        }
        if (help != null) {
            builder.append(" (").append(help).append(')');
        }
        return builder.toString();
    }

    // --- name resolution ---

    public static ShellError variableNotFound(Span span) {
        return of(Kind.VARIABLE_NOT_FOUND, "variable not found", span);
    }

    public static ShellError variableNotFound(Span span, Optional<String> suggestion) {
        return withSuggestion(variableNotFound(span), suggestion);
    }

    public static ShellError commandNotFound(Span span, Optional<String> suggestion) {
        return withSuggestion(of(Kind.COMMAND_NOT_FOUND, "command not found", span), suggestion);
    }

    public static ShellError envVarNotFound(Span span, Optional<String> suggestion) {
        return withSuggestion(of(Kind.ENV_VAR_NOT_FOUND, "environment variable not found", span), suggestion);
    }

    public static ShellError moduleNotFound(String name, Span span) {
        return of(Kind.MODULE_NOT_FOUND, "module '" + name + "' not found", span);
    }

    public static ShellError didNotFind(Span span) {
        return of(Kind.DID_NOT_FIND, "did not find anything under this name", span);
    }

    public static ShellError duplicateDeclaration(String name, Span span) {
        return new ShellError(
            Kind.DUPLICATE_DECLARATION,
            "Name '" + name + "' is defined more than once",
            List.of(new Label("defined more than once", span)),
            null,
            null
        );
    }

    public static ShellError exportNotFound(String name, Span span) {
        return new ShellError(
            Kind.EXPORT_NOT_FOUND,
            Kind.EXPORT_NOT_FOUND.title(),
            List.of(new Label("could not find import '" + name + "'", span)),
            null,
            null
        );
    }

    // --- cell paths ---

    public static ShellError cantFindColumn(Span lookup, Span origin, Optional<String> suggestion) {
        var error = new ShellError(
            Kind.CANT_FIND_COLUMN,
            Kind.CANT_FIND_COLUMN.title(),
            List.of(new Label("cannot find column", lookup), new Label("value originates here", origin)),
            null,
            null
        );
        return withSuggestion(error, suggestion);
    }

    public static ShellError notAList(Span lookup, Span origin) {
        return new ShellError(
            Kind.NOT_A_LIST,
            Kind.NOT_A_LIST.title(),
            List.of(new Label("value not a list", lookup), new Label("value originates here", origin)),
            null,
            null
        );
    }

    public static ShellError incompatiblePathAccess(String typeName, Span span) {
        return of(Kind.INCOMPATIBLE_PATH_ACCESS, typeName + " doesn't support cell paths", span);
    }

    public static ShellError accessBeyondEnd(int length, Span span) {
        return new ShellError(
            Kind.ACCESS_BEYOND_END,
            "Row number too large (max: " + length + ").",
            List.of(new Label("too large", span)),
            null,
            null
        );
    }

    public static ShellError accessBeyondEndOfStream(Span span) {
        return of(Kind.ACCESS_BEYOND_END_OF_STREAM, "too large", span);
    }

    // --- value operations ---

    public static ShellError operatorMismatch(Span opSpan, String lhsType, Span lhsSpan, String rhsType, Span rhsSpan) {
        return new ShellError(
            Kind.OPERATOR_MISMATCH,
            Kind.OPERATOR_MISMATCH.title(),
            List.of(
                new Label("type mismatch for operator", opSpan),
                new Label(lhsType, lhsSpan),
                new Label(rhsType, rhsSpan)
            ),
            null,
            null
        );
    }

    public static ShellError typeMismatch(String message, Span span) {
        return of(Kind.TYPE_MISMATCH, message, span);
    }

    public static ShellError pipelineMismatch(String expected, Span head, Span origin) {
        return new ShellError(
            Kind.PIPELINE_MISMATCH,
            Kind.PIPELINE_MISMATCH.title(),
            List.of(new Label("expected: " + expected, head), new Label("value originates from here", origin)),
            null,
            null
        );
    }

    public static ShellError unsupportedInput(String message, Span span) {
        return of(Kind.UNSUPPORTED_INPUT, message, span);
    }

    public static ShellError cantConvert(String to, String from, Span span) {
        return new ShellError(
            Kind.CANT_CONVERT,
            "Can't convert to " + to + ".",
            List.of(new Label("can't convert " + from + " to " + to, span)),
            null,
            null
        );
    }

    public static ShellError divisionByZero(Span span) {
        return of(Kind.DIVISION_BY_ZERO, "division by zero", span);
    }

    public static ShellError operatorOverflow(String message, Span span) {
        return of(Kind.OPERATOR_OVERFLOW, message, span);
    }

    public static ShellError invalidRange(String from, String to, Span span) {
        return new ShellError(
            Kind.INVALID_RANGE,
            "Invalid range " + from + ".." + to,
            List.of(new Label("expected a valid range", span)),
            null,
            null
        );
    }

    public static ShellError cannotCreateRange(Span span) {
        return of(Kind.CANNOT_CREATE_RANGE, "can't convert to countable values", span);
    }

    // --- calls ---

    public static ShellError missingParameter(String name, Span span) {
        return new ShellError(
            Kind.MISSING_PARAMETER,
            "Missing parameter: " + name + ".",
            List.of(new Label("missing parameter: " + name, span)),
            null,
            null
        );
    }

    public static ShellError delimiterError(String message, Span span) {
        return of(Kind.DELIMITER_ERROR, message, span);
    }

    // --- collaborators ---

    public static ShellError ioError(String message) {
        return new ShellError(Kind.IO_ERROR, Kind.IO_ERROR.title() + ": " + message, List.of(), null, null);
    }

    public static ShellError ioError(String message, Throwable cause) {
        return new ShellError(Kind.IO_ERROR, Kind.IO_ERROR.title() + ": " + message, List.of(), null, cause);
    }

    public static ShellError unsupportedConfigValue(String expected, String got, Span span) {
        return of(Kind.UNSUPPORTED_CONFIG_VALUE, "expected " + expected + ", got " + got, span);
    }

    public static ShellError missingConfigValue(String name, Span span) {
        return of(Kind.MISSING_CONFIG_VALUE, "missing " + name, span);
    }

    public static ShellError engineFailed(String message) {
        return new ShellError(Kind.ENGINE_FAILED, "Engine failed: " + message + ".", List.of(), null, null);
    }

    private static ShellError withSuggestion(ShellError error, Optional<String> suggestion) {
        return suggestion.map(name -> error.withHelp("did you mean '" + name + "'?")).orElse(error);
    }

    public record Label(String text, Span span) {
        public Label {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(span, "span");
        }
    }

    /**
     * Closed taxonomy of failures; each kind has a stable diagnostic code.
     */
    public enum Kind {
        VARIABLE_NOT_FOUND("strata::shell::variable_not_found", "Variable not found"),
        COMMAND_NOT_FOUND("strata::shell::command_not_found", "Command not found"),
        ENV_VAR_NOT_FOUND("strata::shell::env_var_not_found", "Environment variable not found"),
        MODULE_NOT_FOUND("strata::parser::module_not_found", "Module not found"),
        DID_NOT_FIND("strata::parser::not_found", "Not found."),
        DUPLICATE_DECLARATION("strata::parser::duplicate_declaration", "Name is defined more than once"),
        EXPORT_NOT_FOUND("strata::parser::export_not_found", "Could not find import"),
        CANT_FIND_COLUMN("strata::shell::column_not_found", "Cannot find column"),
        NOT_A_LIST("strata::shell::not_a_list", "Not a list value"),
        INCOMPATIBLE_PATH_ACCESS("strata::shell::incompatible_path_access", "Data cannot be accessed with a cell path"),
        ACCESS_BEYOND_END("strata::shell::access_beyond_end", "Row number too large."),
        ACCESS_BEYOND_END_OF_STREAM("strata::shell::access_beyond_end_of_stream", "Row number too large."),
        OPERATOR_MISMATCH("strata::shell::operator_mismatch", "Type mismatch during operation."),
        OPERATOR_OVERFLOW("strata::shell::operator_overflow", "Operator overflow."),
        TYPE_MISMATCH("strata::shell::type_mismatch", "Type mismatch"),
        PIPELINE_MISMATCH("strata::shell::pipeline_mismatch", "Pipeline mismatch."),
        UNSUPPORTED_INPUT("strata::shell::unsupported_input", "Unsupported input"),
        CANT_CONVERT("strata::shell::cant_convert", "Can't convert."),
        DIVISION_BY_ZERO("strata::shell::division_by_zero", "Division by zero."),
        INVALID_RANGE("strata::shell::invalid_range", "Invalid range"),
        CANNOT_CREATE_RANGE("strata::shell::range_to_countable", "Can't convert range to countable values"),
        MISSING_PARAMETER("strata::shell::missing_parameter", "Missing parameter."),
        DELIMITER_ERROR("strata::shell::delimiter_error", "Delimiter error"),
        IO_ERROR("strata::shell::io_error", "I/O error"),
        UNSUPPORTED_CONFIG_VALUE("strata::shell::unsupported_config_value", "Unsupported config value"),
        MISSING_CONFIG_VALUE("strata::shell::missing_config_value", "Missing config value"),
        ENGINE_FAILED("strata::shell::engine_failed", "Engine failed");

        private final String code;
        private final String title;

        Kind(String code, String title) {
            this.code = code;
            this.title = title;
        }

        public String code() {
            return code;
        }

        public String title() {
            return title;
        }
    }
}
