package work.strata.engine.commands;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

/**
 * Text commands: str collect, str substring, str screaming-snake-case, parse and ansi strip.
 */
public final class StringCommands {
    private static final Pattern ANSI_ESCAPE = Pattern.compile(
        "\u001B\\[[0-?]*[ -/]*[@-~]|\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)|\u001B[@-Z\\\\-_]"
    );

    private StringCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("str collect").optional("separator", "optional separator to use when creating string"),
            "Concatenate multiple strings into a single string, with an optional separator between each.",
            StringCommands::collect
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("str substring")
                .required("range", "the indexes to substring [start end]")
                .rest("rest", "optionally substring text by column paths"),
            "Get part of a string.",
            StringCommands::substring
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("str screaming-snake-case").rest("rest", "optionally convert text to SCREAMING_SNAKE_CASE by column paths"),
            "Convert a string to SCREAMING_SNAKE_CASE.",
            StringCommands::screamingSnakeCase
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("parse")
                .required("pattern", "the pattern to match. Eg) \"{foo}: {bar}\"")
                .switchFlag("regex", "use full regex syntax for patterns", 'r'),
            "Parse columns from string data using a simple pattern.",
            StringCommands::parse
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("ansi strip").rest("column path", "optionally, remove ansi sequences by column paths"),
            "Strip ANSI escape sequences from a string.",
            StringCommands::ansiStrip
        ));
        return workingSet;
    }

    private static PipelineData collect(EngineState engine, Stack stack, Call call, PipelineData input) {
        var separator = call.opt(engine, stack, 0).map(Value::asString).orElse("");
        var config = stack.getConfig();
        var parts = new ArrayList<String>();
        var iterator = input.iterator();
        while (iterator.hasNext()) {
            parts.add(iterator.next().debugString("\n", config));
        }
        return PipelineData.value(Value.string(String.join(separator, parts), call.head()));
    }

    // --- str substring ---

    private static PipelineData substring(EngineState engine, Stack stack, Call call, PipelineData input) {
        var bounds = substringBounds(call.req(engine, stack, 0));
        var paths = call.restCellPaths(engine, stack, 1);
        return CellPathAction.operate(
            input,
            paths,
            value -> substringOf(value, bounds[0], bounds[1], call.head()),
            engine.cancellationToken()
        );
    }

    /**
     * Reads {@code "start,end"} or {@code [start end]}; an empty or {@code _} start means 0 and an
     * empty or {@code _} end means the end of the string.
     */
    static long[] substringBounds(Value range) {
        var parts = new ArrayList<String>();
        if (range instanceof Value.Str str) {
            for (var part : str.val().split(",", -1)) {
                parts.add(part.trim());
            }
        } else if (range instanceof Value.List list) {
            for (var item : list.vals()) {
                if (item instanceof Value.Int integer) {
                    parts.add(Long.toString(integer.val()));
                } else if (item instanceof Value.Str str) {
                    parts.add(str.val().trim());
                } else {
                    throw ShellError.unsupportedInput("could not perform substring", range.span());
                }
            }
        } else {
            throw ShellError.unsupportedInput("could not perform substring", range.span());
        }
        if (parts.size() > 2) {
            throw ShellError.unsupportedInput("More than two indices given", range.span());
        }
        long start = parseIndex(parts.isEmpty() ? "" : parts.get(0), 0, range.span());
        long end = parseIndex(parts.size() < 2 ? "" : parts.get(1), Long.MAX_VALUE, range.span());
        return new long[] {start, end};
    }

    private static long parseIndex(String text, long fallback, Span span) {
        if (text.isEmpty() || text.equals("_")) {
            return fallback;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw ShellError.unsupportedInput("could not perform substring", span);
        }
    }

    /**
     * Substring by character (code point) positions. Negative positions count from the end.
     */
    static Value substringOf(Value value, long start, long end, Span head) {
        if (!(value instanceof Value.Str str)) {
            value.orThrow();
            throw ShellError.unsupportedInput(
                "Input's type is " + value.typeName() + ". This command only works with strings.",
                head
            );
        }
        var codePoints = str.val().codePoints().toArray();
        long length = codePoints.length;
        long from = start < 0 ? start + length : start;
        long to = end < 0 ? Math.max(length + end, 0) : end;
        if (from < length && to >= 0) {
            if (from == to) {
                return Value.string("", str.span());
            }
            if (from > to) {
                throw ShellError.unsupportedInput("End must be greater than or equal to Start", head);
            }
            int first = (int) Math.max(from, 0);
            int last = (int) Math.min(to, length);
            return Value.string(new String(codePoints, first, last - first), str.span());
        }
        return Value.string("", str.span());
    }

    // --- str screaming-snake-case ---

    private static PipelineData screamingSnakeCase(EngineState engine, Stack stack, Call call, PipelineData input) {
        var paths = call.restCellPaths(engine, stack, 0);
        return CellPathAction.operate(input, paths, value -> {
            if (!(value instanceof Value.Str str)) {
                value.orThrow();
                throw ShellError.unsupportedInput(
                    "Input's type is " + value.typeName() + ". This command only works with strings.",
                    call.head()
                );
            }
            return Value.string(toScreamingSnakeCase(str.val()), str.span());
        }, engine.cancellationToken());
    }

    /**
     * Splits on non-alphanumerics, lower-to-upper transitions and the end of an acronym, then joins the
     * upper-cased words with underscores.
     */
    static String toScreamingSnakeCase(String text) {
        var words = new ArrayList<String>();
        var word = new StringBuilder();
        var codePoints = text.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            int current = codePoints[i];
            if (!Character.isLetterOrDigit(current)) {
                flush(word, words);
                continue;
            }
            if (word.length() > 0 && Character.isUpperCase(current)) {
                int previous = codePoints[i - 1];
                boolean nextIsLower = i + 1 < codePoints.length && Character.isLowerCase(codePoints[i + 1]);
                if (Character.isLowerCase(previous) || Character.isDigit(previous)
                    || (Character.isUpperCase(previous) && nextIsLower)) {
                    flush(word, words);
                }
            }
            word.appendCodePoint(current);
        }
        flush(word, words);
        var joined = new StringBuilder();
        for (var part : words) {
            if (joined.length() > 0) {
                joined.append('_');
            }
            joined.append(part.toUpperCase(Locale.ROOT));
        }
        return joined.toString();
    }

    private static void flush(StringBuilder word, List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }

    // --- parse ---

    private static PipelineData parse(EngineState engine, Stack stack, Call call, PipelineData input) {
        var patternValue = call.req(engine, stack, 0);
        var text = patternValue.asString();
        var compiled = call.hasFlag("regex")
            ? regexPattern(text, patternValue.span())
            : simplePattern(text, patternValue.span());
        var rows = new ArrayList<Value>();
        var iterator = input.iterator();
        while (iterator.hasNext()) {
            var value = iterator.next();
            if (!(value instanceof Value.Str str)) {
                value.orThrow();
                throw ShellError.pipelineMismatch("string", call.head(), value.span());
            }
            Matcher matcher = compiled.regex().matcher(str.val());
            while (matcher.find()) {
                var vals = new ArrayList<Value>();
                for (int group = 1; group <= compiled.columns().size(); group++) {
                    var captured = matcher.group(group);
                    vals.add(Value.string(captured == null ? "" : captured, call.head()));
                }
                rows.add(Value.record(compiled.columns(), vals, call.head()));
            }
        }
        return PipelineData.fromList(rows, engine.cancellationToken());
    }

    /**
     * {@code {name}} placeholders capture lazily, everything else matches literally and the whole input
     * must match. Doubled braces stand for literal braces.
     */
    static ParsePattern simplePattern(String pattern, Span span) {
        var regex = new StringBuilder("(?s)\\A");
        var columns = new ArrayList<String>();
        var literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '{' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
                literal.append('{');
                i++;
            } else if (c == '}' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
                literal.append('}');
                i++;
            } else if (c == '{') {
                int close = pattern.indexOf('}', i + 1);
                if (close < 0) {
                    throw ShellError.delimiterError("Found opening `{` without an associated closing `}`", span);
                }
                appendLiteral(regex, literal);
                columns.add(pattern.substring(i + 1, close));
                regex.append("(.*?)");
                i = close;
            } else {
                literal.append(c);
            }
        }
        appendLiteral(regex, literal);
        regex.append("\\z");
        return ParsePattern.of(Pattern.compile(regex.toString()), columns, span);
    }

    private static void appendLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * A user regex; named groups become columns of the same name and unnamed ones {@code Capture<n>}.
     */
    static ParsePattern regexPattern(String pattern, Span span) {
        Pattern regex;
        try {
            regex = Pattern.compile(pattern);
        } catch (PatternSyntaxException ex) {
            throw ShellError.delimiterError("Invalid regex: " + ex.getDescription(), span);
        }
        return ParsePattern.of(regex, groupNames(pattern), span);
    }

    private static List<String> groupNames(String pattern) {
        var names = new ArrayList<String>();
        boolean inClass = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                i++;
            } else if (inClass) {
                inClass = c != ']';
            } else if (c == '[') {
                inClass = true;
            } else if (c == '(') {
                if (pattern.startsWith("(?<", i) && !pattern.startsWith("(?<=", i) && !pattern.startsWith("(?<!", i)) {
                    int close = pattern.indexOf('>', i);
                    names.add(pattern.substring(i + 3, close));
                } else if (!pattern.startsWith("(?", i)) {
                    names.add("Capture" + (names.size() + 1));
                }
            }
        }
        return names;
    }

    record ParsePattern(Pattern regex, List<String> columns) {
        /**
         * Column names become record columns, so each one may appear only once.
         */
        static ParsePattern of(Pattern regex, List<String> columns, Span span) {
            var seen = new HashSet<String>();
            for (var column : columns) {
                if (!seen.add(column)) {
                    throw ShellError.delimiterError("Column `" + column + "` is captured more than once", span);
                }
            }
            return new ParsePattern(regex, List.copyOf(columns));
        }
    }

    // --- ansi strip ---

    private static PipelineData ansiStrip(EngineState engine, Stack stack, Call call, PipelineData input) {
        var paths = call.restCellPaths(engine, stack, 0);
        return CellPathAction.operate(input, paths, value -> {
            if (!(value instanceof Value.Str str)) {
                value.orThrow();
                throw ShellError.typeMismatch("value is " + value.typeName() + ", not string", value.span());
            }
            return Value.string(ANSI_ESCAPE.matcher(str.val()).replaceAll(""), str.span());
        }, engine.cancellationToken());
    }
}
