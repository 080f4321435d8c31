package work.strata.engine.formats;

import java.util.LinkedHashMap;
import java.util.Map;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * INI to a record of sections, each a record of string values. Lines starting with {@code ;} or
 * {@code #} are comments.
 */
public final class IniFormat {
    private IniFormat() {}

    public static Value decode(String text, Span span) {
        var sections = new LinkedHashMap<String, Map<String, Value>>();
        Map<String, Value> current = null;
        var lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw invalid("unterminated section header on line " + (i + 1), span);
                }
                var name = line.substring(1, line.length() - 1).trim();
                current = sections.computeIfAbsent(name, key -> new LinkedHashMap<>());
                continue;
            }
            int separator = line.indexOf('=');
            if (separator < 0) {
                throw invalid("expected key=value on line " + (i + 1), span);
            }
            if (current == null) {
                throw invalid("key outside of any section on line " + (i + 1), span);
            }
            var key = line.substring(0, separator).trim();
            var value = unquote(line.substring(separator + 1).trim());
            current.put(key, Value.string(value, span));
        }
        var entries = new LinkedHashMap<String, Value>();
        sections.forEach((name, values) -> entries.put(name, Value.Record.of(values, span)));
        return Value.Record.of(entries, span);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static ShellError invalid(String reason, Span span) {
        return ShellError.unsupportedInput("Could not load ini: " + reason, span);
    }
}
