package work.strata.engine.formats;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * {@code application/x-www-form-urlencoded} text to a record of strings. A repeated key keeps its first
 * position and its last value.
 */
public final class UrlFormat {
    private UrlFormat() {}

    public static Value decode(String text, Span span) {
        var entries = new LinkedHashMap<String, Value>();
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Value.Record.of(entries, span);
        }
        for (var pair : trimmed.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int separator = pair.indexOf('=');
            var key = separator < 0 ? pair : pair.substring(0, separator);
            var value = separator < 0 ? "" : pair.substring(separator + 1);
            entries.put(decodeComponent(key, span), Value.string(decodeComponent(value, span), span));
        }
        return Value.Record.of(entries, span);
    }

    private static String decodeComponent(String component, Span span) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw ShellError.unsupportedInput("String not compatible with url-encoding", span);
        }
    }
}
