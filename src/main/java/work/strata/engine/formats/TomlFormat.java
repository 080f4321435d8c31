package work.strata.engine.formats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * TOML to values through tomlj. Dates and times become their TOML text.
 */
public final class TomlFormat {
    private TomlFormat() {}

    public static Value decode(String text, Span span) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            throw ShellError.cantConvert("structured data from toml", "string", span)
                .withHelp(result.errors().get(0).toString());
        }
        return fromTable(result, span);
    }

    static Value fromTable(TomlTable table, Span span) {
        var entries = new LinkedHashMap<String, Value>();
        for (var key : table.keySet()) {
            entries.put(key, fromObject(table.get(List.of(key)), span));
        }
        return Value.Record.of(entries, span);
    }

    private static Value fromObject(Object object, Span span) {
        if (object == null) {
            return Value.nothing(span);
        }
        if (object instanceof TomlTable table) {
            return fromTable(table, span);
        }
        if (object instanceof TomlArray array) {
            var items = new ArrayList<Value>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(fromObject(array.get(i), span));
            }
            return Value.list(items, span);
        }
        if (object instanceof String text) {
            return Value.string(text, span);
        }
        if (object instanceof Long number) {
            return Value.integer(number, span);
        }
        if (object instanceof Double number) {
            return Value.floating(number, span);
        }
        if (object instanceof Boolean flag) {
            return Value.bool(flag, span);
        }
        return Value.string(object.toString(), span);
    }
}
