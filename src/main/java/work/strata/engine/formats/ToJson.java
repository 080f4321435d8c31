package work.strata.engine.formats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;

/**
 * Values to JSON through Jackson. Ranges are expanded, binary becomes an array of byte values and
 * error values are rethrown.
 */
public final class ToJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ToJson() {}

    public static String toPrettyJson(Value value) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(value));
        } catch (JsonProcessingException ex) {
            throw ShellError.cantConvert("json", value.typeName(), value.span());
        }
    }

    public static String toCompactJson(Value value) {
        try {
            return JSON.writeValueAsString(toNode(value));
        } catch (JsonProcessingException ex) {
            throw ShellError.cantConvert("json", value.typeName(), value.span());
        }
    }

    public static JsonNode toNode(Value value) {
        if (value instanceof Value.Nothing) {
            return NODES.nullNode();
        } else if (value instanceof Value.Bool bool) {
            return NODES.booleanNode(bool.val());
        } else if (value instanceof Value.Int integer) {
            return NODES.numberNode(integer.val());
        } else if (value instanceof Value.Float floating) {
            return NODES.numberNode(floating.val());
        } else if (value instanceof Value.Str str) {
            return NODES.textNode(str.val());
        } else if (value instanceof Value.Binary binary) {
            var array = NODES.arrayNode();
            for (byte b : binary.val()) {
                array.add(Byte.toUnsignedInt(b));
            }
            return array;
        } else if (value instanceof Value.Record record) {
            var object = NODES.objectNode();
            for (int i = 0; i < record.cols().size(); i++) {
                object.set(record.cols().get(i), toNode(record.vals().get(i)));
            }
            return object;
        } else if (value instanceof Value.List list) {
            var array = NODES.arrayNode();
            list.vals().forEach(item -> array.add(toNode(item)));
            return array;
        } else if (value instanceof Value.Range range) {
            if (range.to() instanceof Value.Nothing) {
                throw ShellError.cantConvert("json", "unbounded range", range.span());
            }
            var array = NODES.arrayNode();
            range.iterator().forEachRemaining(item -> array.add(toNode(item)));
            return array;
        } else if (value instanceof Value.Error error) {
            throw error.error();
        }
        return NODES.textNode(value.intoString(", ", null));
    }
}
