package work.strata.engine.formats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * JSON to values through Jackson's tree model. Object keys keep their order.
 */
public final class JsonFormat {
    private static final ObjectMapper JSON = new ObjectMapper();

    private JsonFormat() {}

    public static Value decode(String text, Span span) {
        if (text.isBlank()) {
            return Value.nothing(span);
        }
        try {
            return fromNode(JSON.readTree(text), span);
        } catch (JsonProcessingException ex) {
            throw invalid(ex, span);
        }
    }

    /**
     * Reads a sequence of top-level documents, one value each.
     */
    public static List<Value> decodeObjects(String text, Span span) {
        var values = new ArrayList<Value>();
        try (var documents = JSON.readerFor(JsonNode.class).<JsonNode>readValues(text)) {
            while (documents.hasNext()) {
                values.add(fromNode(documents.next(), span));
            }
        } catch (RuntimeException ex) {
            if (ex.getCause() instanceof JsonProcessingException cause) {
                throw invalid(cause, span);
            }
            throw ex;
        } catch (IOException ex) {
            throw invalid(ex, span);
        }
        return values;
    }

    static Value fromNode(JsonNode node, Span span) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.nothing(span);
        }
        if (node.isBoolean()) {
            return Value.bool(node.booleanValue(), span);
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Value.integer(node.longValue(), span);
        }
        if (node.isNumber()) {
            return Value.floating(node.doubleValue(), span);
        }
        if (node.isTextual()) {
            return Value.string(node.textValue(), span);
        }
        if (node.isArray()) {
            var items = new ArrayList<Value>(node.size());
            node.forEach(item -> items.add(fromNode(item, span)));
            return Value.list(items, span);
        }
        var entries = new LinkedHashMap<String, Value>();
        node.fields().forEachRemaining(field -> entries.put(field.getKey(), fromNode(field.getValue(), span)));
        return Value.Record.of(entries, span);
    }

    private static ShellError invalid(IOException ex, Span span) {
        var message = ex instanceof JsonProcessingException processing ? processing.getOriginalMessage() : ex.getMessage();
        return ShellError.unsupportedInput("Could not parse json: " + message, span);
    }
}
