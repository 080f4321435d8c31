package work.strata.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.DidYouMean;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

class RunResultTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void successSerializesTheValue() throws Exception {
        var value = Value.record(List.of("a"), List.of(Value.integer(1, Span.unknown())), Span.unknown());
        var result = RunResult.success(value, Instant.now());

        assertTrue(result.isSuccess());
        assertEquals(Optional.of(value), result.valueIfSuccess());
        var tree = JSON.readTree(result.toPrettyJson());
        assertEquals("success", tree.get("status").asText());
        assertEquals(1, tree.get("value").get("a").asInt());
        assertFalse(tree.has("error"));
        assertTrue(tree.has("startedAt"));
    }

    @Test
    void failureSerializesCodeLabelsAndHelp() throws Exception {
        var error = ShellError.commandNotFound(Span.of(9, 15), DidYouMean.suggest(List.of("length"), "lenght"));
        var result = RunResult.failure(error, Instant.now());

        assertFalse(result.isSuccess());
        assertTrue(result.valueIfSuccess().isEmpty());
        assertEquals(RunResult.Status.FAILURE, result.status());
        var tree = JSON.readTree(result.toPrettyJson());
        assertEquals("failure", tree.get("status").asText());
        var details = tree.get("error");
        assertEquals("strata::shell::command_not_found", details.get("code").asText());
        assertEquals(9, details.get("labels").get(0).get("start").asInt());
        assertEquals(15, details.get("labels").get(0).get("end").asInt());
        assertEquals("did you mean 'length'?", details.get("help").asText());
    }

    @Test
    void mapKeepsFieldOrder() {
        var map = RunResult.success(Value.nothing(Span.unknown()), Instant.now()).toSerializableMap();
        assertEquals(List.of("status", "value", "startedAt", "finishedAt"), List.copyOf(map.keySet()));
    }

    @Test
    void successNeedsAValue() {
        assertThrows(NullPointerException.class, () -> RunResult.success(null, Instant.now()));
    }
}
