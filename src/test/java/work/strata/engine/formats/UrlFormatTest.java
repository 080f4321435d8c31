package work.strata.engine.formats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

class UrlFormatTest {
    private static Value str(String text) {
        return Value.string(text, Span.unknown());
    }

    @Test
    void decodesPairsInOrder() {
        var value = (Value.Record) UrlFormat.decode("b=2&a=one+two&c=%26", Span.unknown());
        assertEquals(List.of("b", "a", "c"), value.cols());
        assertEquals(List.of(str("2"), str("one two"), str("&")), value.vals());
    }

    @Test
    void repeatedKeyKeepsPositionAndLastValue() {
        var value = (Value.Record) UrlFormat.decode("k=1&x=2&k=3", Span.unknown());
        assertEquals(List.of("k", "x"), value.cols());
        assertEquals(str("3"), value.get("k").orElseThrow());
    }

    @Test
    void keysWithoutValuesAndEmptyPairs() {
        var value = (Value.Record) UrlFormat.decode("flag&&x=", Span.unknown());
        assertEquals(List.of("flag", "x"), value.cols());
        assertEquals(List.of(str(""), str("")), value.vals());
    }

    @Test
    void emptyInputIsAnEmptyRecord() {
        assertTrue(((Value.Record) UrlFormat.decode("  ", Span.unknown())).cols().isEmpty());
    }

    @Test
    void brokenEscapesAreRejected() {
        var error = assertThrows(ShellError.class, () -> UrlFormat.decode("a=%zz", Span.of(0, 5)));
        assertEquals(ShellError.Kind.UNSUPPORTED_INPUT, error.kind());
    }
}
