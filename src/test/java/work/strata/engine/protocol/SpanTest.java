package work.strata.engine.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SpanTest {
    @Test
    void unionCoversAllSpans() {
        var union = Span.union(List.of(Span.of(4, 7), Span.of(1, 2), Span.of(9, 12)));
        assertEquals(Span.of(1, 12), union);
    }

    @Test
    void unionOfNothingIsUnknown() {
        assertTrue(Span.union(List.of()).isUnknown());
    }

    @Test
    void spansAreHalfOpen() {
        var span = Span.of(3, 5);
        assertTrue(span.contains(3));
        assertTrue(span.contains(4));
        assertFalse(span.contains(5));
        assertEquals(2, span.length());
    }

    @Test
    void rejectsInvertedSpans() {
        assertThrows(IllegalArgumentException.class, () -> Span.of(5, 3));
    }
}
