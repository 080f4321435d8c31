package work.strata.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesUnits() {
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationParser.parse("30s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2M"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse(" 1h "));
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
    }

    @Test
    void zeroAndBlank() {
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertEquals("Invalid duration: soon", assertThrows(IllegalArgumentException.class,
            () -> DurationParser.parse("soon")).getMessage());
        assertEquals("Negative duration: -5s", assertThrows(IllegalArgumentException.class,
            () -> DurationParser.parse("-5s")).getMessage());
    }
}
