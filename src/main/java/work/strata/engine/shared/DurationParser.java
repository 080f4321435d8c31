package work.strata.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses evaluation timeouts such as {@code 250ms}, {@code 30s}, {@code 2m} or {@code 1h}; bare numbers are milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long unit;
        String digits;
        if (trimmed.endsWith("ms")) {
            unit = 1L;
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            unit = 1_000L;
            digits = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            unit = 60_000L;
            digits = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("h")) {
            unit = 3_600_000L;
            digits = trimmed.substring(0, trimmed.length() - 1);
        } else {
            unit = 1L;
            digits = trimmed;
        }
        long amount;
        try {
            amount = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Negative duration: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(amount, unit)));
    }
}
