package work.strata.engine.protocol;

import java.util.Objects;

/**
 * An item paired with the span it was read from.
 */
public record Spanned<T>(T item, Span span) {
    public Spanned {
        Objects.requireNonNull(span, "span");
    }
}
