package work.strata.engine.runtime;

import java.util.List;

/**
 * Elements joined by {@code |}; each element receives the previous element's output.
 */
public record Pipeline(List<Expression> elements) {
    public Pipeline {
        elements = List.copyOf(elements);
    }

    public static Pipeline of(Expression... elements) {
        return new Pipeline(List.of(elements));
    }
}
