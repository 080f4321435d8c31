package work.strata.engine.runtime;

import java.util.List;
import java.util.Objects;
import work.strata.engine.protocol.Span;

/**
 * Parsed block: a signature, its pipelines, and the outer variables it captures.
 */
public record Block(Signature signature, List<Pipeline> pipelines, List<Integer> captures, Span span) {
    public Block {
        Objects.requireNonNull(signature, "signature");
        pipelines = List.copyOf(pipelines);
        captures = List.copyOf(captures);
        Objects.requireNonNull(span, "span");
    }

    public static Block of(Signature signature, List<Pipeline> pipelines, Span span) {
        return new Block(signature, pipelines, List.of(), span);
    }

    public Block withCaptures(List<Integer> newCaptures) {
        return new Block(signature, pipelines, newCaptures, span);
    }

    /**
     * Variable id of the first positional parameter, where the block declares one.
     */}
