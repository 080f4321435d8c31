package work.strata.engine.protocol;

import java.util.Collection;

/**
 * Half-open byte range {@code [start, end)} over the original source buffer. Every diagnostic anchors to one.
 */
public record Span(int start, int end) {
    private static final Span UNKNOWN = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    public static Span unknown() {
        return UNKNOWN;
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    /**
     * Minimal span covering every element; {@link #unknown()} when the input is empty.
     */
    public static Span union(Collection<Span> spans) {
        if (spans == null || spans.isEmpty()) {
            return UNKNOWN;
        }
        int start = Integer.MAX_VALUE;
        int end = 0;
        for (Span span : spans) {
            start = Math.min(start, span.start);
            end = Math.max(end, span.end);
        }
        return new Span(start, end);
    }

    public Span merge(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public int length() {
        return end - start;
    }

    public boolean isUnknown() {
        return this.equals(UNKNOWN);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
