package work.strata.engine.protocol;

import java.util.Objects;

/**
 * One step of a cell path: a record column or a list index.
 */
public sealed interface PathMember permits PathMember.Column, PathMember.Index {
    Span span();

    String render();

    static PathMember column(String name, Span span) {
        return new Column(name, span);
    }

    static PathMember index(int index, Span span) {
        return new Index(index, span);
    }

    record Column(String name, Span span) implements PathMember {
        public Column {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(span, "span");
        }

        public String render() {
            return name;
        }
    }

    record Index(int index, Span span) implements PathMember {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("Negative cell path index: " + index);
            }
            Objects.requireNonNull(span, "span");
        }

        public String render() {
            return Integer.toString(index);
        }
    }
}
