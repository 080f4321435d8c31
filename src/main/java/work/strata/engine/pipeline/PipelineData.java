package work.strata.engine.pipeline;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import work.strata.engine.protocol.Config;
import work.strata.engine.protocol.PathMember;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * What flows between pipeline stages: nothing, one materialised value, or a lazy stream.
 */
public sealed interface PipelineData permits PipelineData.Empty, PipelineData.ValueData, PipelineData.Stream {

    static PipelineData empty() {
        return Empty.INSTANCE;
    }

    static PipelineData value(Value value) {
        return new ValueData(value, null);
    }

    static PipelineData stream(Iterator<Value> source, CancellationToken token) {
        return new Stream(ValueStream.of(source, token), null);
    }

    static PipelineData fromList(List<Value> values, CancellationToken token) {
        return new Stream(ValueStream.fromList(values, token), null);
    }

    PipelineMetadata metadata();

    PipelineData withMetadata(PipelineMetadata metadata);

    /**
     * Elements of this data: list items, range items, one row per record column, the value itself
     * for scalars, or the stream's elements.
     */
    default Iterator<Value> iterator() {
        if (this instanceof Stream stream) {
            return stream.stream();
        }
        if (this instanceof ValueData data) {
            return elements(data.value());
        }
        return Collections.emptyIterator();
    }

    default ValueStream intoStream(CancellationToken token) {
        if (this instanceof Stream stream) {
            return stream.stream();
        }
        return ValueStream.of(iterator(), token);
    }

    /**
     * Applies {@code fn} per element. Lists, ranges and streams stay lazy and stop early once the token is
     * raised; any other single value is transformed once. Failures become error values in place.
     */
    default PipelineData map(Function<Value, Value> fn, CancellationToken token) {
        if (this instanceof Empty) {
            return this;
        }
        if (this instanceof ValueData data && !isSequence(data.value())) {
            return new ValueData(ValueStream.applyOrError(fn, data.value()), data.metadata());
        }
        return new Stream(intoStream(token).map(fn), metadata());
    }

    default PipelineData filter(Predicate<Value> predicate, CancellationToken token) {
        if (this instanceof Empty) {
            return this;
        }
        return new Stream(intoStream(token).filter(predicate), metadata());
    }

    default PipelineData takeWhile(Predicate<Value> predicate, CancellationToken token) {
        if (this instanceof Empty) {
            return this;
        }
        return new Stream(intoStream(token).takeWhile(predicate), metadata());
    }

    /**
     * Materialises the data. An exhausted or empty stream becomes {@link Value.Nothing}.
     */
    default Value intoValue(Span span) {
        if (this instanceof ValueData data) {
            return data.value();
        }
        if (this instanceof Stream stream) {
            var values = stream.stream().collect();
            return values.isEmpty() ? Value.nothing(span) : Value.list(values, span);
        }
        return Value.nothing(span);
    }

    /**
     * Renders every element to text joined by {@code separator}. Collects the whole stream.
     */
    default String collectString(String separator, Config config) {
        if (this instanceof ValueData data) {
            return data.value().intoString(separator, config);
        }
        if (this instanceof Stream stream) {
            return stream.stream().collectString(separator, config);
        }
        return "";
    }

    default Value followCellPath(List<PathMember> members, Span head) {
        if (this instanceof Empty) {
            return Value.nothing(head);
        }
        return intoValue(head).followCellPath(members);
    }

    /**
     * Pulls every element, rethrowing the first error value seen.
     */
    default void drain() {
        if (this instanceof ValueData data) {
            data.value().orThrow();
            return;
        }
        var iterator = iterator();
        while (iterator.hasNext()) {
            iterator.next().orThrow();
        }
    }

    private static boolean isSequence(Value value) {
        return value instanceof Value.List || value instanceof Value.Range;
    }

    private static Iterator<Value> elements(Value value) {
        if (value instanceof Value.List list) {
            return list.vals().iterator();
        }
        if (value instanceof Value.Range range) {
            return range.iterator();
        }
        if (value instanceof Value.Record record) {
            var rows = new java.util.ArrayList<Value>(record.cols().size());
            for (int i = 0; i < record.cols().size(); i++) {
                rows.add(Value.record(
                    List.of("column", "value"),
                    List.of(Value.string(record.cols().get(i), record.span()), record.vals().get(i)),
                    record.span()
                ));
            }
            return rows.iterator();
        }
        return List.of(value).iterator();
    }

    final class Empty implements PipelineData {
        private static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public PipelineMetadata metadata() {
            return null;
        }

        @Override
        public PipelineData withMetadata(PipelineMetadata metadata) {
            return this;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    record ValueData(Value value, PipelineMetadata metadata) implements PipelineData {
        public ValueData {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PipelineData withMetadata(PipelineMetadata newMetadata) {
            return new ValueData(value, newMetadata);
        }
    }

    record Stream(ValueStream stream, PipelineMetadata metadata) implements PipelineData {
        public Stream {
            Objects.requireNonNull(stream, "stream");
        }

        @Override
        public PipelineData withMetadata(PipelineMetadata newMetadata) {
            return new Stream(stream, newMetadata);
        }
    }
}
