package work.strata.engine.pipeline;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.function.Predicate;
import work.strata.engine.protocol.Config;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;

/**
 * Single-pass, possibly unbounded sequence of values. Every pull checks the cancellation token first;
 * once it is raised the stream simply ends.
 */
public final class ValueStream implements Iterator<Value> {
    private final Iterator<Value> source;
    private final CancellationToken token;

    private ValueStream(Iterator<Value> source, CancellationToken token) {
        this.source = Objects.requireNonNull(source, "source");
        this.token = token == null ? CancellationToken.none() : token;
    }

    public static ValueStream of(Iterator<Value> source, CancellationToken token) {
        return new ValueStream(source, token);
    }

    public static ValueStream fromList(List<Value> values, CancellationToken token) {
        return new ValueStream(List.copyOf(values).iterator(), token);
    }

    public CancellationToken token() {
        return token;
    }

    @Override
    public boolean hasNext() {
        return !token.isCancelled() && source.hasNext();
    }

    @Override
    public Value next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return source.next();
    }

    /**
     * Lazily applies {@code fn}; a {@link ShellError} thrown for one element becomes an error value at that position.
     */
    public ValueStream map(Function<Value, Value> fn) {
        var upstream = this;
        return new ValueStream(new Iterator<>() {
            @Override
            public boolean hasNext() {
                return upstream.hasNext();
            }

            @Override
            public Value next() {
                return applyOrError(fn, upstream.next());
            }
        }, token);
    }

    public ValueStream filter(Predicate<Value> predicate) {
        return new ValueStream(new LookaheadIterator(this, predicate, false), token);
    }

    public ValueStream takeWhile(Predicate<Value> predicate) {
        return new ValueStream(new LookaheadIterator(this, predicate, true), token);
    }

    /**
     * Skips {@code count} elements and yields at most {@code limit} of the rest, pulling no further.
     */
    public ValueStream slice(long count, long limit) {
        var upstream = this;
        return new ValueStream(new Iterator<>() {
            private long skipped;
            private long taken;

            @Override
            public boolean hasNext() {
                while (skipped < count && upstream.hasNext()) {
                    upstream.next();
                    skipped++;
                }
                return taken < limit && upstream.hasNext();
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                taken++;
                return upstream.next();
            }
        }, token);
    }

    public List<Value> collect() {
        var values = new ArrayList<Value>();
        while (hasNext()) {
            values.add(next());
        }
        return values;
    }

    public String collectString(String separator, Config config) {
        var joiner = new StringJoiner(separator);
        while (hasNext()) {
            joiner.add(next().intoString(", ", config));
        }
        return joiner.toString();
    }

    static Value applyOrError(Function<Value, Value> fn, Value value) {
        try {
            return fn.apply(value);
        } catch (ShellError ex) {
            return Value.error(ex);
        }
    }

    private static final class LookaheadIterator implements Iterator<Value> {
        private final Iterator<Value> upstream;
        private final Predicate<Value> predicate;
        private final boolean stopOnFirstMiss;
        private Value pending;
        private boolean done;

        LookaheadIterator(Iterator<Value> upstream, Predicate<Value> predicate, boolean stopOnFirstMiss) {
            this.upstream = upstream;
            this.predicate = predicate;
            this.stopOnFirstMiss = stopOnFirstMiss;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && !done && upstream.hasNext()) {
                var candidate = upstream.next();
                if (predicate.test(candidate)) {
                    pending = candidate;
                } else if (stopOnFirstMiss) {
                    done = true;
                }
            }
            return pending != null;
        }

        @Override
        public Value next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var value = pending;
            pending = null;
            return value;
        }
    }
}
