package work.strata.engine.protocol;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.UnaryOperator;

/**
 * Structured runtime value. Equality ignores spans: two values are equal when their contents are.
 */
public sealed interface Value
    permits Value.Nothing, Value.Bool, Value.Int, Value.Float, Value.Str, Value.Binary,
        Value.Record, Value.List, Value.Range, Value.Error, Value.Block {

    Span span();

    ValueType type();

    static Value nothing(Span span) {
        return new Nothing(span);
    }

    static Value bool(boolean val, Span span) {
        return new Bool(val, span);
    }

    static Value integer(long val, Span span) {
        return new Int(val, span);
    }

    static Value floating(double val, Span span) {
        return new Float(val, span);
    }

    static Value string(String val, Span span) {
        return new Str(val, span);
    }

    static Value binary(byte[] val, Span span) {
        return new Binary(val, span);
    }

    static Record record(java.util.List<String> cols, java.util.List<Value> vals, Span span) {
        return new Record(cols, vals, span);
    }

    static List list(java.util.List<Value> vals, Span span) {
        return new List(vals, span);
    }

    static Value error(ShellError error) {
        return new Error(error);
    }

    default String typeName() {
        return type().toString();
    }

    default boolean isError() {
        return this instanceof Error;
    }

    default boolean isTrue() {
        return this instanceof Bool bool && bool.val();
    }

    /**
     * Throws the carried error for {@link Error} values; returns {@code this} otherwise.
     */
    default Value orThrow() {
        if (this instanceof Error error) {
            throw error.error();
        }
        return this;
    }

    default java.util.List<String> columns() {
        return this instanceof Record record ? record.cols() : java.util.List.of();
    }

    default String asString() {
        if (this instanceof Str str) {
            return str.val();
        }
        throw ShellError.cantConvert("string", typeName(), span());
    }

    default long asLong() {
        if (this instanceof Int integer) {
            return integer.val();
        }
        throw ShellError.cantConvert("int", typeName(), span());
    }

    default double asDouble() {
        if (this instanceof Int integer) {
            return integer.val();
        }
        if (this instanceof Float floating) {
            return floating.val();
        }
        throw ShellError.cantConvert("float", typeName(), span());
    }

    default boolean asBoolean() {
        if (this instanceof Bool bool) {
            return bool.val();
        }
        throw ShellError.cantConvert("bool", typeName(), span());
    }

    default Value withSpan(Span span) {
        if (this instanceof Nothing) {
            return new Nothing(span);
        } else if (this instanceof Bool bool) {
            return new Bool(bool.val(), span);
        } else if (this instanceof Int integer) {
            return new Int(integer.val(), span);
        } else if (this instanceof Float floating) {
            return new Float(floating.val(), span);
        } else if (this instanceof Str str) {
            return new Str(str.val(), span);
        } else if (this instanceof Binary binary) {
            return new Binary(binary.val(), span);
        } else if (this instanceof Record record) {
            return new Record(record.cols(), record.vals(), span);
        } else if (this instanceof List list) {
            return new List(list.vals(), span);
        } else if (this instanceof Range range) {
            return new Range(range.from(), range.incr(), range.to(), range.inclusive(), span);
        } else if (this instanceof Block block) {
            return new Block(block.blockId(), span);
        }
        return this;
    }

    default Value followCellPath(java.util.List<PathMember> members) {
        return CellPath.follow(this, members);
    }

    default Value updateCellPath(java.util.List<PathMember> members, UnaryOperator<Value> replace) {
        return CellPath.update(this, members, replace);
    }

    /**
     * Text rendering used by string-oriented commands. Nested values use {@code ", "}; the
     * top-level list or record joins its children with {@code separator}.
     */
    default String intoString(String separator, Config config) {
        if (this instanceof Nothing) {
            return "";
        } else if (this instanceof Bool bool) {
            return Boolean.toString(bool.val());
        } else if (this instanceof Int integer) {
            return Long.toString(integer.val());
        } else if (this instanceof Float floating) {
            return formatFloat(floating.val(), config);
        } else if (this instanceof Str str) {
            return str.val();
        } else if (this instanceof Binary binary) {
            var joiner = new StringJoiner(", ", "[", "]");
            for (byte b : binary.val()) {
                joiner.add(Integer.toString(Byte.toUnsignedInt(b)));
            }
            return joiner.toString();
        } else if (this instanceof Record record) {
            var joiner = new StringJoiner(separator, "{", "}");
            for (int i = 0; i < record.cols().size(); i++) {
                joiner.add(record.cols().get(i) + ": " + record.vals().get(i).intoString(", ", config));
            }
            return joiner.toString();
        } else if (this instanceof List list) {
            var joiner = new StringJoiner(separator, "[", "]");
            for (var val : list.vals()) {
                joiner.add(val.intoString(", ", config));
            }
            return joiner.toString();
        } else if (this instanceof Range range) {
            return range.from().intoString(", ", config)
                + (range.inclusive() ? ".." : "..<")
                + range.to().intoString(", ", config);
        } else if (this instanceof Error error) {
            return error.error().describe();
        } else if (this instanceof Block block) {
            return "<Block " + block.blockId() + ">";
        }
        throw new IllegalStateException("Unhandled value " + this);
    }

    /**
     * Like {@link #intoString} but keeps error values recognisable.
     */
    default String debugString(String separator, Config config) {
        if (this instanceof Error error) {
            return "Error: " + error.error().describe();
        }
        return intoString(separator, config);
    }

    static String formatFloat(double val, Config config) {
        if (Double.isNaN(val)) {
            return "NaN";
        }
        if (Double.isInfinite(val)) {
            return val > 0 ? "inf" : "-inf";
        }
        if (config != null && config.floatPrecision() >= 0) {
            return BigDecimal.valueOf(val).setScale(config.floatPrecision(), java.math.RoundingMode.HALF_EVEN).toPlainString();
        }
        var plain = BigDecimal.valueOf(val).stripTrailingZeros().toPlainString();
        return plain.equals("-0") ? "0" : plain;
    }

    record Nothing(Span span) implements Value {
        public ValueType type() {
            return ValueType.NOTHING;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Nothing;
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }

    record Bool(boolean val, Span span) implements Value {
        public ValueType type() {
            return ValueType.BOOL;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Bool bool && bool.val == val;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(val);
        }
    }

    record Int(long val, Span span) implements Value {
        public ValueType type() {
            return ValueType.INT;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Int integer && integer.val == val;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(val);
        }
    }

    record Float(double val, Span span) implements Value {
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Float floating && Double.compare(floating.val, val) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(val);
        }
    }

    record Str(String val, Span span) implements Value {
        public Str {
            Objects.requireNonNull(val, "val");
        }

        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Str str && str.val.equals(val);
        }

        @Override
        public int hashCode() {
            return val.hashCode();
        }
    }

    record Binary(byte[] val, Span span) implements Value {
        public Binary {
            val = val.clone();
        }

        @Override
        public byte[] val() {
            return val.clone();
        }

        public ValueType type() {
            return ValueType.BINARY;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Binary binary && Arrays.equals(binary.val, val);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(val);
        }
    }

    /**
     * Ordered columns with parallel values. Column names are unique and both lists have the same length.
     */
    record Record(java.util.List<String> cols, java.util.List<Value> vals, Span span) implements Value {
        public Record {
            cols = java.util.List.copyOf(cols);
            vals = java.util.List.copyOf(vals);
            if (cols.size() != vals.size()) {
                throw new IllegalArgumentException(
                    "Record has " + cols.size() + " columns but " + vals.size() + " values"
                );
            }
            if (new HashSet<>(cols).size() != cols.size()) {
                throw new IllegalArgumentException("Duplicate column names in record: " + cols);
            }
        }

        public static Record of(Map<String, Value> entries, Span span) {
            return new Record(java.util.List.copyOf(entries.keySet()), java.util.List.copyOf(entries.values()), span);
        }

        public ValueType type() {
            return ValueType.RECORD;
        }

        public Optional<Value> get(String column) {
            int index = cols.indexOf(column);
            return index < 0 ? Optional.empty() : Optional.of(vals.get(index));
        }

        /**
         * Copy with {@code column} replaced in place, or appended when absent.
         */
        public Record with(String column, Value value) {
            var entries = toMap();
            entries.put(column, value);
            return of(entries, span);
        }

        public Record without(String column) {
            var entries = toMap();
            entries.remove(column);
            return of(entries, span);
        }

        public LinkedHashMap<String, Value> toMap() {
            var entries = new LinkedHashMap<String, Value>();
            for (int i = 0; i < cols.size(); i++) {
                entries.put(cols.get(i), vals.get(i));
            }
            return entries;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Record record && record.cols.equals(cols) && record.vals.equals(vals);
        }

        @Override
        public int hashCode() {
            return 31 * cols.hashCode() + vals.hashCode();
        }
    }

    record List(java.util.List<Value> vals, Span span) implements Value {
        public List {
            vals = Collections.unmodifiableList(new java.util.ArrayList<>(vals));
        }

        public ValueType type() {
            return ValueType.LIST;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof List list && list.vals.equals(vals);
        }

        @Override
        public int hashCode() {
            return vals.hashCode();
        }
    }

    /**
     * Numeric range. {@code to} may be {@link Nothing} for an open end. Iteration is lazy.
     */
    record Range(Value from, Value incr, Value to, boolean inclusive, Span span) implements Value {
        public Range {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(incr, "incr");
            Objects.requireNonNull(to, "to");
        }

        /**
         * Builds a range from its bounds. {@code next} (the second element) fixes the step; otherwise
         * the step is 1 or -1 depending on direction.
         */
        public static Range of(Value from, Value next, Value to, boolean inclusive, Span span) {
            var start = from instanceof Nothing ? new Int(0, from.span()) : from;
            if (!start.type().isNumeric()) {
                throw ShellError.invalidRange(start.typeName(), to.typeName(), span);
            }
            if (!(to instanceof Nothing) && !to.type().isNumeric()) {
                throw ShellError.invalidRange(start.typeName(), to.typeName(), span);
            }
            Value incr;
            if (next != null && !(next instanceof Nothing)) {
                if (!next.type().isNumeric()) {
                    throw ShellError.invalidRange(start.typeName(), next.typeName(), span);
                }
                incr = ValueOperations.apply(Operator.SUB, next, start, span);
            } else {
                boolean descending = !(to instanceof Nothing) && to.asDouble() < start.asDouble();
                incr = new Int(descending ? -1 : 1, span);
            }
            if (incr.asDouble() == 0) {
                throw ShellError.cannotCreateRange(span);
            }
            return new Range(start, incr, to, inclusive, span);
        }

        public ValueType type() {
            return ValueType.RANGE;
        }

        public boolean isIntegral() {
            return from instanceof Int && incr instanceof Int && (to instanceof Int || to instanceof Nothing);
        }

        public boolean contains(Value item) {
            if (!item.type().isNumeric()) {
                return false;
            }
            double value = item.asDouble();
            double start = from.asDouble();
            boolean ascending = incr.asDouble() > 0;
            if (to instanceof Nothing) {
                return ascending ? value >= start : value <= start;
            }
            double end = to.asDouble();
            if (ascending) {
                return value >= start && (inclusive ? value <= end : value < end);
            }
            return value <= start && (inclusive ? value >= end : value > end);
        }

        public Iterator<Value> iterator() {
            if (isIntegral()) {
                return new IntIterator(
                    from.asLong(),
                    incr.asLong(),
                    to instanceof Nothing ? null : to.asLong(),
                    inclusive,
                    span
                );
            }
            return new FloatIterator(
                from.asDouble(),
                incr.asDouble(),
                to instanceof Nothing ? null : to.asDouble(),
                inclusive,
                span
            );
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Range range
                && range.from.equals(from)
                && range.incr.equals(incr)
                && range.to.equals(to)
                && range.inclusive == inclusive;
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, incr, to, inclusive);
        }

        private static final class IntIterator implements Iterator<Value> {
            private final long step;
            private final Long end;
            private final boolean inclusive;
            private final Span span;
            private long current;
            private boolean exhausted;

            IntIterator(long start, long step, Long end, boolean inclusive, Span span) {
                this.current = start;
                this.step = step;
                this.end = end;
                this.inclusive = inclusive;
                this.span = span;
            }

            @Override
            public boolean hasNext() {
                if (exhausted) {
                    return false;
                }
                if (end == null) {
                    return true;
                }
                if (step > 0) {
                    return inclusive ? current <= end : current < end;
                }
                return inclusive ? current >= end : current > end;
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var value = new Int(current, span);
                try {
                    current = Math.addExact(current, step);
                } catch (ArithmeticException ex) {
                    exhausted = true;
                }
                return value;
            }
        }

        private static final class FloatIterator implements Iterator<Value> {
            private final double start;
            private final double step;
            private final Double end;
            private final boolean inclusive;
            private final Span span;
            private long index;

            FloatIterator(double start, double step, Double end, boolean inclusive, Span span) {
                this.start = start;
                this.step = step;
                this.end = end;
                this.inclusive = inclusive;
                this.span = span;
            }

            @Override
            public boolean hasNext() {
                if (end == null) {
                    return true;
                }
                double current = start + index * step;
                if (step > 0) {
                    return inclusive ? current <= end : current < end;
                }
                return inclusive ? current >= end : current > end;
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new Float(start + index++ * step, span);
            }
        }
    }

    record Error(ShellError error) implements Value {
        public Error {
            Objects.requireNonNull(error, "error");
        }

        public Span span() {
            return error.span();
        }

        public ValueType type() {
            return ValueType.ERROR;
        }
    }

    /**
     * Reference to a parsed block, used for closures passed as arguments.
     */
    record Block(int blockId, Span span) implements Value {
        public ValueType type() {
            return ValueType.BLOCK;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Block block && block.blockId == blockId;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(blockId);
        }
    }
}
