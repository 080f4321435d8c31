package work.strata.engine.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Binary operators over values.
 */
public final class ValueOperations {
    private ValueOperations() {}

    public static Value apply(Operator op, Value lhs, Value rhs, Span opSpan) {
        Objects.requireNonNull(op, "op");
        lhs.orThrow();
        rhs.orThrow();
        var span = Span.union(List.of(lhs.span(), rhs.span()));
        switch (op) {
            case ADD:
                return add(lhs, rhs, opSpan, span);
            case SUB:
                return arithmetic(op, lhs, rhs, opSpan, span);
            case MUL:
                return arithmetic(op, lhs, rhs, opSpan, span);
            case DIV:
                return divide(lhs, rhs, opSpan, span);
            case MOD:
                return modulo(lhs, rhs, opSpan, span);
            case POW:
                return power(lhs, rhs, opSpan, span);
            case EQ:
                return Value.bool(valuesEqual(lhs, rhs), span);
            case NE:
                return Value.bool(!valuesEqual(lhs, rhs), span);
            case LT:
                return Value.bool(compare(lhs, rhs, opSpan) < 0, span);
            case LE:
                return Value.bool(compare(lhs, rhs, opSpan) <= 0, span);
            case GT:
                return Value.bool(compare(lhs, rhs, opSpan) > 0, span);
            case GE:
                return Value.bool(compare(lhs, rhs, opSpan) >= 0, span);
            case AND:
                return Value.bool(bool(lhs, rhs, opSpan) && rhs.asBoolean(), span);
            case OR:
                return Value.bool(bool(lhs, rhs, opSpan) || rhs.asBoolean(), span);
            case IN:
                return Value.bool(contains(rhs, lhs, opSpan), span);
            case NOT_IN:
                return Value.bool(!contains(rhs, lhs, opSpan), span);
            case CONTAINS:
                return Value.bool(substring(lhs, rhs, opSpan), span);
            case NOT_CONTAINS:
                return Value.bool(!substring(lhs, rhs, opSpan), span);
            default:
                throw ShellError.engineFailed("unhandled operator " + op);
        }
    }

    /**
     * Equality across numeric types (1 == 1.0); everything else compares by content.
     */
    public static boolean valuesEqual(Value lhs, Value rhs) {
        if (lhs.type().isNumeric() && rhs.type().isNumeric() && lhs.type() != rhs.type()) {
            return Double.compare(lhs.asDouble(), rhs.asDouble()) == 0;
        }
        return lhs.equals(rhs);
    }

    public static int compare(Value lhs, Value rhs, Span opSpan) {
        if (lhs instanceof Value.Int left && rhs instanceof Value.Int right) {
            return Long.compare(left.val(), right.val());
        }
        if (lhs.type().isNumeric() && rhs.type().isNumeric()) {
            return Double.compare(lhs.asDouble(), rhs.asDouble());
        }
        if (lhs instanceof Value.Str left && rhs instanceof Value.Str right) {
            return left.val().compareTo(right.val());
        }
        if (lhs instanceof Value.Bool left && rhs instanceof Value.Bool right) {
            return Boolean.compare(left.val(), right.val());
        }
        throw mismatch(lhs, rhs, opSpan);
    }

    private static Value add(Value lhs, Value rhs, Span opSpan, Span span) {
        if (lhs instanceof Value.Str left && rhs instanceof Value.Str right) {
            return Value.string(left.val() + right.val(), span);
        }
        if (lhs instanceof Value.List left && rhs instanceof Value.List right) {
            var joined = new java.util.ArrayList<>(left.vals());
            joined.addAll(right.vals());
            return Value.list(joined, span);
        }
        return arithmetic(Operator.ADD, lhs, rhs, opSpan, span);
    }

    private static Value arithmetic(Operator op, Value lhs, Value rhs, Span opSpan, Span span) {
        if (lhs instanceof Value.Int left && rhs instanceof Value.Int right) {
            try {
                switch (op) {
                    case ADD:
                        return Value.integer(Math.addExact(left.val(), right.val()), span);
                    case SUB:
                        return Value.integer(Math.subtractExact(left.val(), right.val()), span);
                    default:
                        return Value.integer(Math.multiplyExact(left.val(), right.val()), span);
                }
            } catch (ArithmeticException ex) {
                throw ShellError.operatorOverflow("operation overflowed", span);
            }
        }
        if (lhs.type().isNumeric() && rhs.type().isNumeric()) {
            double left = lhs.asDouble();
            double right = rhs.asDouble();
            switch (op) {
                case ADD:
                    return Value.floating(left + right, span);
                case SUB:
                    return Value.floating(left - right, span);
                default:
                    return Value.floating(left * right, span);
            }
        }
        throw mismatch(lhs, rhs, opSpan);
    }

    private static Value divide(Value lhs, Value rhs, Span opSpan, Span span) {
        if (!lhs.type().isNumeric() || !rhs.type().isNumeric()) {
            throw mismatch(lhs, rhs, opSpan);
        }
        if (rhs.asDouble() == 0) {
            throw ShellError.divisionByZero(opSpan);
        }
        if (lhs instanceof Value.Int left && rhs instanceof Value.Int right && left.val() % right.val() == 0) {
            if (left.val() == Long.MIN_VALUE && right.val() == -1) {
                throw ShellError.operatorOverflow("division overflowed", span);
            }
            return Value.integer(left.val() / right.val(), span);
        }
        return Value.floating(lhs.asDouble() / rhs.asDouble(), span);
    }

    private static Value modulo(Value lhs, Value rhs, Span opSpan, Span span) {
        if (!lhs.type().isNumeric() || !rhs.type().isNumeric()) {
            throw mismatch(lhs, rhs, opSpan);
        }
        if (rhs.asDouble() == 0) {
            throw ShellError.divisionByZero(opSpan);
        }
        if (lhs instanceof Value.Int left && rhs instanceof Value.Int right) {
            return Value.integer(left.val() % right.val(), span);
        }
        return Value.floating(lhs.asDouble() % rhs.asDouble(), span);
    }

    private static Value power(Value lhs, Value rhs, Span opSpan, Span span) {
        if (!lhs.type().isNumeric() || !rhs.type().isNumeric()) {
            throw mismatch(lhs, rhs, opSpan);
        }
        if (lhs instanceof Value.Int left && rhs instanceof Value.Int right && right.val() >= 0) {
            long result = 1;
            try {
                for (long i = 0; i < right.val(); i++) {
                    result = Math.multiplyExact(result, left.val());
                }
            } catch (ArithmeticException ex) {
                throw ShellError.operatorOverflow("pow operation overflowed", span);
            }
            return Value.integer(result, span);
        }
        return Value.floating(Math.pow(lhs.asDouble(), rhs.asDouble()), span);
    }

    private static boolean bool(Value lhs, Value rhs, Span opSpan) {
        if (!(lhs instanceof Value.Bool) || !(rhs instanceof Value.Bool)) {
            throw mismatch(lhs, rhs, opSpan);
        }
        return lhs.asBoolean();
    }

    private static boolean contains(Value container, Value item, Span opSpan) {
        if (container instanceof Value.List list) {
            for (var candidate : list.vals()) {
                if (valuesEqual(candidate, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Value.Range range && item.type().isNumeric()) {
            return range.contains(item);
        }
        if (container instanceof Value.Str haystack && item instanceof Value.Str needle) {
            return haystack.val().contains(needle.val());
        }
        if (container instanceof Value.Record record && item instanceof Value.Str column) {
            return record.cols().contains(column.val());
        }
        throw mismatch(item, container, opSpan);
    }

    private static boolean substring(Value lhs, Value rhs, Span opSpan) {
        if (lhs instanceof Value.Str haystack && rhs instanceof Value.Str needle) {
            return haystack.val().contains(needle.val());
        }
        throw mismatch(lhs, rhs, opSpan);
    }

    private static ShellError mismatch(Value lhs, Value rhs, Span opSpan) {
        return ShellError.operatorMismatch(opSpan, lhs.typeName(), lhs.span(), rhs.typeName(), rhs.span());
    }
}
