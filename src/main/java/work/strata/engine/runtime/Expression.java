package work.strata.engine.runtime;

import java.util.List;
import java.util.Objects;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.PathMember;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.scope.ImportPattern;

/**
 * Expression nodes produced by the parser. Names are already resolved to declaration and variable ids.
 */
public sealed interface Expression {
    Span span();

    record Literal(Value value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        public Span span() {
            return value.span();
        }
    }

    record Variable(int varId, Span span) implements Expression {}

    record EnvVariable(String name, Span span) implements Expression {}

    record CallExpr(Call call) implements Expression {
        public Span span() {
            return call.span();
        }
    }

    record BinaryOp(Expression lhs, Operator op, Span opSpan, Expression rhs) implements Expression {
        public Span span() {
            return Span.union(List.of(lhs.span(), opSpan, rhs.span()));
        }
    }

    record FullCellPath(Expression head, List<PathMember> tail, Span span) implements Expression {
        public FullCellPath {
            tail = List.copyOf(tail);
        }
    }

    record ListExpr(List<Expression> items, Span span) implements Expression {
        public ListExpr {
            items = List.copyOf(items);
        }
    }

    record RecordExpr(List<String> cols, List<Expression> vals, Span span) implements Expression {
        public RecordExpr {
            cols = List.copyOf(cols);
            vals = List.copyOf(vals);
        }
    }

    record TableExpr(List<String> headers, List<List<Expression>> rows, Span span) implements Expression {
        public TableExpr {
            headers = List.copyOf(headers);
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    record BlockExpr(int blockId, Span span) implements Expression {}

    record Subexpression(int blockId, Span span) implements Expression {}

    /**
     * {@code from..to}, {@code from,next..to} or {@code from..<to}; null bounds are open.
     */
    record RangeExpr(Expression from, Expression next, Expression to, boolean inclusive, Span span) implements Expression {}

    record CellPathExpr(CellPath path, Span span) implements Expression {}

    record ImportPatternExpr(ImportPattern pattern, Span span) implements Expression {}

    record VarDecl(int varId, Span span) implements Expression {}

    /**
     * Placeholder left where the parser recorded an error.
     */
    record Garbage(Span span) implements Expression {}
}
