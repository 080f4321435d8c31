package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.scope.EngineState;

/**
 * A resolved command invocation: declaration id, head span, and argument expressions.
 */
public record Call(int declId, Span head, List<Expression> positional, List<NamedArg> named, Span span) {
    public Call {
        Objects.requireNonNull(head, "head");
        positional = List.copyOf(positional);
        named = List.copyOf(named);
        Objects.requireNonNull(span, "span");
    }

    public static Call of(int declId, Span head, List<Expression> positional) {
        var spans = new ArrayList<Span>();
        spans.add(head);
        positional.forEach(arg -> spans.add(arg.span()));
        return new Call(declId, head, positional, List.of(), Span.union(spans));
    }

    public Call withNamed(List<NamedArg> flags) {
        return new Call(declId, head, positional, flags, span);
    }

    public Optional<Expression> positionalAt(int index) {
        return index < positional.size() ? Optional.of(positional.get(index)) : Optional.empty();
    }

    public boolean hasFlag(String name) {
        for (var arg : named) {
            if (arg.name().equals(name)) {
                if (arg.value() instanceof Expression.Literal literal && literal.value() instanceof Value.Bool bool) {
                    return bool.val();
                }
                return true;
            }
        }
        return false;
    }

    public Optional<Value> getFlag(EngineState engine, Stack stack, String name) {
        for (var arg : named) {
            if (arg.name().equals(name) && arg.value() != null) {
                return Optional.of(Evaluator.evalExpression(engine, stack, arg.value()));
            }
        }
        return Optional.empty();
    }

    public Value req(EngineState engine, Stack stack, int index) {
        if (index >= positional.size()) {
            throw ShellError.missingParameter(parameterName(engine, index), head);
        }
        return Evaluator.evalExpression(engine, stack, positional.get(index));
    }

    public Optional<Value> opt(EngineState engine, Stack stack, int index) {
        if (index >= positional.size()) {
            return Optional.empty();
        }
        return Optional.of(Evaluator.evalExpression(engine, stack, positional.get(index)));
    }

    public List<Value> rest(EngineState engine, Stack stack, int start) {
        var values = new ArrayList<Value>();
        for (int i = start; i < positional.size(); i++) {
            values.add(Evaluator.evalExpression(engine, stack, positional.get(i)));
        }
        return values;
    }

    /**
     * Cell path arguments from {@code start} on. Literal paths are taken as written; other
     * expressions are evaluated and converted.
     */
    public List<CellPath> restCellPaths(EngineState engine, Stack stack, int start) {
        var paths = new ArrayList<CellPath>();
        for (int i = start; i < positional.size(); i++) {
            paths.add(cellPathAt(engine, stack, i));
        }
        return paths;
    }

    public CellPath cellPathAt(EngineState engine, Stack stack, int index) {
        if (index >= positional.size()) {
            throw ShellError.missingParameter(parameterName(engine, index), head);
        }
        var expression = positional.get(index);
        if (expression instanceof Expression.CellPathExpr cellPath) {
            return cellPath.path();
        }
        return CellPath.fromValue(Evaluator.evalExpression(engine, stack, expression));
    }

    /**
     * Block id of a block-literal argument, or of a block value the argument evaluates to.
     */
    public int blockAt(EngineState engine, Stack stack, int index) {
        if (index >= positional.size()) {
            throw ShellError.missingParameter(parameterName(engine, index), head);
        }
        var expression = positional.get(index);
        if (expression instanceof Expression.BlockExpr block) {
            return block.blockId();
        }
        var value = Evaluator.evalExpression(engine, stack, expression);
        if (value instanceof Value.Block block) {
            return block.blockId();
        }
        throw ShellError.typeMismatch("expected block, got " + value.typeName(), expression.span());
    }

    private String parameterName(EngineState engine, int index) {
        return engine.getDecl(declId).signature().positional(index)
            .map(Signature.PositionalArg::name)
            .orElse("argument " + index);
    }

    /**
     * A {@code --flag} argument; {@code value} is null for switches.
     */
    public record NamedArg(String name, Span span, Expression value) {
        public NamedArg {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(span, "span");
        }
    }
}
