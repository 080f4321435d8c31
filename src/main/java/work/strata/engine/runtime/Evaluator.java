package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.PathMember;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.protocol.ValueOperations;
import work.strata.engine.scope.EngineState;

/**
 * Tree-walking evaluator for blocks, pipelines and expressions.
 */
public final class Evaluator {
    private Evaluator() {}

    /**
     * Runs each pipeline in order. Only the first pipeline receives {@code input}; earlier pipelines are
     * drained so their side effects happen and their errors surface, and the last one's output is returned.
     */
    public static PipelineData evalBlock(EngineState engine, Stack stack, Block block, PipelineData input) {
        var pipelines = block.pipelines();
        var current = input;
        for (int i = 0; i < pipelines.size(); i++) {
            var output = evalPipeline(engine, stack, pipelines.get(i), current);
            if (i == pipelines.size() - 1) {
                return output;
            }
            output.drain();
            current = PipelineData.empty();
        }
        return current;
    }

    public static PipelineData evalPipeline(EngineState engine, Stack stack, Pipeline pipeline, PipelineData input) {
        var data = input;
        for (var element : pipeline.elements()) {
            data = evalElement(engine, stack, element, data);
        }
        return data;
    }

    private static PipelineData evalElement(EngineState engine, Stack stack, Expression element, PipelineData input) {
        if (element instanceof Expression.CallExpr callExpr) {
            return evalCall(engine, stack, callExpr.call(), input);
        }
        if (element instanceof Expression.Subexpression subexpression) {
            return evalBlock(engine, stack, engine.getBlock(subexpression.blockId()), input);
        }
        if (!(input instanceof PipelineData.Empty)) {
            stack.addVar(EngineState.IN_VARIABLE_ID, input.intoValue(element.span()));
        }
        return PipelineData.value(evalExpression(engine, stack, element));
    }

    public static PipelineData evalCall(EngineState engine, Stack stack, Call call, PipelineData input) {
        var command = engine.getDecl(call.declId());
        return command.run(engine, stack, call, input);
    }

    /**
     * Runs a block value with {@code args} bound to its positional parameters in order and {@code $in}
     * set to the first argument. Used by commands that take a block argument.
     */
    public static PipelineData callBlock(EngineState engine, Stack stack, int blockId, List<Value> args, PipelineData input) {
        var block = engine.getBlock(blockId);
        var callee = stack.captureStack(block.captures());
        var params = new ArrayList<Integer>();
        block.signature().requiredPositional().forEach(param -> params.add(param.varId()));
        block.signature().optionalPositional().forEach(param -> params.add(param.varId()));
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            if (params.get(i) != null) {
                callee.addVar(params.get(i), args.get(i));
            }
        }
        if (!args.isEmpty()) {
            callee.addVar(EngineState.IN_VARIABLE_ID, args.get(0));
        }
        return evalBlock(engine, callee, block, input);
    }

    public static Value evalExpression(EngineState engine, Stack stack, Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        } else if (expression instanceof Expression.Variable variable) {
            return evalVariable(engine, stack, variable);
        } else if (expression instanceof Expression.EnvVariable env) {
            return stack.getEnv(env.name(), env.span());
        } else if (expression instanceof Expression.CallExpr callExpr) {
            var call = callExpr.call();
            return evalCall(engine, stack, call, PipelineData.empty()).intoValue(call.head());
        } else if (expression instanceof Expression.BinaryOp op) {
            return evalBinaryOp(engine, stack, op);
        } else if (expression instanceof Expression.FullCellPath path) {
            return evalExpression(engine, stack, path.head()).followCellPath(path.tail());
        } else if (expression instanceof Expression.ListExpr list) {
            var values = new ArrayList<Value>(list.items().size());
            for (var item : list.items()) {
                values.add(evalExpression(engine, stack, item));
            }
            return Value.list(values, list.span());
        } else if (expression instanceof Expression.RecordExpr record) {
            var values = new ArrayList<Value>(record.vals().size());
            for (var val : record.vals()) {
                values.add(evalExpression(engine, stack, val));
            }
            return Value.record(record.cols(), values, record.span());
        } else if (expression instanceof Expression.TableExpr table) {
            return evalTable(engine, stack, table);
        } else if (expression instanceof Expression.BlockExpr block) {
            return new Value.Block(block.blockId(), block.span());
        } else if (expression instanceof Expression.Subexpression subexpression) {
            var block = engine.getBlock(subexpression.blockId());
            return evalBlock(engine, stack, block, PipelineData.empty()).intoValue(subexpression.span());
        } else if (expression instanceof Expression.RangeExpr range) {
            return evalRange(engine, stack, range);
        } else if (expression instanceof Expression.CellPathExpr cellPath) {
            var members = new ArrayList<Value>();
            for (var member : cellPath.path().members()) {
                if (member instanceof PathMember.Column column) {
                    members.add(Value.string(column.name(), column.span()));
                } else if (member instanceof PathMember.Index index) {
                    members.add(Value.integer(index.index(), index.span()));
                }
            }
            return Value.list(members, cellPath.span());
        }
        return Value.nothing(expression.span());
    }

    private static Value evalVariable(EngineState engine, Stack stack, Expression.Variable variable) {
        if (variable.varId() == EngineState.NU_VARIABLE_ID) {
            return nuVariable(engine, stack, variable.span());
        }
        return stack.getVar(variable.varId(), variable.span());
    }

    private static Value evalBinaryOp(EngineState engine, Stack stack, Expression.BinaryOp op) {
        var lhs = evalExpression(engine, stack, op.lhs());
        if (op.op().isShortCircuit() && lhs instanceof Value.Bool bool) {
            if (op.op() == Operator.AND && !bool.val()) {
                return Value.bool(false, op.span());
            }
            if (op.op() == Operator.OR && bool.val()) {
                return Value.bool(true, op.span());
            }
        }
        var rhs = evalExpression(engine, stack, op.rhs());
        return ValueOperations.apply(op.op(), lhs, rhs, op.opSpan());
    }

    private static Value evalTable(EngineState engine, Stack stack, Expression.TableExpr table) {
        var rows = new ArrayList<Value>(table.rows().size());
        for (var row : table.rows()) {
            if (row.size() != table.headers().size()) {
                throw ShellError.typeMismatch("table row has " + row.size() + " cells, expected "
                    + table.headers().size(), table.span());
            }
            var values = new ArrayList<Value>(row.size());
            for (var cell : row) {
                values.add(evalExpression(engine, stack, cell));
            }
            rows.add(Value.record(table.headers(), values, table.span()));
        }
        return Value.list(rows, table.span());
    }

    private static Value evalRange(EngineState engine, Stack stack, Expression.RangeExpr range) {
        var from = range.from() == null ? Value.nothing(range.span()) : evalExpression(engine, stack, range.from());
        var next = range.next() == null ? null : evalExpression(engine, stack, range.next());
        var to = range.to() == null ? Value.nothing(range.span()) : evalExpression(engine, stack, range.to());
        return Value.Range.of(from, next, to, range.inclusive(), range.span());
    }

    /**
     * {@code $nu}: the visible environment and the variables bound on this stack with their types.
     */
    private static Value nuVariable(EngineState engine, Stack stack, Span span) {
        var vars = new LinkedHashMap<String, Value>();
        stack.vars().entrySet().stream()
            .filter(entry -> entry.getKey() > EngineState.CONFIG_VARIABLE_ID)
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> vars.put("$" + engine.getVarName(entry.getKey()),
                Value.string(entry.getValue().typeName(), span)));
        var scope = Value.record(
            List.of("vars"),
            List.of(Value.Record.of(vars, span)),
            span
        );
        return Value.record(
            List.of("env", "scope"),
            List.of(Value.Record.of(stack.envSnapshot(), span), scope),
            span
        );
    }
}
