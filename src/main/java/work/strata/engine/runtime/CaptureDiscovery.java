package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;
import work.strata.engine.scope.EngineState;

/**
 * Finds the variables a block reads but does not declare itself. Nested blocks contribute their own
 * captures minus what the enclosing block declares. The well-known variables are never captured.
 */
public final class CaptureDiscovery {
    private CaptureDiscovery() {}

    public static List<Integer> discover(Block block, IntFunction<Block> blocks) {
        var declared = new HashSet<>(block.signature().parameterVarIds());
        var captured = new LinkedHashSet<Integer>();
        for (var pipeline : block.pipelines()) {
            for (var element : pipeline.elements()) {
                visit(element, declared, captured, blocks);
            }
        }
        return new ArrayList<>(captured);
    }

    private static void visit(Expression expression, Set<Integer> declared, Set<Integer> captured, IntFunction<Block> blocks) {
        if (expression == null) {
            return;
        }
        if (expression instanceof Expression.Variable variable) {
            capture(variable.varId(), declared, captured);
        } else if (expression instanceof Expression.VarDecl decl) {
            declared.add(decl.varId());
        } else if (expression instanceof Expression.CallExpr callExpr) {
            for (var arg : callExpr.call().positional()) {
                visit(arg, declared, captured, blocks);
            }
            for (var flag : callExpr.call().named()) {
                visit(flag.value(), declared, captured, blocks);
            }
        } else if (expression instanceof Expression.BinaryOp op) {
            visit(op.lhs(), declared, captured, blocks);
            visit(op.rhs(), declared, captured, blocks);
        } else if (expression instanceof Expression.FullCellPath path) {
            visit(path.head(), declared, captured, blocks);
        } else if (expression instanceof Expression.ListExpr list) {
            list.items().forEach(item -> visit(item, declared, captured, blocks));
        } else if (expression instanceof Expression.RecordExpr record) {
            record.vals().forEach(item -> visit(item, declared, captured, blocks));
        } else if (expression instanceof Expression.TableExpr table) {
            table.rows().forEach(row -> row.forEach(item -> visit(item, declared, captured, blocks)));
        } else if (expression instanceof Expression.RangeExpr range) {
            visit(range.from(), declared, captured, blocks);
            visit(range.next(), declared, captured, blocks);
            visit(range.to(), declared, captured, blocks);
        } else if (expression instanceof Expression.BlockExpr nested) {
            nestedCaptures(blocks.apply(nested.blockId()), declared, captured);
        } else if (expression instanceof Expression.Subexpression nested) {
            nestedCaptures(blocks.apply(nested.blockId()), declared, captured);
        }
    }

    private static void nestedCaptures(Block nested, Set<Integer> declared, Set<Integer> captured) {
        for (var varId : nested.captures()) {
            capture(varId, declared, captured);
        }
    }

    private static void capture(int varId, Set<Integer> declared, Set<Integer> captured) {
        if (varId > EngineState.CONFIG_VARIABLE_ID && !declared.contains(varId)) {
            captured.add(varId);
        }
    }
}
