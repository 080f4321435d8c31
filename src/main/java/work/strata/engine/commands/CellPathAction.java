package work.strata.engine.commands;

import java.util.List;
import java.util.function.UnaryOperator;
import work.strata.engine.pipeline.CancellationToken;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.Value;

/**
 * Applies a per-value action to each input element, or only at the given cell paths inside it.
 */
final class CellPathAction {
    private CellPathAction() {}

    static PipelineData operate(PipelineData input, List<CellPath> paths, UnaryOperator<Value> action, CancellationToken token) {
        if (paths.isEmpty()) {
            return input.map(action, token);
        }
        return input.map(value -> {
            var updated = value;
            for (var path : paths) {
                updated = updated.updateCellPath(path.members(), action);
            }
            return updated;
        }, token);
    }
}
