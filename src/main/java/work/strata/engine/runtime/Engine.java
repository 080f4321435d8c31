package work.strata.engine.runtime;

import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;
import work.strata.engine.shared.ShellLog;

/**
 * One parse-and-evaluate pass: parse against a fresh working set, merge atomically, then run the block.
 */
public final class Engine {
    private Engine() {}

    /**
     * Runs {@code pass} and commits its declarations. On parse errors nothing is merged and the first
     * error is thrown.
     */
    public static Block parseAndMerge(EngineState engine, ParsePass pass) {
        var workingSet = new StateWorkingSet(engine);
        var block = pass.parse(workingSet);
        if (workingSet.hasErrors()) {
            var errors = workingSet.errors();
            ShellLog.debug(() -> "parse pass rejected with " + errors.size() + " error(s); nothing merged");
            throw errors.get(0);
        }
        if (block == null) {
            throw ShellError.engineFailed("parse pass returned no block");
        }
        int blockId = workingSet.addBlock(block);
        engine.mergeDelta(workingSet.render());
        return engine.getBlock(blockId);
    }

    public static PipelineData evaluate(EngineState engine, Stack stack, ParsePass pass, PipelineData input) {
        var block = parseAndMerge(engine, pass);
        return Evaluator.evalBlock(engine, stack, block, input);
    }
}
