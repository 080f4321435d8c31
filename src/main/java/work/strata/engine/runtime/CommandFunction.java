package work.strata.engine.runtime;

import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.scope.EngineState;

/**
 * Functional signature implemented by builtin commands.
 */
@FunctionalInterface
public interface CommandFunction {
    PipelineData run(EngineState engine, Stack stack, Call call, PipelineData input);
}
