package work.strata.engine.runtime;

import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.scope.EngineState;

/**
 * Entry of the declaration table, looked up by id at call time.
 */
public interface Command {
    Signature signature();

    String usage();

    PipelineData run(EngineState engine, Stack stack, Call call, PipelineData input);

    default String name() {
        return signature().name();
    }

    /**
     * Commands that only affect parsing ({@code def}, {@code module}, {@code alias}) do nothing at runtime.
     */
    default boolean isParserKeyword() {
        return false;
    }

    static Command builtin(Signature signature, String usage, CommandFunction function) {
        return new BuiltinCommand(signature, usage, function, false);
    }

    static Command keyword(Signature signature, String usage, CommandFunction function) {
        return new BuiltinCommand(signature, usage, function, true);
    }
}
