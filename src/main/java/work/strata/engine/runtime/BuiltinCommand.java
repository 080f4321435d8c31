package work.strata.engine.runtime;

import java.util.Objects;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.scope.EngineState;

record BuiltinCommand(Signature signature, String usage, CommandFunction function, boolean parserKeyword)
    implements Command {
    BuiltinCommand {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(function, "function");
        usage = usage == null ? "" : usage;
    }

    @Override
    public PipelineData run(EngineState engine, Stack stack, Call call, PipelineData input) {
        return function.run(engine, stack, call, input);
    }

    @Override
    public boolean isParserKeyword() {
        return parserKeyword;
    }
}
