package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.Objects;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;
import work.strata.engine.scope.EngineState;

/**
 * Command defined with {@code def}: runs its block in a fresh stack holding the captured variables
 * and the bound arguments.
 */
public record CustomCommand(Signature signature, int blockId) implements Command {
    public static final int UNRESOLVED_BLOCK = -1;

    public CustomCommand {
        Objects.requireNonNull(signature, "signature");
    }

    public CustomCommand withBlock(int newBlockId) {
        return new CustomCommand(signature, newBlockId);
    }

    @Override
    public String usage() {
        return signature.usageText();
    }

    @Override
    public PipelineData run(EngineState engine, Stack stack, Call call, PipelineData input) {
        if (blockId == UNRESOLVED_BLOCK) {
            throw ShellError.engineFailed("command '" + name() + "' was declared but never defined");
        }
        var block = engine.getBlock(blockId);
        var callee = stack.captureStack(block.captures());
        bindArguments(engine, stack, callee, call);
        return Evaluator.evalBlock(engine, callee, block, input);
    }

    private void bindArguments(EngineState engine, Stack caller, Stack callee, Call call) {
        var args = call.rest(engine, caller, 0);
        int position = 0;
        for (var param : signature.requiredPositional()) {
            if (position >= args.size()) {
                throw ShellError.missingParameter(param.name(), call.head());
            }
            bind(callee, param.varId(), args.get(position++));
        }
        for (var param : signature.optionalPositional()) {
            var value = position < args.size() ? args.get(position++) : Value.nothing(call.head());
            bind(callee, param.varId(), value);
        }
        var rest = signature.restPositional();
        if (rest.isPresent()) {
            var remaining = new ArrayList<Value>();
            while (position < args.size()) {
                remaining.add(args.get(position++));
            }
            bind(callee, rest.get().varId(), Value.list(remaining, call.span()));
        }
        for (var flag : signature.namedFlags()) {
            if (flag.takesValue()) {
                var value = call.getFlag(engine, caller, flag.longName()).orElse(Value.nothing(call.head()));
                bind(callee, flag.varId(), value);
            } else {
                bind(callee, flag.varId(), Value.bool(call.hasFlag(flag.longName()), call.head()));
            }
        }
    }

    private static void bind(Stack callee, Integer varId, Value value) {
        if (varId != null) {
            callee.addVar(varId, value);
        }
    }
}
