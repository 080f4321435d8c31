package work.strata.engine.commands;

import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

public final class ConversionCommands {
    private ConversionCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("into int")
                .named("radix", "radix of integer", 'r')
                .rest("rest", "column paths to convert to int (for table input)"),
            "Convert value to integer.",
            ConversionCommands::intoInt
        ));
        return workingSet;
    }

    private static PipelineData intoInt(EngineState engine, Stack stack, Call call, PipelineData input) {
        var radixValue = call.getFlag(engine, stack, "radix");
        int radix = 10;
        if (radixValue.isPresent()) {
            long requested = radixValue.get().asLong();
            if (requested < Character.MIN_RADIX || requested > Character.MAX_RADIX) {
                throw ShellError.unsupportedInput("Radix must lie in the range [2, 36]", radixValue.get().span());
            }
            radix = (int) requested;
        }
        var paths = call.restCellPaths(engine, stack, 0);
        final int base = radix;
        return CellPathAction.operate(input, paths, value -> toInt(value, base, call.head()), engine.cancellationToken());
    }

    static Value toInt(Value value, int radix, Span head) {
        if (value instanceof Value.Int) {
            return value;
        }
        if (value instanceof Value.Float floating) {
            return Value.integer((long) floating.val(), floating.span());
        }
        if (value instanceof Value.Bool bool) {
            return Value.integer(bool.val() ? 1 : 0, bool.span());
        }
        if (value instanceof Value.Str str) {
            var text = str.val().trim().replace("_", "");
            try {
                return Value.integer(Long.parseLong(text, radix), str.span());
            } catch (NumberFormatException ex) {
                throw ShellError.cantConvert("int", "string", str.span());
            }
        }
        value.orThrow();
        throw ShellError.cantConvert("int", value.typeName(), head);
    }
}
