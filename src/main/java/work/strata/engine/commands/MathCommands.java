package work.strata.engine.commands;

import java.util.ArrayList;
import java.util.List;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.protocol.ValueOperations;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

public final class MathCommands {
    private MathCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("math sum"),
            "Finds the sum of a list of numbers or tables.",
            MathCommands::sum
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("math variance").switchFlag("sample", "calculate sample variance", 's'),
            "Finds the variance of a list of numbers or tables.",
            MathCommands::variance
        ));
        return workingSet;
    }

    private static PipelineData sum(EngineState engine, Stack stack, Call call, PipelineData input) {
        var values = numbers(input);
        Value total = Value.integer(0, call.head());
        for (var value : values) {
            total = ValueOperations.apply(Operator.ADD, total, value, call.head());
        }
        return PipelineData.value(total.withSpan(call.head()));
    }

    private static PipelineData variance(EngineState engine, Stack stack, Call call, PipelineData input) {
        var values = numbers(input);
        return PipelineData.value(variance(values, call.hasFlag("sample"), call.head()));
    }

    /**
     * Population variance, or sample variance (divided by n - 1) when {@code sample} is set.
     */
    static Value variance(List<Value> values, boolean sample, Span head) {
        if (values.isEmpty() || (sample && values.size() < 2)) {
            throw ShellError.unsupportedInput("Attempted to compute the variance of too few values.", head);
        }
        Value sum = Value.integer(0, head);
        Value sumOfSquares = Value.integer(0, head);
        for (var value : values) {
            if (!value.type().isNumeric()) {
                throw ShellError.unsupportedInput(
                    "Attempted to compute the variance with an item that cannot be used for that.",
                    value.span()
                );
            }
            sum = ValueOperations.apply(Operator.ADD, sum, value, head);
            sumOfSquares = ValueOperations.apply(Operator.ADD, sumOfSquares,
                ValueOperations.apply(Operator.MUL, value, value, head), head);
        }
        long n = values.size();
        var squaredSum = ValueOperations.apply(Operator.MUL, sum, sum, head);
        var meanCorrection = ValueOperations.apply(Operator.DIV, squaredSum, Value.integer(n, head), head);
        var deviations = ValueOperations.apply(Operator.SUB, sumOfSquares, meanCorrection, head);
        long divisor = sample ? n - 1 : n;
        return Value.floating(deviations.asDouble() / divisor, head);
    }

    private static List<Value> numbers(PipelineData input) {
        var values = new ArrayList<Value>();
        var iterator = input.iterator();
        while (iterator.hasNext()) {
            values.add(iterator.next().orThrow());
        }
        return values;
    }
}
