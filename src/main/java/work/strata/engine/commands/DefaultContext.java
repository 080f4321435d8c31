package work.strata.engine.commands;

import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

/**
 * Registers every builtin command in one merged pass.
 */
public final class DefaultContext {
    private DefaultContext() {}

    public static EngineState create() {
        return register(new EngineState());
    }

    public static EngineState register(EngineState engine) {
        var workingSet = new StateWorkingSet(engine);
        CoreCommands.register(workingSet);
        FilterCommands.register(workingSet);
        StringCommands.register(workingSet);
        MathCommands.register(workingSet);
        HashCommands.register(workingSet);
        NetworkCommands.register(workingSet);
        ConversionCommands.register(workingSet);
        FormatCommands.register(workingSet);
        engine.mergeDelta(workingSet.render());
        return engine;
    }
}
