package work.strata.engine.runtime;

import work.strata.engine.scope.StateWorkingSet;

/**
 * The external parser's contract: register declarations in the working set and return the block to run.
 * Errors are reported through {@link StateWorkingSet#error}.
 */
@FunctionalInterface
public interface ParsePass {
    Block parse(StateWorkingSet workingSet);
}
