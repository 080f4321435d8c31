package work.strata.engine.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.strata.engine.runtime.Block;
import work.strata.engine.runtime.Command;

/**
 * Additions collected during one parse pass, merged into {@link EngineState} all at once.
 * Ids continue from the counts of the snapshot the pass started from.
 */
public final class StateDelta {
    final int baseDecls;
    final int baseBlocks;
    final int baseModules;
    final int baseVars;
    final List<Command> decls = new ArrayList<>();
    final List<Block> blocks = new ArrayList<>();
    final List<Module> modules = new ArrayList<>();
    final List<String> vars = new ArrayList<>();
    final List<ScopeFrame> frames = new ArrayList<>();

    StateDelta(EngineState.Snapshot base) {
        this.baseDecls = base.decls().size();
        this.baseBlocks = base.blocks().size();
        this.baseModules = base.modules().size();
        this.baseVars = base.vars().size();
        frames.add(new ScopeFrame());
    }

    public List<Command> decls() {
        return Collections.unmodifiableList(decls);
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public List<Module> modules() {
        return Collections.unmodifiableList(modules);
    }

    ScopeFrame currentFrame() {
        return frames.get(frames.size() - 1);
    }
}
