package work.strata.engine.scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import work.strata.engine.pipeline.CancellationToken;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.runtime.Block;
import work.strata.engine.runtime.Command;
import work.strata.engine.shared.ShellLog;

/**
 * Committed, process-wide engine state: declarations, blocks, modules, variable names and the
 * permanent scope frame. Readers see an immutable snapshot; {@link #mergeDelta} swaps in the next
 * snapshot atomically.
 */
public final class EngineState {
    public static final int NU_VARIABLE_ID = 0;
    public static final int IN_VARIABLE_ID = 1;
    public static final int CONFIG_VARIABLE_ID = 2;

    private final CancellationToken cancellationToken;
    private volatile Snapshot snapshot;

    public EngineState() {
        this(new CancellationToken());
    }

    public EngineState(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
        var scope = new ScopeFrame();
        scope.vars().put("nu", NU_VARIABLE_ID);
        scope.vars().put("in", IN_VARIABLE_ID);
        scope.vars().put("config", CONFIG_VARIABLE_ID);
        this.snapshot = new Snapshot(List.of(), List.of(), List.of(), List.of("nu", "in", "config"), scope);
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public int numDecls() {
        return snapshot.decls().size();
    }

    public int numBlocks() {
        return snapshot.blocks().size();
    }

    public Command getDecl(int declId) {
        var decls = snapshot.decls();
        if (declId < 0 || declId >= decls.size()) {
            throw ShellError.engineFailed("declaration id " + declId + " not found");
        }
        return decls.get(declId);
    }

    public Block getBlock(int blockId) {
        var blocks = snapshot.blocks();
        if (blockId < 0 || blockId >= blocks.size()) {
            throw ShellError.engineFailed("block id " + blockId + " not found");
        }
        return blocks.get(blockId);
    }

    public Module getModule(int moduleId) {
        var modules = snapshot.modules();
        if (moduleId < 0 || moduleId >= modules.size()) {
            throw ShellError.engineFailed("module id " + moduleId + " not found");
        }
        return modules.get(moduleId);
    }

    public String getVarName(int varId) {
        var vars = snapshot.vars();
        return varId >= 0 && varId < vars.size() ? vars.get(varId) : "$" + varId;
    }

    /**
     * Visible declaration of the permanent scope; {@link StateWorkingSet#findDecl} also sees pending additions.
     */
    public Optional<Integer> findDecl(String name) {
        var scope = snapshot.scope();
        var declId = scope.decls().get(name);
        if (declId != null && scope.visibility().isDeclVisible(declId)) {
            return Optional.of(declId);
        }
        return Optional.empty();
    }

    public Optional<Integer> findModule(String name) {
        return Optional.ofNullable(snapshot.scope().modules().get(name));
    }

    public Collection<String> visibleDeclNames() {
        var names = new LinkedHashSet<String>();
        var scope = snapshot.scope();
        scope.decls().forEach((name, id) -> {
            if (scope.visibility().isDeclVisible(id)) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Commits a finished parse pass. The delta must have been produced from the current snapshot and
     * have its scopes closed back to the top-level frame.
     */
    public synchronized void mergeDelta(StateDelta delta) {
        var current = snapshot;
        if (delta.baseDecls != current.decls().size()
            || delta.baseBlocks != current.blocks().size()
            || delta.baseModules != current.modules().size()
            || delta.baseVars != current.vars().size()) {
            throw ShellError.engineFailed("working set is stale; another pass was merged first");
        }
        if (delta.frames.size() != 1) {
            throw ShellError.engineFailed("unbalanced scopes in working set (depth " + delta.frames.size() + ")");
        }
        var scope = current.scope().copy();
        scope.absorb(delta.frames.get(0));
        this.snapshot = new Snapshot(
            concat(current.decls(), delta.decls),
            concat(current.blocks(), delta.blocks),
            concat(current.modules(), delta.modules),
            concat(current.vars(), delta.vars),
            scope
        );
        ShellLog.debug(() -> "merged delta: " + delta.decls.size() + " decl(s), " + delta.blocks.size()
            + " block(s), " + delta.modules.size() + " module(s), " + delta.vars.size() + " var(s)");
    }

    private static <T> List<T> concat(List<T> committed, List<T> added) {
        if (added.isEmpty()) {
            return committed;
        }
        var merged = new ArrayList<T>(committed.size() + added.size());
        merged.addAll(committed);
        merged.addAll(added);
        return List.copyOf(merged);
    }

    /**
     * One committed version of the engine tables. {@code scope} must not be mutated.
     */
    public record Snapshot(List<Command> decls, List<Block> blocks, List<Module> modules, List<String> vars, ScopeFrame scope) {}
}
