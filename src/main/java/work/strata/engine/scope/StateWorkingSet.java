package work.strata.engine.scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.runtime.Block;
import work.strata.engine.runtime.CaptureDiscovery;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.CustomCommand;
import work.strata.engine.runtime.Signature;
import work.strata.engine.shared.ShellLog;

/**
 * Parse-time view of the engine: the committed snapshot plus a {@link StateDelta} of pending additions
 * and a stack of scope frames. Name lookups walk the delta frames innermost-first and then the
 * permanent frame, honouring visibility overrides as they go. Errors are collected, not thrown; a pass
 * with errors must not be merged.
 */
public final class StateWorkingSet {
    private final EngineState permanent;
    private final EngineState.Snapshot base;
    private final StateDelta delta;
    private final List<ShellError> errors = new ArrayList<>();

    public StateWorkingSet(EngineState permanent) {
        this.permanent = permanent;
        this.base = permanent.snapshot();
        this.delta = new StateDelta(base);
    }

    public EngineState permanent() {
        return permanent;
    }

    // --- errors ---

    public void error(ShellError error) {
        errors.add(error);
        ShellLog.debug(() -> "parse error: " + error.describe());
    }

    public List<ShellError> errors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * The pending additions; hand this to {@link EngineState#mergeDelta} once the pass is error-free.
     */
    public StateDelta render() {
        return delta;
    }

    // --- scopes ---

    public void enterScope() {
        delta.frames.add(new ScopeFrame());
    }

    public void exitScope() {
        if (delta.frames.size() <= 1) {
            throw ShellError.engineFailed("exitScope without matching enterScope");
        }
        delta.frames.remove(delta.frames.size() - 1);
    }

    // --- variables ---

    public int addVariable(String name) {
        int varId = base.vars().size() + delta.vars.size();
        delta.vars.add(name);
        delta.currentFrame().vars().put(name, varId);
        return varId;
    }

    public Optional<Integer> findVariable(String name) {
        for (int i = delta.frames.size() - 1; i >= 0; i--) {
            var varId = delta.frames.get(i).vars().get(name);
            if (varId != null) {
                return Optional.of(varId);
            }
        }
        return Optional.ofNullable(base.scope().vars().get(name));
    }

    public String getVarName(int varId) {
        if (varId < base.vars().size()) {
            return base.vars().get(varId);
        }
        return delta.vars.get(varId - base.vars().size());
    }

    public Collection<String> visibleVariableNames() {
        var names = new LinkedHashSet<>(base.scope().vars().keySet());
        for (var frame : delta.frames) {
            names.addAll(frame.vars().keySet());
        }
        return names;
    }

    // --- declarations ---

    /**
     * Registers a command under its signature name in the current frame. A visible command of the
     * same name declared in this same frame is a duplicate; one hidden earlier in the frame is not.
     */
    public int addDecl(Command command, Span span) {
        var name = command.name();
        var frame = delta.currentFrame();
        var existing = frame.decls().get(name);
        if (existing != null && isVisibleFromCurrentFrame(existing)) {
            error(ShellError.duplicateDeclaration(name, span));
        }
        int declId = base.decls().size() + delta.decls.size();
        delta.decls.add(command);
        frame.decls().put(name, declId);
        frame.visibility().use(declId);
        return declId;
    }

    public int addDecl(Command command) {
        return addDecl(command, Span.unknown());
    }

    /**
     * Reserves an id for a custom command whose body is parsed later, so calls to it may appear
     * before (or inside) its definition.
     */
    public int predeclare(Signature signature, Span span) {
        return addDecl(new CustomCommand(signature, CustomCommand.UNRESOLVED_BLOCK), span);
    }

    public void defineBody(int declId, int blockId) {
        int index = declId - base.decls().size();
        if (index < 0 || index >= delta.decls.size() || !(delta.decls.get(index) instanceof CustomCommand custom)) {
            throw ShellError.engineFailed("declaration " + declId + " is not a pending custom command");
        }
        delta.decls.set(index, custom.withBlock(blockId));
    }

    public Optional<Integer> findDecl(String name) {
        var visibility = new Visibility();
        for (int i = delta.frames.size() - 1; i >= 0; i--) {
            var frame = delta.frames.get(i);
            visibility.appendOuter(frame.visibility());
            var declId = frame.decls().get(name);
            if (declId != null && visibility.isDeclVisible(declId)) {
                return Optional.of(declId);
            }
        }
        var scope = base.scope();
        visibility.appendOuter(scope.visibility());
        var declId = scope.decls().get(name);
        if (declId != null && visibility.isDeclVisible(declId)) {
            return Optional.of(declId);
        }
        return Optional.empty();
    }

    public Command getDecl(int declId) {
        if (declId < base.decls().size()) {
            return base.decls().get(declId);
        }
        int index = declId - base.decls().size();
        if (index >= delta.decls.size()) {
            throw ShellError.engineFailed("declaration id " + declId + " not found");
        }
        return delta.decls.get(index);
    }

    /**
     * Hides the declaration {@code name} currently resolves to, in the current frame only.
     */
    public Optional<Integer> hideDecl(String name) {
        var declId = findDecl(name);
        declId.ifPresent(id -> delta.currentFrame().visibility().hide(id));
        return declId;
    }

    public Collection<String> visibleDeclNames() {
        var names = new LinkedHashSet<String>();
        var candidates = new LinkedHashSet<>(base.scope().decls().keySet());
        for (var frame : delta.frames) {
            candidates.addAll(frame.decls().keySet());
        }
        for (var candidate : candidates) {
            if (findDecl(candidate).isPresent()) {
                names.add(candidate);
            }
        }
        return names;
    }

    private boolean isVisibleFromCurrentFrame(int declId) {
        var visibility = new Visibility();
        for (int i = delta.frames.size() - 1; i >= 0; i--) {
            visibility.appendOuter(delta.frames.get(i).visibility());
        }
        visibility.appendOuter(base.scope().visibility());
        return visibility.isDeclVisible(declId);
    }

    // --- aliases ---

    public void addAlias(Alias alias) {
        delta.currentFrame().aliases().put(alias.name(), alias);
    }

    public Optional<Alias> findAlias(String name) {
        for (int i = delta.frames.size() - 1; i >= 0; i--) {
            var alias = delta.frames.get(i).aliases().get(name);
            if (alias != null) {
                return Optional.of(alias);
            }
        }
        return Optional.ofNullable(base.scope().aliases().get(name));
    }

    // --- blocks ---

    /**
     * Stores a block, filling in the outer variables it captures.
     */
    public int addBlock(Block block) {
        var captures = CaptureDiscovery.discover(block, this::getBlock);
        int blockId = base.blocks().size() + delta.blocks.size();
        delta.blocks.add(block.withCaptures(captures));
        return blockId;
    }

    public Block getBlock(int blockId) {
        if (blockId < base.blocks().size()) {
            return base.blocks().get(blockId);
        }
        int index = blockId - base.blocks().size();
        if (index >= delta.blocks.size()) {
            throw ShellError.engineFailed("block id " + blockId + " not found");
        }
        return delta.blocks.get(index);
    }

    // --- modules ---

    public int addModule(Module module) {
        int moduleId = base.modules().size() + delta.modules.size();
        delta.modules.add(module);
        delta.currentFrame().modules().put(module.name(), moduleId);
        return moduleId;
    }

    public Optional<Integer> findModule(String name) {
        for (int i = delta.frames.size() - 1; i >= 0; i--) {
            var moduleId = delta.frames.get(i).modules().get(name);
            if (moduleId != null) {
                return Optional.of(moduleId);
            }
        }
        return Optional.ofNullable(base.scope().modules().get(name));
    }

    public Module getModule(int moduleId) {
        if (moduleId < base.modules().size()) {
            return base.modules().get(moduleId);
        }
        return delta.modules.get(moduleId - base.modules().size());
    }

    // --- use / hide ---

    /**
     * Imports the commands selected by {@code pattern} into the current frame and marks them visible.
     * A bare head imports {@code "<module> <name>"}; a glob or explicit names import bare names.
     * Environment exports are applied when the {@code use} call runs.
     */
    public ImportPattern useModule(ImportPattern pattern) {
        var moduleId = findModule(pattern.head().name());
        if (moduleId.isEmpty()) {
            error(ShellError.moduleNotFound(pattern.head().name(), pattern.head().span()));
            return pattern;
        }
        var module = getModule(moduleId.get());
        Map<String, Integer> imported;
        if (pattern.isHeadOnly()) {
            imported = module.declsWithHead(pattern.head().name());
        } else if (pattern.isGlob()) {
            imported = module.decls();
        } else {
            imported = new LinkedHashMap<>();
            for (var member : pattern.memberNames()) {
                if (!module.exports(member.item())) {
                    error(ShellError.exportNotFound(member.item(), member.span()));
                    continue;
                }
                var declId = module.decls().get(member.item());
                if (declId != null) {
                    imported.put(member.item(), declId);
                }
            }
        }
        var frame = delta.currentFrame();
        imported.forEach((name, declId) -> {
            frame.decls().put(name, declId);
            frame.visibility().use(declId);
        });
        return pattern.withModuleId(moduleId.get());
    }

    /**
     * Hides the commands named by {@code pattern} in the current frame and records their names in the
     * returned pattern. Environment variables are hidden when the {@code hide} call runs, for the names
     * not hidden here.
     */
    public ImportPattern hide(ImportPattern pattern) {
        var hidden = new LinkedHashSet<String>();
        var moduleId = findModule(pattern.head().name());
        if (moduleId.isPresent()) {
            for (var name : hideCandidates(pattern, getModule(moduleId.get()))) {
                if (hideDecl(name).isPresent()) {
                    hidden.add(name);
                }
            }
            return pattern.withHidden(hidden).withModuleId(moduleId.get());
        }
        var name = plainName(pattern);
        if (hideDecl(name).isPresent()) {
            hidden.add(name);
        }
        return pattern.withHidden(hidden);
    }

    /**
     * Names a hide of {@code pattern} targets inside {@code module}: qualified names for a bare head or
     * explicit members, bare export names for a glob.
     */
    public static List<String> hideCandidates(ImportPattern pattern, Module module) {
        var head = pattern.head().name();
        var names = new ArrayList<String>();
        if (pattern.isHeadOnly()) {
            names.addAll(module.declsWithHead(head).keySet());
        } else if (pattern.isGlob()) {
            names.addAll(module.decls().keySet());
        } else {
            for (var member : pattern.memberNames()) {
                names.add(head + " " + member.item());
            }
        }
        return names;
    }

    /**
     * A head that is not a module is hidden as written, members included ({@code hide spam foo}).
     */
    public static String plainName(ImportPattern pattern) {
        var builder = new StringBuilder(pattern.head().name());
        for (var member : pattern.memberNames()) {
            builder.append(' ').append(member.item());
        }
        return builder.toString();
    }
}
