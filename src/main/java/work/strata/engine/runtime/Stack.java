package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import work.strata.engine.protocol.Config;
import work.strata.engine.protocol.DidYouMean;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.scope.EngineState;

/**
 * Runtime context threaded through evaluation: variable values by id and a chain of environment frames.
 * Each environment binding carries its own id so a hide suppresses exactly the binding visible at that
 * point, and a later {@code let-env} of the same name is visible again.
 */
public final class Stack {
    private static final AtomicLong BINDING_IDS = new AtomicLong();

    private final Map<Integer, Value> vars;
    private final List<EnvFrame> envFrames;
    private final Config baseConfig;

    public Stack() {
        this(Config.defaults());
    }

    public Stack(Config baseConfig) {
        this(new HashMap<>(), new ArrayList<>(List.of(new EnvFrame())), baseConfig);
    }

    private Stack(Map<Integer, Value> vars, List<EnvFrame> envFrames, Config baseConfig) {
        this.vars = vars;
        this.envFrames = envFrames;
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
    }

    // --- variables ---

    public Value getVar(int varId, Span span) {
        var value = vars.get(varId);
        if (value == null) {
            throw ShellError.variableNotFound(span);
        }
        return value.withSpan(span);
    }

    public Optional<Value> findVar(int varId) {
        return Optional.ofNullable(vars.get(varId));
    }

    public void addVar(int varId, Value value) {
        vars.put(varId, Objects.requireNonNull(value, "value"));
    }

    public Map<Integer, Value> vars() {
        return Map.copyOf(vars);
    }

    // --- environment ---

    public void addEnv(String name, Value value) {
        Objects.requireNonNull(value, "value");
        currentEnvFrame().bindings.put(name, new EnvBinding(BINDING_IDS.incrementAndGet(), value));
    }

    public Optional<Value> getEnv(String name) {
        return findBinding(name).map(EnvBinding::value);
    }

    public Value getEnv(String name, Span span) {
        return getEnv(name)
            .map(value -> value.withSpan(span))
            .orElseThrow(() -> ShellError.envVarNotFound(span, DidYouMean.suggest(envNames(), name)));
    }

    /**
     * Hides the binding {@code name} currently resolves to, for this frame and the frames it opens.
     */
    public boolean hideEnv(String name) {
        var binding = findBinding(name);
        binding.ifPresent(found -> currentEnvFrame().hidden.add(found.id()));
        return binding.isPresent();
    }

    public List<String> envNames() {
        var candidates = new LinkedHashSet<String>();
        for (var frame : envFrames) {
            candidates.addAll(frame.bindings.keySet());
        }
        var names = new ArrayList<String>();
        for (var candidate : candidates) {
            if (findBinding(candidate).isPresent()) {
                names.add(candidate);
            }
        }
        return names;
    }

    public LinkedHashMap<String, Value> envSnapshot() {
        var snapshot = new LinkedHashMap<String, Value>();
        for (var name : envNames()) {
            snapshot.put(name, getEnv(name).orElseThrow());
        }
        return snapshot;
    }

    private Optional<EnvBinding> findBinding(String name) {
        var hidden = new HashSet<Long>();
        for (int i = envFrames.size() - 1; i >= 0; i--) {
            var frame = envFrames.get(i);
            hidden.addAll(frame.hidden);
            var binding = frame.bindings.get(name);
            if (binding != null && !hidden.contains(binding.id())) {
                return Optional.of(binding);
            }
        }
        return Optional.empty();
    }

    private EnvFrame currentEnvFrame() {
        return envFrames.get(envFrames.size() - 1);
    }

    // --- config ---

    /**
     * The effective configuration: {@code $config} when bound, otherwise the session default.
     */
    public Config getConfig() {
        var config = vars.get(EngineState.CONFIG_VARIABLE_ID);
        return config == null ? baseConfig : Config.fromValue(config);
    }

    // --- derived stacks ---

    /**
     * A stack for running a block: only the captured variables (and {@code $config}) are copied, the
     * environment frames are copied and a fresh frame is opened so the block's own changes stay local.
     */
    public Stack captureStack(List<Integer> captures) {
        var captured = new HashMap<Integer, Value>();
        for (var varId : captures) {
            var value = vars.get(varId);
            if (value != null) {
                captured.put(varId, value);
            }
        }
        var config = vars.get(EngineState.CONFIG_VARIABLE_ID);
        if (config != null) {
            captured.put(EngineState.CONFIG_VARIABLE_ID, config);
        }
        var frames = copyFrames();
        frames.add(new EnvFrame());
        return new Stack(captured, frames, baseConfig);
    }

    /**
     * An independent copy for a parallel worker; nothing is shared with this stack.
     */
    public Stack forkForWorker() {
        return new Stack(new HashMap<>(vars), copyFrames(), baseConfig);
    }

    private List<EnvFrame> copyFrames() {
        var frames = new ArrayList<EnvFrame>(envFrames.size() + 1);
        for (var frame : envFrames) {
            frames.add(frame.copy());
        }
        return frames;
    }

    private record EnvBinding(long id, Value value) {}

    private static final class EnvFrame {
        private final LinkedHashMap<String, EnvBinding> bindings = new LinkedHashMap<>();
        private final Set<Long> hidden = new HashSet<>();

        EnvFrame copy() {
            var copy = new EnvFrame();
            copy.bindings.putAll(bindings);
            copy.hidden.addAll(hidden);
            return copy;
        }
    }
}
