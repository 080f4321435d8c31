package work.strata.engine.scope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Names introduced by one lexical block at parse time, plus the frame's visibility overrides.
 */
public final class ScopeFrame {
    private final Map<String, Integer> vars = new LinkedHashMap<>();
    private final Map<String, Integer> decls = new LinkedHashMap<>();
    private final Map<String, Alias> aliases = new LinkedHashMap<>();
    private final Map<String, Integer> modules = new LinkedHashMap<>();
    private final Visibility visibility = new Visibility();

    public Map<String, Integer> vars() {
        return vars;
    }

    public Map<String, Integer> decls() {
        return decls;
    }

    public Map<String, Alias> aliases() {
        return aliases;
    }

    public Map<String, Integer> modules() {
        return modules;
    }

    public Visibility visibility() {
        return visibility;
    }

    /**
     * Layers {@code newer} over this frame: its names replace same-named entries here.
     */
    void absorb(ScopeFrame newer) {
        vars.putAll(newer.vars);
        decls.putAll(newer.decls);
        aliases.putAll(newer.aliases);
        modules.putAll(newer.modules);
        visibility.mergeWith(newer.visibility);
    }

    public ScopeFrame copy() {
        var copy = new ScopeFrame();
        copy.absorb(this);
        return copy;
    }
}
