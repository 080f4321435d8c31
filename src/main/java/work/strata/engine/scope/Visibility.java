package work.strata.engine.scope;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-frame visibility overrides for declaration ids. Ids without an entry are visible.
 */
public final class Visibility {
    private final Map<Integer, Boolean> declIds = new HashMap<>();

    public boolean isDeclVisible(int declId) {
        return declIds.getOrDefault(declId, true);
    }

    public void hide(int declId) {
        declIds.put(declId, false);
    }

    public void use(int declId) {
        declIds.put(declId, true);
    }

    /**
     * Adds entries from an outer frame; entries already present (from inner frames) win.
     */
    public void appendOuter(Visibility outer) {
        outer.declIds.forEach(declIds::putIfAbsent);
    }

    /**
     * Applies entries from a newer layer over this one.
     */
    public void mergeWith(Visibility newer) {
        declIds.putAll(newer.declIds);
    }

    public Visibility copy() {
        var copy = new Visibility();
        copy.declIds.putAll(declIds);
        return copy;
    }
}
