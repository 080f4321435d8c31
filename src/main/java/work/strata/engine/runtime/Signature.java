package work.strata.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parameters a command accepts. Custom commands attach a variable id to each parameter so the
 * evaluator can bind arguments into the callee's stack.
 */
public final class Signature {
    private final String name;
    private String usage = "";
    private final List<PositionalArg> required = new ArrayList<>();
    private final List<PositionalArg> optional = new ArrayList<>();
    private PositionalArg rest;
    private final List<Flag> named = new ArrayList<>();

    private Signature(String name) {
        this.name = name;
    }

    public static Signature build(String name) {
        return new Signature(name);
    }

    public Signature usage(String text) {
        this.usage = text == null ? "" : text;
        return this;
    }

    public Signature required(String argName, String description) {
        return required(argName, description, null);
    }

    public Signature required(String argName, String description, Integer varId) {
        required.add(new PositionalArg(argName, description, varId));
        return this;
    }

    public Signature optional(String argName, String description) {
        return optional(argName, description, null);
    }

    public Signature optional(String argName, String description, Integer varId) {
        optional.add(new PositionalArg(argName, description, varId));
        return this;
    }

    public Signature rest(String argName, String description) {
        return rest(argName, description, null);
    }

    public Signature rest(String argName, String description, Integer varId) {
        this.rest = new PositionalArg(argName, description, varId);
        return this;
    }

    public Signature switchFlag(String longName, String description, Character shortName) {
        named.add(new Flag(longName, shortName, description, false, null));
        return this;
    }

    public Signature named(String longName, String description, Character shortName) {
        named.add(new Flag(longName, shortName, description, true, null));
        return this;
    }

    public Signature flag(Flag flag) {
        named.add(flag);
        return this;
    }

    public String name() {
        return name;
    }

    public String usageText() {
        return usage;
    }

    public List<PositionalArg> requiredPositional() {
        return Collections.unmodifiableList(required);
    }

    public List<PositionalArg> optionalPositional() {
        return Collections.unmodifiableList(optional);
    }

    public Optional<PositionalArg> restPositional() {
        return Optional.ofNullable(rest);
    }

    public List<Flag> namedFlags() {
        return Collections.unmodifiableList(named);
    }

    /**
     * The {@code index}-th positional parameter counting required ones first, then optional ones.
     */
    public Optional<PositionalArg> positional(int index) {
        if (index < required.size()) {
            return Optional.of(required.get(index));
        }
        int optionalIndex = index - required.size();
        if (optionalIndex < optional.size()) {
            return Optional.of(optional.get(optionalIndex));
        }
        return Optional.empty();
    }

    /**
     * Variable ids bound by this signature's parameters.
     */
    public List<Integer> parameterVarIds() {
        var ids = new ArrayList<Integer>();
        for (var arg : required) {
            if (arg.varId() != null) {
                ids.add(arg.varId());
            }
        }
        for (var arg : optional) {
            if (arg.varId() != null) {
                ids.add(arg.varId());
            }
        }
        if (rest != null && rest.varId() != null) {
            ids.add(rest.varId());
        }
        for (var flag : named) {
            if (flag.varId() != null) {
                ids.add(flag.varId());
            }
        }
        return ids;
    }

    public record PositionalArg(String name, String description, Integer varId) {}

    public record Flag(String longName, Character shortName, String description, boolean takesValue, Integer varId) {}
}
