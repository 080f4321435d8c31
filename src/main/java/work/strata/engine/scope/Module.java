package work.strata.engine.scope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.strata.engine.protocol.Span;

/**
 * Exported names of a module: commands by declaration id and environment variables by the id of
 * the block that computes their value.
 */
public record Module(String name, Map<String, Integer> decls, Map<String, Integer> envVars, Span span) {
    public Module {
        Objects.requireNonNull(name, "name");
        decls = Collections.unmodifiableMap(new LinkedHashMap<>(decls));
        envVars = Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
        Objects.requireNonNull(span, "span");
    }

    public static Builder builder(String name, Span span) {
        return new Builder(name, span);
    }

    public boolean exports(String member) {
        return decls.containsKey(member) || envVars.containsKey(member);
    }

    /**
     * Exported commands renamed to {@code "<head> <name>"}.
     */
    public Map<String, Integer> declsWithHead(String head) {
        return withHead(decls, head);
    }

    public Map<String, Integer> envVarsWithHead(String head) {
        return withHead(envVars, head);
    }

    private static Map<String, Integer> withHead(Map<String, Integer> source, String head) {
        var renamed = new LinkedHashMap<String, Integer>();
        source.forEach((member, id) -> renamed.put(head + " " + member, id));
        return renamed;
    }

    public static final class Builder {
        private final String name;
        private final Span span;
        private final Map<String, Integer> decls = new LinkedHashMap<>();
        private final Map<String, Integer> envVars = new LinkedHashMap<>();

        private Builder(String name, Span span) {
            this.name = name;
            this.span = span;
        }

        public Builder exportDecl(String member, int declId) {
            decls.put(member, declId);
            return this;
        }

        public Builder exportEnv(String member, int blockId) {
            envVars.put(member, blockId);
            return this;
        }

        public Module build() {
            return new Module(name, decls, envVars, span);
        }
    }
}
