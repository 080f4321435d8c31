package work.strata.engine.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.strata.engine.protocol.Span;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Expression;

/**
 * {@code alias name = command args...}: a name standing for a declaration plus leading arguments.
 */
public record Alias(String name, int declId, List<Expression> leadingArgs, Span span) {
    public Alias {
        Objects.requireNonNull(name, "name");
        leadingArgs = List.copyOf(leadingArgs);
        Objects.requireNonNull(span, "span");
    }

    /**
     * Call to the aliased declaration with the leading arguments placed before {@code args}.
     */
    public Call expand(Span head, List<Expression> args) {
        var positional = new ArrayList<Expression>(leadingArgs.size() + args.size());
        positional.addAll(leadingArgs);
        positional.addAll(args);
        return Call.of(declId, head, positional);
    }
}
