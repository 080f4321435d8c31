package work.strata.engine.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Spanned;

/**
 * Target of {@code use} and {@code hide}: a head name followed by a glob, one name, or a list of names.
 * After parsing, {@code hidden} holds the command names the parser already hid and {@code moduleId}
 * the module the head resolved to, if any.
 */
public record ImportPattern(Head head, List<Member> members, Set<String> hidden, Integer moduleId) {
    public ImportPattern {
        Objects.requireNonNull(head, "head");
        members = List.copyOf(members);
        hidden = Set.copyOf(hidden);
    }

    public static ImportPattern of(String head, Span span, Member... members) {
        return new ImportPattern(new Head(head, span), List.of(members), Set.of(), null);
    }

    public ImportPattern withHidden(Set<String> names) {
        return new ImportPattern(head, members, names, moduleId);
    }

    public ImportPattern withModuleId(Integer id) {
        return new ImportPattern(head, members, hidden, id);
    }

    public boolean isHeadOnly() {
        return members.isEmpty();
    }

    /**
     * Member names spelled out by a single-name or list member; empty for a glob or a bare head.
     */
    public List<Spanned<String>> memberNames() {
        var names = new ArrayList<Spanned<String>>();
        for (var member : members) {
            if (member instanceof Name name) {
                names.add(new Spanned<>(name.name(), name.span()));
            } else if (member instanceof Names list) {
                names.addAll(list.names());
            }
        }
        return names;
    }

    public boolean isGlob() {
        return !members.isEmpty() && members.get(0) instanceof Glob;
    }

    public Span span() {
        var spans = new ArrayList<Span>();
        spans.add(head.span());
        for (var member : members) {
            spans.add(member.span());
        }
        return Span.union(spans);
    }

    public record Head(String name, Span span) {
        public Head {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(span, "span");
        }
    }

    public sealed interface Member permits Glob, Name, Names {
        Span span();
    }

    public record Glob(Span span) implements Member {}

    public record Name(String name, Span span) implements Member {}

    public record Names(List<Spanned<String>> names, Span span) implements Member {
        public Names {
            names = List.copyOf(names);
        }
    }
}
