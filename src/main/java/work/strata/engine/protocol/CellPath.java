package work.strata.engine.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.UnaryOperator;

/**
 * Immutable sequence of {@link PathMember}s addressing a position inside a {@link Value}.
 */
public record CellPath(List<PathMember> members) {
    public CellPath {
        members = List.copyOf(members);
    }

    public static CellPath of(PathMember... members) {
        return new CellPath(List.of(members));
    }

    /**
     * Parses dotted text such as {@code a.0.b}; purely numeric segments become indexes.
     */
    public static CellPath parse(String text, Span span) {
        var members = new ArrayList<PathMember>();
        if (text == null || text.isEmpty()) {
            return new CellPath(members);
        }
        for (var segment : text.split("\\.", -1)) {
            if (!segment.isEmpty() && segment.chars().allMatch(Character::isDigit)) {
                members.add(PathMember.index(Integer.parseInt(segment), span));
            } else {
                members.add(PathMember.column(segment, span));
            }
        }
        return new CellPath(members);
    }

    /**
     * Path from a runtime value: a string is one column (dots included), an int one index,
     * a list a member per element.
     */
    public static CellPath fromValue(Value value) {
        if (value instanceof Value.Str str) {
            return CellPath.of(PathMember.column(str.val(), str.span()));
        }
        if (value instanceof Value.Int integer && integer.val() >= 0 && integer.val() <= Integer.MAX_VALUE) {
            return CellPath.of(PathMember.index((int) integer.val(), integer.span()));
        }
        if (value instanceof Value.List list) {
            var members = new ArrayList<PathMember>();
            for (var item : list.vals()) {
                members.addAll(fromValue(item).members());
            }
            return new CellPath(members);
        }
        throw ShellError.cantConvert("cell path", value.typeName(), value.span());
    }

    public Span span() {
        var spans = new ArrayList<Span>();
        for (var member : members) {
            spans.add(member.span());
        }
        return Span.union(spans);
    }

    public String intoString() {
        var joiner = new StringJoiner(".");
        for (var member : members) {
            joiner.add(member.render());
        }
        return joiner.toString();
    }

    public static Value follow(Value value, List<PathMember> members) {
        var current = value;
        for (var member : members) {
            current = step(current, member);
        }
        return current;
    }

    private static Value step(Value current, PathMember member) {
        if (current instanceof Value.Error error) {
            throw error.error();
        }
        if (member instanceof PathMember.Column column) {
            if (current instanceof Value.Record record) {
                return record.get(column.name()).orElseThrow(() -> ShellError.cantFindColumn(
                    column.span(),
                    record.span(),
                    DidYouMean.nearestColumn(record.cols(), column.name())
                ));
            }
            if (current instanceof Value.List list) {
                var projected = new ArrayList<Value>(list.vals().size());
                for (var row : list.vals()) {
                    projected.add(step(row, column));
                }
                return Value.list(projected, list.span());
            }
            throw ShellError.incompatiblePathAccess(current.typeName(), column.span());
        }
        var index = (PathMember.Index) member;
        if (current instanceof Value.List list) {
            if (index.index() < list.vals().size()) {
                return list.vals().get(index.index());
            }
            throw ShellError.accessBeyondEnd(list.vals().size(), index.span());
        }
        if (current instanceof Value.Range range) {
            var iterator = range.iterator();
            for (int i = 0; iterator.hasNext(); i++) {
                var item = iterator.next();
                if (i == index.index()) {
                    return item;
                }
            }
            throw ShellError.accessBeyondEndOfStream(index.span());
        }
        throw ShellError.notAList(index.span(), current.span());
    }

    /**
     * Returns a copy of {@code value} whose addressed leaf is {@code replace(old)}. Only the ancestors on
     * the path are rebuilt; siblings are shared. A column over a list applies to every row. A failing
     * {@code replace} leaves an {@link Value.Error} at the leaf; traversal failures are thrown.
     */
    public static Value update(Value value, List<PathMember> members, UnaryOperator<Value> replace) {
        if (members.isEmpty()) {
            try {
                return replace.apply(value);
            } catch (ShellError ex) {
                return Value.error(ex);
            }
        }
        if (value instanceof Value.Error error) {
            throw error.error();
        }
        var head = members.get(0);
        var rest = members.subList(1, members.size());
        if (head instanceof PathMember.Column column) {
            if (value instanceof Value.Record record) {
                int position = record.cols().indexOf(column.name());
                if (position < 0) {
                    throw ShellError.cantFindColumn(
                        column.span(),
                        record.span(),
                        DidYouMean.nearestColumn(record.cols(), column.name())
                    );
                }
                var vals = new ArrayList<>(record.vals());
                vals.set(position, update(vals.get(position), rest, replace));
                return Value.record(record.cols(), vals, record.span());
            }
            if (value instanceof Value.List list) {
                var rows = new ArrayList<Value>(list.vals().size());
                for (var row : list.vals()) {
                    rows.add(update(row, members, replace));
                }
                return Value.list(rows, list.span());
            }
            throw ShellError.incompatiblePathAccess(value.typeName(), column.span());
        }
        var index = (PathMember.Index) head;
        if (value instanceof Value.List list) {
            if (index.index() >= list.vals().size()) {
                throw ShellError.accessBeyondEnd(list.vals().size(), index.span());
            }
            var vals = new ArrayList<>(list.vals());
            vals.set(index.index(), update(vals.get(index.index()), rest, replace));
            return Value.list(vals, list.span());
        }
        throw ShellError.notAList(index.span(), value.span());
    }
}
