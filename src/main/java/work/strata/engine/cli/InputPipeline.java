package work.strata.engine.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.DidYouMean;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Block;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Expression;
import work.strata.engine.runtime.ParsePass;
import work.strata.engine.runtime.Pipeline;
import work.strata.engine.runtime.Signature;
import work.strata.engine.scope.StateWorkingSet;

/**
 * The pipeline the CLI runs over its input, e.g. {@code from json | get items | drop column 1 | range 0..4}.
 * The pipeline is also rendered as text so diagnostics can point into it.
 */
final class InputPipeline implements ParsePass {
    private final StringBuilder source = new StringBuilder();
    private final List<Stage> stages = new ArrayList<>();

    InputPipeline(String format) {
        stage("from " + format, null, null);
    }

    InputPipeline get(String path) {
        stage("get", path, Kind.CELL_PATH);
        return this;
    }

    InputPipeline dropColumns(int count) {
        stage("drop column", Integer.toString(count), Kind.INT);
        return this;
    }

    InputPipeline range(String rows) {
        stage("range", rows, Kind.RANGE);
        return this;
    }

    String source() {
        return source.toString();
    }

    @Override
    public Block parse(StateWorkingSet workingSet) {
        var elements = new ArrayList<Expression>();
        for (var stage : stages) {
            var declId = workingSet.findDecl(stage.name());
            if (declId.isEmpty()) {
                workingSet.error(ShellError.commandNotFound(
                    stage.head(),
                    DidYouMean.suggest(workingSet.visibleDeclNames(), stage.name())
                ));
                elements.add(new Expression.Garbage(stage.head()));
                continue;
            }
            var args = new ArrayList<Expression>();
            argument(stage).ifPresent(args::add);
            elements.add(new Expression.CallExpr(Call.of(declId.get(), stage.head(), args)));
        }
        return Block.of(Signature.build("main"), List.of(new Pipeline(elements)), Span.of(0, source.length()));
    }

    private Optional<Expression> argument(Stage stage) {
        if (stage.kind() == null) {
            return Optional.empty();
        }
        var span = stage.argSpan();
        switch (stage.kind()) {
            case CELL_PATH:
                return Optional.of(new Expression.CellPathExpr(CellPath.parse(stage.arg(), span), span));
            case INT:
                return Optional.of(new Expression.Literal(Value.integer(Long.parseLong(stage.arg()), span)));
            default:
                return Optional.of(new Expression.Literal(parseRange(stage.arg(), span)));
        }
    }

    /**
     * {@code FROM..TO} or {@code FROM..<TO}; either bound may be left out.
     */
    static Value parseRange(String text, Span span) {
        boolean exclusive = text.contains("..<");
        var separator = exclusive ? "..<" : "..";
        int at = text.indexOf(separator);
        if (at < 0) {
            throw ShellError.typeMismatch("expected a range such as 1..3, got '" + text + "'", span);
        }
        var from = bound(text.substring(0, at), span);
        var to = bound(text.substring(at + separator.length()), span);
        return Value.Range.of(from, null, to, !exclusive, span);
    }

    private static Value bound(String text, Span span) {
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Value.nothing(span);
        }
        try {
            return Value.integer(Long.parseLong(trimmed), span);
        } catch (NumberFormatException ex) {
            throw ShellError.typeMismatch("expected an integer bound, got '" + trimmed + "'", span);
        }
    }

    private void stage(String name, String arg, Kind kind) {
        if (source.length() > 0) {
            source.append(" | ");
        }
        int headStart = source.length();
        source.append(name);
        var head = Span.of(headStart, source.length());
        Span argSpan = null;
        if (arg != null) {
            source.append(' ');
            int argStart = source.length();
            source.append(arg);
            argSpan = Span.of(argStart, source.length());
        }
        stages.add(new Stage(name, head, arg, argSpan, kind));
    }

    private enum Kind {
        CELL_PATH,
        INT,
        RANGE
    }

    private record Stage(String name, Span head, String arg, Span argSpan, Kind kind) {}
}
