package work.strata.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.strata.engine.support.EngineTestSupport.bool;
import static work.strata.engine.support.EngineTestSupport.eval;
import static work.strata.engine.support.EngineTestSupport.integer;
import static work.strata.engine.support.EngineTestSupport.ints;
import static work.strata.engine.support.EngineTestSupport.record;
import static work.strata.engine.support.EngineTestSupport.run;
import static work.strata.engine.support.EngineTestSupport.str;
import static work.strata.engine.support.ScriptBuilder.lines;
import static work.strata.engine.support.ScriptBuilder.pipe;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

class EvaluatorTest {
    @Test
    void letBindsForLaterPipelines() {
        var value = eval(s -> lines(
            pipe(s.let("x", s.integer(5))),
            pipe(s.binary(s.var("x"), Operator.ADD, s.integer(1)))
        ));
        assertEquals(integer(6), value);
    }

    @Test
    void onlyTheLastPipelineIsTheResult() {
        var value = eval(s -> lines(
            pipe(s.call("echo", s.integer(1))),
            pipe(s.call("echo", s.integer(2)))
        ));
        assertEquals(integer(2), value);
    }

    @Test
    void variablesDeclaredInABlockDoNotLeak() {
        var value = eval(s -> lines(
            pipe(s.let("x", s.integer(1))),
            pipe(s.call("do", s.block(b -> lines(pipe(b.let("x", b.integer(2))))))),
            pipe(s.var("x"))
        ));
        assertEquals(integer(1), value);
    }

    @Test
    void blockScopedVariableIsUnknownOutside() {
        var result = run(s -> lines(
            pipe(s.call("do", s.block(b -> lines(pipe(b.let("inner", b.integer(2))))))),
            pipe(s.var("inner"))
        ));
        assertFalse(result.isSuccess());
        assertEquals(ShellError.Kind.VARIABLE_NOT_FOUND, result.error().kind());
    }

    @Test
    void closuresCaptureOuterVariables() {
        var value = eval(s -> lines(
            pipe(s.let("x", s.integer(10))),
            pipe(s.call("do",
                s.closure(List.of("a"), b -> lines(pipe(b.binary(b.var("a"), Operator.ADD, b.var("x"))))),
                s.integer(5)))
        ));
        assertEquals(integer(15), value);
    }

    @Test
    void envChangesInsideABlockStayThere() {
        var value = eval(s -> lines(
            pipe(s.letEnv("FOO", s.str("outer"))),
            pipe(s.call("do", s.block(b -> lines(pipe(b.letEnv("FOO", b.str("inner"))))))),
            pipe(s.env("FOO"))
        ));
        assertEquals(str("outer"), value);
    }

    @Test
    void hiddenEnvIsUnknownInsideTheBlockOnly() {
        var inside = run(s -> lines(
            pipe(s.letEnv("FOO", s.str("x"))),
            pipe(s.call("do", s.block(b -> lines(pipe(b.hide("FOO")), pipe(b.env("FOO"))))))
        ));
        assertEquals(ShellError.Kind.ENV_VAR_NOT_FOUND, inside.error().kind());

        var after = eval(s -> lines(
            pipe(s.letEnv("FOO", s.str("x"))),
            pipe(s.call("do", s.block(b -> lines(pipe(b.hide("FOO")))))),
            pipe(s.env("FOO"))
        ));
        assertEquals(str("x"), after);
    }

    @Test
    void hidingAnUnknownNameFails() {
        var result = run(s -> lines(pipe(s.hide("NOTHING_HERE"))));
        assertEquals(ShellError.Kind.DID_NOT_FIND, result.error().kind());
    }

    @Test
    void hidingACommandTwiceFails() {
        var result = run(s -> {
            s.def("foo", List.of(), b -> lines(pipe(b.str("foo"))));
            var first = s.hide("foo");
            var second = s.hide("foo");
            return lines(pipe(first), pipe(second));
        });
        assertEquals(ShellError.Kind.DID_NOT_FIND, result.error().kind());
    }

    @Test
    void hidingAnEnvVarTwiceFails() {
        var result = run(s -> lines(
            pipe(s.letEnv("foo", s.str("bar"))),
            pipe(s.hide("foo")),
            pipe(s.hide("foo"))
        ));
        assertEquals(ShellError.Kind.DID_NOT_FIND, result.error().kind());
    }

    @Test
    void hidingACommandLeavesTheSameNamedEnvVarVisible() {
        var value = eval(s -> {
            var letEnv = s.letEnv("foo", s.str("bar"));
            s.def("foo", List.of(), b -> lines(pipe(b.str("foo"))));
            return lines(pipe(letEnv), pipe(s.hide("foo")), pipe(s.env("foo")));
        });
        assertEquals(str("bar"), value);
    }

    @Test
    void secondHideReachesTheEnvVarBehindAHiddenCommand() {
        var result = run(s -> {
            var letEnv = s.letEnv("foo", s.str("bar"));
            s.def("foo", List.of(), b -> lines(pipe(b.str("foo"))));
            var first = s.hide("foo");
            var second = s.hide("foo");
            return lines(pipe(letEnv), pipe(first), pipe(second), pipe(s.env("foo")));
        });
        assertEquals(ShellError.Kind.ENV_VAR_NOT_FOUND, result.error().kind());
    }

    @Test
    void redeclaringAfterHideRunsTheNewDefinition() {
        var result = run(s -> {
            s.def("foo", List.of(), b -> lines(pipe(b.str("foo"))));
            var hide = s.hide("foo");
            s.def("foo", List.of(), b -> lines(pipe(b.str("bar"))));
            return lines(pipe(hide), pipe(s.call("foo")));
        });
        assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
        assertEquals(str("bar"), result.value());
    }

    @Test
    void hiddenCommandCannotBeCalledInTheSameScope() {
        var result = run(s -> {
            s.def("greet", List.of(), b -> lines(pipe(b.str("hi"))));
            return lines(pipe(s.hide("greet")), pipe(s.call("greet")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void hideInsideABlockLeavesTheCommandVisibleOutside() {
        var value = eval(s -> {
            s.def("greet", List.of(), b -> lines(pipe(b.str("hi"))));
            return lines(
                pipe(s.call("do", s.block(b -> lines(pipe(b.hide("greet")))))),
                pipe(s.call("greet"))
            );
        });
        assertEquals(str("hi"), value);
    }

    @Test
    void aliasExpandsWithLeadingArguments() {
        var value = eval(s -> {
            s.alias("say", "echo", s.str("hello"));
            return lines(pipe(s.call("say", s.str("world"))));
        });
        assertEquals(Value.list(List.of(str("hello"), str("world")), Span.unknown()), value);
    }

    @Test
    void nuExposesEnvironmentAndVariables() {
        var value = eval(s -> lines(
            pipe(s.letEnv("FOO", s.str("a"))),
            pipe(s.let("count", s.integer(1))),
            pipe(s.var("nu"))
        ));
        assertEquals(str("a"), value.followCellPath(CellPath.parse("env.FOO", Span.unknown()).members()));
        assertEquals(str("int"), value.followCellPath(CellPath.parse("scope.vars.$count", Span.unknown()).members()));
    }

    @Test
    void expressionElementsSeeTheirInputAsIn() {
        var value = eval(s -> lines(pipe(
            s.call("echo", s.integer(20)),
            s.binary(s.var("in"), Operator.MUL, s.integer(2))
        )));
        assertEquals(integer(40), value);
    }

    @Test
    void logicalOperatorsShortCircuit() {
        var value = eval(s -> lines(pipe(s.binary(
            s.bool(false),
            Operator.AND,
            s.binary(s.integer(1), Operator.DIV, s.integer(0))
        ))));
        assertEquals(bool(false), value);
    }

    @Test
    void ifRequiresABoolean() {
        var result = run(s -> lines(pipe(s.call("if", s.integer(1), s.block(b -> lines(pipe(b.integer(2))))))));
        assertEquals(ShellError.Kind.TYPE_MISMATCH, result.error().kind());
    }

    @Test
    void ifRunsTheElseBranchOrExpression() {
        var blockBranch = eval(s -> lines(pipe(s.call("if",
            s.binary(s.integer(1), Operator.GT, s.integer(2)),
            s.block(b -> lines(pipe(b.str("then")))),
            s.block(b -> lines(pipe(b.str("else"))))))));
        assertEquals(str("else"), blockBranch);

        var expressionBranch = eval(s -> lines(pipe(s.call("if",
            s.bool(false),
            s.block(b -> lines(pipe(b.str("then")))),
            s.str("plain")))));
        assertEquals(str("plain"), expressionBranch);
    }

    @Test
    void tablesAndRecordsEvaluateTheirCells() {
        var value = eval(s -> lines(pipe(s.table(
            List.of("name", "size"),
            List.of(List.of(s.str("a"), s.integer(1)), List.of(s.str("b"), s.integer(2)))
        ))));
        assertEquals(Value.list(List.of(
            record(List.of("name", "size"), str("a"), integer(1)),
            record(List.of("name", "size"), str("b"), integer(2))
        ), Span.unknown()), value);
    }

    @Test
    void raggedTableIsATypeMismatch() {
        var result = run(s -> lines(pipe(s.table(List.of("a", "b"), List.of(List.of(s.integer(1)))))));
        assertEquals(ShellError.Kind.TYPE_MISMATCH, result.error().kind());
    }

    @Test
    void cellPathsFollowIntoValues() {
        var value = eval(s -> lines(pipe(s.path(
            s.record(List.of("items"), s.list(s.integer(4), s.integer(5))),
            "items.1"
        ))));
        assertEquals(integer(5), value);
    }

    @Test
    void subexpressionsEvaluateInline() {
        var value = eval(s -> lines(pipe(s.binary(
            s.subexpression(b -> lines(pipe(b.call("echo", b.integer(2))))),
            Operator.MUL,
            s.integer(3)
        ))));
        assertEquals(integer(6), value);
    }

    @Test
    void rangesBecomeLazySequences() {
        var value = eval(s -> lines(pipe(s.range(1L, 4L, false), s.call("each",
            s.closure(List.of("n"), b -> lines(pipe(b.binary(b.var("n"), Operator.MUL, b.integer(10)))))))));
        assertEquals(ints(10, 20, 30), value);
    }

    @Test
    void failuresInsideEachBecomeErrorValues() {
        var value = eval(s -> lines(pipe(
            s.list(s.integer(1), s.str("a")),
            s.call("each", s.closure(List.of("x"), b -> lines(pipe(b.binary(b.var("x"), Operator.ADD, b.integer(1))))))
        )));
        var items = ((Value.List) value).vals();
        assertEquals(integer(2), items.get(0));
        assertTrue(items.get(1).isError());
    }
}
