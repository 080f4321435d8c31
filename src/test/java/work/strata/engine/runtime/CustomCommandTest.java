package work.strata.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.strata.engine.support.EngineTestSupport.eval;
import static work.strata.engine.support.EngineTestSupport.integer;
import static work.strata.engine.support.EngineTestSupport.ints;
import static work.strata.engine.support.EngineTestSupport.run;
import static work.strata.engine.support.EngineTestSupport.runner;
import static work.strata.engine.support.EngineTestSupport.str;
import static work.strata.engine.support.ScriptBuilder.lines;
import static work.strata.engine.support.ScriptBuilder.pipe;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

class CustomCommandTest {
    @Test
    void bindsPositionalArguments() {
        var value = eval(s -> {
            s.def("add", List.of("a", "b"), b -> lines(pipe(b.binary(b.var("a"), Operator.ADD, b.var("b")))));
            return lines(pipe(s.call("add", s.integer(1), s.integer(2))));
        });
        assertEquals(integer(3), value);
    }

    @Test
    void missingRequiredArgumentIsReported() {
        var result = run(s -> {
            s.def("add", List.of("a", "b"), b -> lines(pipe(b.binary(b.var("a"), Operator.ADD, b.var("b")))));
            return lines(pipe(s.call("add", s.integer(1))));
        });
        assertEquals(ShellError.Kind.MISSING_PARAMETER, result.error().kind());
        assertEquals("Missing parameter: b.", result.error().getMessage());
    }

    @Test
    void optionalParameterDefaultsToNothing() {
        var value = eval(s -> {
            s.def("pick", List.of("a"), sig -> sig.optional("b"), b -> lines(pipe(b.var("b"))));
            return lines(pipe(s.call("pick", s.integer(1))));
        });
        assertEquals(Value.nothing(Span.unknown()), value);
    }

    @Test
    void restParameterCollectsTheRemainingArguments() {
        var value = eval(s -> {
            s.def("tail", List.of("head"), sig -> sig.rest("others"), b -> lines(pipe(b.var("others"))));
            return lines(pipe(s.call("tail", s.integer(1), s.integer(2), s.integer(3))));
        });
        assertEquals(ints(2, 3), value);
    }

    @Test
    void switchesAndNamedFlagsAreBound() {
        var value = eval(s -> {
            s.def("greet", List.of("name"), sig -> sig.switchFlag("loud").named("suffix"), b -> lines(pipe(
                b.call("if", b.var("loud"),
                    b.block(t -> lines(pipe(t.call("build-string", t.str("HI "), t.var("name"), t.var("suffix"))))),
                    b.block(t -> lines(pipe(t.call("build-string", t.str("hi "), t.var("name"))))))
            )));
            return lines(pipe(s.call("greet",
                List.of(s.flag("loud"), s.flag("suffix", s.str("!"))),
                s.str("bob"))));
        });
        assertEquals(str("HI bob!"), value);
    }

    @Test
    void absentSwitchIsFalse() {
        var value = eval(s -> {
            s.def("check", List.of(), sig -> sig.switchFlag("verbose"), b -> lines(pipe(b.var("verbose"))));
            return lines(pipe(s.call("check")));
        });
        assertEquals(Value.bool(false, Span.unknown()), value);
    }

    @Test
    void commandsMayCallThemselves() {
        var value = eval(s -> {
            s.def("countdown", List.of("n"), b -> lines(pipe(b.call("if",
                b.binary(b.var("n"), Operator.EQ, b.integer(0)),
                b.block(t -> lines(pipe(t.str("liftoff")))),
                b.block(t -> lines(pipe(t.call("countdown",
                    t.subexpression(u -> lines(pipe(u.binary(u.var("n"), Operator.SUB, u.integer(1))))))))))
            )));
            return lines(pipe(s.call("countdown", s.integer(3))));
        });
        assertEquals(str("liftoff"), value);
    }

    @Test
    void bodyReceivesThePipelineInput() {
        var value = eval(s -> {
            s.def("double", List.of(), b -> lines(pipe(b.binary(b.var("in"), Operator.MUL, b.integer(2)))));
            return lines(pipe(s.call("echo", s.integer(21)), s.call("double")));
        });
        assertEquals(integer(42), value);
    }

    @Test
    void callerEnvironmentIsVisibleButNotChanged() {
        var value = eval(s -> {
            s.def("shout", List.of(), b -> lines(
                pipe(b.letEnv("GREETING", b.str("changed"))),
                pipe(b.env("GREETING"))
            ));
            return lines(
                pipe(s.letEnv("GREETING", s.str("hello"))),
                pipe(s.call("shout")),
                pipe(s.env("GREETING"))
            );
        });
        assertEquals(str("hello"), value);
    }

    @Test
    void definitionsPersistAcrossPasses() {
        var runner = runner();
        run(runner, s -> {
            s.def("seven", List.of(), b -> lines(pipe(b.integer(7))));
            return lines();
        });
        var result = run(runner, s -> lines(pipe(s.call("seven"))));
        assertEquals(integer(7), result.value());
    }
}
