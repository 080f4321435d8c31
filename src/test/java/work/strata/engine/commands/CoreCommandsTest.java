package work.strata.engine.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static work.strata.engine.support.EngineTestSupport.eval;
import static work.strata.engine.support.EngineTestSupport.integer;
import static work.strata.engine.support.EngineTestSupport.ints;
import static work.strata.engine.support.EngineTestSupport.str;
import static work.strata.engine.support.ScriptBuilder.lines;
import static work.strata.engine.support.ScriptBuilder.pipe;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.Value;

class CoreCommandsTest {
    @Test
    void echoOfSeveralArgumentsStreamsThem() {
        assertEquals(ints(1, 2, 3), eval(s -> lines(pipe(s.call("echo", s.integer(1), s.integer(2), s.integer(3))))));
        assertEquals(integer(7), eval(s -> lines(pipe(s.call("echo", s.integer(7))))));
        assertInstanceOf(Value.Nothing.class, eval(s -> lines(pipe(s.call("echo")))));
    }

    @Test
    void buildStringUsesTheListSeparator() {
        var value = eval(s -> lines(pipe(s.call("build-string",
            s.str("items: "), s.list(s.integer(1), s.integer(2)), s.str("!")))));
        assertEquals(str("items: [1, 2]!"), value);
    }

    @Test
    void doPassesArgumentsToTheBlock() {
        var value = eval(s -> lines(pipe(s.call("do",
            s.closure(List.of("a", "b"), b -> lines(pipe(b.binary(b.var("a"), Operator.SUB, b.var("b"))))),
            s.integer(10), s.integer(3)))));
        assertEquals(integer(7), value);
    }

    @Test
    void letEnvIsReadableThroughEnv() {
        var value = eval(s -> lines(
            pipe(s.letEnv("GREETING", s.str("hej"))),
            pipe(s.env("GREETING"))
        ));
        assertEquals(str("hej"), value);
    }

    @Test
    void definitionKeywordsProduceNoOutput() {
        var value = eval(s -> {
            s.def("noop", List.of(), b -> lines(pipe(b.integer(1))));
            return lines(pipe(s.call("def")));
        });
        assertInstanceOf(Value.Nothing.class, value);
    }
}
