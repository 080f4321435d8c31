package work.strata.engine.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.strata.engine.support.EngineTestSupport.evalWithInput;
import static work.strata.engine.support.EngineTestSupport.integer;
import static work.strata.engine.support.EngineTestSupport.ints;
import static work.strata.engine.support.EngineTestSupport.list;
import static work.strata.engine.support.EngineTestSupport.record;
import static work.strata.engine.support.EngineTestSupport.run;
import static work.strata.engine.support.EngineTestSupport.str;
import static work.strata.engine.support.ScriptBuilder.lines;
import static work.strata.engine.support.ScriptBuilder.pipe;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.Operator;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;

class FormatCommandsTest {
    @Test
    void fromUrlDecodesPercentEscapes() {
        var value = evalWithInput(
            str("bread=baguette&cheese=comt%C3%A9&meat=ham&fat=butter"),
            s -> lines(pipe(s.call("from url")))
        );
        assertEquals(
            record(List.of("bread", "cheese", "meat", "fat"), str("baguette"), str("comté"), str("ham"), str("butter")),
            value
        );
    }

    @Test
    void fromJsonObjectsReadsOneValuePerDocument() {
        var value = evalWithInput(
            str("{\"a\": 1}\n{\"a\": 2}\n"),
            s -> lines(pipe(s.call("from json", List.of(s.flag("objects")))))
        );
        assertEquals(list(record(List.of("a"), integer(1)), record(List.of("a"), integer(2))), value);
    }

    @Test
    void fromJsonThenGet() {
        var value = evalWithInput(
            str("{\"items\": [{\"name\": \"x\"}, {\"name\": \"y\"}]}"),
            s -> lines(pipe(s.call("from json"), s.call("get", s.cellPath("items.1.name"))))
        );
        assertEquals(str("y"), value);
    }

    @Test
    void invalidJsonFailsTheRun() {
        var result = run(s -> lines(pipe(s.str("{oops"), s.call("from json"))));
        assertFalse(result.isSuccess());
        assertEquals(ShellError.Kind.UNSUPPORTED_INPUT, result.error().kind());
    }

    @Test
    void fromTomlAndIni() {
        var toml = evalWithInput(str("title = \"x\"\n[owner]\nage = 3\n"), s -> lines(pipe(s.call("from toml"))));
        var table = (Value.Record) toml;
        assertEquals(str("x"), table.get("title").orElseThrow());
        assertEquals(record(List.of("age"), integer(3)), table.get("owner").orElseThrow());

        var ini = evalWithInput(str("[db]\nport = 5432\n"), s -> lines(pipe(s.call("from ini"))));
        assertEquals(record(List.of("db"), record(List.of("port"), str("5432"))), ini);
    }

    @Test
    void toJsonRawIsCompact() {
        var value = evalWithInput(
            record(List.of("a", "b"), ints(1, 2), str("z")),
            s -> lines(pipe(s.call("to json", List.of(s.flag("raw")))))
        );
        assertEquals(str("{\"a\":[1,2],\"b\":\"z\"}"), value);
    }

    @Test
    void toJsonRethrowsErrorValues() {
        assertThrows(ShellError.class, () -> evalWithInput(
            ints(1, 0),
            s -> lines(pipe(
                s.call("each", s.closure(List.of("it"), b -> lines(pipe(b.binary(b.integer(1),
                    Operator.DIV, b.var("it")))))),
                s.call("to json")
            ))
        ));
    }
}
