package work.strata.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.strata.engine.support.EngineTestSupport.eval;
import static work.strata.engine.support.EngineTestSupport.run;
import static work.strata.engine.support.EngineTestSupport.runner;
import static work.strata.engine.support.EngineTestSupport.str;
import static work.strata.engine.support.ScriptBuilder.lines;
import static work.strata.engine.support.ScriptBuilder.pipe;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.support.ScriptBuilder;

class ModuleEvaluationTest {
    private static void spam(ScriptBuilder s) {
        s.module("spam", body -> body
            .exportDef("foo", List.of(), b -> lines(pipe(b.str("foo"))))
            .exportDef("bar", List.of(), b -> lines(pipe(b.str("bar"))))
            .exportEnv("BAZ", b -> b.str("baz")));
    }

    private static void letters(ScriptBuilder s) {
        s.module("abc", body -> body
            .exportDef("a", List.of(), b -> lines(pipe(b.str("a"))))
            .exportDef("b", List.of(), b -> lines(pipe(b.str("b"))))
            .exportDef("c", List.of(), b -> lines(pipe(b.str("c")))));
    }

    @Test
    void moduleCommandsAreUnreachableWithoutUse() {
        var result = run(s -> {
            spam(s);
            return lines(pipe(s.call("foo")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void bareUseImportsQualifiedNames() {
        var value = eval(s -> {
            spam(s);
            return lines(pipe(s.use("spam")), pipe(s.call("spam foo")));
        });
        assertEquals(str("foo"), value);
    }

    @Test
    void globUseImportsBareNamesAndEnvironment() {
        var value = eval(s -> {
            spam(s);
            return lines(
                pipe(s.use("spam", s.glob())),
                pipe(s.call("build-string", s.call("bar"), s.env("BAZ")))
            );
        });
        assertEquals(str("barbaz"), value);
    }

    @Test
    void bareUseQualifiesEnvironmentNames() {
        var value = eval(s -> {
            spam(s);
            return lines(pipe(s.use("spam")), pipe(s.env("spam BAZ")));
        });
        assertEquals(str("baz"), value);
    }

    @Test
    void importingOneMemberLeavesTheOthersOut() {
        var result = run(s -> {
            spam(s);
            return lines(pipe(s.use("spam", s.member("foo"))), pipe(s.call("bar")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void importingAnUnknownMemberFails() {
        var result = run(s -> {
            spam(s);
            return lines(pipe(s.use("spam", s.member("qux"))));
        });
        assertEquals(ShellError.Kind.EXPORT_NOT_FOUND, result.error().kind());
    }

    @Test
    void globUseSkipsPrivateDefinitions() {
        var result = run(s -> {
            s.module("eggs", body -> body
                .exportDef("visible", List.of(), b -> lines(pipe(b.str("visible"))))
                .def("secret", List.of(), b -> lines(pipe(b.str("secret")))));
            return lines(pipe(s.use("eggs", s.glob())), pipe(s.call("secret")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void importingAPrivateDefinitionByNameFails() {
        var result = run(s -> {
            s.module("eggs", body -> body
                .exportDef("visible", List.of(), b -> lines(pipe(b.str("visible"))))
                .def("secret", List.of(), b -> lines(pipe(b.str("secret")))));
            return lines(pipe(s.use("eggs", s.member("secret"))));
        });
        assertEquals(ShellError.Kind.EXPORT_NOT_FOUND, result.error().kind());
    }

    @Test
    void importingAListBringsInExactlyThoseNames() {
        var value = eval(s -> {
            letters(s);
            return lines(pipe(s.use("abc", s.members("c", "a"))), pipe(s.call("build-string", s.call("a"), s.call("c"))));
        });
        assertEquals(str("ac"), value);

        var result = run(s -> {
            letters(s);
            return lines(pipe(s.use("abc", s.members("a", "c"))), pipe(s.call("b")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void useInsideABlockIsScopedToIt() {
        var result = run(s -> {
            spam(s);
            return lines(
                pipe(s.call("do", s.block(b -> lines(pipe(b.use("spam", b.glob())), pipe(b.call("foo")))))),
                pipe(s.call("foo"))
            );
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, result.error().kind());
    }

    @Test
    void hideRemovesImportedCommandsAndEnvironment() {
        var commandResult = run(s -> {
            spam(s);
            return lines(pipe(s.use("spam", s.glob())), pipe(s.hide("spam", s.glob())), pipe(s.call("foo")));
        });
        assertEquals(ShellError.Kind.COMMAND_NOT_FOUND, commandResult.error().kind());

        var envResult = run(s -> {
            spam(s);
            return lines(pipe(s.use("spam", s.glob())), pipe(s.hide("spam", s.glob())), pipe(s.env("BAZ")));
        });
        assertEquals(ShellError.Kind.ENV_VAR_NOT_FOUND, envResult.error().kind());
    }

    @Test
    void hidingOneEnvExportByName() {
        var result = run(s -> {
            spam(s);
            return lines(pipe(s.use("spam")), pipe(s.hide("spam", s.member("BAZ"))), pipe(s.env("spam BAZ")));
        });
        assertEquals(ShellError.Kind.ENV_VAR_NOT_FOUND, result.error().kind());
    }

    @Test
    void modulesPersistForLaterPasses() {
        var runner = runner();
        run(runner, s -> {
            spam(s);
            return lines();
        });
        var result = run(runner, s -> lines(pipe(s.use("spam", s.member("bar"))), pipe(s.call("bar"))));
        assertEquals(str("bar"), result.value());
    }
}
