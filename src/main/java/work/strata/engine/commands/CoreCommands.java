package work.strata.engine.commands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Evaluator;
import work.strata.engine.runtime.Expression;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.ImportPattern;
import work.strata.engine.scope.Module;
import work.strata.engine.scope.StateWorkingSet;

/**
 * Binding, control-flow and scoping commands: let, let-env, if, do, def, module, alias, use, hide,
 * echo and build-string.
 */
public final class CoreCommands {
    private CoreCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("let")
                .required("var_name", "variable name")
                .required("initial_value", "equals sign followed by value"),
            "Create a variable and give it a value.",
            CoreCommands::let
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("let-env")
                .required("var_name", "variable name")
                .required("initial_value", "equals sign followed by value"),
            "Create an environment variable and give it a value.",
            CoreCommands::letEnv
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("if")
                .required("cond", "condition")
                .required("then_block", "then block")
                .optional("else_expression", "expression or block to run if the condition is false"),
            "Conditionally run a block.",
            CoreCommands::ifCommand
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("do")
                .required("block", "the block to run")
                .rest("rest", "the parameter(s) for the block"),
            "Run a block.",
            CoreCommands::doCommand
        ));
        workingSet.addDecl(Command.keyword(
            Signature.build("def")
                .required("def_name", "definition name")
                .required("params", "parameters")
                .required("block", "body of the definition"),
            "Define a custom command.",
            CoreCommands::parseTimeOnly
        ));
        workingSet.addDecl(Command.keyword(
            Signature.build("module")
                .required("module_name", "module name")
                .required("block", "body of the module"),
            "Define a module.",
            CoreCommands::parseTimeOnly
        ));
        workingSet.addDecl(Command.keyword(
            Signature.build("alias")
                .required("name", "name of the alias")
                .required("initial_value", "equals sign followed by value"),
            "Alias a command (with optional flags) to a new name.",
            CoreCommands::parseTimeOnly
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("use").required("pattern", "import pattern"),
            "Use definitions from a module.",
            CoreCommands::use
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("hide").required("pattern", "import pattern"),
            "Hide definitions in the current scope.",
            CoreCommands::hide
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("echo").rest("rest", "the values to echo"),
            "Echo the arguments back to the user.",
            CoreCommands::echo
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("build-string").rest("rest", "list of string"),
            "Create a string from the arguments.",
            CoreCommands::buildString
        ));
        return workingSet;
    }

    private static PipelineData let(EngineState engine, Stack stack, Call call, PipelineData input) {
        int varId = varDeclAt(call, 0);
        var value = call.req(engine, stack, 1);
        stack.addVar(varId, value);
        return PipelineData.empty();
    }

    private static PipelineData letEnv(EngineState engine, Stack stack, Call call, PipelineData input) {
        var name = call.req(engine, stack, 0).asString();
        var value = call.req(engine, stack, 1);
        stack.addEnv(name, value);
        return PipelineData.empty();
    }

    private static PipelineData ifCommand(EngineState engine, Stack stack, Call call, PipelineData input) {
        var condition = call.req(engine, stack, 0);
        if (!(condition instanceof Value.Bool bool)) {
            condition.orThrow();
            throw ShellError.typeMismatch("expected bool, got " + condition.typeName(), condition.span());
        }
        if (bool.val()) {
            int thenBlock = call.blockAt(engine, stack, 1);
            return Evaluator.callBlock(engine, stack, thenBlock, List.of(), input);
        }
        var elseExpression = call.positionalAt(2);
        if (elseExpression.isEmpty()) {
            return PipelineData.empty();
        }
        if (elseExpression.get() instanceof Expression.BlockExpr elseBlock) {
            return Evaluator.callBlock(engine, stack, elseBlock.blockId(), List.of(), input);
        }
        return PipelineData.value(Evaluator.evalExpression(engine, stack, elseExpression.get()));
    }

    private static PipelineData doCommand(EngineState engine, Stack stack, Call call, PipelineData input) {
        int blockId = call.blockAt(engine, stack, 0);
        var args = call.rest(engine, stack, 1);
        return Evaluator.callBlock(engine, stack, blockId, args, input);
    }

    private static PipelineData parseTimeOnly(EngineState engine, Stack stack, Call call, PipelineData input) {
        return PipelineData.empty();
    }

    /**
     * Declarations were imported while parsing; here the module's environment exports are evaluated
     * and bound.
     */
    private static PipelineData use(EngineState engine, Stack stack, Call call, PipelineData input) {
        var pattern = importPatternAt(call);
        if (pattern.moduleId() == null) {
            return PipelineData.empty();
        }
        var module = engine.getModule(pattern.moduleId());
        for (var entry : selectedEnvExports(pattern, module).entrySet()) {
            var block = engine.getBlock(entry.getValue());
            var blockStack = stack.captureStack(block.captures());
            var value = Evaluator.evalBlock(engine, blockStack, block, PipelineData.empty()).intoValue(block.span());
            stack.addEnv(entry.getKey(), value);
        }
        return PipelineData.empty();
    }

    /**
     * Commands were hidden while parsing; here the environment variables of the same names are hidden.
     * Fails when neither a command nor an environment variable was hidden.
     */
    private static PipelineData hide(EngineState engine, Stack stack, Call call, PipelineData input) {
        var pattern = importPatternAt(call);
        var envNames = new ArrayList<String>();
        if (pattern.moduleId() != null) {
            var module = engine.getModule(pattern.moduleId());
            var head = pattern.head().name();
            if (pattern.isHeadOnly()) {
                envNames.addAll(module.envVarsWithHead(head).keySet());
            } else if (pattern.isGlob()) {
                envNames.addAll(module.envVars().keySet());
            } else {
                pattern.memberNames().forEach(member -> envNames.add(head + " " + member.item()));
            }
        } else {
            envNames.add(StateWorkingSet.plainName(pattern));
        }
        int hiddenEnv = 0;
        for (var name : envNames) {
            if (!pattern.hidden().contains(name) && stack.hideEnv(name)) {
                hiddenEnv++;
            }
        }
        if (pattern.hidden().isEmpty() && hiddenEnv == 0) {
            throw ShellError.didNotFind(pattern.span());
        }
        return PipelineData.empty();
    }

    private static PipelineData echo(EngineState engine, Stack stack, Call call, PipelineData input) {
        var args = call.rest(engine, stack, 0);
        if (args.isEmpty()) {
            return PipelineData.empty();
        }
        if (args.size() == 1) {
            return PipelineData.value(args.get(0));
        }
        return PipelineData.fromList(args, engine.cancellationToken());
    }

    private static PipelineData buildString(EngineState engine, Stack stack, Call call, PipelineData input) {
        var config = stack.getConfig();
        var builder = new StringBuilder();
        for (var arg : call.rest(engine, stack, 0)) {
            builder.append(arg.orThrow().intoString(config.listSeparator(), config));
        }
        return PipelineData.value(Value.string(builder.toString(), call.head()));
    }

    private static Map<String, Integer> selectedEnvExports(ImportPattern pattern, Module module) {
        if (pattern.isHeadOnly()) {
            return module.envVarsWithHead(pattern.head().name());
        }
        if (pattern.isGlob()) {
            return module.envVars();
        }
        var selected = new LinkedHashMap<String, Integer>();
        for (var member : pattern.memberNames()) {
            var blockId = module.envVars().get(member.item());
            if (blockId != null) {
                selected.put(member.item(), blockId);
            }
        }
        return selected;
    }

    private static int varDeclAt(Call call, int index) {
        var expression = call.positionalAt(index).orElseThrow(() -> ShellError.missingParameter("var_name", call.head()));
        if (expression instanceof Expression.VarDecl decl) {
            return decl.varId();
        }
        throw ShellError.typeMismatch("expected variable declaration", expression.span());
    }

    private static ImportPattern importPatternAt(Call call) {
        var expression = call.positionalAt(0).orElseThrow(() -> ShellError.missingParameter("pattern", call.head()));
        if (expression instanceof Expression.ImportPatternExpr importPattern) {
            return importPattern.pattern();
        }
        throw ShellError.typeMismatch("expected import pattern", expression.span());
    }
}
