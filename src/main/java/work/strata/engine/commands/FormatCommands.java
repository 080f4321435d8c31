package work.strata.engine.commands;

import work.strata.engine.formats.FormatDecoder;
import work.strata.engine.formats.IniFormat;
import work.strata.engine.formats.JsonFormat;
import work.strata.engine.formats.ToJson;
import work.strata.engine.formats.TomlFormat;
import work.strata.engine.formats.UrlFormat;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.pipeline.PipelineMetadata;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

/**
 * {@code from <format>} decoders over string input and the {@code to json} encoder.
 */
public final class FormatCommands {
    private FormatCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("from json").switchFlag("objects", "treat each line as a separate value", 'o'),
            "Convert from json to structured data.",
            FormatCommands::fromJson
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("from toml"),
            "Parse text as .toml and create table.",
            (engine, stack, call, input) -> decodeWith(TomlFormat::decode, "toml", stack, call, input)
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("from ini"),
            "Parse text as .ini and create table.",
            (engine, stack, call, input) -> decodeWith(IniFormat::decode, "ini", stack, call, input)
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("from url"),
            "Parse url-encoded string as a table.",
            (engine, stack, call, input) -> decodeWith(UrlFormat::decode, "url", stack, call, input)
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("to json").switchFlag("raw", "remove all of the whitespace", 'r'),
            "Converts table data into JSON text.",
            FormatCommands::toJson
        ));
        return workingSet;
    }

    private static PipelineData fromJson(EngineState engine, Stack stack, Call call, PipelineData input) {
        var text = input.collectString("", stack.getConfig());
        if (call.hasFlag("objects")) {
            var values = JsonFormat.decodeObjects(text, call.head());
            return PipelineData.fromList(values, engine.cancellationToken())
                .withMetadata(new PipelineMetadata("json"));
        }
        return decodeWith(JsonFormat::decode, "json", stack, call, PipelineData.value(Value.string(text, call.head())));
    }

    private static PipelineData decodeWith(FormatDecoder decoder, String format, Stack stack, Call call, PipelineData input) {
        var text = input.collectString("", stack.getConfig());
        return PipelineData.value(decoder.decode(text, call.head()))
            .withMetadata(new PipelineMetadata(format));
    }

    private static PipelineData toJson(EngineState engine, Stack stack, Call call, PipelineData input) {
        var value = input.intoValue(call.head());
        var json = call.hasFlag("raw") ? ToJson.toCompactJson(value) : ToJson.toPrettyJson(value);
        return PipelineData.value(Value.string(json, call.head()));
    }
}
