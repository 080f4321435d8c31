package work.strata.engine.commands;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.function.Function;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

/**
 * URL component extraction. A string that does not parse as a URL yields an empty string.
 */
public final class NetworkCommands {
    private NetworkCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("url host").rest("rest", "optionally operate by cell path"),
            "Get the host of a URL.",
            (engine, stack, call, input) -> component(engine, stack, call, input, URI::getHost)
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("url query").rest("rest", "optionally operate by cell path"),
            "Get the query string of a URL.",
            (engine, stack, call, input) -> component(engine, stack, call, input, URI::getRawQuery)
        ));
        return workingSet;
    }

    private static PipelineData component(EngineState engine, Stack stack, Call call, PipelineData input,
                                          Function<URI, String> part) {
        var paths = call.restCellPaths(engine, stack, 0);
        return CellPathAction.operate(input, paths, value -> {
            if (!(value instanceof Value.Str str)) {
                value.orThrow();
                throw ShellError.unsupportedInput("Expected a URL string, got " + value.typeName(), value.span());
            }
            return Value.string(extract(str.val(), part), str.span());
        }, engine.cancellationToken());
    }

    static String extract(String text, Function<URI, String> part) {
        try {
            var uri = new URI(text.trim());
            if (!uri.isAbsolute()) {
                return "";
            }
            var result = part.apply(uri);
            return result == null ? "" : result;
        } catch (URISyntaxException ex) {
            return "";
        }
    }
}
