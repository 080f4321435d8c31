package work.strata.engine.commands;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;

public final class HashCommands {
    private HashCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("hash md5").rest("rest", "optionally md5 hash data by cell path"),
            "Hash a value using the md5 hash algorithm.",
            HashCommands::md5
        ));
        return workingSet;
    }

    private static PipelineData md5(EngineState engine, Stack stack, Call call, PipelineData input) {
        var paths = call.restCellPaths(engine, stack, 0);
        return CellPathAction.operate(input, paths, value -> md5Hex(value, call.head()), engine.cancellationToken());
    }

    static Value md5Hex(Value value, Span head) {
        byte[] bytes;
        if (value instanceof Value.Str str) {
            bytes = str.val().getBytes(StandardCharsets.UTF_8);
        } else if (value instanceof Value.Binary binary) {
            bytes = binary.val();
        } else {
            value.orThrow();
            throw ShellError.unsupportedInput("md5 hashing only works on strings and binary data", value.span());
        }
        try {
            var digest = MessageDigest.getInstance("MD5").digest(bytes);
            return Value.string(HexFormat.of().formatHex(digest), value.span());
        } catch (NoSuchAlgorithmException ex) {
            throw ShellError.engineFailed("MD5 algorithm unavailable: " + ex.getMessage());
        }
    }
}
