package work.strata.engine.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import work.strata.engine.formats.TomlFormat;
import work.strata.engine.protocol.Config;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * Reads engine settings from a TOML file, e.g.
 * <pre>
 * float_precision = 2
 * parallel_workers = 4
 * list_separator = "; "
 * </pre>
 */
public final class ConfigLoader {
    private ConfigLoader() {}

    public static Value loadRecord(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw ShellError.ioError("config file not found: " + path);
        }
        try {
            return TomlFormat.decode(Files.readString(path), Span.unknown());
        } catch (IOException ex) {
            throw ShellError.ioError("unable to read config file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Config load(Path path) {
        return Config.fromValue(loadRecord(path));
    }
}
