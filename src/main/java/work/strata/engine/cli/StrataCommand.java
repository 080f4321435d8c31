package work.strata.engine.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.strata.engine.api.EngineConfiguration;
import work.strata.engine.api.LogLevel;
import work.strata.engine.api.ShellRunner;
import work.strata.engine.formats.ToJson;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.DiagnosticFormatter;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

@CommandLine.Command(
    name = "strata",
    description = "Decode structured data and run it through the engine's pipeline commands.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class StrataCommand implements Callable<Integer> {
    @CommandLine.Parameters(
        index = "0",
        paramLabel = "FILE|-",
        description = "Input file; use '-' to read from stdin."
    )
    private String input;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Input format (json|toml|ini|url); guessed from the file extension when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String format;

    @CommandLine.Option(
        names = "--get",
        paramLabel = "PATH",
        description = "Cell path to extract, e.g. items.0.name.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String getPath;

    @CommandLine.Option(
        names = "--drop-columns",
        paramLabel = "N",
        description = "Number of trailing columns to drop.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer dropColumns;

    @CommandLine.Option(
        names = "--range",
        paramLabel = "FROM..TO",
        description = "Rows to keep, e.g. 0..4, 2.., ..<3 or -2..",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String rows;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "TOML file with engine settings (float_precision, parallel_workers, list_separator).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Engine log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private LogLevel logLevel;

    @CommandLine.Option(
        names = "--timeout",
        description = "Evaluation timeout (e.g. 500ms, 30s, 2m); 0 disables it.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Duration timeout;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var text = readInput();
        var pipeline = new InputPipeline(resolveFormat());
        if (getPath != null) {
            pipeline.get(getPath);
        }
        if (dropColumns != null) {
            pipeline.dropColumns(dropColumns);
        }
        if (rows != null) {
            pipeline.range(rows);
        }

        var configuration = EngineConfiguration.builder()
            .logLevel(logLevel == null ? LogLevel.FATAL : logLevel)
            .timeout(Optional.ofNullable(timeout).filter(value -> !value.isZero()))
            .configFile(Optional.ofNullable(configFile).map(path -> Paths.get(path).toAbsolutePath().normalize()))
            .build();
        var runner = new ShellRunner(configuration);
        var result = runner.run(pipeline, PipelineData.value(Value.string(text, Span.unknown())));

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (result.isSuccess()) {
            out.println(ToJson.toPrettyJson(result.value()));
        } else {
            err.println(DiagnosticFormatter.format(result.error(), pipeline.source()));
        }
        out.flush();
        err.flush();
        return result.status().exitCode();
    }

    private String readInput() throws IOException {
        if ("-".equals(input)) {
            InputStream stdin = System.in;
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Input file not found: " + path);
        }
        return Files.readString(path);
    }

    private String resolveFormat() {
        if (format != null && !format.isBlank()) {
            return format.trim().toLowerCase(Locale.ROOT);
        }
        var name = input.toLowerCase(Locale.ROOT);
        for (var candidate : new String[] {"toml", "ini", "url"}) {
            if (name.endsWith("." + candidate)) {
                return candidate;
            }
        }
        return "json";
    }
}
