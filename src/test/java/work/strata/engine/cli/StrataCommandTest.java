package work.strata.engine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StrataCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Path workDir;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createTempDirectory("strata-cli");
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() throws Exception {
        try (var files = Files.walk(workDir)) {
            files.sorted((a, b) -> b.compareTo(a)).forEach(path -> path.toFile().delete());
        }
    }

    private int execute(String... args) {
        return Main.commandLine()
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err))
            .execute(args);
    }

    private Path write(String name, String content) throws Exception {
        var file = workDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void printsTheSelectedJson() throws Exception {
        var file = write("people.json", "{\"items\": [{\"name\": \"ana\", \"age\": 31}, {\"name\": \"bo\", \"age\": 17}]}");
        int exitCode = execute(file.toString(), "--get", "items.1.name");
        assertEquals(0, exitCode, err.toString());
        assertEquals("bo", JSON.readTree(out.toString()).asText());
    }

    @Test
    void dropsColumnsAndSlicesRows() throws Exception {
        var file = write("rows.json", "[{\"a\":1,\"b\":2},{\"a\":3,\"b\":4},{\"a\":5,\"b\":6}]");
        int exitCode = execute(file.toString(), "--drop-columns", "1", "--range", "1..");
        assertEquals(0, exitCode, err.toString());
        assertEquals(JSON.readTree("[{\"a\":3},{\"a\":5}]"), JSON.readTree(out.toString()));
    }

    @Test
    void guessesTheFormatFromTheExtension() throws Exception {
        var file = write("settings.ini", "[db]\nport = 5432\n");
        int exitCode = execute(file.toString(), "--get", "db.port");
        assertEquals(0, exitCode, err.toString());
        assertEquals("5432", JSON.readTree(out.toString()).asText());
    }

    @Test
    void explicitFormatWins() throws Exception {
        var file = write("query.txt", "q=strata&lang=en");
        int exitCode = execute(file.toString(), "-f", "url", "--get", "lang");
        assertEquals(0, exitCode, err.toString());
        assertEquals("en", JSON.readTree(out.toString()).asText());
    }

    @Test
    void failuresRenderADiagnosticAgainstThePipeline() throws Exception {
        var file = write("person.json", "{\"name\": \"ana\"}");
        int exitCode = execute(file.toString(), "--get", "nmae");
        assertEquals(1, exitCode);
        var rendered = err.toString();
        assertTrue(rendered.contains("error[strata::shell::column_not_found]"), rendered);
        assertTrue(rendered.contains("from json | get nmae"), rendered);
        assertTrue(rendered.contains("did you mean 'name'?"), rendered);
        assertEquals("", out.toString());
    }

    @Test
    void configFileIsLoaded() throws Exception {
        var data = write("values.json", "[1.5]");
        var config = write("config.toml", "float_precision = 2\nparallel_workers = 2\n");
        int exitCode = execute(data.toString(), "--config", config.toString(), "--get", "0");
        assertEquals(0, exitCode, err.toString());
        assertEquals(1.5, JSON.readTree(out.toString()).asDouble());
    }

    @Test
    void invalidConfigFileStopsTheRun() throws Exception {
        var data = write("values.json", "[1]");
        var config = write("config.toml", "parallel_workers = 0\n");
        int exitCode = execute(data.toString(), "--config", config.toString());
        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Unsupported config value"), err.toString());
    }

    @Test
    void missingInputFileIsAUsageError() {
        int exitCode = execute(workDir.resolve("absent.json").toString());
        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Input file not found"), err.toString());
    }

    @Test
    void invalidTimeoutIsAUsageError() throws Exception {
        var file = write("one.json", "1");
        int exitCode = execute(file.toString(), "--timeout", "soon");
        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Invalid duration: soon"), err.toString());
    }

    @Test
    void unknownLogLevelIsAUsageError() throws Exception {
        var file = write("one.json", "1");
        int exitCode = execute(file.toString(), "--log-level", "loud");
        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Unsupported log level: loud"), err.toString());
    }

    @Test
    void versionListsTheBuiltinCommandSet() {
        int exitCode = execute("--version");
        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("strata " + VersionProvider.DEVELOPMENT), out.toString());
        assertTrue(out.toString().contains("builtin commands"), out.toString());
    }
}
