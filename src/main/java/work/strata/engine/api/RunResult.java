package work.strata.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.strata.engine.formats.ToJson;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;

/**
 * Outcome of a {@link ShellRunner} pass (usable by the CLI and embedding apps). Exactly one of
 * {@code value} and {@code error} is set.
 */
public record RunResult(Status status, Value value, ShellError error, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
    }

    public static RunResult success(Value value, Instant startedAt) {
        return new RunResult(Status.SUCCESS, Objects.requireNonNull(value, "value"), null, startedAt, Instant.now());
    }

    public static RunResult failure(ShellError error, Instant startedAt) {
        return new RunResult(Status.FAILURE, null, Objects.requireNonNull(error, "error"), startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<Value> valueIfSuccess() {
        return Optional.ofNullable(value);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        if (value != null) {
            serializable.put("value", ToJson.toNode(value));
        }
        if (error != null) {
            serializable.put("error", errorMap(error));
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static Map<String, Object> errorMap(ShellError error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", error.code());
        details.put("message", error.getMessage());
        var labels = new ArrayList<Map<String, Object>>();
        for (var label : error.labels()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("text", label.text());
            entry.put("start", label.span().start());
            entry.put("end", label.span().end());
            labels.add(entry);
        }
        details.put("labels", labels);
        error.help().ifPresent(help -> details.put("help", help));
        return details;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
