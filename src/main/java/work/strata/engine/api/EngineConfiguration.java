package work.strata.engine.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.strata.engine.protocol.Config;

/**
 * Immutable settings for a {@link ShellRunner} session.
 */
public record EngineConfiguration(
    Path workingDirectory,
    LogLevel logLevel,
    Optional<Duration> timeout,
    Optional<Path> configFile,
    Config config
) {
    public EngineConfiguration {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(config, "config");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workingDirectory = Paths.get("").toAbsolutePath().normalize();
        private LogLevel logLevel = LogLevel.FATAL;
        private Optional<Duration> timeout = Optional.empty();
        private Optional<Path> configFile = Optional.empty();
        private Config config = Config.defaults();

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder configFile(Optional<Path> configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder config(Config config) {
            this.config = config;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(workingDirectory, logLevel, timeout, configFile, config);
        }
    }
}
