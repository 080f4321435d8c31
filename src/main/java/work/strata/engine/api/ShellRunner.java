package work.strata.engine.api;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import work.strata.engine.commands.DefaultContext;
import work.strata.engine.pipeline.CancellationToken;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Engine;
import work.strata.engine.runtime.ParsePass;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.shared.ShellLog;

/**
 * Public entry point for embedding the engine. A runner is one session: declarations merged by one
 * pass and variables bound on its stack stay visible to the next.
 */
public final class ShellRunner {
    private final EngineConfiguration configuration;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final EngineState engine;
    private final Stack stack;

    public ShellRunner() {
        this(EngineConfiguration.builder().build());
    }

    public ShellRunner(EngineConfiguration configuration) {
        this.configuration = configuration;
        ShellLog.setThreshold(configuration.logLevel());
        this.engine = DefaultContext.register(new EngineState(cancellationToken));
        this.stack = new Stack(configuration.config());
        configuration.configFile().ifPresent(path ->
            stack.addVar(EngineState.CONFIG_VARIABLE_ID, ConfigLoader.loadRecord(path)));
    }

    public EngineState engineState() {
        return engine;
    }

    public Stack stack() {
        return stack;
    }

    /**
     * Stops streams and parallel work of this session. Once raised it stays raised.
     */
    public void cancel() {
        cancellationToken.cancel();
    }

    /**
     * Parses, merges and evaluates one pass, materialising the output. Parse errors leave the session
     * untouched; a top-level error value is reported as a failure.
     */
    public RunResult run(ParsePass pass, PipelineData input) {
        var started = Instant.now();
        var timer = configuration.timeout().map(this::scheduleTimeout).orElse(null);
        try {
            var value = Engine.evaluate(engine, stack, pass, input).intoValue(Span.unknown());
            if (value instanceof Value.Error error) {
                return failure(error.error(), started);
            }
            return RunResult.success(value, started);
        } catch (ShellError ex) {
            return failure(ex, started);
        } finally {
            if (timer != null) {
                timer.shutdownNow();
            }
        }
    }

    public RunResult run(ParsePass pass) {
        return run(pass, PipelineData.empty());
    }

    /**
     * Like {@link #run} but hands back the output unmaterialised; errors are thrown.
     */
    public PipelineData evaluate(ParsePass pass, PipelineData input) {
        return Engine.evaluate(engine, stack, pass, input);
    }

    private RunResult failure(ShellError error, Instant started) {
        ShellLog.debug(() -> "run failed: " + error.describe());
        if (Boolean.getBoolean("strata.debug")) {
            error.printStackTrace();
        }
        return RunResult.failure(error, started);
    }

    private ScheduledExecutorService scheduleTimeout(Duration timeout) {
        var scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "strata-timeout");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.schedule(() -> {
            ShellLog.warn("timeout of " + timeout.toMillis() + "ms reached; cancelling");
            cancellationToken.cancel();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return scheduler;
    }
}
