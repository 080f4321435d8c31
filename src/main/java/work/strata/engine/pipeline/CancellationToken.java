package work.strata.engine.pipeline;

/**
 * Shared cancellation flag. Consumers check it between elements; raising it is never an error.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
