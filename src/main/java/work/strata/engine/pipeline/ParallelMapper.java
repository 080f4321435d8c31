package work.strata.engine.pipeline;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Value;
import work.strata.engine.shared.ShellLog;

/**
 * Maps elements on a fixed pool of worker threads and returns the results in input order.
 * A failing element yields an error value at its position. If the token is raised, no further
 * elements are scheduled and the contiguous prefix of completed results is returned.
 */
public final class ParallelMapper {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private ParallelMapper() {}

    @FunctionalInterface
    public interface IndexedMapper {
        Value apply(int index, Value item);
    }

    public static List<Value> map(Iterator<Value> input, int workers, CancellationToken token, IndexedMapper mapper) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        var executor = Executors.newFixedThreadPool(workers, daemonThreads());
        var futures = new ArrayList<Future<Value>>();
        try {
            int index = 0;
            while (!token.isCancelled() && input.hasNext()) {
                final int position = index++;
                final var item = input.next();
                futures.add(executor.submit(() -> runOne(mapper, position, item)));
            }
            final int scheduled = futures.size();
            ShellLog.trace(() -> "par-each scheduled " + scheduled + " element(s) on " + workers + " worker(s)");
            return gather(futures, token);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Value runOne(IndexedMapper mapper, int position, Value item) {
        try {
            return mapper.apply(position, item);
        } catch (ShellError ex) {
            return Value.error(ex);
        }
    }

    private static List<Value> gather(List<Future<Value>> futures, CancellationToken token) {
        var results = new ArrayList<Value>(futures.size());
        for (var future : futures) {
            if (token.isCancelled() && !future.isDone()) {
                break;
            }
            try {
                results.add(future.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            } catch (CancellationException ex) {
                break;
            } catch (ExecutionException ex) {
                var cause = ex.getCause();
                throw ShellError.engineFailed("parallel worker failed: " + (cause == null ? ex : cause).getMessage());
            }
        }
        return results;
    }

    private static ThreadFactory daemonThreads() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "strata-par-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
