package work.strata.engine.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.strata.engine.support.EngineTestSupport.integer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

class ParallelMapperTest {
    private static List<Value> numbers(int count) {
        var values = new ArrayList<Value>();
        for (int i = 0; i < count; i++) {
            values.add(integer(i));
        }
        return values;
    }

    @Test
    void resultsKeepInputOrder() {
        var results = ParallelMapper.map(numbers(50).iterator(), 4, CancellationToken.none(), (index, item) -> {
            try {
                Thread.sleep((50 - index) % 5);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return integer(item.asLong() * 2);
        });
        assertEquals(50, results.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(integer(i * 2L), results.get(i));
        }
    }

    @Test
    void usesSeveralWorkerThreads() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ParallelMapper.map(numbers(40).iterator(), 4, CancellationToken.none(), (index, item) -> {
            threads.add(Thread.currentThread().getName());
            try {
                Thread.sleep(5);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return item;
        });
        assertTrue(threads.size() > 1, "expected more than one worker, got " + threads);
        assertTrue(threads.stream().allMatch(name -> name.startsWith("strata-par-")));
    }

    @Test
    void failingElementBecomesErrorValueAtItsPosition() {
        var results = ParallelMapper.map(numbers(5).iterator(), 2, CancellationToken.none(), (index, item) -> {
            if (index == 2) {
                throw ShellError.divisionByZero(Span.unknown());
            }
            return item;
        });
        assertEquals(5, results.size());
        assertTrue(results.get(2).isError());
        assertEquals(integer(4), results.get(4));
    }

    @Test
    void cancelledBeforeStartProducesNothing() {
        var token = new CancellationToken();
        token.cancel();
        var results = ParallelMapper.map(numbers(10).iterator(), 2, token, (index, item) -> item);
        assertTrue(results.isEmpty());
    }

    @Test
    void rejectsZeroWorkers() {
        assertThrows(IllegalArgumentException.class,
            () -> ParallelMapper.map(numbers(1).iterator(), 0, CancellationToken.none(), (index, item) -> item));
    }
}
