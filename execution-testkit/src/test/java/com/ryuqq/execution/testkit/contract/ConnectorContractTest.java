package com.ryuqq.execution.testkit.contract;

import com.ryuqq.execution.core.pipe.Pipe;
import com.ryuqq.execution.core.pipe.PipeSink;
import com.ryuqq.execution.core.pipe.PutOptions;
import com.ryuqq.execution.core.pipe.connector.ConnectorConfig;
import com.ryuqq.execution.core.pipe.connector.Handler;
import com.ryuqq.execution.core.pipe.connector.PipeConnectors;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the pipe connectors running on real threads.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Cancelling a pipe-to-pipe connector flushes every buffered item downstream first</li>
 *   <li>The destination is stopped exactly once, whatever the exit path</li>
 *   <li>The distributor applies each handler to its own destination</li>
 *   <li>Fan-in closes the destination after the last source finishes</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
class ConnectorContractTest extends AbstractContractTest {

    private static final Logger log = LoggerFactory.getLogger(ConnectorContractTest.class);

    @Test
    void testNoLossUnderCancellation() throws Exception {
        // Given: the handler blocks on the first item while four more wait upstream
        Pipe<Integer> source = new Pipe<>();
        for (int i = 1; i <= 5; i++) {
            source.put(i, PutOptions.defaults());
        }
        CountingSink<Integer> destination = new CountingSink<>(new Pipe<>());
        CountDownLatch entered = new CountDownLatch(1);
        Handler<Integer, Integer> handler = Handler.emitter((value, out) -> {
            if (value == 1) {
                entered.countDown();
                new CountDownLatch(1).await();
            }
            out.accept(value * 10);
        });

        Future<Void> connector = runAsync(() -> {
            PipeConnectors.pipeToPipe(source, handler, destination, log);
            return null;
        });
        assertTrue(entered.await(5, TimeUnit.SECONDS), "Handler should start processing");

        // When
        connector.cancel(true);

        // Then: the four buffered items arrive, transformed, before the sentinel
        assertEquals(List.of(20, 30, 40, 50), drain(destination.delegate));
        assertEquals(1, destination.stops.get(), "Destination must be stopped exactly once");
        assertTrue(source.join(Duration.ofSeconds(1)), "Every upstream item should be acknowledged");
    }

    @Test
    void testHandlerFailure_StopsDestinationAndPropagates() throws Exception {
        // Given
        Pipe<Integer> source = closedPipeOf(List.of(1, 2, 3));
        CountingSink<Integer> destination = new CountingSink<>(new Pipe<>());
        Handler<Integer, Integer> handler = Handler.transform(value -> {
            if (value == 2) {
                throw new IllegalStateException("bad tick " + value);
            }
            return value;
        });

        // When
        Future<Void> connector = runAsync(() -> {
            PipeConnectors.pipeToPipe(source, handler, destination, log);
            return null;
        });

        // Then
        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> connector.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertEquals(List.of(1), drain(destination.delegate));
        assertEquals(1, destination.stops.get());
    }

    @Test
    void testDistributorExample_HandlerPerDestination() throws Exception {
        // Given
        Pipe<String> source = closedPipeOf(List.of("a", "b"));
        Pipe<String> first = new Pipe<>();
        Pipe<String> second = new Pipe<>();
        List<Handler<String, String>> handlers = List.of(
                Handler.transform(value -> "f(" + value + ")"),
                Handler.transform(value -> "g(" + value + ")")
        );

        // When
        Future<Void> connector = runAsync(() -> {
            PipeConnectors.pipeToMultipipe(source, handlers, List.of(first, second), ConnectorConfig.defaults(), log);
            return null;
        });
        connector.get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(List.of("f(a)", "f(b)"), drain(first));
        assertEquals(List.of("g(a)", "g(b)"), drain(second));
    }

    @Test
    void testFanIn_DestinationClosedAfterLastSource() throws Exception {
        // Given
        Pipe<Integer> fast = closedPipeOf(List.of(1, 2, 3));
        Pipe<Integer> slow = new Pipe<>();
        slow.put(10, PutOptions.defaults());
        CountingSink<Integer> destination = new CountingSink<>(new Pipe<>());

        Future<Void> connector = runAsync(() -> {
            PipeConnectors.multipipeToPipe(List.of(fast, slow), Handler.identity(), destination,
                    ConnectorConfig.defaults(), workers, log);
            return null;
        });

        // When: the fast source is done but the slow one is still open
        sleep(100);
        assertEquals(0, destination.stops.get(), "Destination must stay open while a source is open");
        slow.put(20, PutOptions.defaults());
        slow.stop();
        connector.get(5, TimeUnit.SECONDS);

        // Then: per-source order is kept, the sentinel comes once at the end
        List<Integer> received = drain(destination.delegate);
        assertEquals(List.of(1, 2, 3), filter(received, value -> value < 10));
        assertEquals(List.of(10, 20), filter(received, value -> value >= 10));
        assertEquals(1, destination.stops.get());
    }

    @Test
    void testCancelledConnector_CancellationPropagates() throws Exception {
        // Given: an idle connector blocked on an empty source
        Pipe<Integer> source = new Pipe<>();
        CountingSink<Integer> destination = new CountingSink<>(new Pipe<>());
        Future<Void> connector = runAsync(() -> {
            PipeConnectors.pipeToPipe(source, Handler.identity(), destination, log);
            return null;
        });
        sleep(50);

        // When
        connector.cancel(true);

        // Then
        assertThrows(CancellationException.class, connector::get);
        assertEquals(List.of(), drain(destination.delegate));
        assertEquals(1, destination.stops.get());
    }

    private static List<Integer> filter(List<Integer> values, IntPredicate predicate) {
        List<Integer> result = new ArrayList<>();
        for (Integer value : values) {
            if (predicate.test(value)) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * Delegating sink that counts stop() calls.
     */
    private static final class CountingSink<T> implements PipeSink<T> {

        private final Pipe<T> delegate;
        private final AtomicInteger stops = new AtomicInteger();

        private CountingSink(Pipe<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void put(T item, PutOptions options) throws InterruptedException {
            delegate.put(item, options);
        }

        @Override
        public void stop() {
            stops.incrementAndGet();
            delegate.stop();
        }

        @Override
        public boolean isFull() {
            return delegate.isFull();
        }

        @Override
        public boolean isStopped() {
            return delegate.isStopped();
        }
    }
}
