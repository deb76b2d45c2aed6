package com.ryuqq.execution.core.pipe.connector;

import com.ryuqq.execution.core.pipe.Pipe;
import com.ryuqq.execution.core.pipe.PipeException;
import com.ryuqq.execution.core.pipe.PipeFullException;
import com.ryuqq.execution.core.pipe.PipeItem;
import com.ryuqq.execution.core.pipe.PipeSink;
import com.ryuqq.execution.core.pipe.PipeSource;
import com.ryuqq.execution.core.pipe.PutOptions;
import com.ryuqq.execution.core.spi.MessageIterator;
import com.ryuqq.execution.core.spi.MessageStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * PipeConnectors 유닛 테스트.
 *
 * <ul>
 *   <li>pipeToPipe: 변환, SENTINEL 전파, 실패 시 하류 종료, 취소 시 잔여 원소 flush</li>
 *   <li>pipeToMultipipe: 핸들러 수 검증, 목적지별 독립 변환</li>
 *   <li>multipipeToPipe: 모든 소스 종료 후 하나의 SENTINEL</li>
 *   <li>streamToPipe / reconnectingStreamToPipe</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
class PipeConnectorsTest {

    private static final long TIMEOUT_SECONDS = 5;

    private Logger log;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        log = mock(Logger.class);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ============================================================
    // 1. pipeToPipe
    // ============================================================

    @Test
    void pipeToPipe_StoppedSource_TransformsInOrderAndStopsDestination() throws InterruptedException {
        // given
        Pipe<Integer> source = pipeOf(1, 2, 3);
        Pipe<Integer> destination = new Pipe<>();

        // when
        PipeConnectors.pipeToPipe(source, Handler.transform(value -> value * 2), destination, log);

        // then
        assertThat(destination.snapshot())
            .containsExactly(PipeItem.of(2), PipeItem.of(4), PipeItem.of(6), PipeItem.sentinel());
        assertThat(source.join(Duration.ofMillis(100))).isTrue();
    }

    @Test
    void pipeToPipe_GeneratorHandler_ForwardsAllOutputsInOrder() throws InterruptedException {
        // given
        Pipe<Integer> source = pipeOf(1, 3);
        Pipe<Integer> destination = new Pipe<>();

        // when
        PipeConnectors.pipeToPipe(source, Handler.generator(value -> List.of(value, value + 1)), destination, log);

        // then
        assertThat(destination.snapshot()).containsExactly(
            PipeItem.of(1), PipeItem.of(2), PipeItem.of(3), PipeItem.of(4), PipeItem.sentinel()
        );
    }

    @Test
    void pipeToPipe_HandlerThrows_StopsDestinationAndPropagates() throws InterruptedException {
        // given
        Pipe<Integer> source = pipeOf(1, 2);
        PipeSink<Integer> destination = mockSink();
        Handler<Integer, Integer> failing = Handler.transform(value -> {
            throw new IllegalStateException("bad item " + value);
        });

        // when & then
        assertThatThrownBy(() -> PipeConnectors.pipeToPipe(source, failing, destination, log))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("bad item 1");
        verify(destination, times(1)).stop();
        verify(log).error(eq("Pipeline stage failed, closing downstream pipe"), any(IllegalStateException.class));
    }

    @Test
    void pipeToPipe_DestinationFull_RetriesWithFallbackOptions() throws InterruptedException {
        // given
        Pipe<Integer> source = pipeOf(1);
        PipeSink<Integer> destination = mockSink();
        ConnectorConfig config = ConnectorConfig.defaults();
        doThrow(new PipeFullException("full")).when(destination).put(10, config.putOptions());

        // when
        PipeConnectors.pipeToPipe(source, Handler.transform(value -> value * 10), destination, config, log);

        // then
        InOrder order = inOrder(destination);
        order.verify(destination).put(10, config.putOptions());
        order.verify(destination).put(10, config.fallbackPutOptions());
        order.verify(destination).stop();
        verify(log).warn("Downstream pipe is full, retrying {} times", 3);
    }

    @Test
    void pipeToPipe_CancelledWhileHandling_FlushesBufferedItemsThenStopsDestinationOnce() throws Exception {
        // given
        Pipe<Integer> source = reopen(pipeOf(1, 2, 3, 4, 5));
        PipeSink<Integer> destination = mockSink();
        CountDownLatch handling = new CountDownLatch(1);
        CountDownLatch neverReleased = new CountDownLatch(1);
        Handler<Integer, Integer> handler = Handler.emitter((value, out) -> {
            if (value == 1) {
                handling.countDown();
                neverReleased.await();
            }
            out.accept(value * 10);
        });
        ConnectorRun run = runInBackground(source, handler, destination);
        assertThat(handling.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // when
        run.future.cancel(true);

        // then
        assertThat(run.done.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(run.cancelled.get()).isTrue();
        InOrder order = inOrder(destination);
        order.verify(destination).put(20, PutOptions.defaults());
        order.verify(destination).put(30, PutOptions.defaults());
        order.verify(destination).put(40, PutOptions.defaults());
        order.verify(destination).put(50, PutOptions.defaults());
        order.verify(destination, times(1)).stop();
        verify(log).warn("Pipe connector was cancelled, attempting to process remaining items");
        assertThat(source.isEmpty()).isTrue();
    }

    @Test
    void pipeToPipe_DestinationFullDuringFlush_LogsLossAndStillStops() throws Exception {
        // given
        Pipe<Integer> source = reopen(pipeOf(1, 2, 3, 4, 5));
        PipeSink<Integer> destination = mockSink();
        doThrow(new PipeFullException("full")).when(destination).put(eq(30), any(PutOptions.class));
        CountDownLatch handling = new CountDownLatch(1);
        CountDownLatch neverReleased = new CountDownLatch(1);
        Handler<Integer, Integer> handler = Handler.emitter((value, out) -> {
            if (value == 1) {
                handling.countDown();
                neverReleased.await();
            }
            out.accept(value * 10);
        });
        ConnectorRun run = runInBackground(source, handler, destination);
        assertThat(handling.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // when
        run.future.cancel(true);

        // then
        assertThat(run.done.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        verify(log).error(
            "Attempted to flush upstream pipe on cancellation, however downstream pipe is full. "
                + "Loss of data incurred ({} items)", 3
        );
        verify(destination, times(1)).stop();
        verify(destination, times(0)).put(eq(40), any(PutOptions.class));
    }

    // ============================================================
    // 2. pipeToMultipipe
    // ============================================================

    @Test
    void pipeToMultipipe_HandlersPerDestination_EachDestinationGetsOwnTransform() throws InterruptedException {
        // given
        Pipe<String> source = pipeOf("a", "b");
        Pipe<String> first = new Pipe<>();
        Pipe<String> second = new Pipe<>();
        List<Handler<String, String>> handlers = List.of(
            Handler.transform(value -> "f(" + value + ")"),
            Handler.transform(value -> "g(" + value + ")")
        );

        // when
        PipeConnectors.pipeToMultipipe(source, handlers, List.of(first, second), ConnectorConfig.defaults(), log);

        // then
        assertThat(first.snapshot())
            .containsExactly(PipeItem.of("f(a)"), PipeItem.of("f(b)"), PipeItem.sentinel());
        assertThat(second.snapshot())
            .containsExactly(PipeItem.of("g(a)"), PipeItem.of("g(b)"), PipeItem.sentinel());
    }

    @Test
    void pipeToMultipipe_SingleHandler_BroadcastsToAll() throws InterruptedException {
        // given
        Pipe<Integer> source = pipeOf(5);
        List<Pipe<Integer>> destinations = List.of(new Pipe<>(), new Pipe<>(), new Pipe<>());

        // when
        PipeConnectors.pipeToMultipipe(source, Handler.transform(value -> value + 1), destinations, log);

        // then
        for (Pipe<Integer> destination : destinations) {
            assertThat(destination.snapshot()).containsExactly(PipeItem.of(6), PipeItem.sentinel());
        }
    }

    @Test
    void pipeToMultipipe_HandlerCountMismatch_FailsBeforeReadingSource() {
        // given
        @SuppressWarnings("unchecked")
        PipeSource<Integer> source = mock(PipeSource.class);
        List<Handler<Integer, Integer>> handlers = List.of(Handler.identity(), Handler.identity());
        List<Pipe<Integer>> destinations = List.of(new Pipe<>(), new Pipe<>(), new Pipe<>());

        // when & then
        assertThatThrownBy(() ->
            PipeConnectors.pipeToMultipipe(source, handlers, destinations, ConnectorConfig.defaults(), log)
        )
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("The handlers must match the number of destinations");
        verifyNoInteractions(source);
    }

    // ============================================================
    // 3. multipipeToPipe (fan-in)
    // ============================================================

    @Test
    void multipipeToPipe_AllSourcesStopped_SingleSentinelAfterAllData() throws InterruptedException {
        // given
        Pipe<Integer> first = pipeOf(1, 2, 3);
        Pipe<Integer> second = pipeOf(10, 20);
        Pipe<Integer> destination = new Pipe<>();

        // when
        PipeConnectors.multipipeToPipe(List.of(first, second), Handler.identity(), destination,
            ConnectorConfig.defaults(), executor, log);

        // then
        List<PipeItem<Integer>> items = destination.snapshot();
        assertThat(items).hasSize(6);
        assertThat(items.get(5)).isEqualTo(PipeItem.sentinel());
        assertThat(items.subList(0, 5))
            .containsExactlyInAnyOrder(PipeItem.of(1), PipeItem.of(2), PipeItem.of(3), PipeItem.of(10), PipeItem.of(20));
        assertThat(items.subList(0, 5)).containsSubsequence(PipeItem.of(1), PipeItem.of(2), PipeItem.of(3));
    }

    @Test
    void multipipeToPipe_OneSourceStillOpen_DestinationStaysOpen() throws Exception {
        // given
        Pipe<Integer> stopped = pipeOf(1);
        Pipe<Integer> open = new Pipe<>();
        Pipe<Integer> destination = new Pipe<>();
        Future<?> fanIn = executor.submit(() -> {
            PipeConnectors.multipipeToPipe(List.of(stopped, open), Handler.identity(), destination,
                ConnectorConfig.defaults(), executor, log);
            return null;
        });

        // when
        assertThat(destination.get()).isEqualTo(PipeItem.of(1));
        TimeUnit.MILLISECONDS.sleep(50);

        // then
        assertThat(destination.isStopped()).isFalse();
        open.stop();
        fanIn.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(destination.get().isSentinel()).isTrue();
    }

    // ============================================================
    // 4. streamToPipe
    // ============================================================

    @Test
    void streamToPipe_StreamExhausted_ReturnsWithoutStoppingDestination() throws Exception {
        // given
        ScriptedIterator messages = new ScriptedIterator("a", "b");
        Pipe<String> destination = new Pipe<>();

        // when
        PipeConnectors.streamToPipe(() -> messages, Handler.transform(String::toUpperCase), destination, log);

        // then
        assertThat(destination.isStopped()).isFalse();
        assertThat(destination.snapshot()).containsExactly(PipeItem.of("A"), PipeItem.of("B"));
        assertThat(messages.closed).isTrue();
    }

    @Test
    void streamToPipe_SourceFails_StopsDestinationAndPropagates() {
        // given
        ScriptedIterator messages = new ScriptedIterator("a", new IllegalStateException("bad frame"));
        Pipe<String> destination = new Pipe<>();

        // when & then
        assertThatThrownBy(() ->
            PipeConnectors.streamToPipe(() -> messages, Handler.identity(), destination, log)
        ).isInstanceOf(IllegalStateException.class);
        assertThat(destination.snapshot()).containsExactly(PipeItem.of("a"), PipeItem.sentinel());
        assertThat(messages.closed).isTrue();
    }

    @Test
    void streamToPipe_Cancelled_StopsDestination() throws Exception {
        // given
        CountDownLatch waiting = new CountDownLatch(1);
        MessageStream<String> blocking = () -> new MessageIterator<>() {
            @Override
            public Optional<String> next() throws InterruptedException {
                waiting.countDown();
                new CountDownLatch(1).await();
                return Optional.empty();
            }

            @Override
            public void close() {
            }
        };
        Pipe<String> destination = new Pipe<>();
        Future<?> task = executor.submit(() -> {
            PipeConnectors.streamToPipe(blocking, Handler.identity(), destination, log);
            return null;
        });
        assertThat(waiting.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // when
        task.cancel(true);

        // then
        assertThat(destination.get().isSentinel()).isTrue();
        verify(log).warn("Stream connector was cancelled, closing downstream pipe");
    }

    // ============================================================
    // 5. reconnectingStreamToPipe
    // ============================================================

    @Test
    void reconnectingStreamToPipe_ConnectionDrops_ReconnectsUntilAttemptsExhausted() {
        // given
        AtomicInteger connections = new AtomicInteger();
        AtomicInteger disconnects = new AtomicInteger();
        MessageStream<String> stream = () -> connections.get() == 1
            ? new ScriptedIterator("a", new IOException("connection reset"))
            : new ScriptedIterator("b", new IOException("connection reset"));
        Pipe<String> destination = new Pipe<>();
        ReconnectConfig config = new ReconnectConfig()
            .withBaseDelay(Duration.ofMillis(5))
            .withMaxDelay(Duration.ofMillis(10))
            .withMaxAttempts(2);

        // when & then
        assertThatThrownBy(() -> PipeConnectors.reconnectingStreamToPipe(stream, Handler.identity(), destination,
            connections::incrementAndGet, disconnects::incrementAndGet, config, log))
            .isInstanceOf(PipeException.class)
            .hasCauseInstanceOf(IOException.class);
        assertThat(connections.get()).isEqualTo(2);
        assertThat(disconnects.get()).isEqualTo(2);
        assertThat(destination.snapshot())
            .containsExactly(PipeItem.of("a"), PipeItem.of("b"), PipeItem.sentinel());
        verify(log, times(2)).warn(eq("Stream connection was closed ({}), reconnect attempt {}"), any(), anyInt());
    }

    @Test
    void reconnectingStreamToPipe_ConnectFails_CountsAsFailure() {
        // given
        Pipe<String> destination = new Pipe<>();
        ReconnectConfig config = new ReconnectConfig()
            .withBaseDelay(Duration.ofMillis(5))
            .withMaxDelay(Duration.ofMillis(10))
            .withMaxAttempts(3);
        MessageStream<String> stream = () -> new ScriptedIterator();

        // when & then
        assertThatThrownBy(() -> PipeConnectors.reconnectingStreamToPipe(stream, Handler.identity(), destination,
            () -> {
                throw new IOException("refused");
            }, () -> { }, config, log))
            .isInstanceOf(PipeException.class);
        assertThat(destination.isStopped()).isTrue();
        verify(log).error("Stream reconnect attempts exhausted ({}), closing downstream pipe", 3);
    }

    @Test
    void reconnectingStreamToPipe_StreamEndsImmediately_WaitsBaseDelayBetweenConnections() throws Exception {
        // given: every connection yields an empty stream
        AtomicInteger connections = new AtomicInteger();
        Pipe<String> destination = new Pipe<>();
        ReconnectConfig config = new ReconnectConfig()
            .withBaseDelay(Duration.ofMillis(50))
            .withMaxDelay(Duration.ofMillis(50));
        MessageStream<String> stream = () -> new ScriptedIterator();

        // when
        Future<?> connector = executor.submit(() -> {
            PipeConnectors.reconnectingStreamToPipe(stream, Handler.identity(), destination,
                connections::incrementAndGet, () -> { }, config, log);
            return null;
        });
        TimeUnit.MILLISECONDS.sleep(300);
        connector.cancel(true);

        // then: roughly one connection per base delay, not a busy loop
        assertThat(connections.get()).isBetween(2, 10);
        assertThat(destination.get().isSentinel()).isTrue();
        verify(log, atLeastOnce()).debug("Stream ended, reconnecting in {}", Duration.ofMillis(50));
    }

    // ============================================================
    // helpers
    // ============================================================

    @SafeVarargs
    private static <T> Pipe<T> pipeOf(T... values) throws InterruptedException {
        Pipe<T> pipe = new Pipe<>();
        for (T value : values) {
            pipe.put(value);
        }
        pipe.stop();
        return pipe;
    }

    /**
     * 같은 데이터를 가진 열린(SENTINEL 없는) Pipe로 복사.
     */
    private static <T> Pipe<T> reopen(Pipe<T> stopped) throws InterruptedException {
        Pipe<T> open = new Pipe<>();
        for (PipeItem<T> item : stopped.snapshot()) {
            if (!item.isSentinel()) {
                open.put(item.value());
            }
        }
        return open;
    }

    @SuppressWarnings("unchecked")
    private static PipeSink<Integer> mockSink() {
        return mock(PipeSink.class);
    }

    private ConnectorRun runInBackground(
        PipeSource<Integer> source,
        Handler<Integer, Integer> handler,
        PipeSink<Integer> destination
    ) {
        ConnectorRun run = new ConnectorRun();
        run.future = executor.submit(() -> {
            try {
                PipeConnectors.pipeToPipe(source, handler, destination, log);
            } catch (InterruptedException e) {
                run.cancelled.set(true);
            } finally {
                run.done.countDown();
            }
        });
        return run;
    }

    private static final class ConnectorRun {
        final CountDownLatch done = new CountDownLatch(1);
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        volatile Future<?> future;
    }

    private static final class ScriptedIterator implements MessageIterator<String> {

        private final List<Object> steps;
        private int index;
        volatile boolean closed;

        ScriptedIterator(Object... steps) {
            this.steps = new ArrayList<>(List.of(steps));
        }

        @Override
        public Optional<String> next() throws IOException {
            if (index >= steps.size()) {
                return Optional.empty();
            }
            Object step = steps.get(index++);
            if (step instanceof IOException) {
                throw (IOException) step;
            }
            if (step instanceof RuntimeException) {
                throw (RuntimeException) step;
            }
            return Optional.of((String) step);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
