package com.ryuqq.execution.core.pipe.connector;

import com.ryuqq.execution.core.pipe.Pipe;
import com.ryuqq.execution.core.pipe.PipeException;
import com.ryuqq.execution.core.pipe.PipeFullException;
import com.ryuqq.execution.core.pipe.PipeHandlerException;
import com.ryuqq.execution.core.pipe.PipeItem;
import com.ryuqq.execution.core.pipe.PipeSink;
import com.ryuqq.execution.core.pipe.PipeSource;
import com.ryuqq.execution.core.pipe.PutOptions;
import com.ryuqq.execution.core.spi.MessageIterator;
import com.ryuqq.execution.core.spi.MessageStream;
import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipe를 이어 파이프라인을 구성하는 커넥터 함수 모음.
 *
 * <p>각 함수는 호출 스레드에서 블로킹으로 실행됩니다. 보통 {@link ExecutorService}에
 * 제출하고, 취소는 {@code Future.cancel(true)}(스레드 인터럽트)로 합니다.</p>
 *
 * <p><strong>공통 규칙:</strong></p>
 * <ul>
 *   <li>전달: {@link ConnectorConfig#putOptions()}로 먼저 put하고, 가득 차 있으면
 *       WARN 후 {@link ConnectorConfig#fallbackPutOptions()}로 한 번 더 시도합니다.</li>
 *   <li>종료 전파: 소스의 SENTINEL을 받으면 목적지를 stop합니다.</li>
 *   <li>핸들러 예외: 목적지를 stop한 뒤 예외를 다시 던집니다.</li>
 *   <li>취소: 소스에 남은 원소를 snapshot으로 꺼내 핸들러를 거쳐 전달한 뒤,
 *       목적지를 한 번 stop하고 {@link InterruptedException}을 다시 던집니다.</li>
 * </ul>
 *
 * <pre>
 * Future&lt;?&gt; task = executor.submit(() -&gt; {
 *     PipeConnectors.pipeToPipe(raw, Handler.transform(Trade::parse), trades, log);
 *     return null;
 * });
 * ...
 * task.cancel(true); // raw에 남은 원소는 trades로 배출된 뒤 trades.stop()
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class PipeConnectors {

    private PipeConnectors() {
    }

    /**
     * 소스 Pipe의 원소를 핸들러로 변환하여 목적지 Pipe로 전달 (기본 설정).
     *
     * @see #pipeToPipe(PipeSource, Handler, PipeSink, ConnectorConfig, Logger)
     */
    public static <I, O> void pipeToPipe(
        PipeSource<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        Logger log
    ) throws InterruptedException {
        pipeToPipe(source, handler, destination, ConnectorConfig.defaults(), log);
    }

    /**
     * 소스 Pipe의 원소를 핸들러로 변환하여 목적지 Pipe로 전달.
     *
     * <p>SENTINEL을 받으면 목적지를 stop하고 정상 반환합니다.</p>
     *
     * @param source 소스 Pipe
     * @param handler 변환 핸들러
     * @param destination 목적지 Pipe
     * @param config put 설정
     * @param log 로거
     * @throws InterruptedException 취소된 경우 (남은 원소 배출 후)
     */
    public static <I, O> void pipeToPipe(
        PipeSource<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        ConnectorConfig config,
        Logger log
    ) throws InterruptedException {
        requireNonNull(source, "source");
        requireNonNull(handler, "handler");
        requireNonNull(destination, "destination");
        route(source, List.of(new Route<>(handler, destination)), config, log);
    }

    /**
     * 하나의 소스를 여러 목적지로 분배 (핸들러 하나를 모든 목적지에 적용).
     *
     * @see #pipeToMultipipe(PipeSource, List, List, ConnectorConfig, Logger)
     */
    public static <I, O> void pipeToMultipipe(
        PipeSource<I> source,
        Handler<I, O> handler,
        List<? extends PipeSink<O>> destinations,
        Logger log
    ) throws InterruptedException {
        pipeToMultipipe(source, List.of(handler), destinations, ConnectorConfig.defaults(), log);
    }

    /**
     * 하나의 소스를 여러 목적지로 분배.
     *
     * <p>핸들러 수는 목적지 수와 같거나(짝지어 적용) 1개(모든 목적지에 적용)여야 합니다.
     * 각 원소는 목적지 순서대로 전달되며, SENTINEL을 받으면 모든 목적지를 stop합니다.</p>
     *
     * @param source 소스 Pipe
     * @param handlers 핸들러 목록
     * @param destinations 목적지 목록
     * @param config put 설정
     * @param log 로거
     * @throws IllegalArgumentException 핸들러 수가 맞지 않는 경우 (원소를 읽기 전에 검사)
     * @throws InterruptedException 취소된 경우 (남은 원소 배출 후)
     */
    public static <I, O> void pipeToMultipipe(
        PipeSource<I> source,
        List<? extends Handler<I, O>> handlers,
        List<? extends PipeSink<O>> destinations,
        ConnectorConfig config,
        Logger log
    ) throws InterruptedException {
        requireNonNull(source, "source");
        requireNonNull(handlers, "handlers");
        requireNonNull(destinations, "destinations");
        if (destinations.isEmpty()) {
            throw new IllegalArgumentException("destinations cannot be empty");
        }
        if (handlers.size() != destinations.size() && handlers.size() != 1) {
            throw new IllegalArgumentException(
                "The handlers must match the number of destinations, or there must be only one handler "
                    + "(handlers: " + handlers.size() + ", destinations: " + destinations.size() + ")"
            );
        }

        List<Route<I, O>> routes = new ArrayList<>(destinations.size());
        for (int i = 0; i < destinations.size(); i++) {
            Handler<I, O> handler = handlers.size() == 1 ? handlers.get(0) : handlers.get(i);
            routes.add(new Route<>(requireNonNull(handler, "handler"), requireNonNull(destinations.get(i), "destination")));
        }
        route(source, routes, config, log);
    }

    /**
     * 여러 소스를 하나의 목적지로 합류.
     *
     * <p>소스마다 {@link #pipeToPipe} 작업을 executor에 제출합니다. 목적지는 모든 소스가
     * SENTINEL을 전달한 뒤에 한 번만 stop됩니다. 소스 간 순서는 보장하지 않으며,
     * 소스 하나 안에서의 순서는 유지됩니다.</p>
     *
     * @param sources 소스 목록
     * @param handler 모든 소스에 적용할 핸들러
     * @param destination 목적지 Pipe
     * @param config put 설정
     * @param executor 소스별 작업을 실행할 ExecutorService (소스 수 이상의 스레드 필요)
     * @param log 로거
     * @throws InterruptedException 취소된 경우 (모든 소스 작업 취소 후)
     */
    public static <I, O> void multipipeToPipe(
        List<? extends PipeSource<I>> sources,
        Handler<I, O> handler,
        PipeSink<O> destination,
        ConnectorConfig config,
        ExecutorService executor,
        Logger log
    ) throws InterruptedException {
        requireNonNull(sources, "sources");
        requireNonNull(handler, "handler");
        requireNonNull(destination, "destination");
        requireNonNull(executor, "executor");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("sources cannot be empty");
        }

        SharedDestination<O> shared = new SharedDestination<>(destination, sources.size());
        List<Future<?>> tasks = new ArrayList<>(sources.size());
        List<AtomicBoolean> started = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            PipeSource<I> source = sources.get(i);
            PipeSink<O> member = shared.member(i);
            AtomicBoolean flag = new AtomicBoolean(false);
            started.add(flag);
            tasks.add(executor.submit(() -> {
                flag.set(true);
                pipeToPipe(source, handler, member, config, log);
                return null;
            }));
        }

        try {
            for (Future<?> task : tasks) {
                task.get();
            }
        } catch (InterruptedException e) {
            log.warn("Fan-in connector was cancelled, cancelling {} source tasks", tasks.size());
            cancelAll(tasks, started, shared);
            throw e;
        } catch (ExecutionException e) {
            log.error("Fan-in source task failed, cancelling remaining source tasks", e.getCause());
            cancelAll(tasks, started, shared);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new PipeHandlerException("Fan-in source task failed", cause);
        }
    }

    /**
     * 메시지 스트림을 목적지 Pipe로 전달 (기본 설정).
     *
     * @see #streamToPipe(MessageStream, Handler, PipeSink, ConnectorConfig, Logger)
     */
    public static <I, O> void streamToPipe(
        MessageStream<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        Logger log
    ) throws IOException, InterruptedException {
        streamToPipe(source, handler, destination, ConnectorConfig.defaults(), log);
    }

    /**
     * 메시지 스트림을 목적지 Pipe로 전달.
     *
     * <p>스트림이 정상적으로 끝나면 목적지를 stop하지 않고 반환합니다 (다른 생산자가
     * 이어서 쓸 수 있도록). 실패하거나 취소되면 목적지를 stop한 뒤 전파합니다.</p>
     *
     * @param source 메시지 스트림
     * @param handler 변환 핸들러
     * @param destination 목적지 Pipe
     * @param config put 설정
     * @param log 로거
     * @throws IOException 스트림 I/O 실패 시
     * @throws InterruptedException 취소된 경우
     */
    public static <I, O> void streamToPipe(
        MessageStream<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        ConnectorConfig config,
        Logger log
    ) throws IOException, InterruptedException {
        streamToPipe(source, handler, destination, config, log, true);
    }

    /**
     * 끊기면 다시 연결하며 메시지 스트림을 목적지 Pipe로 전달.
     *
     * <pre>
     * loop:
     *   connect() → streamToPipe() → disconnect()
     *   실패 시 BackoffCalculator 대기 후 재연결 (maxAttempts 초과 시 목적지 stop 후 PipeException)
     *   취소 시 disconnect() → 목적지 stop → InterruptedException
     * </pre>
     *
     * <p>스트림이 정상 종료되어도 baseDelay만큼 기다린 뒤 다시 연결합니다. 연결이 성공하여 스트림이
     * 끝까지 흐르면 연속 실패 횟수는 초기화됩니다.</p>
     *
     * @param source 메시지 스트림
     * @param handler 변환 핸들러
     * @param destination 목적지 Pipe
     * @param connect 연결 동작
     * @param disconnect 해제 동작
     * @param config 재연결 설정
     * @param log 로거
     * @throws InterruptedException 취소된 경우
     * @throws PipeException 연속 실패가 maxAttempts를 넘은 경우
     */
    public static <I, O> void reconnectingStreamToPipe(
        MessageStream<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        ConnectionAction connect,
        ConnectionAction disconnect,
        ReconnectConfig config,
        Logger log
    ) throws InterruptedException {
        requireNonNull(connect, "connect");
        requireNonNull(disconnect, "disconnect");
        requireNonNull(config, "config");
        BackoffCalculator backoff = config.backoffCalculator();

        int failures = 0;
        while (true) {
            Exception lastFailure = null;
            try {
                connect.run();
                streamToPipe(source, handler, destination, config.connectorConfig(), log, false);
                failures = 0;
            } catch (InterruptedException e) {
                log.warn("Reconnecting stream connector was cancelled, closing downstream pipe");
                destination.stop();
                throw e;
            } catch (IOException e) {
                failures++;
                lastFailure = e;
                log.warn("Stream connection was closed ({}), reconnect attempt {}", e.getMessage(), failures);
            } catch (RuntimeException e) {
                failures++;
                lastFailure = e;
                log.error("Unexpected error while listening to stream, reconnect attempt {}", failures, e);
            } finally {
                disconnectQuietly(disconnect, log);
            }

            Duration delay;
            if (lastFailure == null) {
                delay = config.baseDelay();
                log.debug("Stream ended, reconnecting in {}", delay);
            } else {
                if (!config.isUnlimited() && failures >= config.maxAttempts()) {
                    log.error("Stream reconnect attempts exhausted ({}), closing downstream pipe", failures);
                    destination.stop();
                    throw new PipeException("Stream reconnect attempts exhausted (" + failures + ")", lastFailure);
                }
                delay = backoff.delayFor(failures);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                log.warn("Reconnecting stream connector was cancelled while waiting {}, closing downstream pipe", delay);
                destination.stop();
                throw e;
            }
        }
    }

    private static <I, O> void streamToPipe(
        MessageStream<I> source,
        Handler<I, O> handler,
        PipeSink<O> destination,
        ConnectorConfig config,
        Logger log,
        boolean stopOnFailure
    ) throws IOException, InterruptedException {
        requireNonNull(source, "source");
        requireNonNull(handler, "handler");
        requireNonNull(destination, "destination");
        requireNonNull(config, "config");
        Handler.Output<O> out = value -> putWithFallback(destination, value, config, log);

        try (MessageIterator<I> messages = source.iterMessages()) {
            Optional<I> message;
            while ((message = messages.next()).isPresent()) {
                handler.apply(message.get(), out);
                if (Thread.interrupted()) {
                    throw new InterruptedException("stream connector cancelled");
                }
            }
        } catch (InterruptedException e) {
            log.warn("Stream connector was cancelled, closing downstream pipe");
            destination.stop();
            throw e;
        } catch (IOException | RuntimeException e) {
            if (stopOnFailure) {
                log.error("Unexpected error while listening to stream, closing downstream pipe", e);
                destination.stop();
            }
            throw e;
        }
    }

    private static <I, O> void route(
        PipeSource<I> source,
        List<Route<I, O>> routes,
        ConnectorConfig config,
        Logger log
    ) throws InterruptedException {
        requireNonNull(config, "config");
        requireNonNull(log, "log");
        try {
            while (true) {
                PipeItem<I> item = source.get();
                try {
                    if (item.isSentinel()) {
                        stopAll(routes);
                        return;
                    }
                    for (Route<I, O> route : routes) {
                        route.deliver(item.value(), config, log);
                    }
                } finally {
                    source.taskDone();
                }
            }
        } catch (InterruptedException e) {
            log.warn("Pipe connector was cancelled, attempting to process remaining items");
            try {
                drain(source, routes, config, log, e);
            } finally {
                stopAll(routes);
            }
            throw e;
        } catch (RuntimeException e) {
            log.error("Pipeline stage failed, closing downstream pipe", e);
            stopAll(routes);
            throw e;
        }
    }

    private static <I, O> void drain(
        PipeSource<I> source,
        List<Route<I, O>> routes,
        ConnectorConfig config,
        Logger log,
        InterruptedException cancellation
    ) throws InterruptedException {
        List<PipeItem<I>> taken = Pipe.pipeSnapshot(source);
        List<PipeItem<I>> items = Pipe.sentinelize(taken);
        int dataCount = items.size() - 1;
        try {
            for (int i = 0; i < dataCount; i++) {
                try {
                    for (Route<I, O> route : routes) {
                        route.deliver(items.get(i).value(), config, log);
                    }
                } catch (PipeFullException e) {
                    log.error("Attempted to flush upstream pipe on cancellation, however downstream pipe is full. "
                        + "Loss of data incurred ({} items)", dataCount - i);
                    break;
                } catch (RuntimeException e) {
                    log.error("Pipeline stage failed while flushing on cancellation", e);
                    cancellation.addSuppressed(e);
                    break;
                }
            }
        } finally {
            // snapshot으로 꺼낸 원소(소스의 SENTINEL 포함)마다 정확히 한 번
            for (int i = 0; i < taken.size(); i++) {
                source.taskDone();
            }
        }
    }

    private static <O> void putWithFallback(
        PipeSink<O> destination,
        O value,
        ConnectorConfig config,
        Logger log
    ) throws InterruptedException {
        try {
            destination.put(value, config.putOptions());
        } catch (PipeFullException e) {
            PutOptions fallback = config.fallbackPutOptions();
            log.warn("Downstream pipe is full, retrying {} times", fallback.maxRetries());
            destination.put(value, fallback);
        }
    }

    private static <I, O> void stopAll(List<Route<I, O>> routes) {
        for (Route<I, O> route : routes) {
            route.destination().stop();
        }
    }

    private static void cancelAll(List<Future<?>> tasks, List<AtomicBoolean> started, SharedDestination<?> shared) {
        for (int i = 0; i < tasks.size(); i++) {
            tasks.get(i).cancel(true);
            if (!started.get(i).get()) {
                // 실행되지 못한 작업의 몫은 여기서 stop
                shared.member(i).stop();
            }
        }
    }

    private static void disconnectQuietly(ConnectionAction disconnect, Logger log) {
        try {
            disconnect.run();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to disconnect stream source", e);
        }
    }

    private static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    private record Route<I, O>(Handler<I, O> handler, PipeSink<O> destination) {

        void deliver(I input, ConnectorConfig config, Logger log) throws InterruptedException {
            handler.apply(input, value -> putWithFallback(destination, value, config, log));
        }
    }

    /**
     * 여러 생산자가 공유하는 목적지. 모든 생산자가 stop해야 실제 목적지를 stop합니다.
     */
    private static final class SharedDestination<O> {

        private final PipeSink<O> destination;
        private final AtomicInteger remaining;
        private final List<PipeSink<O>> members;

        SharedDestination(PipeSink<O> destination, int producers) {
            this.destination = destination;
            this.remaining = new AtomicInteger(producers);
            List<PipeSink<O>> list = new ArrayList<>(producers);
            for (int i = 0; i < producers; i++) {
                list.add(new Member());
            }
            this.members = Collections.unmodifiableList(list);
        }

        PipeSink<O> member(int index) {
            return members.get(index);
        }

        private final class Member implements PipeSink<O> {

            private final AtomicBoolean stopped = new AtomicBoolean(false);

            @Override
            public void put(O item, PutOptions options) throws InterruptedException {
                destination.put(item, options);
            }

            @Override
            public void stop() {
                if (stopped.compareAndSet(false, true) && remaining.decrementAndGet() == 0) {
                    destination.stop();
                }
            }

            @Override
            public boolean isFull() {
                return destination.isFull();
            }

            @Override
            public boolean isStopped() {
                return stopped.get() || destination.isStopped();
            }
        }
    }
}
