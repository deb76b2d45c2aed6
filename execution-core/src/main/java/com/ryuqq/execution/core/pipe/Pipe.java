package com.ryuqq.execution.core.pipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 종료 신호(SENTINEL)와 backpressure를 지원하는 bounded FIFO 큐.
 *
 * <p><strong>핵심 규칙:</strong></p>
 * <ul>
 *   <li>put 순서 그대로 get됩니다.</li>
 *   <li>{@link #stop()} 이후 put은 {@link PipeStoppedException}으로 거부됩니다.</li>
 *   <li>SENTINEL은 정확히 한 번, 모든 데이터 원소 뒤에 소비됩니다.</li>
 *   <li>버퍼가 가득 찬 상태에서 stop()이 호출되면 SENTINEL은 현재 원소들이
 *       모두 소비된 직후로 지연 배치됩니다 ({@code sentinelPosition}).</li>
 * </ul>
 *
 * <p><strong>Backpressure:</strong></p>
 * <pre>
 * put(item, options)
 *   ↓ 가득 참?
 *   ├─ 재시도 남음 → DEBUG 로그, min(waitTime, maxWaitTimePerRetry) 동안 빈자리 대기
 *   └─ 재시도 소진 → ERROR 로그, PipeFullException
 * </pre>
 *
 * <p><strong>동시성:</strong> 모든 변경 연산은 하나의 {@link ReentrantLock} 아래에서
 * 원자적으로 수행됩니다.</p>
 *
 * @param <T> 데이터 타입
 * @author Execution Team
 * @since 1.0.0
 */
public class Pipe<T> implements PipeSource<T>, PipeSink<T> {

    private final int maxSize;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition allTasksDone = lock.newCondition();

    private final ArrayDeque<PipeItem<T>> buffer = new ArrayDeque<>();
    private int sentinelPosition = -1;
    private int unfinishedTasks;
    private boolean closed;
    private volatile boolean stopped;

    /**
     * 무제한 Pipe 생성.
     */
    public Pipe() {
        this(0);
    }

    /**
     * 생성자.
     *
     * @param maxSize 최대 용량 (0 이하 = 무제한)
     */
    public Pipe(int maxSize) {
        this(maxSize, null);
    }

    /**
     * 생성자 (로거 주입).
     *
     * @param maxSize 최대 용량 (0 이하 = 무제한)
     * @param logger 로거 (null이면 클래스 로거 사용)
     */
    public Pipe(int maxSize, Logger logger) {
        this.maxSize = maxSize;
        this.log = logger != null ? logger : LoggerFactory.getLogger(Pipe.class);
    }

    @Override
    public void put(T item, PutOptions options) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (stopped) {
            throw new PipeStoppedException("Cannot put item into a stopped pipe");
        }
        if (item instanceof PipeItem && ((PipeItem<?>) item).isSentinel()) {
            throw new PipeSentinelException("Cannot put the SENTINEL into a pipe, use stop()");
        }

        lock.lockInterruptibly();
        try {
            ensureNotStopped();
            int retries = 0;
            while (isFullLocked()) {
                if (retries >= options.maxRetries()) {
                    log.error("Failed to put item after {} retries: pipe is full ({})", retries, maxSize);
                    throw new PipeFullException("Pipe is full after " + retries + " retries (capacity " + maxSize + ")");
                }
                retries++;
                Duration delay = options.retryDelay();
                log.debug("Pipe is full {}/{}, waiting up to {}", retries, options.maxRetries(), delay);
                awaitSpace(delay.toNanos());
                ensureNotStopped();
            }
            enqueue(PipeItem.of(item));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PipeItem<T> get() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    throw new IllegalStateException("get() called after the SENTINEL was consumed");
                }
                PipeItem<T> item = pollLocked();
                if (item != null) {
                    return item;
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            if (isFullLocked()) {
                sentinelPosition = buffer.size();
                unfinishedTasks++;
                notEmpty.signalAll();
            } else {
                putSentinel();
            }
            // 재시도 대기 중인 생산자는 PipeStoppedException으로 깨어남
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 용량 검사 없이 SENTINEL을 버퍼 끝에 추가.
     *
     * <p>{@link #stop()} 전용 내부 연산입니다.</p>
     */
    void putSentinel() {
        lock.lock();
        try {
            enqueue(PipeItem.sentinel());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PipeItem<T>> snapshot() {
        lock.lock();
        try {
            List<PipeItem<T>> items = new ArrayList<>(buffer.size() + 1);
            PipeItem<T> item;
            while (!closed && (item = pollLocked()) != null) {
                items.add(item);
            }
            if (!buffer.isEmpty()) {
                // SENTINEL 뒤에 남은 원소는 버려지므로 작업 카운트에서도 제외
                unfinishedTasks -= buffer.size();
                buffer.clear();
                signalIfAllDone();
            }
            return List.copyOf(items);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void taskDone() {
        lock.lock();
        try {
            if (unfinishedTasks <= 0) {
                throw new IllegalStateException("taskDone() called more times than there were items placed in the pipe");
            }
            unfinishedTasks--;
            signalIfAllDone();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void join() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (unfinishedTasks > 0) {
                allTasksDone.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean join(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (unfinishedTasks > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = allTasksDone.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 소스의 남은 원소를 모두 꺼냄.
     *
     * @param source 대상 소스
     * @param <T> 데이터 타입
     * @return 순서가 보존된 불변 리스트
     */
    public static <T> List<PipeItem<T>> pipeSnapshot(PipeSource<T> source) {
        return source.snapshot();
    }

    /**
     * 리스트가 정확히 하나의 SENTINEL로 끝나도록 정리.
     *
     * <p>SENTINEL이 있으면 첫 SENTINEL까지만 남기고, 없으면 끝에 하나 추가합니다.</p>
     *
     * @param items 원소 리스트
     * @param <T> 데이터 타입
     * @return SENTINEL로 끝나는 불변 리스트
     */
    public static <T> List<PipeItem<T>> sentinelize(List<PipeItem<T>> items) {
        List<PipeItem<T>> result = new ArrayList<>(items.size() + 1);
        for (PipeItem<T> item : items) {
            result.add(item);
            if (item.isSentinel()) {
                return List.copyOf(result);
            }
        }
        result.add(PipeItem.sentinel());
        return List.copyOf(result);
    }

    /**
     * SENTINEL까지 데이터를 순회하는 Iterable.
     *
     * @param source 대상 소스
     * @param <T> 데이터 타입
     * @return 한 번만 순회 가능한 Iterable
     */
    public static <T> Iterable<T> iterate(PipeSource<T> source) {
        return () -> new PipeIterator<>(source);
    }

    @Override
    public boolean isStopped() {
        return stopped;
    }

    @Override
    public boolean isEmpty() {
        lock.lock();
        try {
            return buffer.isEmpty() && sentinelPosition < 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isFull() {
        lock.lock();
        try {
            return isFullLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 상태.
     *
     * @return OPEN, STOPPING, CLOSED 중 하나
     */
    public PipeState state() {
        lock.lock();
        try {
            if (closed) {
                return PipeState.CLOSED;
            }
            return stopped ? PipeState.STOPPING : PipeState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * 지연 배치된 SENTINEL의 위치 (-1이면 지연 없음).
     */
    int getSentinelPosition() {
        lock.lock();
        try {
            return sentinelPosition;
        } finally {
            lock.unlock();
        }
    }

    private PipeItem<T> pollLocked() {
        if (sentinelPosition == 0) {
            sentinelPosition = -1;
            markClosed();
            return PipeItem.sentinel();
        }
        PipeItem<T> item = buffer.pollFirst();
        if (item == null) {
            return null;
        }
        if (sentinelPosition > 0) {
            sentinelPosition--;
        }
        notFull.signal();
        if (item.isSentinel()) {
            markClosed();
        }
        return item;
    }

    private void markClosed() {
        closed = true;
        // 같은 Pipe를 기다리던 다른 소비자가 무한 대기하지 않도록 깨움
        notEmpty.signalAll();
    }

    private void enqueue(PipeItem<T> item) {
        buffer.addLast(item);
        unfinishedTasks++;
        notEmpty.signal();
    }

    private void awaitSpace(long nanos) throws InterruptedException {
        long remaining = nanos;
        while (remaining > 0 && isFullLocked() && !stopped) {
            remaining = notFull.awaitNanos(remaining);
        }
    }

    private void ensureNotStopped() {
        if (stopped) {
            throw new PipeStoppedException("Cannot put item into a stopped pipe");
        }
    }

    private void signalIfAllDone() {
        if (unfinishedTasks == 0) {
            allTasksDone.signalAll();
        }
    }

    private boolean isFullLocked() {
        return maxSize > 0 && buffer.size() >= maxSize;
    }

    @Override
    public String toString() {
        return "Pipe{maxSize=" + maxSize + ", size=" + size() + ", state=" + state() + "}";
    }
}
