package com.ryuqq.execution.core.runnable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 주기 실행 워커의 기반 클래스.
 *
 * <p>{@link #start()} 호출 시 백그라운드 루프를 하나 띄우고, {@code updateInterval} 간격으로
 * {@link #controlTask()}를 반복 호출합니다.</p>
 *
 * <p><strong>루프 동작:</strong></p>
 * <pre>
 * start()
 *   ↓ NOT_STARTED → RUNNING
 * onStart()
 *   ↓
 * while (stop 요청 없음):
 *   1. controlTask()   (예외는 ERROR 로그 후 계속, 인터럽트는 루프 종료)
 *   2. sleep(updateInterval)
 *   ↓
 * onStop()
 *   ↓ → TERMINATED
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>tick은 한 번에 하나만 실행됩니다. 다음 tick은 이전 tick이 끝난 뒤 sleep을 거쳐 시작합니다.</li>
 *   <li>{@link #stop()}은 루프 스레드를 인터럽트하여 진행 중인 tick을 취소합니다.</li>
 *   <li>상태는 {@link StatusTransition} 규칙에 따라 전진 방향으로만 바뀝니다.</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public abstract class RunnableBase {

    private final String id;
    private final Duration updateInterval;
    private final Logger log;
    private final ExecutorService injectedExecutor;

    private final AtomicReference<RunnableStatus> status = new AtomicReference<>(RunnableStatus.NOT_STARTED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean loopClaimed = new AtomicBoolean(false);
    private final AtomicBoolean startHookCalled = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile ExecutorService ownedExecutor;
    private volatile Future<?> loopFuture;
    private volatile Thread loopThread;

    /**
     * 생성자 (기본 로거, 전용 루프 스레드).
     *
     * @param id 워커 식별자
     * @param updateInterval tick 간격 (0 허용, 음수 불가)
     */
    protected RunnableBase(String id, Duration updateInterval) {
        this(id, updateInterval, null, null);
    }

    /**
     * 생성자 (로거 및 루프 실행기 주입).
     *
     * @param id 워커 식별자
     * @param updateInterval tick 간격 (0 허용, 음수 불가)
     * @param logger 로거 (null이면 클래스 로거 사용)
     * @param loopExecutor 루프를 실행할 ExecutorService (null이면 워커 전용 데몬 스레드 생성)
     * @throws IllegalArgumentException id가 비어있거나 updateInterval이 null/음수인 경우
     */
    protected RunnableBase(String id, Duration updateInterval, Logger logger, ExecutorService loopExecutor) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (updateInterval == null) {
            throw new IllegalArgumentException("updateInterval cannot be null");
        }
        if (updateInterval.isNegative()) {
            throw new IllegalArgumentException("updateInterval must not be negative (current: " + updateInterval + ")");
        }
        this.id = id;
        this.updateInterval = updateInterval;
        this.log = logger != null ? logger : LoggerFactory.getLogger(getClass());
        this.injectedExecutor = loopExecutor;
    }

    /**
     * 한 번의 control tick.
     *
     * <p>InterruptedException은 취소 신호로 간주되어 루프를 끝냅니다.
     * 그 외 예외는 로그만 남기고 다음 tick으로 진행합니다.</p>
     *
     * @throws Exception tick 처리 중 발생한 예외
     */
    protected abstract void controlTask() throws Exception;

    /**
     * 루프 시작 직후, 첫 tick 전에 한 번 호출.
     *
     * @throws Exception 시작 처리 실패 시 (워커는 종료 절차로 진입)
     */
    protected void onStart() throws Exception {
    }

    /**
     * 루프 종료 직후, TERMINATED 전이 전에 한 번 호출.
     */
    protected void onStop() {
    }

    /**
     * 워커 시작.
     *
     * <p>NOT_STARTED가 아니면 아무것도 하지 않고 WARN 로그만 남깁니다.</p>
     */
    public final void start() {
        if (!status.compareAndSet(RunnableStatus.NOT_STARTED, RunnableStatus.RUNNING)) {
            log.warn("[{}] start() ignored: status is {}", id, status.get());
            return;
        }
        log.info("[{}] {} → {}", id, RunnableStatus.NOT_STARTED, RunnableStatus.RUNNING);

        ExecutorService executor = injectedExecutor;
        if (executor == null) {
            executor = createOwnedExecutor();
            ownedExecutor = executor;
        }
        try {
            loopFuture = executor.submit(this::controlLoop);
        } catch (RejectedExecutionException e) {
            if (stopRequested.get()) {
                log.debug("[{}] loop submission skipped: stop already requested", id);
                return;
            }
            log.error("[{}] failed to submit control loop", id, e);
            if (loopClaimed.compareAndSet(false, true)) {
                finishTermination();
            }
            throw e;
        }

        // stop()이 submit 전에 종료 절차를 끝냈다면 전용 실행기는 여기서 닫아야 함
        if (stopRequested.get() && injectedExecutor == null) {
            executor.shutdown();
        }
    }

    /**
     * 워커 정지.
     *
     * <p>RUNNING → SHUTTING_DOWN 전이 후 루프를 취소합니다. 루프가 풀리면 TERMINATED가 됩니다.
     * 이미 정지 요청되었거나 TERMINATED이면 아무 효과가 없습니다 (멱등).</p>
     *
     * <p>시작 전(NOT_STARTED)에 호출되면 바로 TERMINATED로 전이하므로 이후 start()는 거부됩니다.</p>
     */
    public final void stop() {
        if (status.get().isTerminal() || !stopRequested.compareAndSet(false, true)) {
            return;
        }

        if (status.compareAndSet(RunnableStatus.NOT_STARTED, RunnableStatus.TERMINATED)) {
            log.info("[{}] {} → {} (stopped before start)", id, RunnableStatus.NOT_STARTED, RunnableStatus.TERMINATED);
            loopClaimed.set(true);
            terminated.countDown();
            return;
        }

        transitionTo(RunnableStatus.SHUTTING_DOWN);

        Future<?> future = loopFuture;
        if (future != null && Thread.currentThread() != loopThread) {
            future.cancel(true);
        }

        // 루프가 아직 실행되지 않았다면 여기서 종료 절차를 대신 수행
        if (loopClaimed.compareAndSet(false, true)) {
            finishTermination();
        }
    }

    /**
     * 종료 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 제한 시간 내에 TERMINATED가 되면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 전진 방향 상태 전이.
     *
     * <p>허용되지 않는 전이(역방향, 동일 상태, TERMINATED 이후)는 무시하고 false를 반환합니다.</p>
     *
     * @param target 목표 상태
     * @return 전이되었으면 true
     */
    protected final boolean transitionTo(RunnableStatus target) {
        while (true) {
            RunnableStatus current = status.get();
            if (!StatusTransition.isAllowed(current, target)) {
                return false;
            }
            if (status.compareAndSet(current, target)) {
                log.info("[{}] {} → {}", id, current, target);
                return true;
            }
        }
    }

    private void controlLoop() {
        if (!loopClaimed.compareAndSet(false, true)) {
            return;
        }
        loopThread = Thread.currentThread();
        try {
            startHookCalled.set(true);
            onStart();
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    controlTask();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("[{}] control task failed", id, e);
                }

                if (stopRequested.get()) {
                    break;
                }
                try {
                    pause();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("[{}] start hook failed, shutting down", id, e);
            stopRequested.set(true);
            transitionTo(RunnableStatus.SHUTTING_DOWN);
        } finally {
            finishTermination();
        }
    }

    private void pause() throws InterruptedException {
        if (updateInterval.isZero()) {
            Thread.yield();
            return;
        }
        TimeUnit.NANOSECONDS.sleep(updateInterval.toNanos());
    }

    private void finishTermination() {
        try {
            if (startHookCalled.get()) {
                onStop();
            }
        } catch (Exception e) {
            log.error("[{}] stop hook failed", id, e);
        } finally {
            transitionTo(RunnableStatus.TERMINATED);
            terminated.countDown();
            loopThread = null;
            ExecutorService owned = ownedExecutor;
            if (owned != null) {
                owned.shutdown();
            }
        }
    }

    /**
     * 워커 전용 루프 실행기 생성 (루프 실행기가 주입되지 않은 경우).
     */
    ExecutorService createOwnedExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "runnable-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    public String getId() {
        return id;
    }

    public RunnableStatus getStatus() {
        return status.get();
    }

    public Duration getUpdateInterval() {
        return updateInterval;
    }

    /**
     * stop()이 호출되었는지 확인.
     *
     * @return 정지 요청 여부
     */
    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * 주입된 로거.
     *
     * @return 이 워커의 로거
     */
    protected Logger logger() {
        return log;
    }
}
