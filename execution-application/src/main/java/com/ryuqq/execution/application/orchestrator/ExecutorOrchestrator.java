package com.ryuqq.execution.application.orchestrator;

import com.ryuqq.execution.core.executor.ExecutorBase;
import com.ryuqq.execution.core.executor.ExecutorInfo;
import com.ryuqq.execution.core.model.CloseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Executor 실행 조정자.
 *
 * <p>controller별로 Executor를 생성, 조기 종료, 보고하고, 종료 시 모든 Executor를 정리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutorOrchestrator orchestrator = new ExecutorOrchestrator(
 *     Map.of(PositionExecutorConfig.TYPE, config -&gt; new PositionExecutor((PositionExecutorConfig) config, connectors, bus))
 * );
 *
 * orchestrator.executeAction(new CreateExecutorAction("controller-1", positionConfig));
 * orchestrator.executeAction(new StopExecutorAction("controller-1", positionConfig.id(), true));
 *
 * PerformanceReport report = orchestrator.generatePerformanceReport("controller-1");
 * orchestrator.stop();
 * </pre>
 *
 * <p><strong>동시성:</strong> 요청 처리와 보고는 서로 다른 스레드에서 호출될 수 있습니다.
 * Executor 목록은 copy-on-write 리스트로 관리됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class ExecutorOrchestrator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, ExecutorFactory> factories;
    private final OrchestratorConfig config;
    private final Logger log;
    private final Map<String, List<ExecutorBase>> executors = new ConcurrentHashMap<>();

    public ExecutorOrchestrator(Map<String, ExecutorFactory> factories) {
        this(factories, new OrchestratorConfig(), null);
    }

    /**
     * 생성자.
     *
     * @param factories Executor 유형 → 팩토리
     * @param config 설정
     * @param logger 로거 (null이면 클래스 로거 사용)
     * @throws IllegalArgumentException factories 또는 config가 null인 경우
     */
    public ExecutorOrchestrator(Map<String, ExecutorFactory> factories, OrchestratorConfig config, Logger logger) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.factories = Map.copyOf(factories);
        this.config = config;
        this.log = logger != null ? logger : LoggerFactory.getLogger(ExecutorOrchestrator.class);
    }

    /**
     * 요청 실행.
     *
     * @param action 생성 또는 조기 종료 요청
     * @throws IllegalArgumentException action이 null이거나 등록되지 않은 Executor 유형인 경우
     */
    public void executeAction(ExecutorAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        List<ExecutorBase> controllerExecutors =
            executors.computeIfAbsent(action.controllerId(), id -> new CopyOnWriteArrayList<>());

        if (action instanceof CreateExecutorAction create) {
            createExecutor(create, controllerExecutors);
        } else if (action instanceof StopExecutorAction stop) {
            stopExecutor(stop, controllerExecutors);
        }
    }

    public void executeActions(List<? extends ExecutorAction> actions) {
        for (ExecutorAction action : actions) {
            executeAction(action);
        }
    }

    private void createExecutor(CreateExecutorAction action, List<ExecutorBase> controllerExecutors) {
        String type = action.executorConfig().type();
        ExecutorFactory factory = factories.get(type);
        if (factory == null) {
            throw new IllegalArgumentException("Unsupported executor config type: " + type);
        }
        ExecutorBase executor = factory.create(action.executorConfig());
        executor.start();
        controllerExecutors.add(executor);
        log.debug("Created {} {} for controller {}", executor.getClass().getSimpleName(), executor.getId(),
            action.controllerId());
    }

    private void stopExecutor(StopExecutorAction action, List<ExecutorBase> controllerExecutors) {
        Optional<ExecutorBase> executor = controllerExecutors.stream()
            .filter(candidate -> candidate.getId().equals(action.executorId()))
            .findFirst();
        if (executor.isEmpty()) {
            log.error("Executor ID {} not found for controller {}", action.executorId(), action.controllerId());
            return;
        }
        executor.get().earlyStop(action.keepPosition());
    }

    /**
     * controller별 Executor 스냅샷.
     *
     * @return controller ID → ExecutorInfo 목록 (생성 순서)
     */
    public Map<String, List<ExecutorInfo>> getExecutorsReport() {
        Map<String, List<ExecutorInfo>> report = new LinkedHashMap<>();
        executors.forEach((controllerId, list) -> {
            List<ExecutorInfo> infos = new ArrayList<>();
            for (ExecutorBase executor : list) {
                infos.add(executor.getExecutorInfo());
            }
            report.put(controllerId, List.copyOf(infos));
        });
        return report;
    }

    /**
     * controller 성과 보고서.
     *
     * @param controllerId controller ID
     * @return 성과 보고서 (Executor가 없으면 빈 보고서)
     */
    public PerformanceReport generatePerformanceReport(String controllerId) {
        List<ExecutorBase> controllerExecutors = executors.get(controllerId);
        if (controllerExecutors == null || controllerExecutors.isEmpty()) {
            return PerformanceReport.empty();
        }

        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal volume = BigDecimal.ZERO;
        Map<CloseType, Integer> closeTypeCounts = new EnumMap<>(CloseType.class);

        for (ExecutorBase executor : controllerExecutors) {
            ExecutorInfo info = executor.getExecutorInfo();
            if (info.isDone()) {
                realized = realized.add(info.netPnlQuote());
                if (info.closeType() != null) {
                    closeTypeCounts.merge(info.closeType(), 1, Integer::sum);
                }
            } else {
                unrealized = unrealized.add(info.netPnlQuote());
            }
            volume = volume.add(info.filledAmountQuote());
        }

        BigDecimal global = realized.add(unrealized);
        return new PerformanceReport(realized, unrealized, global, percentOf(realized, volume),
            percentOf(unrealized, volume), percentOf(global, volume), volume, closeTypeCounts);
    }

    /**
     * 모든 Executor 조기 종료 후 종료 대기.
     *
     * <p>열린 Executor에 {@code earlyStop(false)}를 보내고, 최대 {@code maxExecutorsCloseAttempts} 라운드 동안
     * 종료를 기다립니다. 그래도 끝나지 않은 Executor는 루프를 강제로 취소합니다.</p>
     *
     * @return 모든 Executor가 제한 시간 안에 스스로 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean stop() throws InterruptedException {
        List<ExecutorBase> all = allExecutors();
        for (ExecutorBase executor : all) {
            if (!executor.getStatus().isTerminal()) {
                executor.earlyStop(false);
            }
        }

        boolean graceful = false;
        for (int attempt = 1; attempt <= config.maxExecutorsCloseAttempts(); attempt++) {
            if (awaitAll(all, config.closeAttemptInterval())) {
                graceful = true;
                break;
            }
            log.debug("Waiting for executors to close ({}/{})", attempt, config.maxExecutorsCloseAttempts());
        }

        if (!graceful) {
            for (ExecutorBase executor : all) {
                if (!executor.getStatus().isTerminal()) {
                    log.warn("Executor {} did not close after {} attempts, cancelling", executor.getId(),
                        config.maxExecutorsCloseAttempts());
                    executor.stop();
                }
            }
        }
        executors.clear();
        return graceful;
    }

    private boolean awaitAll(List<ExecutorBase> all, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (ExecutorBase executor : all) {
            long remaining = deadline - System.nanoTime();
            if (!executor.awaitTermination(Duration.ofNanos(Math.max(remaining, 0)))) {
                return false;
            }
        }
        return true;
    }

    private List<ExecutorBase> allExecutors() {
        List<ExecutorBase> all = new ArrayList<>();
        executors.values().forEach(all::addAll);
        return all;
    }

    public List<ExecutorBase> getExecutors(String controllerId) {
        return List.copyOf(executors.getOrDefault(controllerId, List.of()));
    }

    private static BigDecimal percentOf(BigDecimal value, BigDecimal volume) {
        if (volume.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.divide(volume, MathContext.DECIMAL64).multiply(HUNDRED);
    }
}
