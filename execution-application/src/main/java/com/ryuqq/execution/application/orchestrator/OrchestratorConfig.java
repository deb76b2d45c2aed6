package com.ryuqq.execution.application.orchestrator;

import java.time.Duration;

/**
 * ExecutorOrchestrator 설정 (불변 record).
 *
 * @author Execution Team
 * @since 1.0.0
 * @param maxExecutorsCloseAttempts 종료 시 Executor 종료를 기다리는 최대 라운드 수 (1 이상)
 * @param closeAttemptInterval 라운드당 대기 시간 (양수)
 */
public record OrchestratorConfig(int maxExecutorsCloseAttempts, Duration closeAttemptInterval) {

    /**
     * 기본 설정 생성자 (3라운드, 라운드당 2초).
     */
    public OrchestratorConfig() {
        this(3, Duration.ofSeconds(2));
    }

    public OrchestratorConfig {
        if (maxExecutorsCloseAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxExecutorsCloseAttempts must be positive (current: " + maxExecutorsCloseAttempts + ")"
            );
        }
        if (closeAttemptInterval == null || closeAttemptInterval.isNegative() || closeAttemptInterval.isZero()) {
            throw new IllegalArgumentException(
                "closeAttemptInterval must be positive (current: " + closeAttemptInterval + ")"
            );
        }
    }

    public OrchestratorConfig withMaxExecutorsCloseAttempts(int maxExecutorsCloseAttempts) {
        return new OrchestratorConfig(maxExecutorsCloseAttempts, closeAttemptInterval);
    }

    public OrchestratorConfig withCloseAttemptInterval(Duration closeAttemptInterval) {
        return new OrchestratorConfig(maxExecutorsCloseAttempts, closeAttemptInterval);
    }
}
