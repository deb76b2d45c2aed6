package com.ryuqq.execution.application.orchestrator;

import com.ryuqq.execution.core.executor.ExecutorConfig;

/**
 * Executor 생성 후 시작 요청.
 *
 * @author Execution Team
 * @since 1.0.0
 * @param controllerId 요청한 controller ID
 * @param executorConfig 생성할 Executor 설정 ({@link ExecutorConfig#type()}으로 팩토리 선택)
 */
public record CreateExecutorAction(String controllerId, ExecutorConfig executorConfig) implements ExecutorAction {

    public CreateExecutorAction {
        if (controllerId == null || controllerId.isBlank()) {
            throw new IllegalArgumentException("controllerId cannot be null or blank");
        }
        if (executorConfig == null) {
            throw new IllegalArgumentException("executorConfig cannot be null");
        }
    }
}
