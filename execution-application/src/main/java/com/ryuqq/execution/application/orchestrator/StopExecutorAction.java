package com.ryuqq.execution.application.orchestrator;

/**
 * 실행 중인 Executor 조기 종료 요청.
 *
 * @author Execution Team
 * @since 1.0.0
 * @param controllerId 요청한 controller ID
 * @param executorId 종료할 Executor ID
 * @param keepPosition true면 포지션을 유지한 채 종료 (POSITION_HOLD)
 */
public record StopExecutorAction(String controllerId, String executorId, boolean keepPosition) implements ExecutorAction {

    public StopExecutorAction {
        if (controllerId == null || controllerId.isBlank()) {
            throw new IllegalArgumentException("controllerId cannot be null or blank");
        }
        if (executorId == null || executorId.isBlank()) {
            throw new IllegalArgumentException("executorId cannot be null or blank");
        }
    }

    public StopExecutorAction(String controllerId, String executorId) {
        this(controllerId, executorId, false);
    }
}
