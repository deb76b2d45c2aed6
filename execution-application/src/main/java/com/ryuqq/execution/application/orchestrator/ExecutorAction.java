package com.ryuqq.execution.application.orchestrator;

/**
 * Orchestrator에 전달되는 Executor 제어 요청.
 *
 * <p>모든 요청은 요청한 controller의 ID를 가지며, Orchestrator는 controller별로 Executor를 묶어 관리합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface ExecutorAction permits CreateExecutorAction, StopExecutorAction {

    /**
     * 요청한 controller ID.
     *
     * @return controller ID (non-blank)
     */
    String controllerId();
}
