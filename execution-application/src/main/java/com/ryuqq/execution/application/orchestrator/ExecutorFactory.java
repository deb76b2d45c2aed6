package com.ryuqq.execution.application.orchestrator;

import com.ryuqq.execution.core.executor.ExecutorBase;
import com.ryuqq.execution.core.executor.ExecutorConfig;

/**
 * Executor 유형별 생성기.
 *
 * <p>Orchestrator는 {@link ExecutorConfig#type()} 값으로 팩토리를 찾습니다.
 * 생성된 Executor는 아직 시작되지 않은 상태(NOT_STARTED)여야 합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExecutorFactory {

    /**
     * Executor 생성.
     *
     * @param config Executor 설정
     * @return 시작 전 Executor
     * @throws IllegalArgumentException 설정 유형이 이 팩토리와 맞지 않는 경우
     */
    ExecutorBase create(ExecutorConfig config);
}
