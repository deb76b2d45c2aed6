package com.ryuqq.execution.core.pipe;

/**
 * Pipe 상태.
 *
 * <pre>
 * OPEN ──stop()──► STOPPING ──SENTINEL 소비──► CLOSED
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum PipeState {

    /**
     * put 허용.
     */
    OPEN,

    /**
     * stop() 호출됨. 남은 원소와 SENTINEL을 배출하는 중.
     */
    STOPPING,

    /**
     * SENTINEL까지 소비됨 (최종 상태).
     */
    CLOSED
}
