package com.ryuqq.execution.core.pipe;

/**
 * 생산자가 예약된 SENTINEL을 직접 put한 경우 (프로그래밍 오류).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeSentinelException extends PipeException {

    public PipeSentinelException(String message) {
        super(message);
    }
}
