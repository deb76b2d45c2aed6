package com.ryuqq.execution.core.pipe;

/**
 * stop() 이후 put을 시도한 경우.
 *
 * <p>생산자는 생산을 멈춰야 합니다. 재시도 대상이 아닙니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeStoppedException extends PipeException {

    public PipeStoppedException(String message) {
        super(message);
    }
}
