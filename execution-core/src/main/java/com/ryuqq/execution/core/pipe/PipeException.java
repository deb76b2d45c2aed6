package com.ryuqq.execution.core.pipe;

/**
 * Pipe 관련 예외의 상위 타입.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeException extends RuntimeException {

    public PipeException(String message) {
        super(message);
    }

    public PipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
