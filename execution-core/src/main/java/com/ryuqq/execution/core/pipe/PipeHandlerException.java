package com.ryuqq.execution.core.pipe;

/**
 * 파이프라인 핸들러가 checked 예외로 실패한 경우의 래퍼.
 *
 * <p>unchecked 예외는 래핑 없이 그대로 전파됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeHandlerException extends PipeException {

    public PipeHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
