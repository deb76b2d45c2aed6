package com.ryuqq.execution.core.executor;

/**
 * 커넥터가 주문을 동기적으로 거부한 경우.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class OrderPlacementException extends RuntimeException {

    public OrderPlacementException(String message, Throwable cause) {
        super(message, cause);
    }
}
