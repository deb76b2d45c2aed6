package com.ryuqq.execution.core.event;

/**
 * 주문 취소 이벤트.
 *
 * @param orderId 로컬 주문 ID
 * @param exchangeOrderId 거래소 주문 ID (알 수 없으면 null)
 * @param timestamp 발생 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderCanceledEvent(String orderId, String exchangeOrderId, long timestamp) implements OrderEvent {

    public OrderCanceledEvent {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
    }
}
