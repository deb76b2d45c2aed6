package com.ryuqq.execution.core.event;

import com.ryuqq.execution.core.model.OrderType;

/**
 * 주문 실패 이벤트.
 *
 * @param orderId 로컬 주문 ID
 * @param orderType 주문 유형
 * @param reason 실패 사유
 * @param timestamp 발생 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderFailedEvent(String orderId, OrderType orderType, String reason, long timestamp) implements OrderEvent {

    public OrderFailedEvent {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
    }
}
