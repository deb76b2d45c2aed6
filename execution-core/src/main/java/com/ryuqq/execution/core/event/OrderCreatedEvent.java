package com.ryuqq.execution.core.event;

import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;

/**
 * 주문 접수 이벤트.
 *
 * @param orderId 로컬 주문 ID
 * @param exchangeOrderId 거래소 주문 ID
 * @param tradingPair 거래쌍
 * @param tradeType 주문 방향
 * @param orderType 주문 유형
 * @param amount 주문 수량
 * @param price 주문 가격
 * @param timestamp 발생 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderCreatedEvent(
    String orderId,
    String exchangeOrderId,
    String tradingPair,
    TradeType tradeType,
    OrderType orderType,
    BigDecimal amount,
    BigDecimal price,
    long timestamp
) implements OrderEvent {

    public OrderCreatedEvent {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
    }
}
