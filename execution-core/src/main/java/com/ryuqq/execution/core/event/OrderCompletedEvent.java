package com.ryuqq.execution.core.event;

import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;

/**
 * 전량 체결 완료 이벤트.
 *
 * @param orderId 로컬 주문 ID
 * @param tradingPair 거래쌍
 * @param tradeType 주문 방향
 * @param baseAmount 총 체결 수량
 * @param quoteAmount 총 체결 금액
 * @param timestamp 발생 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderCompletedEvent(
    String orderId,
    String tradingPair,
    TradeType tradeType,
    BigDecimal baseAmount,
    BigDecimal quoteAmount,
    long timestamp
) implements OrderEvent {

    public OrderCompletedEvent {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
    }
}
