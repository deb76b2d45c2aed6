package com.ryuqq.execution.core.event;

import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;

/**
 * 체결 이벤트 (부분 체결 포함).
 *
 * @param orderId 로컬 주문 ID
 * @param tradingPair 거래쌍
 * @param tradeType 주문 방향
 * @param orderType 주문 유형
 * @param price 체결 가격
 * @param amount 체결 수량 (base)
 * @param feeQuote 체결 수수료 (quote)
 * @param exchangeTradeId 거래소 체결 ID
 * @param timestamp 발생 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderFilledEvent(
    String orderId,
    String tradingPair,
    TradeType tradeType,
    OrderType orderType,
    BigDecimal price,
    BigDecimal amount,
    BigDecimal feeQuote,
    String exchangeTradeId,
    long timestamp
) implements OrderEvent {

    public OrderFilledEvent {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive (current: " + price + ")");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive (current: " + amount + ")");
        }
        feeQuote = feeQuote == null ? BigDecimal.ZERO : feeQuote;
    }
}
