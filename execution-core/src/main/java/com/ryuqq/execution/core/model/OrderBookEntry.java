package com.ryuqq.execution.core.model;

import java.math.BigDecimal;

/**
 * 호가 한 단계.
 *
 * @param price 가격 (양수)
 * @param amount 수량 (0 이상)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderBookEntry(BigDecimal price, BigDecimal amount) {

    public OrderBookEntry {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive (current: " + price + ")");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative (current: " + amount + ")");
        }
    }
}
