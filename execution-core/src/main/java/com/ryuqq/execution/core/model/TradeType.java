package com.ryuqq.execution.core.model;

/**
 * 주문 방향.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum TradeType {
    BUY,
    SELL;

    /**
     * 반대 방향.
     *
     * @return BUY이면 SELL, SELL이면 BUY
     */
    public TradeType opposite() {
        return this == BUY ? SELL : BUY;
    }
}
