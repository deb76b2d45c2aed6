package com.ryuqq.execution.core.model;

/**
 * 가격 조회 기준.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum PriceType {
    MID_PRICE,
    BEST_BID,
    BEST_ASK,
    LAST_TRADE
}
