package com.ryuqq.execution.core.model;

/**
 * 주문 유형.
 *
 * <p>MARKET을 제외한 모든 유형은 양수 가격이 필요합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum OrderType {
    MARKET,
    LIMIT,
    LIMIT_MAKER;

    /**
     * 가격이 필요한 주문 유형인지 확인.
     *
     * @return MARKET이 아니면 true
     */
    public boolean requiresPrice() {
        return this != MARKET;
    }
}
