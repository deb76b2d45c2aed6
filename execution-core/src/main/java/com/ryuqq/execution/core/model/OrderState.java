package com.ryuqq.execution.core.model;

/**
 * 거래소 측 주문 상태.
 *
 * <pre>
 * PENDING_CREATE → OPEN → PARTIALLY_FILLED → FILLED
 *                    │            │
 *                    └────────────┴──► CANCELED
 * (어느 단계에서든) ─────────────────► FAILED
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum OrderState {
    PENDING_CREATE,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FILLED, CANCELED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == FAILED;
    }
}
