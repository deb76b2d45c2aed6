package com.ryuqq.execution.core.model;

/**
 * Executor가 종료된 사유.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum CloseType {
    TIME_LIMIT,
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP,
    EXPIRED,
    EARLY_STOP,
    INSUFFICIENT_BALANCE,
    POSITION_HOLD,
    COMPLETED,
    FAILED
}
