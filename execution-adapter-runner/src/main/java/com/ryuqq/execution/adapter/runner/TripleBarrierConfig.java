package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.core.model.OrderType;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Triple barrier 설정 (불변 record).
 *
 * <p>세 barrier 중 하나라도 닿으면 포지션을 시장가로 청산합니다. null인 barrier는 비활성입니다.</p>
 *
 * <ul>
 *   <li>stopLoss: 순손익률이 -stopLoss 이하이면 STOP_LOSS</li>
 *   <li>takeProfit: 순손익률이 takeProfit 이상이면 TAKE_PROFIT</li>
 *   <li>timeLimit: 생성 후 timeLimit이 지나면 TIME_LIMIT</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param stopLoss 손절 비율 (예: 0.03 = 3%, null이면 비활성)
 * @param takeProfit 익절 비율 (null이면 비활성)
 * @param timeLimit 최대 보유 시간 (null이면 비활성)
 * @param openOrderType 진입 주문 유형 (MARKET 또는 LIMIT)
 */
public record TripleBarrierConfig(
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    Duration timeLimit,
    OrderType openOrderType
) {

    /**
     * 기본 설정: barrier 없음, 시장가 진입.
     */
    public TripleBarrierConfig() {
        this(null, null, null, OrderType.MARKET);
    }

    public TripleBarrierConfig {
        if (stopLoss != null && stopLoss.signum() <= 0) {
            throw new IllegalArgumentException("stopLoss must be positive (current: " + stopLoss + ")");
        }
        if (takeProfit != null && takeProfit.signum() <= 0) {
            throw new IllegalArgumentException("takeProfit must be positive (current: " + takeProfit + ")");
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new IllegalArgumentException("timeLimit must be positive (current: " + timeLimit + ")");
        }
        if (openOrderType == null) {
            throw new IllegalArgumentException("openOrderType cannot be null");
        }
        if (openOrderType == OrderType.LIMIT_MAKER) {
            throw new IllegalArgumentException("openOrderType must be MARKET or LIMIT (current: " + openOrderType + ")");
        }
    }

    public TripleBarrierConfig withStopLoss(BigDecimal stopLoss) {
        return new TripleBarrierConfig(stopLoss, takeProfit, timeLimit, openOrderType);
    }

    public TripleBarrierConfig withTakeProfit(BigDecimal takeProfit) {
        return new TripleBarrierConfig(stopLoss, takeProfit, timeLimit, openOrderType);
    }

    public TripleBarrierConfig withTimeLimit(Duration timeLimit) {
        return new TripleBarrierConfig(stopLoss, takeProfit, timeLimit, openOrderType);
    }

    public TripleBarrierConfig withOpenOrderType(OrderType openOrderType) {
        return new TripleBarrierConfig(stopLoss, takeProfit, timeLimit, openOrderType);
    }
}
