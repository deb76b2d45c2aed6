package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.core.executor.ExecutorConfig;
import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * OrderChaserExecutor 설정 (불변 record).
 *
 * @author Execution Team
 * @since 1.0.0
 * @param id Executor 식별자
 * @param timestamp 생성 시각 (epoch millis)
 * @param connectorName 커넥터 이름
 * @param tradingPair 거래쌍
 * @param side 주문 방향 (BUY는 best bid, SELL은 best ask를 따라감)
 * @param amount 목표 체결 수량 (양수)
 * @param refreshThreshold 재주문 기준 가격 이탈률 (예: 0.001 = 0.1%, 0 이상)
 * @param updateInterval tick 간격
 * @param maxRetries 주문 실패 재시도 허용 횟수 (0 이상)
 * @param maxLostOrderChecks 분실 주문 확인 횟수 (0 이상)
 */
public record OrderChaserConfig(
    String id,
    long timestamp,
    String connectorName,
    String tradingPair,
    TradeType side,
    BigDecimal amount,
    BigDecimal refreshThreshold,
    Duration updateInterval,
    int maxRetries,
    int maxLostOrderChecks
) implements ExecutorConfig {

    public static final String TYPE = "order_chaser";

    /**
     * 기본값 생성자 (이탈률 0.1%, 1초 tick, 재시도 10회, 분실 확인 3회).
     */
    public OrderChaserConfig(
        String id,
        long timestamp,
        String connectorName,
        String tradingPair,
        TradeType side,
        BigDecimal amount
    ) {
        this(id, timestamp, connectorName, tradingPair, side, amount, new BigDecimal("0.001"),
            Duration.ofSeconds(1), 10, 3);
    }

    public OrderChaserConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (connectorName == null || connectorName.isBlank()) {
            throw new IllegalArgumentException("connectorName cannot be null or blank");
        }
        if (tradingPair == null || tradingPair.isBlank()) {
            throw new IllegalArgumentException("tradingPair cannot be null or blank");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive (current: " + amount + ")");
        }
        if (refreshThreshold == null || refreshThreshold.signum() < 0) {
            throw new IllegalArgumentException("refreshThreshold must not be negative (current: " + refreshThreshold + ")");
        }
        if (updateInterval == null || updateInterval.isNegative()) {
            throw new IllegalArgumentException("updateInterval must not be null or negative (current: " + updateInterval + ")");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative (current: " + maxRetries + ")");
        }
        if (maxLostOrderChecks < 0) {
            throw new IllegalArgumentException(
                "maxLostOrderChecks must not be negative (current: " + maxLostOrderChecks + ")"
            );
        }
    }

    @Override
    public String type() {
        return TYPE;
    }

    public OrderChaserConfig withRefreshThreshold(BigDecimal refreshThreshold) {
        return new OrderChaserConfig(id, timestamp, connectorName, tradingPair, side, amount, refreshThreshold,
            updateInterval, maxRetries, maxLostOrderChecks);
    }

    public OrderChaserConfig withUpdateInterval(Duration updateInterval) {
        return new OrderChaserConfig(id, timestamp, connectorName, tradingPair, side, amount, refreshThreshold,
            updateInterval, maxRetries, maxLostOrderChecks);
    }

    public OrderChaserConfig withMaxRetries(int maxRetries) {
        return new OrderChaserConfig(id, timestamp, connectorName, tradingPair, side, amount, refreshThreshold,
            updateInterval, maxRetries, maxLostOrderChecks);
    }
}
