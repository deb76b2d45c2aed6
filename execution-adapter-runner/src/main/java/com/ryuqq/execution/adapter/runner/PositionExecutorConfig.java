package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.core.executor.ExecutorConfig;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * PositionExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>connectorName / tradingPair: 주문을 낼 커넥터와 거래쌍</li>
 *   <li>side / amount: 진입 방향과 수량</li>
 *   <li>entryPrice: LIMIT 진입 가격 (MARKET 진입이면 null 허용)</li>
 *   <li>tripleBarrier: 청산 조건</li>
 *   <li>updateInterval: control tick 간격 (기본 1초)</li>
 *   <li>maxRetries: 주문 실패 재시도 허용 횟수 (기본 10)</li>
 *   <li>maxLostOrderChecks: 분실 주문 확인 횟수 (기본 3)</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param id Executor 식별자
 * @param timestamp 생성 시각 (epoch millis, time limit 기준)
 * @param connectorName 커넥터 이름
 * @param tradingPair 거래쌍
 * @param side 진입 방향
 * @param amount 진입 수량 (양수)
 * @param entryPrice LIMIT 진입 가격
 * @param tripleBarrier 청산 조건
 * @param updateInterval tick 간격
 * @param maxRetries 재시도 허용 횟수 (0 이상)
 * @param maxLostOrderChecks 분실 주문 확인 횟수 (0 이상)
 */
public record PositionExecutorConfig(
    String id,
    long timestamp,
    String connectorName,
    String tradingPair,
    TradeType side,
    BigDecimal amount,
    BigDecimal entryPrice,
    TripleBarrierConfig tripleBarrier,
    Duration updateInterval,
    int maxRetries,
    int maxLostOrderChecks
) implements ExecutorConfig {

    public static final String TYPE = "position_executor";

    /**
     * 기본값 생성자 (barrier 없음, 시장가 진입, 1초 tick, 재시도 10회, 분실 확인 3회).
     */
    public PositionExecutorConfig(
        String id,
        long timestamp,
        String connectorName,
        String tradingPair,
        TradeType side,
        BigDecimal amount
    ) {
        this(id, timestamp, connectorName, tradingPair, side, amount, null, new TripleBarrierConfig(),
            Duration.ofSeconds(1), 10, 3);
    }

    public PositionExecutorConfig {
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
        if (tripleBarrier == null) {
            throw new IllegalArgumentException("tripleBarrier cannot be null");
        }
        if (tripleBarrier.openOrderType() == OrderType.LIMIT && (entryPrice == null || entryPrice.signum() <= 0)) {
            throw new IllegalArgumentException("entryPrice must be positive for LIMIT entries (current: " + entryPrice + ")");
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

    public PositionExecutorConfig withEntryPrice(BigDecimal entryPrice) {
        return new PositionExecutorConfig(id, timestamp, connectorName, tradingPair, side, amount, entryPrice,
            tripleBarrier, updateInterval, maxRetries, maxLostOrderChecks);
    }

    public PositionExecutorConfig withTripleBarrier(TripleBarrierConfig tripleBarrier) {
        return new PositionExecutorConfig(id, timestamp, connectorName, tradingPair, side, amount, entryPrice,
            tripleBarrier, updateInterval, maxRetries, maxLostOrderChecks);
    }

    public PositionExecutorConfig withUpdateInterval(Duration updateInterval) {
        return new PositionExecutorConfig(id, timestamp, connectorName, tradingPair, side, amount, entryPrice,
            tripleBarrier, updateInterval, maxRetries, maxLostOrderChecks);
    }

    public PositionExecutorConfig withMaxRetries(int maxRetries) {
        return new PositionExecutorConfig(id, timestamp, connectorName, tradingPair, side, amount, entryPrice,
            tripleBarrier, updateInterval, maxRetries, maxLostOrderChecks);
    }

    public PositionExecutorConfig withMaxLostOrderChecks(int maxLostOrderChecks) {
        return new PositionExecutorConfig(id, timestamp, connectorName, tradingPair, side, amount, entryPrice,
            tripleBarrier, updateInterval, maxRetries, maxLostOrderChecks);
    }
}
