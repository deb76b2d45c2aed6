package com.ryuqq.execution.core.pipe.connector;

import java.time.Duration;

/**
 * 재연결 스트림 커넥터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseDelay: 첫 실패 후 대기 시간 (기본 1초)</li>
 *   <li>maxDelay: 대기 시간 상한 (기본 30초)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 *   <li>maxAttempts: 연속 실패 허용 횟수 (기본 0 = 무제한)</li>
 *   <li>connectorConfig: 스트림 단계의 put 설정</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record ReconnectConfig(
    Duration baseDelay,
    Duration maxDelay,
    double jitterFactor,
    int maxAttempts,
    ConnectorConfig connectorConfig
) {

    public ReconnectConfig() {
        this(Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1, 0, ConnectorConfig.defaults());
    }

    public ReconnectConfig {
        if (baseDelay == null || baseDelay.toMillis() <= 0) {
            throw new IllegalArgumentException("baseDelay must be positive (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative (current: " + maxAttempts + ")");
        }
        if (connectorConfig == null) {
            throw new IllegalArgumentException("connectorConfig cannot be null");
        }
    }

    /**
     * 이 설정의 대기 시간 계산기.
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseDelay, maxDelay, jitterFactor);
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    public ReconnectConfig withBaseDelay(Duration baseDelay) {
        return new ReconnectConfig(baseDelay, maxDelay, jitterFactor, maxAttempts, connectorConfig);
    }

    public ReconnectConfig withMaxDelay(Duration maxDelay) {
        return new ReconnectConfig(baseDelay, maxDelay, jitterFactor, maxAttempts, connectorConfig);
    }

    public ReconnectConfig withJitterFactor(double jitterFactor) {
        return new ReconnectConfig(baseDelay, maxDelay, jitterFactor, maxAttempts, connectorConfig);
    }

    public ReconnectConfig withMaxAttempts(int maxAttempts) {
        return new ReconnectConfig(baseDelay, maxDelay, jitterFactor, maxAttempts, connectorConfig);
    }

    public ReconnectConfig withConnectorConfig(ConnectorConfig connectorConfig) {
        return new ReconnectConfig(baseDelay, maxDelay, jitterFactor, maxAttempts, connectorConfig);
    }
}
