package com.ryuqq.execution.core.pipe.connector;

import com.ryuqq.execution.core.pipe.PutOptions;

import java.time.Duration;

/**
 * 커넥터 put 설정 (불변 record).
 *
 * <p>커넥터는 먼저 {@code putOptions}로 전달을 시도하고, 하류 Pipe가 가득 차서
 * 실패하면 WARN 로그 후 {@code fallbackPutOptions}로 한 번 더 시도합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param putOptions 첫 시도 설정 (기본: 즉시 실패)
 * @param fallbackPutOptions 두 번째 시도 설정 (기본: 100ms, 3회, 시도당 최대 1초)
 */
public record ConnectorConfig(PutOptions putOptions, PutOptions fallbackPutOptions) {

    private static final ConnectorConfig DEFAULTS = new ConnectorConfig();

    public ConnectorConfig() {
        this(PutOptions.defaults(), new PutOptions(Duration.ofMillis(100), 3, Duration.ofSeconds(1)));
    }

    public ConnectorConfig {
        if (putOptions == null) {
            throw new IllegalArgumentException("putOptions cannot be null");
        }
        if (fallbackPutOptions == null) {
            throw new IllegalArgumentException("fallbackPutOptions cannot be null");
        }
    }

    public static ConnectorConfig defaults() {
        return DEFAULTS;
    }

    public ConnectorConfig withPutOptions(PutOptions putOptions) {
        return new ConnectorConfig(putOptions, fallbackPutOptions);
    }

    public ConnectorConfig withFallbackPutOptions(PutOptions fallbackPutOptions) {
        return new ConnectorConfig(putOptions, fallbackPutOptions);
    }
}
