package com.ryuqq.execution.core.pipe.connector;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 스트림 재연결 대기 시간 계산기 (Exponential Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, maxDelay=30s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1.0 ~ 1.1s</li>
 *   <li>attempt=3: 4.0 ~ 4.4s</li>
 *   <li>attempt=6 이상: 30s (maxDelay)</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1s, maxDelay=30s, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1);
    }

    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelay 첫 재시도 대기 시간 (양수)
     * @param maxDelay 최대 대기 시간 (baseDelay 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
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
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 연속 실패 횟수에 대한 대기 시간.
     *
     * @param attempt 연속 실패 횟수 (1부터 시작)
     * @return 다음 연결 시도 전 대기 시간
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }

        // shift가 커지면 long overflow가 나므로 maxDelay로 포화
        int shift = attempt - 1;
        long exponential;
        if (shift >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
            exponential = maxDelayMs;
        } else {
            exponential = Math.min(baseDelayMs << shift, maxDelayMs);
        }

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
