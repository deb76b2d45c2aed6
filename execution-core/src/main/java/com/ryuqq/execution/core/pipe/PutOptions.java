package com.ryuqq.execution.core.pipe;

import java.time.Duration;

/**
 * put 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>waitTime: 재시도 사이 대기 시간 (기본 0)</li>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 0 = 가득 차면 즉시 실패)</li>
 *   <li>maxWaitTimePerRetry: 시도당 대기 상한 (기본 10초)</li>
 * </ul>
 *
 * <p>버퍼가 계속 가득 차 있으면 총 대기 시간은 대략
 * {@code maxRetries * min(waitTime, maxWaitTimePerRetry)}입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param waitTime 재시도 사이 대기 시간 (음수 불가)
 * @param maxRetries 최대 재시도 횟수 (음수 불가)
 * @param maxWaitTimePerRetry 시도당 대기 상한 (음수 불가)
 */
public record PutOptions(Duration waitTime, int maxRetries, Duration maxWaitTimePerRetry) {

    private static final PutOptions DEFAULTS = new PutOptions();

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: waitTime=0, maxRetries=0, maxWaitTimePerRetry=10s</p>
     */
    public PutOptions() {
        this(Duration.ZERO, 0, Duration.ofSeconds(10));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PutOptions {
        if (waitTime == null || waitTime.isNegative()) {
            throw new IllegalArgumentException("waitTime must be non-negative (current: " + waitTime + ")");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (maxWaitTimePerRetry == null || maxWaitTimePerRetry.isNegative()) {
            throw new IllegalArgumentException(
                "maxWaitTimePerRetry must be non-negative (current: " + maxWaitTimePerRetry + ")"
            );
        }
    }

    /**
     * 기본 설정.
     *
     * @return 즉시 실패(fail-fast) 설정
     */
    public static PutOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 한 번의 재시도에서 실제로 대기할 시간.
     *
     * @return min(waitTime, maxWaitTimePerRetry)
     */
    public Duration retryDelay() {
        return waitTime.compareTo(maxWaitTimePerRetry) <= 0 ? waitTime : maxWaitTimePerRetry;
    }

    public PutOptions withWaitTime(Duration waitTime) {
        return new PutOptions(waitTime, maxRetries, maxWaitTimePerRetry);
    }

    public PutOptions withMaxRetries(int maxRetries) {
        return new PutOptions(waitTime, maxRetries, maxWaitTimePerRetry);
    }

    public PutOptions withMaxWaitTimePerRetry(Duration maxWaitTimePerRetry) {
        return new PutOptions(waitTime, maxRetries, maxWaitTimePerRetry);
    }
}
