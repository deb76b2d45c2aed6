package com.ryuqq.execution.core.executor;

import java.time.Duration;

/**
 * Executor 설정.
 *
 * <p>구체 Executor마다 자기 설정 record가 이 인터페이스를 구현합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface ExecutorConfig {

    /**
     * Executor 식별자.
     */
    String id();

    /**
     * Executor 유형 (예: position_executor). Orchestrator가 팩토리를 고를 때 사용합니다.
     */
    String type();

    /**
     * 생성 시각 (epoch millis).
     */
    long timestamp();

    /**
     * control tick 간격.
     */
    default Duration updateInterval() {
        return Duration.ofSeconds(1);
    }

    /**
     * 주문 실패 재시도 허용 횟수.
     */
    default int maxRetries() {
        return 10;
    }

    /**
     * 주문이 거래소에서 조회되지 않을 때 FAILED로 처리하기 전까지 허용하는 확인 횟수.
     */
    default int maxLostOrderChecks() {
        return 3;
    }
}
