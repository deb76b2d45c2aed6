package com.ryuqq.execution.core.runnable;

/**
 * 주기 실행 워커(Runnable/Executor)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NOT_STARTED → RUNNING (start)</li>
 *   <li>RUNNING → SHUTTING_DOWN (stop / early stop)</li>
 *   <li>SHUTTING_DOWN → TERMINATED (종료 루틴 완료)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NOT_STARTED
 *    │
 *    ▼ (start)
 * RUNNING
 *    │
 *    ▼ (stop / earlyStop)
 * SHUTTING_DOWN
 *    │
 *    ▼ (루프 종료)
 * TERMINATED
 *
 * 금지된 전이:
 * - TERMINATED → * ❌
 * - SHUTTING_DOWN → RUNNING ❌
 * - RUNNING → NOT_STARTED ❌
 * </pre>
 *
 * <p>선언 순서가 곧 진행 순서입니다. {@link #isAfter(RunnableStatus)}는 이 순서를 기준으로 비교합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum RunnableStatus {

    /**
     * 생성됨 (아직 시작 안 됨).
     */
    NOT_STARTED,

    /**
     * 실행 중 (control tick 반복).
     */
    RUNNING,

    /**
     * 종료 진행 중.
     */
    SHUTTING_DOWN,

    /**
     * 종료됨 (최종 상태).
     */
    TERMINATED;

    /**
     * 종료 상태인지 확인.
     *
     * @return TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == TERMINATED;
    }

    /**
     * 활성 상태인지 확인 (RUNNING 또는 SHUTTING_DOWN).
     *
     * @return 루프가 아직 살아있어야 하는 상태이면 true
     */
    public boolean isActive() {
        return this == RUNNING || this == SHUTTING_DOWN;
    }

    /**
     * 이 상태가 other보다 진행된 상태인지 확인.
     *
     * @param other 비교 대상
     * @return 진행 순서상 뒤에 있으면 true
     */
    public boolean isAfter(RunnableStatus other) {
        return ordinal() > other.ordinal();
    }
}
