package com.ryuqq.execution.core.runnable;

/**
 * 생명주기 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 {@link RunnableStatus}의 전이가 전진 방향인지 검증하고,
 * 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NOT_STARTED → RUNNING</li>
 *   <li>NOT_STARTED → TERMINATED (시작 전 stop)</li>
 *   <li>RUNNING → SHUTTING_DOWN</li>
 *   <li>RUNNING → TERMINATED</li>
 *   <li>SHUTTING_DOWN → TERMINATED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(TERMINATED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>같은 상태로의 전이, 역방향 전이 불가</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunnableStatus from, RunnableStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        if (!to.isAfter(from)) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 가능 여부 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 전진 방향 전이이면 true
     */
    public static boolean isAllowed(RunnableStatus from, RunnableStatus to) {
        return from != null && to != null && !from.isTerminal() && to.isAfter(from);
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunnableStatus transition(RunnableStatus current, RunnableStatus next) {
        validate(current, next);
        return next;
    }
}
