package com.ryuqq.execution.core.event;

/**
 * 주문 이벤트 구독자.
 *
 * @author Execution Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OrderEventListener {

    /**
     * 이벤트 수신.
     *
     * <p>구독자는 자신과 무관한 이벤트도 받을 수 있으며, 이 경우 조용히 무시해야 합니다.</p>
     *
     * @param event 주문 이벤트
     */
    void onEvent(OrderEvent event);
}
