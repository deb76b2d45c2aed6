package com.ryuqq.execution.core.event;

/**
 * 주문 이벤트.
 *
 * <p>거래소 커넥터가 발행하는 주문 생명주기 이벤트입니다. 모든 이벤트는 로컬 주문 ID를 가지며,
 * Executor는 이 ID로 자신이 추적 중인 주문인지 판단합니다.</p>
 *
 * <ul>
 *   <li>{@link OrderCreatedEvent}: 거래소 접수 완료</li>
 *   <li>{@link OrderFilledEvent}: 부분/전체 체결</li>
 *   <li>{@link OrderCompletedEvent}: 전량 체결 완료</li>
 *   <li>{@link OrderCanceledEvent}: 취소됨</li>
 *   <li>{@link OrderFailedEvent}: 접수/처리 실패</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface OrderEvent
    permits OrderCreatedEvent, OrderFilledEvent, OrderCompletedEvent, OrderCanceledEvent, OrderFailedEvent {

    /**
     * 로컬 주문 ID.
     *
     * @return 주문 ID
     */
    String orderId();

    /**
     * 이벤트 발생 시각.
     *
     * @return epoch millis
     */
    long timestamp();
}
