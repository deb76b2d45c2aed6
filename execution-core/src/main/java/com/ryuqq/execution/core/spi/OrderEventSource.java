package com.ryuqq.execution.core.spi;

import com.ryuqq.execution.core.event.OrderEventListener;

/**
 * Order Event Source SPI.
 *
 * <p>주문 이벤트를 구독자에게 fan-out합니다. 하나의 소스를 여러 Executor가 공유하며,
 * 각 Executor는 주문 ID로 자기 주문만 골라냅니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface OrderEventSource {

    /**
     * 구독 등록.
     *
     * @param listener 구독자
     * @return 해지 핸들 (close() 호출 시 구독 해지, 멱등)
     * @throws IllegalArgumentException listener가 null인 경우
     */
    Subscription subscribe(OrderEventListener listener);
}
