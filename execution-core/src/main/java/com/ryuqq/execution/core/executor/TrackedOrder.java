package com.ryuqq.execution.core.executor;

import com.ryuqq.execution.core.event.OrderCompletedEvent;
import com.ryuqq.execution.core.event.OrderCreatedEvent;
import com.ryuqq.execution.core.event.OrderFilledEvent;
import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.OrderState;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Executor가 추적하는 주문.
 *
 * <p>로컬 주문 ID와 거래소 주문 ID, 그리고 마지막으로 알려진 주문 스냅샷({@link InFlightOrder})을
 * 연결합니다. 이벤트 처리 스레드와 Executor 루프 스레드가 함께 접근하므로 모든 갱신은
 * 인스턴스 모니터 아래에서 수행됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class TrackedOrder {

    private final String orderId;
    private final String connectorName;
    private InFlightOrder order;
    private int lostCount;

    public TrackedOrder(String orderId, String connectorName, InFlightOrder order) {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (connectorName == null || connectorName.isBlank()) {
            throw new IllegalArgumentException("connectorName cannot be null or blank");
        }
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
        this.orderId = orderId;
        this.connectorName = connectorName;
        this.order = order;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getConnectorName() {
        return connectorName;
    }

    public synchronized InFlightOrder getOrder() {
        return order;
    }

    public String getTradingPair() {
        return getOrder().tradingPair();
    }

    public TradeType getTradeType() {
        return getOrder().tradeType();
    }

    public OrderType getOrderType() {
        return getOrder().orderType();
    }

    public synchronized String getExchangeOrderId() {
        return order.exchangeOrderId();
    }

    public synchronized OrderState getState() {
        return order.state();
    }

    public synchronized BigDecimal getExecutedAmountBase() {
        return order.executedAmountBase();
    }

    public synchronized BigDecimal getExecutedAmountQuote() {
        return order.executedAmountQuote();
    }

    public synchronized BigDecimal getCumulativeFeeQuote() {
        return order.cumulativeFeeQuote();
    }

    /**
     * 평균 체결가.
     *
     * @return 체결 quote / 체결 base (체결이 없으면 0)
     */
    public synchronized BigDecimal getAverageExecutedPrice() {
        if (order.executedAmountBase().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return order.executedAmountQuote().divide(order.executedAmountBase(), MathContext.DECIMAL64);
    }

    public synchronized boolean isDone() {
        return order.isDone();
    }

    public synchronized boolean isFilled() {
        return order.isFilled();
    }

    public synchronized boolean isOpen() {
        return order.state() == OrderState.OPEN || order.state() == OrderState.PARTIALLY_FILLED;
    }

    public synchronized int getLostCount() {
        return lostCount;
    }

    synchronized void applyCreated(OrderCreatedEvent event) {
        OrderState next = order.state() == OrderState.PENDING_CREATE ? OrderState.OPEN : order.state();
        order = new InFlightOrder(order.clientOrderId(), event.exchangeOrderId(), order.tradingPair(),
            order.orderType(), order.tradeType(), order.price(), order.amount(), order.executedAmountBase(),
            order.executedAmountQuote(), order.cumulativeFeeQuote(), next, order.creationTimestamp());
    }

    synchronized void applyFill(OrderFilledEvent event) {
        order = order.withFill(event.amount(), event.price(), event.feeQuote());
    }

    /**
     * 완료 이벤트 반영.
     *
     * <p>개별 체결 이벤트를 놓친 경우를 대비해 완료 이벤트의 누적 수량이 더 크면 그 값을 사용합니다.</p>
     */
    synchronized void applyCompleted(OrderCompletedEvent event) {
        BigDecimal base = order.executedAmountBase().max(event.baseAmount());
        BigDecimal quote = order.executedAmountQuote().max(event.quoteAmount());
        order = new InFlightOrder(order.clientOrderId(), order.exchangeOrderId(), order.tradingPair(),
            order.orderType(), order.tradeType(), order.price(), order.amount(), base, quote,
            order.cumulativeFeeQuote(), OrderState.FILLED, order.creationTimestamp());
    }

    synchronized void applyState(OrderState state) {
        order = order.withState(state);
    }

    synchronized void applySnapshot(InFlightOrder snapshot) {
        order = snapshot;
        lostCount = 0;
    }

    synchronized int markLost() {
        return ++lostCount;
    }

    @Override
    public synchronized String toString() {
        return "TrackedOrder{orderId='" + orderId + "', connector='" + connectorName + "', state=" + order.state()
            + ", executedBase=" + order.executedAmountBase() + ", lost=" + lostCount + "}";
    }
}
