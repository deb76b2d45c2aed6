package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.core.event.OrderCanceledEvent;
import com.ryuqq.execution.core.event.OrderCompletedEvent;
import com.ryuqq.execution.core.event.OrderFailedEvent;
import com.ryuqq.execution.core.executor.ExecutorBase;
import com.ryuqq.execution.core.executor.OrderPlacementException;
import com.ryuqq.execution.core.executor.TrackedOrder;
import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.PriceType;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.runnable.RunnableStatus;
import com.ryuqq.execution.core.spi.ExchangeConnector;
import com.ryuqq.execution.core.spi.OrderEventSource;
import org.slf4j.Logger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * 호가 추종 지정가 주문 Executor.
 *
 * <p>매수는 best bid, 매도는 best ask에 지정가 주문을 유지합니다. 호가가 주문 가격에서
 * {@code refreshThreshold} 이상 벗어나면 주문을 취소하고 새 호가로 다시 냅니다.
 * 누적 체결 수량이 목표에 닿으면 COMPLETED로 종료합니다.</p>
 *
 * <p>조기 종료 시에는 남은 주문을 취소한 뒤 종료합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class OrderChaserExecutor extends ExecutorBase {

    private final OrderChaserConfig config;
    private final List<String> chaseOrderIds = new CopyOnWriteArrayList<>();

    private volatile String activeOrderId;
    private volatile String cancelRequestedId;

    public OrderChaserExecutor(
        OrderChaserConfig config,
        Map<String, ExchangeConnector> connectors,
        OrderEventSource eventSource
    ) {
        this(config, connectors, eventSource, Clock.systemUTC(), null, null);
    }

    public OrderChaserExecutor(
        OrderChaserConfig config,
        Map<String, ExchangeConnector> connectors,
        OrderEventSource eventSource,
        Clock clock,
        Logger logger,
        ExecutorService loopExecutor
    ) {
        super(config, connectors, eventSource, clock, logger, loopExecutor);
        this.config = config;
    }

    @Override
    protected void onStart() throws Exception {
        super.onStart();
        logger().info("[{}] chasing {} {} {} on {}", getId(), config.side(), config.amount(), config.tradingPair(),
            config.connectorName());
    }

    @Override
    protected void controlTask() {
        RunnableStatus status = getStatus();
        if (status == RunnableStatus.RUNNING) {
            chase();
        } else if (status == RunnableStatus.SHUTTING_DOWN) {
            controlShutdownProcess();
        }
        evaluateMaxRetries();
    }

    private void chase() {
        if (getFilledAmount().compareTo(config.amount()) >= 0) {
            logger().info("[{}] target amount {} filled", getId(), config.amount());
            closeWith(CloseType.COMPLETED);
            stop();
            return;
        }

        Optional<BigDecimal> reference = getPrice(config.connectorName(), config.tradingPair(), referencePriceType());
        if (reference.isEmpty()) {
            logger().debug("[{}] no {} for {}, waiting", getId(), referencePriceType(), config.tradingPair());
            return;
        }

        TrackedOrder active = findOrder(activeOrderId).orElse(null);
        if (active == null || active.isDone()) {
            activeOrderId = null;
            placeChaseOrder(reference.get());
            return;
        }

        BigDecimal orderPrice = active.getOrder().price();
        if (!active.getOrderId().equals(cancelRequestedId) && drift(orderPrice, reference.get()).compareTo(config.refreshThreshold()) > 0) {
            logger().debug("[{}] top of book moved {} → {}, refreshing order {}",
                getId(), orderPrice, reference.get(), active.getOrderId());
            cancelRequestedId = active.getOrderId();
            cancelOrder(config.connectorName(), config.tradingPair(), active.getOrderId());
        }
    }

    private void placeChaseOrder(BigDecimal price) {
        BigDecimal remaining = config.amount().subtract(getFilledAmount());
        try {
            String orderId = placeOrder(config.connectorName(), config.tradingPair(), OrderType.LIMIT, config.side(),
                remaining, price);
            activeOrderId = orderId;
            chaseOrderIds.add(orderId);
        } catch (OrderPlacementException e) {
            int retries = incrementRetries();
            logger().warn("[{}] chase order not placed, retry {}/{}", getId(), retries, config.maxRetries());
        }
    }

    private void controlShutdownProcess() {
        markClosed();
        TrackedOrder active = findOrder(activeOrderId).orElse(null);
        if (active == null || active.isDone()) {
            stop();
            return;
        }
        if (!active.getOrderId().equals(cancelRequestedId)) {
            cancelRequestedId = active.getOrderId();
            cancelOrder(config.connectorName(), config.tradingPair(), active.getOrderId());
        }
        reconcileTrackedOrders();
    }

    private PriceType referencePriceType() {
        return config.side() == TradeType.BUY ? PriceType.BEST_BID : PriceType.BEST_ASK;
    }

    private static BigDecimal drift(BigDecimal orderPrice, BigDecimal reference) {
        if (orderPrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return reference.subtract(orderPrice).abs().divide(orderPrice, MathContext.DECIMAL64);
    }

    @Override
    protected void onOrderCompleted(TrackedOrder order, OrderCompletedEvent event) {
        clearIfActive(order);
    }

    @Override
    protected void onOrderCanceled(TrackedOrder order, OrderCanceledEvent event) {
        clearIfActive(order);
    }

    @Override
    protected void onOrderFailed(TrackedOrder order, OrderFailedEvent event) {
        if (order.getOrderId().equals(activeOrderId)) {
            activeOrderId = null;
            int retries = incrementRetries();
            logger().error("[{}] chase order {} failed, retrying {}/{}", getId(), order.getOrderId(), retries,
                config.maxRetries());
        }
    }

    private void clearIfActive(TrackedOrder order) {
        if (order.getOrderId().equals(activeOrderId)) {
            activeOrderId = null;
        }
    }

    /**
     * 지금까지 낸 모든 추종 주문의 누적 체결 수량.
     */
    public BigDecimal getFilledAmount() {
        BigDecimal filled = BigDecimal.ZERO;
        for (String id : chaseOrderIds) {
            filled = filled.add(findOrder(id).map(TrackedOrder::getExecutedAmountBase).orElse(BigDecimal.ZERO));
        }
        return filled;
    }

    public Optional<String> getActiveOrderId() {
        return Optional.ofNullable(activeOrderId);
    }

    public List<String> getChaseOrderIds() {
        return List.copyOf(chaseOrderIds);
    }

    @Override
    protected Map<String, Object> getCustomInfo() {
        return Map.of(
            "side", config.side(),
            "targetAmount", config.amount(),
            "filledAmount", getFilledAmount(),
            "ordersPlaced", chaseOrderIds.size(),
            "currentRetries", getCurrentRetries()
        );
    }
}
