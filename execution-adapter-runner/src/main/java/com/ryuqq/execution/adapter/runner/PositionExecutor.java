package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.core.event.OrderCanceledEvent;
import com.ryuqq.execution.core.event.OrderFailedEvent;
import com.ryuqq.execution.core.executor.ExecutorBase;
import com.ryuqq.execution.core.executor.OrderPlacementException;
import com.ryuqq.execution.core.executor.TrackedOrder;
import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.runnable.RunnableStatus;
import com.ryuqq.execution.core.spi.ExchangeConnector;
import com.ryuqq.execution.core.spi.OrderEventSource;
import org.slf4j.Logger;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * Triple barrier 포지션 Executor.
 *
 * <p>진입 주문 하나로 포지션을 열고, 손절/익절/시간 제한 중 하나에 닿으면 시장가 주문으로 청산합니다.</p>
 *
 * <p><strong>tick 흐름:</strong></p>
 * <pre>
 * RUNNING:
 *   1. 진입 주문이 없으면 진입 주문 (MARKET 또는 LIMIT @ entryPrice)
 *   2. 진입 주문이 전량 체결되었으면 stop loss → take profit 확인
 *   3. time limit 확인
 *   barrier 도달 → 미체결 진입 주문 취소 + 시장가 청산 주문 → SHUTTING_DOWN
 *
 * SHUTTING_DOWN:
 *   - 미완료 주문이 있으면 취소 요청 + 분실 주문 점검
 *   - POSITION_HOLD면 포지션을 남기고 종료
 *   - 진입/청산 수량이 맞으면 종료
 *   - 아니면 잔량 청산 주문 재시도 (재시도 횟수 증가)
 *
 * 매 tick 마지막: 재시도 예산 초과 시 FAILED로 종료
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PositionExecutor extends ExecutorBase {

    private final PositionExecutorConfig config;
    private final List<String> closeOrderIds = new CopyOnWriteArrayList<>();
    private final List<String> heldPositionOrderIds = new CopyOnWriteArrayList<>();

    private volatile String openOrderId;
    private volatile String closeOrderId;

    public PositionExecutor(
        PositionExecutorConfig config,
        Map<String, ExchangeConnector> connectors,
        OrderEventSource eventSource
    ) {
        this(config, connectors, eventSource, Clock.systemUTC(), null, null);
    }

    public PositionExecutor(
        PositionExecutorConfig config,
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
        if (isExpired()) {
            logger().info("[{}] position expired before start, stopping", getId());
            closeWith(CloseType.EXPIRED);
            stop();
        }
    }

    @Override
    protected void controlTask() {
        RunnableStatus status = getStatus();
        if (status == RunnableStatus.RUNNING) {
            controlOpenOrder();
            controlBarriers();
        } else if (status == RunnableStatus.SHUTTING_DOWN) {
            controlShutdownProcess();
        }
        evaluateMaxRetries();
    }

    // ========================================
    // RUNNING
    // ========================================

    private void controlOpenOrder() {
        if (openOrderId != null) {
            return;
        }
        OrderType orderType = config.tripleBarrier().openOrderType();
        BigDecimal price = orderType == OrderType.MARKET ? null : config.entryPrice();
        try {
            openOrderId = placeOrder(config.connectorName(), config.tradingPair(), orderType, config.side(),
                config.amount(), price);
            logger().debug("[{}] placed open order {}", getId(), openOrderId);
        } catch (OrderPlacementException e) {
            int retries = incrementRetries();
            logger().warn("[{}] open order not placed, retry {}/{}", getId(), retries, config.maxRetries());
        }
    }

    private void controlBarriers() {
        TrackedOrder open = findOrder(openOrderId).orElse(null);
        if (open != null && open.isFilled()) {
            controlStopLoss();
            controlTakeProfit();
        }
        controlTimeLimit();
    }

    private void controlStopLoss() {
        BigDecimal stopLoss = config.tripleBarrier().stopLoss();
        if (stopLoss != null && getStatus() == RunnableStatus.RUNNING
            && getNetPnlPct().compareTo(stopLoss.negate()) <= 0) {
            placeCloseOrderAndCancelOpenOrders(CloseType.STOP_LOSS);
        }
    }

    private void controlTakeProfit() {
        BigDecimal takeProfit = config.tripleBarrier().takeProfit();
        if (takeProfit != null && getStatus() == RunnableStatus.RUNNING
            && getNetPnlPct().compareTo(takeProfit) >= 0) {
            placeCloseOrderAndCancelOpenOrders(CloseType.TAKE_PROFIT);
        }
    }

    private void controlTimeLimit() {
        if (getStatus() == RunnableStatus.RUNNING && isExpired()) {
            placeCloseOrderAndCancelOpenOrders(CloseType.TIME_LIMIT);
        }
    }

    private void placeCloseOrderAndCancelOpenOrders(CloseType closeType) {
        cancelOpenOrders();
        BigDecimal amountToClose = getAmountToClose();
        if (amountToClose.signum() > 0 && closeType != CloseType.POSITION_HOLD) {
            placeCloseOrder(amountToClose);
        }
        logger().info("[{}] closing position: {}", getId(), closeType);
        closeWith(closeType);
    }

    private void placeCloseOrder(BigDecimal amount) {
        try {
            String orderId = placeOrder(config.connectorName(), config.tradingPair(), OrderType.MARKET,
                getCloseSide(), amount, null);
            closeOrderId = orderId;
            closeOrderIds.add(orderId);
            logger().debug("[{}] placed close order {} for {}", getId(), orderId, amount);
        } catch (OrderPlacementException e) {
            int retries = incrementRetries();
            logger().warn("[{}] close order not placed, retry {}/{}", getId(), retries, config.maxRetries());
        }
    }

    private void cancelOpenOrders() {
        TrackedOrder open = findOrder(openOrderId).orElse(null);
        if (open != null && !open.isDone()) {
            cancelOrder(config.connectorName(), config.tradingPair(), open.getOrderId());
        }
    }

    // ========================================
    // SHUTTING_DOWN
    // ========================================

    private void controlShutdownProcess() {
        markClosed();
        if (!allOrdersCompleted()) {
            cancelOpenOrders();
            reconcileTrackedOrders();
            return;
        }

        if (getCloseType() == CloseType.POSITION_HOLD) {
            TrackedOrder open = findOrder(openOrderId).orElse(null);
            if (open != null && open.getExecutedAmountBase().signum() > 0) {
                heldPositionOrderIds.add(open.getOrderId());
            }
            for (String id : closeOrderIds) {
                if (findOrder(id).map(o -> o.getExecutedAmountBase().signum() > 0).orElse(false)) {
                    heldPositionOrderIds.add(id);
                }
            }
            if (heldPositionOrderIds.isEmpty()) {
                closeWith(CloseType.EARLY_STOP);
            }
            stop();
        } else if (openAndCloseVolumeMatch()) {
            stop();
        } else {
            placeCloseOrder(getAmountToClose());
            incrementRetries();
        }
    }

    private boolean allOrdersCompleted() {
        boolean openDone = findOrder(openOrderId).map(TrackedOrder::isDone).orElse(true);
        boolean closeDone = findOrder(closeOrderId).map(TrackedOrder::isDone).orElse(true);
        return openDone && closeDone;
    }

    private boolean openAndCloseVolumeMatch() {
        BigDecimal opened = getOpenFilledAmount();
        return opened.signum() == 0 || getCloseFilledAmount().compareTo(opened) >= 0;
    }

    // ========================================
    // 이벤트 hook
    // ========================================

    @Override
    protected void onOrderCanceled(TrackedOrder order, OrderCanceledEvent event) {
        if (order.getOrderId().equals(openOrderId) && order.getExecutedAmountBase().signum() == 0) {
            openOrderId = null;
        }
    }

    @Override
    protected void onOrderFailed(TrackedOrder order, OrderFailedEvent event) {
        if (order.getOrderId().equals(openOrderId)) {
            openOrderId = null;
            int retries = incrementRetries();
            logger().error("[{}] open order {} failed, retrying {}/{}", getId(), order.getOrderId(), retries,
                config.maxRetries());
        } else if (order.getOrderId().equals(closeOrderId)) {
            int retries = incrementRetries();
            logger().error("[{}] close order {} failed, retrying {}/{}", getId(), order.getOrderId(), retries,
                config.maxRetries());
        }
    }

    // ========================================
    // 조회
    // ========================================

    public boolean isExpired() {
        return config.tripleBarrier().timeLimit() != null
            && clock().millis() >= config.timestamp() + config.tripleBarrier().timeLimit().toMillis();
    }

    public BigDecimal getOpenFilledAmount() {
        return findOrder(openOrderId).map(TrackedOrder::getExecutedAmountBase).orElse(BigDecimal.ZERO);
    }

    public BigDecimal getCloseFilledAmount() {
        BigDecimal closed = BigDecimal.ZERO;
        for (String id : closeOrderIds) {
            closed = closed.add(findOrder(id).map(TrackedOrder::getExecutedAmountBase).orElse(BigDecimal.ZERO));
        }
        return closed;
    }

    public BigDecimal getAmountToClose() {
        return getOpenFilledAmount().subtract(getCloseFilledAmount()).max(BigDecimal.ZERO);
    }

    public TradeType getCloseSide() {
        return config.side() == TradeType.BUY ? TradeType.SELL : TradeType.BUY;
    }

    public String getOpenOrderId() {
        return openOrderId;
    }

    public List<String> getCloseOrderIds() {
        return List.copyOf(closeOrderIds);
    }

    public List<String> getHeldPositionOrderIds() {
        return List.copyOf(heldPositionOrderIds);
    }

    @Override
    protected boolean isTrading() {
        return getStatus().isActive() && getOpenFilledAmount().signum() > 0;
    }

    @Override
    protected Map<String, Object> getCustomInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("side", config.side());
        info.put("currentPositionAveragePrice",
            findOrder(openOrderId).map(TrackedOrder::getAverageExecutedPrice).orElse(BigDecimal.ZERO));
        info.put("openFilledAmount", getOpenFilledAmount());
        info.put("closeFilledAmount", getCloseFilledAmount());
        info.put("currentRetries", getCurrentRetries());
        info.put("maxRetries", config.maxRetries());
        info.put("heldPositionOrders", getHeldPositionOrderIds());
        return info;
    }
}
