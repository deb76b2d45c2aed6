package com.ryuqq.execution.core.executor;

import com.ryuqq.execution.core.event.OrderCanceledEvent;
import com.ryuqq.execution.core.event.OrderCompletedEvent;
import com.ryuqq.execution.core.event.OrderCreatedEvent;
import com.ryuqq.execution.core.event.OrderEvent;
import com.ryuqq.execution.core.event.OrderFailedEvent;
import com.ryuqq.execution.core.event.OrderFilledEvent;
import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.OrderBook;
import com.ryuqq.execution.core.model.OrderState;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.PriceType;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.runnable.RunnableBase;
import com.ryuqq.execution.core.runnable.RunnableStatus;
import com.ryuqq.execution.core.spi.ExchangeConnector;
import com.ryuqq.execution.core.spi.OrderEventSource;
import com.ryuqq.execution.core.spi.Subscription;
import org.slf4j.Logger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 하나의 트레이딩 결정을 책임지는 Executor의 기반 클래스.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>주문 실행 래핑: {@link #placeOrder}가 커넥터에 주문을 넣고 추적 목록에 등록</li>
 *   <li>이벤트 필터링: 공유 이벤트 버스의 주문 이벤트 중 자기 주문만 처리</li>
 *   <li>손익 계산: 추적 주문들로부터 순손익/수수료를 호출 시점에 계산</li>
 *   <li>감독 인터페이스: {@link #getExecutorInfo()} 스냅샷과 {@link #earlyStop(boolean)}</li>
 * </ul>
 *
 * <p><strong>이벤트 구독:</strong> {@link #onStart()}에서 {@link OrderEventSource}를 구독하고
 * {@link #onStop()}에서 해지합니다. 하위 클래스가 이 hook을 재정의할 때는 super를 호출해야 합니다.</p>
 *
 * <p><strong>동시성:</strong> 추적 주문 목록은 루프 스레드(control tick)와 이벤트 전달 스레드가
 * 함께 변경하므로 하나의 잠금 아래에서만 변경됩니다. 하위 클래스 hook
 * ({@code onOrderXxx})은 잠금 밖에서 호출됩니다.</p>
 *
 * <p><strong>주문 등록 전 이벤트:</strong> 커넥터는 {@code buy/sell}이 반환되기 전에 이벤트를 보낼 수 있습니다.
 * 주문 실행이 진행 중인 동안 모르는 주문 ID의 이벤트는 보류되고, 주문이 등록되면 도착 순서대로
 * 다시 처리됩니다. 진행 중인 주문 실행이 모두 끝난 뒤에도 주인이 없는 보류 이벤트는 버립니다.</p>
 *
 * <p><strong>실패 처리:</strong> 주문 거부는 FAILED 추적 주문으로 기록되고 {@link #onOrderFailed}
 * hook을 거친 뒤 {@link OrderPlacementException}으로 전파됩니다. 재시도, 종료, 포지션 유지 여부는
 * 구체 Executor의 {@link #controlTask()}가 결정합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public abstract class ExecutorBase extends RunnableBase {

    private final ExecutorConfig config;
    private final Map<String, ExchangeConnector> connectors;
    private final OrderEventSource eventSource;
    private final Clock clock;

    private final Object orderLock = new Object();
    private final Map<String, TrackedOrder> activeOrders = new LinkedHashMap<>();
    private final List<TrackedOrder> finishedOrders = new ArrayList<>();
    private final List<TrackedOrder> failedOrders = new ArrayList<>();
    private final List<TrackedOrder> placedOrders = new ArrayList<>();
    private final List<OrderEvent> heldEvents = new ArrayList<>();
    private final Set<String> replayingOrders = new HashSet<>();
    private int placementsInFlight;

    private final AtomicInteger currentRetries = new AtomicInteger();
    private final AtomicLong rejectedSequence = new AtomicLong();

    private volatile Subscription subscription;
    private volatile CloseType closeType;
    private volatile long closeTimestamp;

    /**
     * 생성자 (시스템 시계, 기본 로거, 전용 루프 스레드).
     *
     * @param config Executor 설정
     * @param connectors 커넥터 이름 → 커넥터
     * @param eventSource 주문 이벤트 구독 대상
     */
    protected ExecutorBase(ExecutorConfig config, Map<String, ExchangeConnector> connectors, OrderEventSource eventSource) {
        this(config, connectors, eventSource, Clock.systemUTC(), null, null);
    }

    /**
     * 생성자.
     *
     * @param config Executor 설정
     * @param connectors 커넥터 이름 → 커넥터
     * @param eventSource 주문 이벤트 구독 대상
     * @param clock 시계 (종료 시각, 주문 생성 시각)
     * @param logger 로거 (null이면 클래스 로거 사용)
     * @param loopExecutor 루프 실행기 (null이면 전용 데몬 스레드)
     * @throws IllegalArgumentException 필수 파라미터가 null인 경우
     */
    protected ExecutorBase(
        ExecutorConfig config,
        Map<String, ExchangeConnector> connectors,
        OrderEventSource eventSource,
        Clock clock,
        Logger logger,
        ExecutorService loopExecutor
    ) {
        super(requireConfig(config).id(), config.updateInterval(), logger, loopExecutor);
        if (connectors == null) {
            throw new IllegalArgumentException("connectors cannot be null");
        }
        if (eventSource == null) {
            throw new IllegalArgumentException("eventSource cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.connectors = Map.copyOf(connectors);
        this.eventSource = eventSource;
        this.clock = clock;
    }

    private static ExecutorConfig requireConfig(ExecutorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    @Override
    protected void onStart() throws Exception {
        subscription = eventSource.subscribe(this::dispatch);
        logger().debug("[{}] subscribed to order events", getId());
    }

    @Override
    protected void onStop() {
        Subscription current = subscription;
        if (current != null) {
            current.close();
            subscription = null;
            logger().debug("[{}] unsubscribed from order events", getId());
        }
    }

    // ========================================
    // 주문 실행
    // ========================================

    /**
     * 주문 실행.
     *
     * @param connectorName 커넥터 이름
     * @param tradingPair 거래쌍
     * @param orderType 주문 유형
     * @param side 매수/매도
     * @param amount 수량 (양수)
     * @param price 가격 (MARKET이 아니면 양수, MARKET이면 무시)
     * @return 커넥터가 보고한 주문 ID
     * @throws IllegalArgumentException 수량/가격 검증 실패 시
     * @throws CollaboratorNotFoundException 등록되지 않은 커넥터인 경우
     * @throws OrderPlacementException 커넥터가 주문을 거부한 경우
     */
    public String placeOrder(
        String connectorName,
        String tradingPair,
        OrderType orderType,
        TradeType side,
        BigDecimal amount,
        BigDecimal price
    ) {
        if (tradingPair == null || tradingPair.isBlank()) {
            throw new IllegalArgumentException("tradingPair cannot be null or blank");
        }
        if (orderType == null || side == null) {
            throw new IllegalArgumentException("orderType and side cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive (current: " + amount + ")");
        }
        if (orderType.requiresPrice() && (price == null || price.signum() <= 0)) {
            throw new IllegalArgumentException(
                "price must be positive for " + orderType + " orders (current: " + price + ")"
            );
        }
        ExchangeConnector connector = connector(connectorName);

        synchronized (orderLock) {
            placementsInFlight++;
        }
        String orderId;
        try {
            orderId = side == TradeType.BUY
                ? connector.buy(tradingPair, amount, orderType, price)
                : connector.sell(tradingPair, amount, orderType, price);
        } catch (RuntimeException e) {
            finishPlacement(null);
            logger().error("[{}] {} {} order rejected by {} ({} {} @ {})",
                getId(), orderType, side, connectorName, tradingPair, amount, price, e);
            recordRejectedOrder(connectorName, tradingPair, orderType, side, amount, price, e);
            throw new OrderPlacementException(
                "Order rejected by " + connectorName + ": " + side + " " + amount + " " + tradingPair, e
            );
        }

        InFlightOrder initial = new InFlightOrder(orderId, null, tradingPair, orderType, side, price, amount,
            null, null, null, OrderState.PENDING_CREATE, clock.millis());
        TrackedOrder tracked = new TrackedOrder(orderId, connectorName, initial);
        synchronized (orderLock) {
            activeOrders.put(orderId, tracked);
            placedOrders.add(tracked);
        }
        logger().debug("[{}] placed {} {} order {} ({} {} @ {})",
            getId(), orderType, side, orderId, tradingPair, amount, price);
        finishPlacement(orderId);
        return orderId;
    }

    /**
     * 주문 실행 종료 처리: 등록된 주문의 보류 이벤트를 재처리하고, 마지막 실행이면 남은 보류 이벤트를 버립니다.
     *
     * @param orderId 등록된 주문 ID (거부된 경우 null)
     */
    private void finishPlacement(String orderId) {
        List<OrderEvent> dropped = new ArrayList<>();
        synchronized (orderLock) {
            placementsInFlight--;
            if (orderId != null) {
                replayingOrders.add(orderId);
            }
            if (placementsInFlight == 0) {
                Iterator<OrderEvent> it = heldEvents.iterator();
                while (it.hasNext()) {
                    OrderEvent held = it.next();
                    if (!held.orderId().equals(orderId) && !replayingOrders.contains(held.orderId())) {
                        dropped.add(held);
                        it.remove();
                    }
                }
            }
        }
        for (OrderEvent event : dropped) {
            logger().debug("[{}] dropping {} for untracked order {}",
                getId(), event.getClass().getSimpleName(), event.orderId());
        }
        if (orderId == null) {
            return;
        }

        while (true) {
            List<OrderEvent> batch = new ArrayList<>();
            synchronized (orderLock) {
                Iterator<OrderEvent> it = heldEvents.iterator();
                while (it.hasNext()) {
                    OrderEvent held = it.next();
                    if (held.orderId().equals(orderId)) {
                        batch.add(held);
                        it.remove();
                    }
                }
                if (batch.isEmpty()) {
                    replayingOrders.remove(orderId);
                    return;
                }
            }
            logger().debug("[{}] replaying {} event(s) received before order {} was registered",
                getId(), batch.size(), orderId);
            for (OrderEvent event : batch) {
                applyEvent(event);
            }
        }
    }

    /**
     * 주문 실행 중 도착한 모르는 주문의 이벤트, 또는 재처리 중인 주문의 이벤트를 보류합니다.
     *
     * @return 보류했으면 true
     */
    private boolean holdIfUnregistered(OrderEvent event) {
        synchronized (orderLock) {
            boolean replaying = replayingOrders.contains(event.orderId());
            boolean awaitingPlacement = placementsInFlight > 0 && !activeOrders.containsKey(event.orderId());
            if (replaying || awaitingPlacement) {
                heldEvents.add(event);
                return true;
            }
            return false;
        }
    }

    /**
     * 주문 취소 요청. 결과는 취소 이벤트로 전달됩니다.
     *
     * @param connectorName 커넥터 이름
     * @param tradingPair 거래쌍
     * @param orderId 주문 ID
     */
    public void cancelOrder(String connectorName, String tradingPair, String orderId) {
        connector(connectorName).cancel(tradingPair, orderId);
        logger().debug("[{}] cancel requested for order {}", getId(), orderId);
    }

    // ========================================
    // 조회 (읽기 전용 위임)
    // ========================================

    public Optional<BigDecimal> getPrice(String connectorName, String tradingPair, PriceType priceType) {
        return connector(connectorName).getPrice(tradingPair, priceType);
    }

    public Optional<OrderBook> getOrderBook(String connectorName, String tradingPair) {
        return connector(connectorName).getOrderBook(tradingPair);
    }

    public BigDecimal getBalance(String connectorName, String asset) {
        return nonNull(connector(connectorName).getBalance(asset));
    }

    public BigDecimal getAvailableBalance(String connectorName, String asset) {
        return nonNull(connector(connectorName).getAvailableBalance(asset));
    }

    public Optional<InFlightOrder> getInFlightOrder(String connectorName, String orderId) {
        return connector(connectorName).getInFlightOrder(orderId);
    }

    // ========================================
    // 이벤트 처리
    // ========================================

    /**
     * 주문 생성 이벤트. 추적 중이 아닌 주문이면 아무 일도 하지 않습니다.
     */
    public void processOrderCreatedEvent(OrderCreatedEvent event) {
        if (!holdIfUnregistered(event)) {
            handleCreated(event);
        }
    }

    private void handleCreated(OrderCreatedEvent event) {
        TrackedOrder tracked = findActive(event.orderId());
        if (tracked == null) {
            return;
        }
        synchronized (orderLock) {
            tracked.applyCreated(event);
        }
        onOrderCreated(tracked, event);
    }

    /**
     * 체결 이벤트. 추적 중이 아닌 주문이면 아무 일도 하지 않습니다.
     */
    public void processOrderFilledEvent(OrderFilledEvent event) {
        if (!holdIfUnregistered(event)) {
            handleFilled(event);
        }
    }

    private void handleFilled(OrderFilledEvent event) {
        TrackedOrder tracked = findActive(event.orderId());
        if (tracked == null) {
            return;
        }
        synchronized (orderLock) {
            tracked.applyFill(event);
        }
        onOrderFilled(tracked, event);
    }

    /**
     * 완료 이벤트. 주문을 활성 목록에서 내립니다.
     */
    public void processOrderCompletedEvent(OrderCompletedEvent event) {
        if (!holdIfUnregistered(event)) {
            handleCompleted(event);
        }
    }

    private void handleCompleted(OrderCompletedEvent event) {
        TrackedOrder tracked;
        synchronized (orderLock) {
            tracked = activeOrders.remove(event.orderId());
            if (tracked == null) {
                return;
            }
            tracked.applyCompleted(event);
            finishedOrders.add(tracked);
        }
        onOrderCompleted(tracked, event);
    }

    /**
     * 취소 이벤트. 주문을 활성 목록에서 내립니다 (부분 체결분은 손익에 남음).
     */
    public void processOrderCanceledEvent(OrderCanceledEvent event) {
        if (!holdIfUnregistered(event)) {
            handleCanceled(event);
        }
    }

    private void handleCanceled(OrderCanceledEvent event) {
        TrackedOrder tracked;
        synchronized (orderLock) {
            tracked = activeOrders.remove(event.orderId());
            if (tracked == null) {
                return;
            }
            tracked.applyState(OrderState.CANCELED);
            finishedOrders.add(tracked);
        }
        onOrderCanceled(tracked, event);
    }

    /**
     * 실패 이벤트. 주문을 실패 목록으로 옮깁니다.
     */
    public void processOrderFailedEvent(OrderFailedEvent event) {
        if (!holdIfUnregistered(event)) {
            handleFailed(event);
        }
    }

    private void handleFailed(OrderFailedEvent event) {
        TrackedOrder tracked;
        synchronized (orderLock) {
            tracked = activeOrders.remove(event.orderId());
            if (tracked == null) {
                return;
            }
            tracked.applyState(OrderState.FAILED);
            failedOrders.add(tracked);
        }
        logger().warn("[{}] order {} failed: {}", getId(), event.orderId(), event.reason());
        onOrderFailed(tracked, event);
    }

    protected void onOrderCreated(TrackedOrder order, OrderCreatedEvent event) {
    }

    protected void onOrderFilled(TrackedOrder order, OrderFilledEvent event) {
    }

    protected void onOrderCompleted(TrackedOrder order, OrderCompletedEvent event) {
    }

    protected void onOrderCanceled(TrackedOrder order, OrderCanceledEvent event) {
    }

    /**
     * 주문 실패 hook. 이벤트로 통보된 실패, 거부된 주문, 분실 주문 모두 여기로 옵니다.
     */
    protected void onOrderFailed(TrackedOrder order, OrderFailedEvent event) {
    }

    private void dispatch(OrderEvent event) {
        try {
            if (event instanceof OrderCreatedEvent created) {
                processOrderCreatedEvent(created);
            } else if (event instanceof OrderFilledEvent filled) {
                processOrderFilledEvent(filled);
            } else if (event instanceof OrderCompletedEvent completed) {
                processOrderCompletedEvent(completed);
            } else if (event instanceof OrderCanceledEvent canceled) {
                processOrderCanceledEvent(canceled);
            } else if (event instanceof OrderFailedEvent failed) {
                processOrderFailedEvent(failed);
            }
        } catch (RuntimeException e) {
            logger().error("[{}] failed to process {} for order {}",
                getId(), event.getClass().getSimpleName(), event.orderId(), e);
        }
    }

    private void applyEvent(OrderEvent event) {
        try {
            if (event instanceof OrderCreatedEvent created) {
                handleCreated(created);
            } else if (event instanceof OrderFilledEvent filled) {
                handleFilled(filled);
            } else if (event instanceof OrderCompletedEvent completed) {
                handleCompleted(completed);
            } else if (event instanceof OrderCanceledEvent canceled) {
                handleCanceled(canceled);
            } else if (event instanceof OrderFailedEvent failed) {
                handleFailed(failed);
            }
        } catch (RuntimeException e) {
            logger().error("[{}] failed to replay {} for order {}",
                getId(), event.getClass().getSimpleName(), event.orderId(), e);
        }
    }

    // ========================================
    // 분실 주문 점검
    // ========================================

    /**
     * 활성 주문을 커넥터의 in-flight 상태와 대조.
     *
     * <p>커넥터에서 조회되는 주문은 스냅샷으로 갱신하고 분실 횟수를 초기화합니다. 조회되지 않으면
     * 분실 횟수를 늘리고, {@link ExecutorConfig#maxLostOrderChecks()}를 넘으면 FAILED로 확정합니다.</p>
     *
     * @return 이번 점검에서 FAILED로 확정된 주문 수
     */
    public int reconcileTrackedOrders() {
        List<TrackedOrder> snapshot;
        synchronized (orderLock) {
            snapshot = new ArrayList<>(activeOrders.values());
        }

        int failed = 0;
        for (TrackedOrder tracked : snapshot) {
            Optional<InFlightOrder> inFlight = getInFlightOrder(tracked.getConnectorName(), tracked.getOrderId());
            if (inFlight.isPresent()) {
                synchronized (orderLock) {
                    tracked.applySnapshot(inFlight.get());
                    if (inFlight.get().isDone() && activeOrders.remove(tracked.getOrderId()) != null) {
                        (inFlight.get().state() == OrderState.FAILED ? failedOrders : finishedOrders).add(tracked);
                    }
                }
                continue;
            }

            int lost = tracked.markLost();
            if (lost <= config.maxLostOrderChecks()) {
                logger().warn("[{}] order {} not found on {} ({}/{})",
                    getId(), tracked.getOrderId(), tracked.getConnectorName(), lost, config.maxLostOrderChecks());
                continue;
            }

            boolean removed;
            synchronized (orderLock) {
                removed = activeOrders.remove(tracked.getOrderId()) != null;
                if (removed) {
                    tracked.applyState(OrderState.FAILED);
                    failedOrders.add(tracked);
                }
            }
            if (removed) {
                failed++;
                logger().error("[{}] order {} lost after {} checks, marking as FAILED",
                    getId(), tracked.getOrderId(), lost - 1);
                onOrderFailed(tracked, new OrderFailedEvent(tracked.getOrderId(), tracked.getOrderType(),
                    "order lost", clock.millis()));
            }
        }
        return failed;
    }

    // ========================================
    // 손익
    // ========================================

    /**
     * 순손익 (quote).
     *
     * <p>거래쌍별로 (매도 quote − 매수 quote) + 잔여 base × 중간가를 더하고 누적 수수료를 뺍니다.
     * 중간가가 없으면 잔여 base는 평균 체결가로 평가합니다.</p>
     *
     * @return 순손익 (체결이 없으면 0)
     */
    public BigDecimal getNetPnlQuote() {
        BigDecimal gross = BigDecimal.ZERO;
        for (PairExposure exposure : exposures().values()) {
            gross = gross.add(exposure.grossPnl());
        }
        return gross.subtract(getCumFeesQuote());
    }

    /**
     * 순손익률.
     *
     * @return 순손익 / 진입 방향 체결 금액 (체결이 없으면 0)
     */
    public BigDecimal getNetPnlPct() {
        BigDecimal openVolume = BigDecimal.ZERO;
        for (PairExposure exposure : exposures().values()) {
            openVolume = openVolume.add(exposure.openingQuote());
        }
        if (openVolume.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return getNetPnlQuote().divide(openVolume, MathContext.DECIMAL64);
    }

    public BigDecimal getCumFeesQuote() {
        BigDecimal fees = BigDecimal.ZERO;
        for (TrackedOrder order : allOrders()) {
            fees = fees.add(order.getCumulativeFeeQuote());
        }
        return fees;
    }

    public BigDecimal getFilledAmountQuote() {
        BigDecimal filled = BigDecimal.ZERO;
        for (TrackedOrder order : allOrders()) {
            filled = filled.add(order.getExecutedAmountQuote());
        }
        return filled;
    }

    private Map<String, PairExposure> exposures() {
        Map<String, PairExposure> byPair = new LinkedHashMap<>();
        for (TrackedOrder order : allOrders()) {
            if (order.getExecutedAmountBase().signum() == 0) {
                continue;
            }
            String key = order.getConnectorName() + ":" + order.getTradingPair();
            byPair.computeIfAbsent(key, k -> new PairExposure(order.getConnectorName(), order.getTradingPair(),
                order.getTradeType())).add(order);
        }
        return byPair;
    }

    /**
     * 거래쌍 하나에 대한 누적 체결.
     */
    private final class PairExposure {

        private final String connectorName;
        private final String tradingPair;
        private final TradeType openingSide;
        private BigDecimal buyBase = BigDecimal.ZERO;
        private BigDecimal buyQuote = BigDecimal.ZERO;
        private BigDecimal sellBase = BigDecimal.ZERO;
        private BigDecimal sellQuote = BigDecimal.ZERO;

        PairExposure(String connectorName, String tradingPair, TradeType openingSide) {
            this.connectorName = connectorName;
            this.tradingPair = tradingPair;
            this.openingSide = openingSide;
        }

        void add(TrackedOrder order) {
            if (order.getTradeType() == TradeType.BUY) {
                buyBase = buyBase.add(order.getExecutedAmountBase());
                buyQuote = buyQuote.add(order.getExecutedAmountQuote());
            } else {
                sellBase = sellBase.add(order.getExecutedAmountBase());
                sellQuote = sellQuote.add(order.getExecutedAmountQuote());
            }
        }

        BigDecimal openingQuote() {
            return openingSide == TradeType.BUY ? buyQuote : sellQuote;
        }

        BigDecimal grossPnl() {
            BigDecimal residual = buyBase.subtract(sellBase);
            BigDecimal realised = sellQuote.subtract(buyQuote);
            if (residual.signum() == 0) {
                return realised;
            }
            return realised.add(residual.multiply(markPrice()));
        }

        private BigDecimal markPrice() {
            Optional<BigDecimal> mid = connectors.containsKey(connectorName)
                ? connectors.get(connectorName).getPrice(tradingPair, PriceType.MID_PRICE)
                : Optional.empty();
            if (mid.isPresent()) {
                return mid.get();
            }
            BigDecimal base = openingSide == TradeType.BUY ? buyBase : sellBase;
            BigDecimal quote = openingQuote();
            return base.signum() == 0 ? BigDecimal.ZERO : quote.divide(base, MathContext.DECIMAL64);
        }
    }

    // ========================================
    // 종료 / 재시도
    // ========================================

    /**
     * 감독 코드에 의한 조기 종료.
     *
     * <p>종료 유형을 정하고 SHUTTING_DOWN으로 전이하지만 루프는 취소하지 않습니다.
     * 구체 Executor의 {@link #controlTask()}가 열린 주문을 정리한 뒤 {@link #stop()}을 호출합니다.
     * 시작 전이면 바로 종료합니다.</p>
     *
     * @param keepPosition true면 포지션 유지 (POSITION_HOLD), false면 청산 (EARLY_STOP)
     */
    public void earlyStop(boolean keepPosition) {
        RunnableStatus status = getStatus();
        if (status.isTerminal()) {
            logger().debug("[{}] earlyStop() ignored: already {}", getId(), status);
            return;
        }
        closeType = keepPosition ? CloseType.POSITION_HOLD : CloseType.EARLY_STOP;
        if (status == RunnableStatus.NOT_STARTED) {
            markClosed();
            stop();
            return;
        }
        transitionTo(RunnableStatus.SHUTTING_DOWN);
    }

    /**
     * 종료 유형을 정하고 SHUTTING_DOWN으로 전이 (구체 Executor의 barrier 처리용).
     *
     * @param type 종료 유형
     */
    protected void closeWith(CloseType type) {
        closeType = type;
        markClosed();
        transitionTo(RunnableStatus.SHUTTING_DOWN);
    }

    /**
     * 재시도 예산 확인. 초과 시 FAILED로 종료합니다.
     *
     * @return 예산을 초과하여 종료했으면 true
     */
    protected boolean evaluateMaxRetries() {
        if (currentRetries.get() > config.maxRetries()) {
            logger().error("[{}] retry budget exhausted ({}/{}), stopping", getId(), currentRetries.get(),
                config.maxRetries());
            closeType = CloseType.FAILED;
            markClosed();
            stop();
            return true;
        }
        return false;
    }

    protected int incrementRetries() {
        return currentRetries.incrementAndGet();
    }

    public int getCurrentRetries() {
        return currentRetries.get();
    }

    /**
     * 종료 시각 기록 (최초 한 번).
     */
    protected void markClosed() {
        if (closeTimestamp == 0) {
            closeTimestamp = clock.millis();
        }
    }

    private void recordRejectedOrder(
        String connectorName,
        String tradingPair,
        OrderType orderType,
        TradeType side,
        BigDecimal amount,
        BigDecimal price,
        RuntimeException cause
    ) {
        String localId = getId() + "-rejected-" + rejectedSequence.incrementAndGet();
        InFlightOrder rejected = new InFlightOrder(localId, null, tradingPair, orderType, side, price, amount,
            null, null, null, OrderState.FAILED, clock.millis());
        TrackedOrder tracked = new TrackedOrder(localId, connectorName, rejected);
        synchronized (orderLock) {
            failedOrders.add(tracked);
            placedOrders.add(tracked);
        }
        onOrderFailed(tracked, new OrderFailedEvent(localId, orderType, String.valueOf(cause.getMessage()),
            clock.millis()));
    }

    // ========================================
    // 스냅샷
    // ========================================

    /**
     * 현재 상태 스냅샷.
     *
     * @return 불변 ExecutorInfo
     */
    public ExecutorInfo getExecutorInfo() {
        RunnableStatus status = getStatus();
        return new ExecutorInfo(
            getId(),
            config.type(),
            status,
            closeType,
            config.timestamp(),
            closeTimestamp,
            getNetPnlQuote(),
            getNetPnlPct(),
            getCumFeesQuote(),
            getFilledAmountQuote(),
            status.isActive(),
            isTrading(),
            getCustomInfo()
        );
    }

    /**
     * 포지션 보유 중인지 여부. 기본 구현은 활성 상태에서 체결이 있었는지로 판단합니다.
     */
    protected boolean isTrading() {
        return getStatus().isActive() && getFilledAmountQuote().signum() > 0;
    }

    /**
     * Executor별 추가 정보.
     */
    protected Map<String, Object> getCustomInfo() {
        return Map.of();
    }

    public ExecutorConfig getConfig() {
        return config;
    }

    public CloseType getCloseType() {
        return closeType;
    }

    public long getCloseTimestamp() {
        return closeTimestamp;
    }

    protected Clock clock() {
        return clock;
    }

    /**
     * 활성(미완료) 추적 주문.
     *
     * @return 등록 순서의 불변 리스트
     */
    public List<TrackedOrder> getActiveOrders() {
        synchronized (orderLock) {
            return List.copyOf(activeOrders.values());
        }
    }

    public List<TrackedOrder> getFinishedOrders() {
        synchronized (orderLock) {
            return List.copyOf(finishedOrders);
        }
    }

    public List<TrackedOrder> getFailedOrders() {
        synchronized (orderLock) {
            return List.copyOf(failedOrders);
        }
    }

    public boolean isTracking(String orderId) {
        synchronized (orderLock) {
            return activeOrders.containsKey(orderId);
        }
    }

    /**
     * 이 Executor가 낸 주문 조회 (활성, 완료, 실패 모두 포함).
     *
     * @param orderId 주문 ID (null 허용)
     * @return 추적 주문 또는 Optional.empty()
     */
    public Optional<TrackedOrder> findOrder(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        synchronized (orderLock) {
            for (TrackedOrder order : placedOrders) {
                if (order.getOrderId().equals(orderId)) {
                    return Optional.of(order);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 주문 순서대로의 모든 추적 주문 (활성, 완료, 실패 포함).
     */
    private List<TrackedOrder> allOrders() {
        synchronized (orderLock) {
            return new ArrayList<>(placedOrders);
        }
    }

    private TrackedOrder findActive(String orderId) {
        synchronized (orderLock) {
            return activeOrders.get(orderId);
        }
    }

    private ExchangeConnector connector(String connectorName) {
        ExchangeConnector connector = connectorName == null ? null : connectors.get(connectorName);
        if (connector == null) {
            throw new CollaboratorNotFoundException(connectorName);
        }
        return connector;
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
