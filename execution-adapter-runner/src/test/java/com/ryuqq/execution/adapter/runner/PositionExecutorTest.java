package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.adapter.inmemory.bus.InMemoryOrderEventBus;
import com.ryuqq.execution.adapter.inmemory.exchange.InMemoryExchangeConnector;
import com.ryuqq.execution.core.executor.ExecutorInfo;
import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.runnable.RunnableStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * PositionExecutor 유닛 테스트.
 *
 * <p>루프 실행기를 mock으로 주입하고 {@code controlTask()}를 직접 호출하여
 * tick 단위로 결정적으로 검증합니다. 거래소 이벤트는 {@code bus.dispatchPending()}으로 전달합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
class PositionExecutorTest {

    private static final String CONNECTOR = "sim";
    private static final String PAIR = "ETH-USDT";
    private static final long START = 1_700_000_000_000L;

    private MutableClock clock;
    private InMemoryOrderEventBus bus;
    private InMemoryExchangeConnector exchange;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        bus = new InMemoryOrderEventBus();
        exchange = new InMemoryExchangeConnector(CONNECTOR, bus, clock, BigDecimal.ZERO);
        exchange.setPrice(PAIR, new BigDecimal("100"));
    }

    // ============================================================
    // 1. 진입
    // ============================================================

    @Test
    void controlTask_Running_PlacesMarketOpenOrderOnce() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig());

        // when
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getOpenOrderId()).isNotNull();
        assertThat(executor.getOpenFilledAmount()).isEqualByComparingTo("1");
        assertThat(executor.getFinishedOrders()).hasSize(1);
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.RUNNING);
        assertThat(executor.getExecutorInfo().isTrading()).isTrue();
    }

    @Test
    void controlTask_LimitEntry_RestsUntilPriceReached() throws Exception {
        // given
        PositionExecutorConfig config = baseConfig()
            .withEntryPrice(new BigDecimal("95"))
            .withTripleBarrier(new TripleBarrierConfig().withOpenOrderType(OrderType.LIMIT));
        PositionExecutor executor = started(config);

        // when
        tick(executor);
        tick(executor);

        // then
        assertThat(exchange.getOpenOrders()).extracting(InFlightOrder::clientOrderId)
            .containsExactly(executor.getOpenOrderId());
        assertThat(executor.getOpenFilledAmount()).isEqualByComparingTo("0");

        // when
        exchange.setPrice(PAIR, new BigDecimal("95"));
        bus.dispatchPending();

        // then
        assertThat(executor.getOpenFilledAmount()).isEqualByComparingTo("1");
    }

    @Test
    void openOrderFailed_Replaced_AndRetryCounted() throws Exception {
        // given
        PositionExecutorConfig config = baseConfig()
            .withEntryPrice(new BigDecimal("95"))
            .withTripleBarrier(new TripleBarrierConfig().withOpenOrderType(OrderType.LIMIT));
        PositionExecutor executor = started(config);
        tick(executor);
        String firstOrder = executor.getOpenOrderId();

        // when
        exchange.failOrder(firstOrder, "exchange maintenance");
        bus.dispatchPending();
        tick(executor);

        // then
        assertThat(executor.getCurrentRetries()).isEqualTo(1);
        assertThat(executor.getOpenOrderId()).isNotNull().isNotEqualTo(firstOrder);
        assertThat(executor.getFailedOrders()).hasSize(1);
    }

    @Test
    void controlTask_OrdersRejectedBeyondBudget_StopsAsFailed() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withMaxRetries(2));
        exchange.rejectOrders(true);

        // when
        tick(executor);
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.FAILED);
        assertThat(executor.getFailedOrders()).hasSize(3);
    }

    // ============================================================
    // 2. Triple barrier
    // ============================================================

    @Test
    void stopLoss_PriceDrops_ClosesPositionAtMarket() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withTripleBarrier(
            new TripleBarrierConfig().withStopLoss(new BigDecimal("0.05"))));
        tick(executor);

        // when
        exchange.setPrice(PAIR, new BigDecimal("90"));
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.SHUTTING_DOWN);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.STOP_LOSS);
        assertThat(executor.getCloseOrderIds()).hasSize(1);
        assertThat(executor.getCloseFilledAmount()).isEqualByComparingTo("1");

        // when
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getNetPnlQuote()).isEqualByComparingTo("-10");
        assertThat(executor.getCloseTimestamp()).isEqualTo(START);
    }

    @Test
    void stopLoss_LossWithinLimit_KeepsPositionOpen() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withTripleBarrier(
            new TripleBarrierConfig().withStopLoss(new BigDecimal("0.05"))));
        tick(executor);

        // when
        exchange.setPrice(PAIR, new BigDecimal("97"));
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.RUNNING);
        assertThat(executor.getCloseOrderIds()).isEmpty();
    }

    @Test
    void takeProfit_PriceRises_ClosesWithProfit() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withTripleBarrier(
            new TripleBarrierConfig().withTakeProfit(new BigDecimal("0.05"))));
        tick(executor);

        // when
        exchange.setPrice(PAIR, new BigDecimal("110"));
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.TAKE_PROFIT);
        assertThat(executor.getNetPnlQuote()).isEqualByComparingTo("10");
    }

    @Test
    void takeProfit_ShortPosition_ClosesWithBuy() throws Exception {
        // given
        PositionExecutorConfig config = new PositionExecutorConfig("pos-short", START, CONNECTOR, PAIR,
            TradeType.SELL, BigDecimal.ONE).withTripleBarrier(
            new TripleBarrierConfig().withTakeProfit(new BigDecimal("0.05")));
        PositionExecutor executor = started(config);
        tick(executor);

        // when
        exchange.setPrice(PAIR, new BigDecimal("90"));
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getCloseSide()).isEqualTo(TradeType.BUY);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.TAKE_PROFIT);
        assertThat(executor.getNetPnlQuote()).isEqualByComparingTo("10");
    }

    @Test
    void timeLimit_Elapsed_ClosesPosition() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withTripleBarrier(
            new TripleBarrierConfig().withTimeLimit(Duration.ofMinutes(1))));
        tick(executor);
        assertThat(executor.isExpired()).isFalse();

        // when
        clock.advance(Duration.ofSeconds(61));
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getCloseType()).isEqualTo(CloseType.TIME_LIMIT);
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getAmountToClose()).isEqualByComparingTo("0");
    }

    @Test
    void onStart_AlreadyExpired_StopsWithoutTrading() throws Exception {
        // given
        PositionExecutorConfig config = new PositionExecutorConfig("pos-old", START - 120_000L, CONNECTOR, PAIR,
            TradeType.BUY, BigDecimal.ONE).withTripleBarrier(
            new TripleBarrierConfig().withTimeLimit(Duration.ofMinutes(1)));

        // when
        PositionExecutor executor = started(config);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.EXPIRED);
        assertThat(exchange.getOpenOrders()).isEmpty();
        assertThat(executor.getOpenOrderId()).isNull();
    }

    // ============================================================
    // 3. 조기 종료
    // ============================================================

    @Test
    void earlyStop_WithOpenPosition_ClosesThenTerminates() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig());
        tick(executor);

        // when
        executor.earlyStop(false);
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.SHUTTING_DOWN);
        assertThat(executor.getCloseOrderIds()).hasSize(1);
        assertThat(executor.getCurrentRetries()).isEqualTo(1);

        // when
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.EARLY_STOP);
        assertThat(executor.getAmountToClose()).isEqualByComparingTo("0");
    }

    @Test
    void earlyStop_KeepPosition_RecordsHeldOrderWithoutClosing() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig());
        tick(executor);

        // when
        executor.earlyStop(true);
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.POSITION_HOLD);
        assertThat(executor.getHeldPositionOrderIds()).containsExactly(executor.getOpenOrderId());
        assertThat(executor.getCloseOrderIds()).isEmpty();
        assertThat(executor.getExecutorInfo().customInfo())
            .containsEntry("heldPositionOrders", executor.getHeldPositionOrderIds());
    }

    @Test
    void earlyStop_KeepPositionWithUnfilledEntry_CancelsAndEndsAsEarlyStop() throws Exception {
        // given
        PositionExecutorConfig config = baseConfig()
            .withEntryPrice(new BigDecimal("95"))
            .withTripleBarrier(new TripleBarrierConfig().withOpenOrderType(OrderType.LIMIT));
        PositionExecutor executor = started(config);
        tick(executor);

        // when
        executor.earlyStop(true);
        tick(executor);
        tick(executor);

        // then
        assertThat(exchange.getOpenOrders()).isEmpty();
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.EARLY_STOP);
        assertThat(executor.getHeldPositionOrderIds()).isEmpty();
    }

    @Test
    void earlyStop_BeforeStart_TerminatesImmediately() {
        // given
        PositionExecutor executor = newExecutor(baseConfig());

        // when
        executor.earlyStop(false);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.EARLY_STOP);
    }

    @Test
    void getExecutorInfo_DoneExecutor_ReportsRealisedPnl() throws Exception {
        // given
        PositionExecutor executor = started(baseConfig().withTripleBarrier(
            new TripleBarrierConfig().withTakeProfit(new BigDecimal("0.05"))));
        tick(executor);
        exchange.setPrice(PAIR, new BigDecimal("120"));
        tick(executor);
        tick(executor);

        // when
        ExecutorInfo info = executor.getExecutorInfo();

        // then
        assertThat(info.type()).isEqualTo(PositionExecutorConfig.TYPE);
        assertThat(info.isDone()).isTrue();
        assertThat(info.isActive()).isFalse();
        assertThat(info.netPnlQuote()).isEqualByComparingTo("20");
        assertThat(info.netPnlPct()).isEqualByComparingTo("0.2");
        assertThat(info.filledAmountQuote()).isEqualByComparingTo("220");
        assertThat(info.customInfo()).containsEntry("side", TradeType.BUY);
    }

    @Test
    void config_LimitEntryWithoutPrice_ThrowsException() {
        assertThatThrownBy(() -> baseConfig()
            .withTripleBarrier(new TripleBarrierConfig().withOpenOrderType(OrderType.LIMIT)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entryPrice");
        assertThatThrownBy(() -> new TripleBarrierConfig().withOpenOrderType(OrderType.LIMIT_MAKER))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // helpers
    // ============================================================

    private PositionExecutorConfig baseConfig() {
        return new PositionExecutorConfig("pos-1", START, CONNECTOR, PAIR, TradeType.BUY, BigDecimal.ONE);
    }

    private PositionExecutor newExecutor(PositionExecutorConfig config) {
        return new PositionExecutor(config, Map.of(CONNECTOR, exchange), bus, clock, mock(Logger.class),
            mock(ExecutorService.class));
    }

    private PositionExecutor started(PositionExecutorConfig config) throws Exception {
        PositionExecutor executor = newExecutor(config);
        executor.start();
        executor.onStart();
        return executor;
    }

    private void tick(PositionExecutor executor) {
        executor.controlTask();
        bus.dispatchPending();
    }
}
