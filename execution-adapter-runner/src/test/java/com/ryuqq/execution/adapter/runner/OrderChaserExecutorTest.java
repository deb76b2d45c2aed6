package com.ryuqq.execution.adapter.runner;

import com.ryuqq.execution.adapter.inmemory.bus.InMemoryOrderEventBus;
import com.ryuqq.execution.adapter.inmemory.exchange.InMemoryExchangeConnector;
import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.runnable.RunnableStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * OrderChaserExecutor 유닛 테스트.
 *
 * @author Execution Team
 * @since 1.0.0
 */
class OrderChaserExecutorTest {

    private static final String CONNECTOR = "sim";
    private static final String PAIR = "BTC-USDT";
    private static final long START = 1_700_000_000_000L;

    private InMemoryOrderEventBus bus;
    private InMemoryExchangeConnector exchange;

    @BeforeEach
    void setUp() {
        bus = new InMemoryOrderEventBus();
        exchange = new InMemoryExchangeConnector(CONNECTOR, bus, new MutableClock(START), BigDecimal.ZERO);
        exchange.setTopOfBook(PAIR, new BigDecimal("1999"), new BigDecimal("2001"));
    }

    @Test
    void controlTask_Buy_RestsLimitOrderAtBestBid() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));

        // when
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getChaseOrderIds()).hasSize(1);
        assertThat(exchange.getOpenOrders()).singleElement()
            .satisfies(order -> {
                assertThat(order.price()).isEqualByComparingTo("1999");
                assertThat(order.amount()).isEqualByComparingTo("2");
            });
        assertThat(executor.getActiveOrderId()).isPresent();
    }

    @Test
    void controlTask_Sell_RestsLimitOrderAtBestAsk() throws Exception {
        // given
        OrderChaserConfig config = new OrderChaserConfig("chase-sell", START, CONNECTOR, PAIR, TradeType.SELL,
            BigDecimal.ONE);
        OrderChaserExecutor executor = started(config);

        // when
        tick(executor);

        // then
        assertThat(exchange.getOpenOrders()).extracting(InFlightOrder::price)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("2001"));
    }

    @Test
    void controlTask_BookMovesBeyondThreshold_CancelsAndReplacesAtNewPrice() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));
        tick(executor);
        String first = executor.getActiveOrderId().orElseThrow();

        // when
        exchange.setTopOfBook(PAIR, new BigDecimal("2009"), new BigDecimal("2011"));
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getChaseOrderIds()).hasSize(2);
        assertThat(executor.getActiveOrderId()).isPresent().get().isNotEqualTo(first);
        assertThat(exchange.getOpenOrders()).extracting(InFlightOrder::price)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("2009"));
    }

    @Test
    void controlTask_SmallBookMove_KeepsOrder() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));
        tick(executor);

        // when
        exchange.setTopOfBook(PAIR, new BigDecimal("1999.5"), new BigDecimal("2001"));
        tick(executor);

        // then
        assertThat(executor.getChaseOrderIds()).hasSize(1);
    }

    @Test
    void controlTask_PartialFillThenRefresh_ReplacesOnlyRemainder() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));
        tick(executor);
        exchange.fill(executor.getActiveOrderId().orElseThrow(), BigDecimal.ONE);
        bus.dispatchPending();

        // when
        exchange.setTopOfBook(PAIR, new BigDecimal("2009"), new BigDecimal("2011"));
        tick(executor);
        tick(executor);

        // then
        assertThat(executor.getFilledAmount()).isEqualByComparingTo("1");
        assertThat(exchange.getOpenOrders()).singleElement()
            .satisfies(order -> assertThat(order.amount()).isEqualByComparingTo("1"));
    }

    @Test
    void controlTask_TargetFilled_CompletesAndTerminates() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));
        tick(executor);
        exchange.fill(executor.getActiveOrderId().orElseThrow(), new BigDecimal("2"));
        bus.dispatchPending();

        // when
        tick(executor);

        // then
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.COMPLETED);
        assertThat(executor.getActiveOrderId()).isEmpty();
        assertThat(executor.getExecutorInfo().customInfo()).containsEntry("ordersPlaced", 1);
    }

    @Test
    void controlTask_NoBook_WaitsWithoutPlacing() throws Exception {
        // given
        InMemoryExchangeConnector empty = new InMemoryExchangeConnector("empty", bus);
        OrderChaserConfig config = new OrderChaserConfig("chase-2", START, "empty", PAIR, TradeType.BUY,
            BigDecimal.ONE);
        OrderChaserExecutor executor = new OrderChaserExecutor(config, Map.of("empty", empty), bus,
            new MutableClock(START), mock(Logger.class), mock(ExecutorService.class));
        executor.start();

        // when
        executor.controlTask();

        // then
        assertThat(executor.getChaseOrderIds()).isEmpty();
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.RUNNING);
    }

    @Test
    void chaseOrderFailed_RetriedWithNewOrder() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("1"));
        tick(executor);

        // when
        exchange.failOrder(executor.getActiveOrderId().orElseThrow(), "rate limited");
        bus.dispatchPending();
        tick(executor);

        // then
        assertThat(executor.getCurrentRetries()).isEqualTo(1);
        assertThat(executor.getChaseOrderIds()).hasSize(2);
        assertThat(executor.getActiveOrderId()).isPresent();
    }

    @Test
    void earlyStop_WithRestingOrder_CancelsThenTerminates() throws Exception {
        // given
        OrderChaserExecutor executor = started(buyConfig("2"));
        tick(executor);

        // when
        executor.earlyStop(false);
        tick(executor);
        tick(executor);

        // then
        assertThat(exchange.getOpenOrders()).isEmpty();
        assertThat(executor.getStatus()).isEqualTo(RunnableStatus.TERMINATED);
        assertThat(executor.getCloseType()).isEqualTo(CloseType.EARLY_STOP);
    }

    private OrderChaserConfig buyConfig(String amount) {
        return new OrderChaserConfig("chase-1", START, CONNECTOR, PAIR, TradeType.BUY, new BigDecimal(amount));
    }

    private OrderChaserExecutor started(OrderChaserConfig config) throws Exception {
        OrderChaserExecutor executor = new OrderChaserExecutor(config, Map.of(CONNECTOR, exchange), bus,
            new MutableClock(START), mock(Logger.class), mock(ExecutorService.class));
        executor.start();
        executor.onStart();
        return executor;
    }

    private void tick(OrderChaserExecutor executor) {
        executor.controlTask();
        bus.dispatchPending();
    }
}
