package com.ryuqq.execution.adapter.inmemory.exchange;

import com.ryuqq.execution.adapter.inmemory.bus.InMemoryOrderEventBus;
import com.ryuqq.execution.core.event.OrderCanceledEvent;
import com.ryuqq.execution.core.event.OrderCompletedEvent;
import com.ryuqq.execution.core.event.OrderCreatedEvent;
import com.ryuqq.execution.core.event.OrderFailedEvent;
import com.ryuqq.execution.core.event.OrderFilledEvent;
import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.OrderBook;
import com.ryuqq.execution.core.model.OrderBookEntry;
import com.ryuqq.execution.core.model.OrderState;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.PriceType;
import com.ryuqq.execution.core.model.TradeType;
import com.ryuqq.execution.core.spi.ExchangeConnector;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory paper exchange implementing {@link ExchangeConnector} for testing and reference purposes.
 *
 * <p>Orders are matched against prices set by the test, and the resulting order events are
 * published to an {@link InMemoryOrderEventBus}. Nothing is delivered until the bus is dispatched.</p>
 *
 * <p><strong>Matching rules:</strong></p>
 * <ul>
 *   <li>MARKET: filled immediately at the best ask (buy) or best bid (sell)</li>
 *   <li>LIMIT: filled immediately if it crosses the book, otherwise rests until
 *       {@link #setPrice} or {@link #setOrderBook} crosses it</li>
 *   <li>LIMIT_MAKER: fails (post-only) if it would cross on placement</li>
 * </ul>
 *
 * <p><strong>Test controls:</strong> {@link #rejectOrders(boolean)} for synchronous rejection,
 * {@link #fill(String, BigDecimal)} for manual partial fills, {@link #failOrder} for asynchronous
 * failures and {@link #forgetOrder(String)} to simulate an order the exchange no longer reports.</p>
 *
 * <p>Trading pairs are written {@code BASE-QUOTE} (e.g. {@code BTC-USDT}); fees are charged in quote.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class InMemoryExchangeConnector implements ExchangeConnector {

    /**
     * Default fee rate: 0.1% of the quote amount.
     */
    public static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.001");

    private final String name;
    private final InMemoryOrderEventBus bus;
    private final Clock clock;
    private final BigDecimal feeRate;

    private final Map<String, BigDecimal> prices = new HashMap<>();
    private final Map<String, BigDecimal> lastTrades = new HashMap<>();
    private final Map<String, OrderBook> orderBooks = new HashMap<>();
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Map<String, InFlightOrder> orders = new LinkedHashMap<>();

    private long sequence;
    private boolean rejecting;

    public InMemoryExchangeConnector(String name, InMemoryOrderEventBus bus) {
        this(name, bus, Clock.systemUTC(), DEFAULT_FEE_RATE);
    }

    /**
     * Creates a new paper exchange.
     *
     * @param name connector name
     * @param bus bus receiving the order events
     * @param clock clock for event timestamps
     * @param feeRate fee rate applied to the quote amount of every fill (0 or more)
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public InMemoryExchangeConnector(String name, InMemoryOrderEventBus bus, Clock clock, BigDecimal feeRate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (feeRate == null || feeRate.signum() < 0) {
            throw new IllegalArgumentException("feeRate must be non-negative (current: " + feeRate + ")");
        }
        this.name = name;
        this.bus = bus;
        this.clock = clock;
        this.feeRate = feeRate;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String buy(String tradingPair, BigDecimal amount, OrderType orderType, BigDecimal price) {
        return place(TradeType.BUY, tradingPair, amount, orderType, price);
    }

    @Override
    public String sell(String tradingPair, BigDecimal amount, OrderType orderType, BigDecimal price) {
        return place(TradeType.SELL, tradingPair, amount, orderType, price);
    }

    private synchronized String place(
        TradeType side,
        String tradingPair,
        BigDecimal amount,
        OrderType orderType,
        BigDecimal price
    ) {
        if (rejecting) {
            throw new IllegalStateException(name + " rejected " + side + " order for " + tradingPair);
        }
        if (orderType == OrderType.MARKET && !prices.containsKey(tradingPair) && !orderBooks.containsKey(tradingPair)) {
            throw new IllegalStateException("No market price for " + tradingPair);
        }

        long id = ++sequence;
        String orderId = side.name().toLowerCase() + "-" + tradingPair + "-" + id;
        String exchangeOrderId = "EX-" + id;
        long now = clock.millis();
        BigDecimal orderPrice = orderType == OrderType.MARKET ? BigDecimal.ZERO : price;

        orders.put(orderId, new InFlightOrder(orderId, exchangeOrderId, tradingPair, orderType, side, orderPrice,
            amount, null, null, null, OrderState.OPEN, now));
        bus.publish(new OrderCreatedEvent(orderId, exchangeOrderId, tradingPair, side, orderType, amount,
            orderPrice, now));

        Optional<BigDecimal> crossing = crossingPrice(side, tradingPair, orderType, orderPrice);
        if (crossing.isPresent()) {
            if (orderType == OrderType.LIMIT_MAKER) {
                failLocked(orderId, "LIMIT_MAKER order would immediately match and take");
            } else {
                fillLocked(orderId, amount, crossing.get());
            }
        }
        return orderId;
    }

    @Override
    public synchronized void cancel(String tradingPair, String orderId) {
        InFlightOrder order = orders.get(orderId);
        if (order == null || order.isDone()) {
            return;
        }
        orders.put(orderId, order.withState(OrderState.CANCELED));
        bus.publish(new OrderCanceledEvent(orderId, order.exchangeOrderId(), clock.millis()));
    }

    @Override
    public synchronized Optional<BigDecimal> getPrice(String tradingPair, PriceType priceType) {
        OrderBook book = orderBooks.get(tradingPair);
        BigDecimal mid = prices.get(tradingPair);
        switch (priceType) {
            case BEST_BID:
                return book != null && book.bestBid().isPresent()
                    ? Optional.of(book.bestBid().get().price()) : Optional.ofNullable(mid);
            case BEST_ASK:
                return book != null && book.bestAsk().isPresent()
                    ? Optional.of(book.bestAsk().get().price()) : Optional.ofNullable(mid);
            case LAST_TRADE:
                return Optional.ofNullable(lastTrades.getOrDefault(tradingPair, mid));
            case MID_PRICE:
            default:
                if (book != null && book.midPrice().isPresent()) {
                    return book.midPrice();
                }
                return Optional.ofNullable(mid);
        }
    }

    @Override
    public synchronized Optional<OrderBook> getOrderBook(String tradingPair) {
        return Optional.ofNullable(orderBooks.get(tradingPair));
    }

    @Override
    public synchronized BigDecimal getBalance(String asset) {
        return balances.getOrDefault(asset, BigDecimal.ZERO);
    }

    /**
     * Balance minus the amount locked by open orders (quote for buys, base for sells).
     */
    @Override
    public synchronized BigDecimal getAvailableBalance(String asset) {
        BigDecimal locked = BigDecimal.ZERO;
        for (InFlightOrder order : orders.values()) {
            if (order.isDone()) {
                continue;
            }
            BigDecimal remaining = order.amount().subtract(order.executedAmountBase());
            if (order.tradeType() == TradeType.BUY && asset.equals(quoteOf(order.tradingPair()))) {
                locked = locked.add(remaining.multiply(order.price()));
            } else if (order.tradeType() == TradeType.SELL && asset.equals(baseOf(order.tradingPair()))) {
                locked = locked.add(remaining);
            }
        }
        return getBalance(asset).subtract(locked);
    }

    @Override
    public synchronized Optional<InFlightOrder> getInFlightOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    // ========================================
    // Test controls
    // ========================================

    /**
     * Sets the mid price of a pair and fills every resting limit order it crosses.
     *
     * @param tradingPair trading pair
     * @param price new mid price (positive)
     */
    public synchronized void setPrice(String tradingPair, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive (current: " + price + ")");
        }
        prices.put(tradingPair, price);
        matchResting(tradingPair);
    }

    /**
     * Sets the order book of a pair (best bid/ask take precedence over the mid price).
     */
    public synchronized void setOrderBook(OrderBook orderBook) {
        if (orderBook == null) {
            throw new IllegalArgumentException("orderBook cannot be null");
        }
        orderBooks.put(orderBook.tradingPair(), orderBook);
        matchResting(orderBook.tradingPair());
    }

    /**
     * Sets the top of book of a pair.
     */
    public void setTopOfBook(String tradingPair, BigDecimal bestBid, BigDecimal bestAsk) {
        setOrderBook(new OrderBook(tradingPair,
            List.of(new OrderBookEntry(bestBid, BigDecimal.ONE)),
            List.of(new OrderBookEntry(bestAsk, BigDecimal.ONE)),
            clock.millis()));
    }

    public synchronized void setBalance(String asset, BigDecimal amount) {
        balances.put(asset, amount);
    }

    /**
     * Makes every subsequent buy/sell throw until turned off.
     */
    public synchronized void rejectOrders(boolean reject) {
        this.rejecting = reject;
    }

    /**
     * Fills part of an open order at its limit price (or the current price for market orders).
     *
     * @param orderId order id
     * @param amount base amount to fill (capped at the remaining amount)
     * @return true if the order was open and a fill was published
     */
    public synchronized boolean fill(String orderId, BigDecimal amount) {
        InFlightOrder order = orders.get(orderId);
        if (order == null || order.isDone()) {
            return false;
        }
        BigDecimal price = order.price().signum() > 0
            ? order.price()
            : prices.getOrDefault(order.tradingPair(), BigDecimal.ZERO);
        fillLocked(orderId, amount, price);
        return true;
    }

    /**
     * Fails an open order asynchronously (publishes an order failed event).
     */
    public synchronized boolean failOrder(String orderId, String reason) {
        InFlightOrder order = orders.get(orderId);
        if (order == null || order.isDone()) {
            return false;
        }
        failLocked(orderId, reason);
        return true;
    }

    /**
     * Drops an order without publishing anything, as if the exchange lost it.
     */
    public synchronized boolean forgetOrder(String orderId) {
        return orders.remove(orderId) != null;
    }

    public synchronized List<InFlightOrder> getOpenOrders() {
        List<InFlightOrder> open = new ArrayList<>();
        for (InFlightOrder order : orders.values()) {
            if (!order.isDone()) {
                open.add(order);
            }
        }
        return open;
    }

    private void matchResting(String tradingPair) {
        for (InFlightOrder order : new ArrayList<>(orders.values())) {
            if (order.isDone() || !order.tradingPair().equals(tradingPair) || order.orderType() == OrderType.MARKET) {
                continue;
            }
            if (crossingPrice(order.tradeType(), tradingPair, OrderType.LIMIT, order.price()).isPresent()) {
                fillLocked(order.clientOrderId(), order.amount().subtract(order.executedAmountBase()), order.price());
            }
        }
    }

    /**
     * Price at which an order would execute right now, if it crosses the book.
     */
    private Optional<BigDecimal> crossingPrice(TradeType side, String tradingPair, OrderType orderType, BigDecimal price) {
        Optional<BigDecimal> opposite = getPrice(tradingPair, side == TradeType.BUY ? PriceType.BEST_ASK : PriceType.BEST_BID);
        if (opposite.isEmpty()) {
            return Optional.empty();
        }
        if (orderType == OrderType.MARKET) {
            return opposite;
        }
        boolean crosses = side == TradeType.BUY
            ? price.compareTo(opposite.get()) >= 0
            : price.compareTo(opposite.get()) <= 0;
        return crosses ? opposite : Optional.empty();
    }

    private void fillLocked(String orderId, BigDecimal amount, BigDecimal price) {
        InFlightOrder order = orders.get(orderId);
        BigDecimal remaining = order.amount().subtract(order.executedAmountBase());
        BigDecimal fillAmount = amount.min(remaining);
        if (fillAmount.signum() <= 0) {
            return;
        }
        BigDecimal quote = fillAmount.multiply(price);
        BigDecimal fee = quote.multiply(feeRate);
        long now = clock.millis();

        InFlightOrder updated = order.withFill(fillAmount, price, fee);
        orders.put(orderId, updated);
        lastTrades.put(order.tradingPair(), price);
        settle(order.tradingPair(), order.tradeType(), fillAmount, quote, fee);

        bus.publish(new OrderFilledEvent(orderId, order.tradingPair(), order.tradeType(), order.orderType(), price,
            fillAmount, fee, "T-" + (++sequence), now));
        if (updated.isFilled()) {
            bus.publish(new OrderCompletedEvent(orderId, order.tradingPair(), order.tradeType(),
                updated.executedAmountBase(), updated.executedAmountQuote(), now));
        }
    }

    private void failLocked(String orderId, String reason) {
        InFlightOrder order = orders.get(orderId);
        orders.put(orderId, order.withState(OrderState.FAILED));
        bus.publish(new OrderFailedEvent(orderId, order.orderType(), reason, clock.millis()));
    }

    private void settle(String tradingPair, TradeType side, BigDecimal base, BigDecimal quote, BigDecimal fee) {
        String baseAsset = baseOf(tradingPair);
        String quoteAsset = quoteOf(tradingPair);
        if (side == TradeType.BUY) {
            balances.merge(baseAsset, base, BigDecimal::add);
            balances.merge(quoteAsset, quote.add(fee).negate(), BigDecimal::add);
        } else {
            balances.merge(baseAsset, base.negate(), BigDecimal::add);
            balances.merge(quoteAsset, quote.subtract(fee), BigDecimal::add);
        }
    }

    private static String baseOf(String tradingPair) {
        int dash = tradingPair.indexOf('-');
        return dash < 0 ? tradingPair : tradingPair.substring(0, dash);
    }

    private static String quoteOf(String tradingPair) {
        int dash = tradingPair.indexOf('-');
        return dash < 0 ? "" : tradingPair.substring(dash + 1);
    }
}
