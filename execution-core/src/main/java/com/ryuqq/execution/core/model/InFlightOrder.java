package com.ryuqq.execution.core.model;

import java.math.BigDecimal;

/**
 * 거래소 커넥터가 보고하는 주문 스냅샷 (불변).
 *
 * <p>TrackedOrder는 이 스냅샷의 최신 값을 보관합니다.</p>
 *
 * @param clientOrderId 로컬에서 생성된 주문 ID
 * @param exchangeOrderId 거래소가 부여한 주문 ID (아직 없으면 null)
 * @param tradingPair 거래쌍
 * @param orderType 주문 유형
 * @param tradeType 주문 방향
 * @param price 주문 가격 (시장가는 0)
 * @param amount 주문 수량
 * @param executedAmountBase 체결 수량 (base)
 * @param executedAmountQuote 체결 금액 (quote)
 * @param cumulativeFeeQuote 누적 수수료 (quote)
 * @param state 현재 상태
 * @param creationTimestamp 생성 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record InFlightOrder(
    String clientOrderId,
    String exchangeOrderId,
    String tradingPair,
    OrderType orderType,
    TradeType tradeType,
    BigDecimal price,
    BigDecimal amount,
    BigDecimal executedAmountBase,
    BigDecimal executedAmountQuote,
    BigDecimal cumulativeFeeQuote,
    OrderState state,
    long creationTimestamp
) {

    public InFlightOrder {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("clientOrderId cannot be null or blank");
        }
        if (tradingPair == null || tradingPair.isBlank()) {
            throw new IllegalArgumentException("tradingPair cannot be null or blank");
        }
        if (orderType == null || tradeType == null || state == null) {
            throw new IllegalArgumentException("orderType, tradeType and state cannot be null");
        }
        price = price == null ? BigDecimal.ZERO : price;
        amount = amount == null ? BigDecimal.ZERO : amount;
        executedAmountBase = executedAmountBase == null ? BigDecimal.ZERO : executedAmountBase;
        executedAmountQuote = executedAmountQuote == null ? BigDecimal.ZERO : executedAmountQuote;
        cumulativeFeeQuote = cumulativeFeeQuote == null ? BigDecimal.ZERO : cumulativeFeeQuote;
    }

    public boolean isDone() {
        return state.isTerminal();
    }

    public boolean isFilled() {
        return state == OrderState.FILLED;
    }

    /**
     * 상태만 변경한 새 인스턴스 생성.
     */
    public InFlightOrder withState(OrderState state) {
        return new InFlightOrder(clientOrderId, exchangeOrderId, tradingPair, orderType, tradeType, price, amount,
            executedAmountBase, executedAmountQuote, cumulativeFeeQuote, state, creationTimestamp);
    }

    /**
     * 체결 반영한 새 인스턴스 생성.
     *
     * @param fillBase 체결 수량
     * @param fillPrice 체결 가격
     * @param feeQuote 체결 수수료 (quote)
     * @return 누적 체결/수수료가 더해진 인스턴스 (전량 체결이면 FILLED, 아니면 PARTIALLY_FILLED)
     */
    public InFlightOrder withFill(BigDecimal fillBase, BigDecimal fillPrice, BigDecimal feeQuote) {
        BigDecimal base = executedAmountBase.add(fillBase);
        BigDecimal quote = executedAmountQuote.add(fillBase.multiply(fillPrice));
        BigDecimal fees = cumulativeFeeQuote.add(feeQuote == null ? BigDecimal.ZERO : feeQuote);
        OrderState next = base.compareTo(amount) >= 0 ? OrderState.FILLED : OrderState.PARTIALLY_FILLED;
        return new InFlightOrder(clientOrderId, exchangeOrderId, tradingPair, orderType, tradeType, price, amount,
            base, quote, fees, next, creationTimestamp);
    }
}
