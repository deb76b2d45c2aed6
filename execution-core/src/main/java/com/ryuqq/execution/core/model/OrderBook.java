package com.ryuqq.execution.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * 호가창 스냅샷 (불변).
 *
 * <p>bids는 가격 내림차순, asks는 가격 오름차순으로 정렬되어 있어야 합니다.</p>
 *
 * @param tradingPair 거래쌍 (예: BTC-USDT)
 * @param bids 매수 호가
 * @param asks 매도 호가
 * @param timestamp 스냅샷 시각 (epoch millis)
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderBook(String tradingPair, List<OrderBookEntry> bids, List<OrderBookEntry> asks, long timestamp) {

    public OrderBook {
        if (tradingPair == null || tradingPair.isBlank()) {
            throw new IllegalArgumentException("tradingPair cannot be null or blank");
        }
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public Optional<OrderBookEntry> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
    }

    public Optional<OrderBookEntry> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
    }

    /**
     * 중간 가격.
     *
     * @return 양쪽 최우선 호가가 모두 있을 때만 값 존재
     */
    public Optional<BigDecimal> midPrice() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(bids.get(0).price().add(asks.get(0).price())
            .divide(BigDecimal.valueOf(2), 18, RoundingMode.HALF_EVEN)
            .stripTrailingZeros());
    }
}
