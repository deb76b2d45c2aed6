package com.ryuqq.execution.core.spi;

import com.ryuqq.execution.core.model.InFlightOrder;
import com.ryuqq.execution.core.model.OrderBook;
import com.ryuqq.execution.core.model.OrderType;
import com.ryuqq.execution.core.model.PriceType;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Exchange Connector SPI.
 *
 * <p>Executor가 주문을 내고 시장/잔고를 조회하기 위해 필요한 거래소 기능입니다.
 * 거래소별 REST/WebSocket 구현, 인증, rate limit은 구현체 책임입니다.</p>
 *
 * <p><strong>주문 ID 규약:</strong></p>
 * <ul>
 *   <li>{@link #buy}/{@link #sell}은 로컬 주문 ID를 동기적으로 반환합니다.</li>
 *   <li>이후의 접수/체결/취소/실패는 {@link OrderEventSource}를 통해 비동기로 전달됩니다.</li>
 *   <li>동기 거부(잘못된 요청 등)는 예외로 던집니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface ExchangeConnector {

    /**
     * 커넥터 이름 (예: binance, kucoin_paper_trade).
     *
     * @return 커넥터 이름
     */
    String name();

    /**
     * 매수 주문.
     *
     * @param tradingPair 거래쌍
     * @param amount 수량 (양수)
     * @param orderType 주문 유형
     * @param price 가격 (MARKET이면 무시)
     * @return 로컬 주문 ID
     * @throws RuntimeException 거래소가 동기적으로 거부한 경우
     */
    String buy(String tradingPair, BigDecimal amount, OrderType orderType, BigDecimal price);

    /**
     * 매도 주문.
     *
     * @param tradingPair 거래쌍
     * @param amount 수량 (양수)
     * @param orderType 주문 유형
     * @param price 가격 (MARKET이면 무시)
     * @return 로컬 주문 ID
     * @throws RuntimeException 거래소가 동기적으로 거부한 경우
     */
    String sell(String tradingPair, BigDecimal amount, OrderType orderType, BigDecimal price);

    /**
     * 주문 취소 요청.
     *
     * <p>취소 결과는 이벤트로 전달됩니다.</p>
     *
     * @param tradingPair 거래쌍
     * @param orderId 로컬 주문 ID
     */
    void cancel(String tradingPair, String orderId);

    /**
     * 가격 조회.
     *
     * @param tradingPair 거래쌍
     * @param priceType 가격 기준
     * @return 가격 (시세가 없으면 empty)
     */
    Optional<BigDecimal> getPrice(String tradingPair, PriceType priceType);

    /**
     * 호가창 조회.
     *
     * @param tradingPair 거래쌍
     * @return 호가창 (알 수 없는 거래쌍이면 empty)
     */
    Optional<OrderBook> getOrderBook(String tradingPair);

    /**
     * 총 잔고.
     *
     * @param asset 자산 심볼
     * @return 잔고 (알 수 없는 자산이면 0)
     */
    BigDecimal getBalance(String asset);

    /**
     * 주문 가능 잔고 (미체결 주문에 묶인 금액 제외).
     *
     * @param asset 자산 심볼
     * @return 가용 잔고 (알 수 없는 자산이면 0)
     */
    BigDecimal getAvailableBalance(String asset);

    /**
     * 진행 중 주문 스냅샷 조회.
     *
     * @param orderId 로컬 주문 ID
     * @return 주문 스냅샷 (커넥터가 모르는 주문이면 empty)
     */
    Optional<InFlightOrder> getInFlightOrder(String orderId);
}
