package com.ryuqq.execution.core.executor;

import com.ryuqq.execution.core.model.CloseType;
import com.ryuqq.execution.core.runnable.RunnableStatus;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Executor 상태 스냅샷 (불변).
 *
 * <p>{@link ExecutorBase#getExecutorInfo()} 호출 시점의 주문 상태로 계산되며,
 * 생성 이후 바뀌지 않습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param id Executor 식별자
 * @param type Executor 유형
 * @param status 수명주기 상태
 * @param closeType 종료 유형 (종료 전이면 null)
 * @param timestamp 생성 시각 (epoch millis)
 * @param closeTimestamp 종료 시각 (종료 전이면 0)
 * @param netPnlQuote 순손익 (quote)
 * @param netPnlPct 순손익률
 * @param cumFeesQuote 누적 수수료 (quote)
 * @param filledAmountQuote 누적 체결 금액 (quote)
 * @param isActive RUNNING 또는 SHUTTING_DOWN 여부
 * @param isTrading 포지션 보유 중 여부
 * @param customInfo Executor별 추가 정보
 */
public record ExecutorInfo(
    String id,
    String type,
    RunnableStatus status,
    CloseType closeType,
    long timestamp,
    long closeTimestamp,
    BigDecimal netPnlQuote,
    BigDecimal netPnlPct,
    BigDecimal cumFeesQuote,
    BigDecimal filledAmountQuote,
    boolean isActive,
    boolean isTrading,
    Map<String, Object> customInfo
) {

    public ExecutorInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        netPnlQuote = netPnlQuote == null ? BigDecimal.ZERO : netPnlQuote;
        netPnlPct = netPnlPct == null ? BigDecimal.ZERO : netPnlPct;
        cumFeesQuote = cumFeesQuote == null ? BigDecimal.ZERO : cumFeesQuote;
        filledAmountQuote = filledAmountQuote == null ? BigDecimal.ZERO : filledAmountQuote;
        customInfo = customInfo == null ? Map.of() : Map.copyOf(customInfo);
    }

    public boolean isDone() {
        return status.isTerminal();
    }
}
