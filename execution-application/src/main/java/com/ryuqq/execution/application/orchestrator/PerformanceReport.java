package com.ryuqq.execution.application.orchestrator;

import com.ryuqq.execution.core.model.CloseType;

import java.math.BigDecimal;
import java.util.Map;

/**
 * controller 하나의 성과 요약.
 *
 * <p>종료된 Executor의 순손익은 실현 손익, 실행 중인 Executor의 순손익은 미실현 손익으로 집계합니다.
 * 비율 값은 거래량 대비 백분율이며 거래량이 0이면 0입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param realizedPnlQuote 실현 손익 (quote)
 * @param unrealizedPnlQuote 미실현 손익 (quote)
 * @param globalPnlQuote 실현 + 미실현 손익
 * @param realizedPnlPct 실현 손익률 (%)
 * @param unrealizedPnlPct 미실현 손익률 (%)
 * @param globalPnlPct 전체 손익률 (%)
 * @param volumeTraded 누적 체결 금액 (quote)
 * @param closeTypeCounts 종료 유형별 Executor 수
 */
public record PerformanceReport(
    BigDecimal realizedPnlQuote,
    BigDecimal unrealizedPnlQuote,
    BigDecimal globalPnlQuote,
    BigDecimal realizedPnlPct,
    BigDecimal unrealizedPnlPct,
    BigDecimal globalPnlPct,
    BigDecimal volumeTraded,
    Map<CloseType, Integer> closeTypeCounts
) {

    public PerformanceReport {
        closeTypeCounts = closeTypeCounts == null ? Map.of() : Map.copyOf(closeTypeCounts);
    }

    /**
     * Executor가 하나도 없는 controller의 빈 보고서.
     */
    public static PerformanceReport empty() {
        return new PerformanceReport(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, Map.of());
    }
}
