package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;

/**
 * 组合在一个日期范围内的绩效指标，随时可由底层记录重新计算，不落库
 */
public record PerformanceSnapshot(
        Long portfolioId,
        DateRange range,
        BigDecimal totalInvested,
        BigDecimal realizedDistributions,
        BigDecimal currentValue,
        BigDecimal irr,
        BigDecimal moic,
        BigDecimal cashOnCash,
        BigDecimal totalReturn,
        BigDecimal annualizedReturn,
        BigDecimal volatility,
        BigDecimal sharpeRatio,
        int cashFlowCount
) {
}
