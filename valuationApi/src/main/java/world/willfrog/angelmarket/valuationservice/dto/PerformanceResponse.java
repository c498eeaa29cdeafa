package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 收益类指标均为小数形式，0.12 表示 12%
 */
@Data
@Builder
public class PerformanceResponse {
    private Long portfolioId;
    private LocalDate fromDate;
    private LocalDate toDate;
    private BigDecimal totalInvested;
    private BigDecimal realizedDistributions;
    private BigDecimal currentValue;
    private BigDecimal irr;
    private BigDecimal moic;
    private BigDecimal cashOnCash;
    private BigDecimal totalReturn;
    private BigDecimal annualizedReturn;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private Integer cashFlowCount;
}
