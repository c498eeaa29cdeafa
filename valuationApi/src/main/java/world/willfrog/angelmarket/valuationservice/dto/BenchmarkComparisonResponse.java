package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class BenchmarkComparisonResponse {
    private Long portfolioId;
    private String benchmark;
    private LocalDate fromDate;
    private LocalDate toDate;
    private Integer alignedPeriods;
    private BigDecimal portfolioReturn;
    private BigDecimal benchmarkReturn;
    private BigDecimal outperformance;
    private BigDecimal alpha;
    private BigDecimal beta;
    private BigDecimal correlation;
    private BigDecimal trackingError;
}
