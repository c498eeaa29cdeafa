package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;

public record BenchmarkComparison(
        String benchmarkName,
        int alignedPeriods,
        BigDecimal portfolioReturn,
        BigDecimal benchmarkReturn,
        BigDecimal outperformance,
        BigDecimal alpha,
        BigDecimal beta,
        BigDecimal correlation,
        BigDecimal trackingError
) {
}
