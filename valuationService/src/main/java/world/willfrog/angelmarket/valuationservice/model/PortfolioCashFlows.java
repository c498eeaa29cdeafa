package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioCashFlows(
        Long portfolioId,
        DateRange range,
        List<CashFlowEvent> events,
        BigDecimal totalInvested,
        BigDecimal realizedDistributions,
        BigDecimal currentValue,
        List<PeriodReturn> periodicReturns
) {
}
