package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;

public record RiskAssessment(
        Long portfolioId,
        DateRange range,
        int investmentCount,
        BigDecimal herfindahlIndex,
        ConcentrationBand concentrationBand,
        SectorConcentration sectorConcentration,
        BigDecimal volatility,
        String volatilityLabel,
        BigDecimal sharpeRatio,
        String sharpeLabel,
        int riskScore,
        RiskLevel riskLevel
) {
}
