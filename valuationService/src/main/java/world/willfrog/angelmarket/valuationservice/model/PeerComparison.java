package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;

public record PeerComparison(
        BigDecimal portfolioReturn,
        int peerCount,
        BigDecimal percentileRank,
        BigDecimal averageReturn,
        BigDecimal medianReturn,
        BigDecimal topQuartileReturn,
        BigDecimal bottomQuartileReturn
) {
}
