package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class PeerComparisonResponse {
    private Long portfolioId;
    private String cohort;
    private LocalDate fromDate;
    private LocalDate toDate;
    private BigDecimal portfolioReturn;
    private Integer peerCount;
    private BigDecimal percentileRank;
    private BigDecimal averageReturn;
    private BigDecimal medianReturn;
    private BigDecimal topQuartileReturn;
    private BigDecimal bottomQuartileReturn;
}
