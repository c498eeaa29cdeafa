package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
public class RiskMetricsResponse {
    private Long portfolioId;
    private LocalDate fromDate;
    private LocalDate toDate;
    private Integer investmentCount;
    private BigDecimal herfindahlIndex;
    private String concentrationBand;
    private String concentrationLabel;
    private List<SectorShareResponse> sectors;
    private String topSector;
    private BigDecimal topSectorShare;
    private BigDecimal volatility;
    private String volatilityLabel;
    private BigDecimal sharpeRatio;
    private String sharpeLabel;
    private Integer riskScore;
    private String riskLevel;
}
