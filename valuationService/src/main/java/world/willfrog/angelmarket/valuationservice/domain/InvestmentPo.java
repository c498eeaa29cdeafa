package world.willfrog.angelmarket.valuationservice.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 投资记录，portfolioId 即投资人的组合标识
 */
@Data
public class InvestmentPo {
    private Long id;
    private Long portfolioId;
    private Long startupId;
    private String startupName;
    private String sector;
    private BigDecimal amount;
    private LocalDate investmentDate;
    private BigDecimal currentValuation;
    private InvestmentStatus status;
}
