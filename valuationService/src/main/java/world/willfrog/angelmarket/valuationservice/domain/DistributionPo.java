package world.willfrog.angelmarket.valuationservice.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class DistributionPo {
    private Long id;
    private Long investmentId;
    private BigDecimal amount;
    private LocalDate distributionDate;
}
