package world.willfrog.angelmarket.valuationservice.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class ValuationSnapshotPo {
    private Long portfolioId;
    private SnapshotType snapshotType;
    private LocalDate snapshotDate;
    private BigDecimal totalValue;
}
