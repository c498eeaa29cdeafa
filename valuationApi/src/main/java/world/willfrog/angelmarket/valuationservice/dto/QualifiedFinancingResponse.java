package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class QualifiedFinancingResponse {
    private Long instrumentId;
    private BigDecimal roundAmount;
    private BigDecimal threshold;
    private boolean qualified;
}
