package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
public class RepaymentResponse {
    private Long instrumentId;
    private BigDecimal accruedInterest;
    private BigDecimal totalOwed;
    private BigDecimal repaymentAmount;
    private BigDecimal overpayment;
    private OffsetDateTime repaidAt;
}
