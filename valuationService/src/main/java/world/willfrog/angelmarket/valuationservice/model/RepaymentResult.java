package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * @param overpayment 还款金额超出应还总额的部分
 */
public record RepaymentResult(
        Long instrumentId,
        BigDecimal accruedInterest,
        BigDecimal totalOwed,
        BigDecimal repaymentAmount,
        BigDecimal overpayment,
        OffsetDateTime repaidAt
) {
}
