package world.willfrog.angelmarket.valuationservice.exception;

import lombok.Getter;
import world.willfrog.angelmarket.common.dto.ResponseCode;

import java.math.BigDecimal;

@Getter
public class InsufficientRepaymentException extends BizException {
    private final BigDecimal totalOwed;
    private final BigDecimal repaymentAmount;

    public InsufficientRepaymentException(BigDecimal totalOwed, BigDecimal repaymentAmount) {
        super(ResponseCode.INSUFFICIENT_REPAYMENT,
                "repaymentAmount " + repaymentAmount.toPlainString() + " 低于应还总额 " + totalOwed.toPlainString());
        this.totalOwed = totalOwed;
        this.repaymentAmount = repaymentAmount;
    }
}
