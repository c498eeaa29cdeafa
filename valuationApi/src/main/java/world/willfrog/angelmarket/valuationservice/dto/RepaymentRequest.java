package world.willfrog.angelmarket.valuationservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class RepaymentRequest {
    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    private BigDecimal repaymentAmount;
}
