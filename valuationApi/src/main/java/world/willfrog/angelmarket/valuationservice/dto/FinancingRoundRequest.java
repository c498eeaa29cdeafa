package world.willfrog.angelmarket.valuationservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class FinancingRoundRequest {
    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    private BigDecimal pricePerShare;

    /** 本轮投前完全稀释股本，工具设置了估值上限时必填 */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal fullyDilutedShares;

    @DecimalMin("0.00")
    private BigDecimal roundAmount;
}
