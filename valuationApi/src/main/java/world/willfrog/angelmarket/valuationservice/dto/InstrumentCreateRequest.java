package world.willfrog.angelmarket.valuationservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 条款的取值范围由估值服务统一校验，这里只做格式层面的约束
 */
@Data
public class InstrumentCreateRequest {
    @NotNull
    private Long investmentId;

    private Long startupId;

    private Long investorId;

    @NotBlank
    @Size(max = 16)
    private String instrumentType;

    @Size(max = 16)
    private String safeType;

    @NotNull
    private BigDecimal principal;

    private BigDecimal interestRate;

    @NotNull
    private LocalDate issueDate;

    @NotNull
    private LocalDate maturityDate;

    private BigDecimal discountRate;

    private BigDecimal valuationCap;

    private BigDecimal qualifiedFinancingThreshold;

    @Size(max = 16)
    private String compounding;

    private Boolean autoConversion;

    @Size(max = 32)
    private String securityType;

    private Boolean proRataRight;

    private Boolean mfnProvision;

    @Size(max = 512)
    private String documentUrl;
}
