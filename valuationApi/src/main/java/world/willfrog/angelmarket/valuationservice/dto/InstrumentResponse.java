package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
public class InstrumentResponse {
    private Long id;
    private Long investmentId;
    private Long startupId;
    private Long investorId;
    private String instrumentType;
    private String safeType;
    private BigDecimal principal;
    private BigDecimal interestRate;
    private LocalDate issueDate;
    private LocalDate maturityDate;
    private BigDecimal discountRate;
    private BigDecimal valuationCap;
    private BigDecimal qualifiedFinancingThreshold;
    private String compounding;
    private Boolean autoConversion;
    private String securityType;
    private Boolean proRataRight;
    private Boolean mfnProvision;
    private String documentUrl;
    private BigDecimal accruedInterest;
    private OffsetDateTime lastAccrualAt;
    private String status;
    private BigDecimal conversionPrice;
    private Long convertedShares;
    private OffsetDateTime convertedAt;
    private BigDecimal repaidAmount;
    private OffsetDateTime repaidAt;
    private Integer version;
}
