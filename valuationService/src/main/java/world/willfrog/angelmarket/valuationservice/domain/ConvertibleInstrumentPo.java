package world.willfrog.angelmarket.valuationservice.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
public class ConvertibleInstrumentPo {
    private Long id;
    private Long investmentId;
    private Long startupId;
    private Long investorId;
    private InstrumentType instrumentType;
    private SafeType safeType;
    private BigDecimal principal;
    /** 年化利率，百分数 */
    private BigDecimal interestRate;
    private LocalDate issueDate;
    private LocalDate maturityDate;
    /** 折扣率，百分数 */
    private BigDecimal discountRate;
    private BigDecimal valuationCap;
    private BigDecimal qualifiedFinancingThreshold;
    private CompoundingMode compounding;
    private Boolean autoConversion;
    private String securityType;
    private Boolean proRataRight;
    private Boolean mfnProvision;
    private String documentUrl;
    private BigDecimal accruedInterest;
    private OffsetDateTime lastAccrualAt;
    private InstrumentStatus status;
    private BigDecimal conversionPrice;
    private Long convertedShares;
    private OffsetDateTime convertedAt;
    private BigDecimal repaidAmount;
    private OffsetDateTime repaidAt;
    private Integer version;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
