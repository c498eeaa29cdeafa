package world.willfrog.angelmarket.valuationservice.model;

import lombok.Builder;
import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;
import world.willfrog.angelmarket.valuationservice.domain.SafeType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 创建可转换工具时的条款。可选字段为 null 表示未设置。
 */
@Builder
public record InstrumentTerms(
        Long investmentId,
        Long startupId,
        Long investorId,
        InstrumentType instrumentType,
        SafeType safeType,
        BigDecimal principal,
        BigDecimal interestRate,
        LocalDate issueDate,
        LocalDate maturityDate,
        BigDecimal discountRate,
        BigDecimal valuationCap,
        BigDecimal qualifiedFinancingThreshold,
        CompoundingMode compounding,
        Boolean autoConversion,
        String securityType,
        Boolean proRataRight,
        Boolean mfnProvision,
        String documentUrl
) {
}
