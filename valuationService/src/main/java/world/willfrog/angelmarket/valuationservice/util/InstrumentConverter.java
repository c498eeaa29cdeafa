package world.willfrog.angelmarket.valuationservice.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;
import world.willfrog.angelmarket.valuationservice.domain.SafeType;
import world.willfrog.angelmarket.valuationservice.dto.ConversionResponse;
import world.willfrog.angelmarket.valuationservice.dto.FinancingRoundConversionResponse;
import world.willfrog.angelmarket.valuationservice.dto.FinancingRoundRequest;
import world.willfrog.angelmarket.valuationservice.dto.InstrumentCreateRequest;
import world.willfrog.angelmarket.valuationservice.dto.InstrumentResponse;
import world.willfrog.angelmarket.valuationservice.dto.RepaymentResponse;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.model.ConversionResult;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.model.FinancingRoundConversionResult;
import world.willfrog.angelmarket.valuationservice.model.InstrumentTerms;
import world.willfrog.angelmarket.valuationservice.model.RepaymentResult;

import java.math.BigDecimal;
import java.util.Locale;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MONEY_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

@UtilityClass
public class InstrumentConverter {

    public static InstrumentTerms toTerms(InstrumentCreateRequest request) {
        return InstrumentTerms.builder()
                .investmentId(request.getInvestmentId())
                .startupId(request.getStartupId())
                .investorId(request.getInvestorId())
                .instrumentType(parseEnum(InstrumentType.class, "instrumentType", request.getInstrumentType()))
                .safeType(parseEnum(SafeType.class, "safeType", request.getSafeType()))
                .principal(request.getPrincipal())
                .interestRate(request.getInterestRate())
                .issueDate(request.getIssueDate())
                .maturityDate(request.getMaturityDate())
                .discountRate(request.getDiscountRate())
                .valuationCap(request.getValuationCap())
                .qualifiedFinancingThreshold(request.getQualifiedFinancingThreshold())
                .compounding(parseEnum(CompoundingMode.class, "compounding", request.getCompounding()))
                .autoConversion(request.getAutoConversion())
                .securityType(request.getSecurityType())
                .proRataRight(request.getProRataRight())
                .mfnProvision(request.getMfnProvision())
                .documentUrl(request.getDocumentUrl())
                .build();
    }

    public static FinancingRound toRound(FinancingRoundRequest request) {
        return new FinancingRound(request.getPricePerShare(), request.getFullyDilutedShares(), request.getRoundAmount());
    }

    public static InstrumentResponse toResponse(ConvertibleInstrumentPo po) {
        return InstrumentResponse.builder()
                .id(po.getId())
                .investmentId(po.getInvestmentId())
                .startupId(po.getStartupId())
                .investorId(po.getInvestorId())
                .instrumentType(nameOf(po.getInstrumentType()))
                .safeType(nameOf(po.getSafeType()))
                .principal(po.getPrincipal())
                .interestRate(po.getInterestRate())
                .issueDate(po.getIssueDate())
                .maturityDate(po.getMaturityDate())
                .discountRate(po.getDiscountRate())
                .valuationCap(po.getValuationCap())
                .qualifiedFinancingThreshold(po.getQualifiedFinancingThreshold())
                .compounding(nameOf(po.getCompounding()))
                .autoConversion(po.getAutoConversion())
                .securityType(po.getSecurityType())
                .proRataRight(po.getProRataRight())
                .mfnProvision(po.getMfnProvision())
                .documentUrl(po.getDocumentUrl())
                .accruedInterest(money(po.getAccruedInterest()))
                .lastAccrualAt(po.getLastAccrualAt())
                .status(nameOf(po.getStatus()))
                .conversionPrice(po.getConversionPrice())
                .convertedShares(po.getConvertedShares())
                .convertedAt(po.getConvertedAt())
                .repaidAmount(po.getRepaidAmount())
                .repaidAt(po.getRepaidAt())
                .version(po.getVersion())
                .build();
    }

    public static ConversionResponse toResponse(ConversionResult result) {
        return ConversionResponse.builder()
                .instrumentId(result.instrumentId())
                .principal(result.principal())
                .accruedInterest(money(result.accruedInterest()))
                .totalAmount(money(result.totalAmount()))
                .conversionPrice(result.conversionPrice())
                .shares(result.shares())
                .convertedAt(result.convertedAt())
                .build();
    }

    public static RepaymentResponse toResponse(RepaymentResult result) {
        return RepaymentResponse.builder()
                .instrumentId(result.instrumentId())
                .accruedInterest(money(result.accruedInterest()))
                .totalOwed(result.totalOwed())
                .repaymentAmount(result.repaymentAmount())
                .overpayment(money(result.overpayment()))
                .repaidAt(result.repaidAt())
                .build();
    }

    public static FinancingRoundConversionResponse toResponse(FinancingRoundConversionResult result) {
        return FinancingRoundConversionResponse.builder()
                .startupId(result.startupId())
                .conversions(result.conversions().stream().map(InstrumentConverter::toResponse).toList())
                .skippedInstrumentIds(result.skippedInstrumentIds())
                .build();
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(MONEY_SCALE, ROUNDING);
    }

    private static String nameOf(Enum<?> value) {
        return value == null ? null : value.name();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, "不支持的取值 " + raw);
        }
    }
}
