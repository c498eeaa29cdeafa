package world.willfrog.angelmarket.valuationservice.engine;

import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.model.InstrumentTerms;

import java.math.BigDecimal;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.HUNDRED;

/**
 * 校验工具条款，失败时抛出的异常带上违反约束的字段名
 */
final class InstrumentTermsValidator {

    private InstrumentTermsValidator() {}

    static void validate(InstrumentTerms terms) {
        if (terms == null) {
            throw new ValidationException("terms", "不能为空");
        }
        if (terms.investmentId() == null) {
            throw new ValidationException("investmentId", "不能为空");
        }
        if (terms.instrumentType() == null) {
            throw new ValidationException("instrumentType", "不能为空");
        }
        if (terms.principal() == null || terms.principal().signum() <= 0) {
            throw new ValidationException("principal", "必须大于 0");
        }
        if (terms.interestRate() != null) {
            requirePercent("interestRate", terms.interestRate());
        } else if (terms.instrumentType() == InstrumentType.NOTE) {
            throw new ValidationException("interestRate", "可转债必须设置年化利率");
        }
        if (terms.issueDate() == null) {
            throw new ValidationException("issueDate", "不能为空");
        }
        if (terms.maturityDate() == null || !terms.maturityDate().isAfter(terms.issueDate())) {
            throw new ValidationException("maturityDate", "必须晚于 issueDate");
        }
        if (terms.discountRate() != null) {
            requirePercent("discountRate", terms.discountRate());
        }
        if (terms.valuationCap() != null && terms.valuationCap().signum() <= 0) {
            throw new ValidationException("valuationCap", "必须大于 0");
        }
        if (terms.qualifiedFinancingThreshold() != null && terms.qualifiedFinancingThreshold().signum() <= 0) {
            throw new ValidationException("qualifiedFinancingThreshold", "必须大于 0");
        }
        if (terms.instrumentType() == InstrumentType.SAFE) {
            if (terms.valuationCap() == null && terms.discountRate() == null) {
                throw new ValidationException("valuationCap", "SAFE 至少需要估值上限或折扣率之一");
            }
            if (terms.interestRate() != null && terms.interestRate().signum() != 0) {
                throw new ValidationException("interestRate", "SAFE 不计息");
            }
        }
    }

    private static void requirePercent(String field, BigDecimal value) {
        if (value.signum() < 0 || value.compareTo(HUNDRED) > 0) {
            throw new ValidationException(field, "取值范围为 [0, 100]");
        }
    }
}
