package world.willfrog.angelmarket.valuationservice.calculator;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.domain.InvestmentPo;
import world.willfrog.angelmarket.valuationservice.model.ConcentrationBand;
import world.willfrog.angelmarket.valuationservice.model.RiskLevel;
import world.willfrog.angelmarket.valuationservice.model.SectorConcentration;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static world.willfrog.angelmarket.valuationservice.calculator.MetricMath.scale;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.DEFAULT_SECTOR;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;

/**
 * 持仓集中度与综合风险等级。只统计 APPROVED / COMPLETED 状态的投资，阈值全部来自配置。
 */
@Component
public class ConcentrationRiskAnalyzer {

    private final ValuationProperties.Risk settings;

    public ConcentrationRiskAnalyzer(ValuationProperties properties) {
        this.settings = properties.getRisk();
    }

    /**
     * HHI = Σ (amount_i / total)²，n 笔等额投资时为 1/n，单笔时为 1；没有有效投资时为 0
     */
    public BigDecimal herfindahlIndex(List<InvestmentPo> investments) {
        List<InvestmentPo> active = activeInvestments(investments);
        BigDecimal total = totalInvested(active);
        if (total.signum() == 0) {
            return scale(BigDecimal.ZERO);
        }
        BigDecimal hhi = BigDecimal.ZERO;
        for (InvestmentPo investment : active) {
            BigDecimal weight = investment.getAmount().divide(total, MATH_CONTEXT);
            hhi = hhi.add(weight.multiply(weight, MATH_CONTEXT));
        }
        return scale(hhi);
    }

    public ConcentrationBand classifyConcentration(BigDecimal hhi) {
        if (hhi.compareTo(settings.getWellDiversifiedBelow()) < 0) {
            return ConcentrationBand.WELL_DIVERSIFIED;
        }
        if (hhi.compareTo(settings.getModeratelyConcentratedBelow()) < 0) {
            return ConcentrationBand.MODERATELY_CONCENTRATED;
        }
        if (hhi.compareTo(settings.getHighlyConcentratedBelow()) < 0) {
            return ConcentrationBand.HIGHLY_CONCENTRATED;
        }
        return ConcentrationBand.VERY_HIGHLY_CONCENTRATED;
    }

    /**
     * 按行业汇总投资额，行业为空的归入 Other
     */
    public SectorConcentration sectorConcentration(List<InvestmentPo> investments) {
        List<InvestmentPo> active = activeInvestments(investments);
        Map<String, BigDecimal> bySector = new HashMap<>();
        for (InvestmentPo investment : active) {
            String sector = StringUtils.isBlank(investment.getSector()) ? DEFAULT_SECTOR : investment.getSector().trim();
            bySector.merge(sector, investment.getAmount(), BigDecimal::add);
        }

        Map<String, BigDecimal> ordered = new LinkedHashMap<>();
        bySector.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));

        BigDecimal total = totalInvested(active);
        if (ordered.isEmpty() || total.signum() == 0) {
            return new SectorConcentration(ordered, null, scale(BigDecimal.ZERO));
        }
        Map.Entry<String, BigDecimal> top = ordered.entrySet().iterator().next();
        return new SectorConcentration(ordered, top.getKey(), scale(top.getValue().divide(total, MATH_CONTEXT)));
    }

    /**
     * 波动率、集中度、持仓数量三项打分相加后映射为风险等级
     */
    public RiskLevel overallRiskLevel(BigDecimal volatility, BigDecimal hhi, int investmentCount) {
        int score = riskScore(volatility, hhi, investmentCount);
        if (score >= settings.getHighRiskScore()) {
            return RiskLevel.HIGH;
        }
        if (score >= settings.getModerateRiskScore()) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.LOW;
    }

    public int riskScore(BigDecimal volatility, BigDecimal hhi, int investmentCount) {
        int score = 0;
        if (volatility.compareTo(settings.getHighVolatilityBelow()) > 0) {
            score += 3;
        } else if (volatility.compareTo(settings.getModerateVolatilityBelow()) > 0) {
            score += 2;
        } else if (volatility.compareTo(settings.getLowVolatilityBelow()) > 0) {
            score += 1;
        }

        if (hhi.compareTo(settings.getHighlyConcentratedBelow()) > 0) {
            score += 3;
        } else if (hhi.compareTo(settings.getModeratelyConcentratedBelow()) > 0) {
            score += 2;
        } else if (hhi.compareTo(settings.getWellDiversifiedBelow()) > 0) {
            score += 1;
        }

        if (investmentCount < settings.getFewHoldingsBelow()) {
            score += 2;
        } else if (investmentCount < settings.getLimitedHoldingsBelow()) {
            score += 1;
        }
        return score;
    }

    public String volatilityLabel(BigDecimal volatility) {
        if (volatility.compareTo(settings.getLowVolatilityBelow()) < 0) {
            return "Low volatility";
        }
        if (volatility.compareTo(settings.getModerateVolatilityBelow()) < 0) {
            return "Moderate volatility";
        }
        if (volatility.compareTo(settings.getHighVolatilityBelow()) < 0) {
            return "High volatility";
        }
        return "Very high volatility";
    }

    public String sharpeLabel(BigDecimal sharpeRatio) {
        if (sharpeRatio.signum() < 0) {
            return "Poor risk-adjusted returns";
        }
        if (sharpeRatio.compareTo(BigDecimal.ONE) < 0) {
            return "Below average risk-adjusted returns";
        }
        if (sharpeRatio.compareTo(BigDecimal.valueOf(2)) < 0) {
            return "Good risk-adjusted returns";
        }
        if (sharpeRatio.compareTo(BigDecimal.valueOf(3)) < 0) {
            return "Very good risk-adjusted returns";
        }
        return "Excellent risk-adjusted returns";
    }

    public List<InvestmentPo> activeInvestments(List<InvestmentPo> investments) {
        return investments.stream()
                .filter(investment -> investment.getStatus() != null && investment.getStatus().isActive())
                .filter(investment -> investment.getAmount() != null && investment.getAmount().signum() > 0)
                .toList();
    }

    private BigDecimal totalInvested(List<InvestmentPo> active) {
        BigDecimal total = BigDecimal.ZERO;
        for (InvestmentPo investment : active) {
            total = total.add(investment.getAmount());
        }
        return total;
    }
}
