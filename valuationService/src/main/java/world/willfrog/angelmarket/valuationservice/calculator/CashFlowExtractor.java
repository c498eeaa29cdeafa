package world.willfrog.angelmarket.valuationservice.calculator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.domain.DistributionPo;
import world.willfrog.angelmarket.valuationservice.domain.InvestmentPo;
import world.willfrog.angelmarket.valuationservice.domain.ValuationSnapshotPo;
import world.willfrog.angelmarket.valuationservice.exception.ResourceNotFoundException;
import world.willfrog.angelmarket.valuationservice.mapper.DistributionMapper;
import world.willfrog.angelmarket.valuationservice.mapper.InvestmentMapper;
import world.willfrog.angelmarket.valuationservice.mapper.ValuationSnapshotMapper;
import world.willfrog.angelmarket.valuationservice.model.CashFlowEvent;
import world.willfrog.angelmarket.valuationservice.model.CashFlowType;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.model.PeriodReturn;
import world.willfrog.angelmarket.valuationservice.model.PortfolioCashFlows;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;

/**
 * 把组合的投资、分配与估值快照整理为带符号的现金流序列和分期收益序列
 */
@Slf4j
@Component
public class CashFlowExtractor {

    private final InvestmentMapper investmentMapper;
    private final DistributionMapper distributionMapper;
    private final ValuationSnapshotMapper snapshotMapper;

    public CashFlowExtractor(InvestmentMapper investmentMapper,
                             DistributionMapper distributionMapper,
                             ValuationSnapshotMapper snapshotMapper) {
        this.investmentMapper = investmentMapper;
        this.distributionMapper = distributionMapper;
        this.snapshotMapper = snapshotMapper;
    }

    public PortfolioCashFlows extract(Long portfolioId, DateRange range) {
        requirePortfolio(portfolioId);
        List<InvestmentPo> investments =
                investmentMapper.listActiveByPortfolioBetween(portfolioId, range.start(), range.end());

        List<CashFlowEvent> events = new ArrayList<>();
        List<Long> investmentIds = new ArrayList<>();
        BigDecimal totalInvested = BigDecimal.ZERO;
        BigDecimal currentValue = BigDecimal.ZERO;
        for (InvestmentPo investment : investments) {
            if (investment.getAmount() == null || investment.getAmount().signum() <= 0) {
                log.warn("Skip investment without positive amount id={} portfolioId={}", investment.getId(), portfolioId);
                continue;
            }
            investmentIds.add(investment.getId());
            events.add(new CashFlowEvent(investment.getInvestmentDate(), investment.getAmount().negate(),
                    investment.getId(), CashFlowType.INVESTMENT));
            totalInvested = totalInvested.add(investment.getAmount());
            currentValue = currentValue.add(valuationOf(investment));
        }

        BigDecimal distributions = BigDecimal.ZERO;
        if (!investmentIds.isEmpty()) {
            for (DistributionPo distribution : distributionMapper.listByInvestmentsBetween(investmentIds, range.start(), range.end())) {
                if (distribution.getAmount() == null || distribution.getAmount().signum() <= 0) {
                    continue;
                }
                events.add(new CashFlowEvent(distribution.getDistributionDate(), distribution.getAmount(),
                        distribution.getInvestmentId(), CashFlowType.DISTRIBUTION));
                distributions = distributions.add(distribution.getAmount());
            }
        }

        if (currentValue.signum() > 0) {
            events.add(new CashFlowEvent(range.end(), currentValue, null, CashFlowType.TERMINAL_VALUATION));
        }
        events.sort(Comparator.comparing(CashFlowEvent::date));

        return new PortfolioCashFlows(portfolioId, range, List.copyOf(events), totalInvested, distributions,
                currentValue, periodicReturns(portfolioId, range));
    }

    /**
     * 截至指定日期组合内有效投资的估值合计，口径与 {@link #extract} 的终值一致
     */
    public BigDecimal valueAsOf(Long portfolioId, LocalDate asOf) {
        requirePortfolio(portfolioId);
        BigDecimal total = BigDecimal.ZERO;
        for (InvestmentPo investment : investmentMapper.listActiveByPortfolioAsOf(portfolioId, asOf)) {
            if (investment.getAmount() == null || investment.getAmount().signum() <= 0) {
                continue;
            }
            total = total.add(valuationOf(investment));
        }
        return total;
    }

    public List<ValuationSnapshotPo> snapshots(Long portfolioId, DateRange range) {
        return snapshotMapper.listByPortfolioBetween(portfolioId, range.start(), range.end());
    }

    public List<PeriodReturn> periodicReturns(Long portfolioId, DateRange range) {
        return toPeriodicReturns(snapshots(portfolioId, range));
    }

    /**
     * r_i = v_i / v_{i-1} − 1，前值为 0 或缺失的区间跳过
     */
    public List<PeriodReturn> toPeriodicReturns(List<ValuationSnapshotPo> snapshots) {
        List<PeriodReturn> returns = new ArrayList<>();
        BigDecimal previous = null;
        for (ValuationSnapshotPo snapshot : snapshots) {
            BigDecimal value = snapshot.getTotalValue();
            if (previous != null && previous.signum() > 0 && value != null) {
                returns.add(new PeriodReturn(snapshot.getSnapshotDate(),
                        value.divide(previous, MATH_CONTEXT).subtract(BigDecimal.ONE)));
            }
            previous = value;
        }
        return returns;
    }

    // 未记录估值的投资按成本计
    private static BigDecimal valuationOf(InvestmentPo investment) {
        return investment.getCurrentValuation() == null ? investment.getAmount() : investment.getCurrentValuation();
    }

    public void requirePortfolio(Long portfolioId) {
        if (portfolioId == null || investmentMapper.countByPortfolio(portfolioId) == 0) {
            throw new ResourceNotFoundException("组合不存在或没有投资记录: " + portfolioId);
        }
    }
}
