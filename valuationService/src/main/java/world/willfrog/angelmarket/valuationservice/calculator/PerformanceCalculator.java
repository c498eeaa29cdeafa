package world.willfrog.angelmarket.valuationservice.calculator;

import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.exception.InsufficientDataException;
import world.willfrog.angelmarket.valuationservice.model.CashFlowEvent;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.model.PerformanceSnapshot;
import world.willfrog.angelmarket.valuationservice.model.PeriodReturn;
import world.willfrog.angelmarket.valuationservice.model.PortfolioCashFlows;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;
import static world.willfrog.angelmarket.valuationservice.calculator.MetricMath.scale;

/**
 * 组合绩效指标：IRR、MOIC、现金回报、总收益、年化收益、波动率、夏普比率。
 * <p>
 * {@link #calculate(PortfolioCashFlows)} 只依赖入参，不同组合可以并发计算。
 */
@Component
public class PerformanceCalculator {

    private static final double DAYS_PER_YEAR = 365d;

    private final CashFlowExtractor cashFlowExtractor;
    private final ValuationProperties.Performance settings;
    private final IrrSolver irrSolver;

    public PerformanceCalculator(CashFlowExtractor cashFlowExtractor, ValuationProperties properties) {
        this.cashFlowExtractor = cashFlowExtractor;
        this.settings = properties.getPerformance();
        this.irrSolver = new IrrSolver(settings.getIrrMaxIterations(), settings.getIrrTolerance(),
                settings.getIrrInitialGuess());
    }

    public PerformanceSnapshot calculatePortfolioPerformance(Long portfolioId, DateRange range) {
        return calculate(cashFlowExtractor.extract(portfolioId, range));
    }

    public PerformanceSnapshot calculate(PortfolioCashFlows flows) {
        requireInvestedCapital(flows);
        BigDecimal invested = flows.totalInvested();
        BigDecimal distributions = flows.realizedDistributions();
        BigDecimal currentValue = flows.currentValue();

        BigDecimal totalReturn = totalReturn(currentValue, distributions, invested);
        BigDecimal annualized = annualizedReturn(totalReturn, elapsedDays(flows.events(), flows.range().end()));
        BigDecimal volatility = volatility(flows.periodicReturns());
        BigDecimal irr = scale(BigDecimal.valueOf(irrSolver.solve(flows.events())));

        return new PerformanceSnapshot(
                flows.portfolioId(),
                flows.range(),
                invested,
                distributions,
                currentValue,
                irr,
                moic(currentValue, distributions, invested),
                cashOnCash(distributions, invested),
                scale(totalReturn),
                scale(annualized),
                scale(volatility),
                sharpeRatio(annualized, volatility),
                flows.events().size());
    }

    /**
     * 区间内的年化收益，没有投入资本时抛出 {@link InsufficientDataException}
     */
    public BigDecimal annualizedReturn(PortfolioCashFlows flows) {
        requireInvestedCapital(flows);
        BigDecimal totalReturn = totalReturn(flows.currentValue(), flows.realizedDistributions(), flows.totalInvested());
        return annualizedReturn(totalReturn, elapsedDays(flows.events(), flows.range().end()));
    }

    /**
     * (当前价值 + 已实现分配) / 投入资本
     */
    public BigDecimal moic(BigDecimal currentValue, BigDecimal distributions, BigDecimal invested) {
        return scale(currentValue.add(distributions).divide(invested, MATH_CONTEXT));
    }

    public BigDecimal cashOnCash(BigDecimal distributions, BigDecimal invested) {
        return scale(distributions.divide(invested, MATH_CONTEXT));
    }

    public BigDecimal totalReturn(BigDecimal currentValue, BigDecimal distributions, BigDecimal invested) {
        return currentValue.add(distributions).subtract(invested).divide(invested, MATH_CONTEXT);
    }

    /**
     * CAGR = (1 + totalReturn)^(365 / days) − 1，不足一天时直接返回总收益。
     * 区间过短导致年化结果超出 double 范围时抛出 {@link InsufficientDataException}
     */
    public BigDecimal annualizedReturn(BigDecimal totalReturn, long elapsedDays) {
        if (elapsedDays < 1) {
            return totalReturn;
        }
        double growth = BigDecimal.ONE.add(totalReturn).doubleValue();
        if (growth <= 0d) {
            return BigDecimal.ONE.negate();
        }
        double annualized = Math.pow(growth, DAYS_PER_YEAR / elapsedDays) - 1d;
        if (!Double.isFinite(annualized)) {
            throw new InsufficientDataException("区间 " + elapsedDays + " 天过短，总收益 " + totalReturn
                    + " 无法年化");
        }
        return BigDecimal.valueOf(annualized);
    }

    /**
     * 分期收益的总体标准差 × sqrt(每年期数)，少于两期时为 0
     */
    public BigDecimal volatility(List<PeriodReturn> periodicReturns) {
        if (periodicReturns == null || periodicReturns.size() < 2) {
            return BigDecimal.ZERO;
        }
        List<BigDecimal> values = periodicReturns.stream().map(PeriodReturn::value).toList();
        BigDecimal periods = BigDecimal.valueOf(settings.getPeriodsPerYear());
        return MetricMath.populationStdDev(values).multiply(MetricMath.sqrt(periods), MATH_CONTEXT);
    }

    /**
     * 波动率为 0 时返回 0
     */
    public BigDecimal sharpeRatio(BigDecimal annualizedReturn, BigDecimal volatility) {
        if (volatility == null || volatility.signum() == 0) {
            return scale(BigDecimal.ZERO);
        }
        return scale(annualizedReturn.subtract(settings.getRiskFreeRate()).divide(volatility, MATH_CONTEXT));
    }

    private void requireInvestedCapital(PortfolioCashFlows flows) {
        BigDecimal invested = flows.totalInvested();
        if (invested == null || invested.signum() <= 0) {
            throw new InsufficientDataException("组合 " + flows.portfolioId() + " 在区间 "
                    + flows.range().start() + " ~ " + flows.range().end() + " 内没有投入资本");
        }
    }

    private long elapsedDays(List<CashFlowEvent> events, LocalDate end) {
        if (events.isEmpty()) {
            return 0L;
        }
        return ChronoUnit.DAYS.between(events.get(0).date(), end);
    }
}
