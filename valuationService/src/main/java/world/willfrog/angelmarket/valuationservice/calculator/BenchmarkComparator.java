package world.willfrog.angelmarket.valuationservice.calculator;

import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.exception.InsufficientDataException;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkComparison;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkSeries;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.model.PeerComparison;
import world.willfrog.angelmarket.valuationservice.model.PeriodReturn;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static world.willfrog.angelmarket.valuationservice.calculator.MetricMath.scale;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.HUNDRED;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;

/**
 * 组合相对指数或同类组合的表现。
 * <p>
 * 基准方差为 0 时 beta 记为 0，任一序列标准差为 0 时相关系数记为 0。
 */
@Component
public class BenchmarkComparator {

    private static final int MIN_ALIGNED_PERIODS = 2;

    private final CashFlowExtractor cashFlowExtractor;

    public BenchmarkComparator(CashFlowExtractor cashFlowExtractor) {
        this.cashFlowExtractor = cashFlowExtractor;
    }

    public BenchmarkComparison compareToIndex(Long portfolioId, BenchmarkSeries benchmark, DateRange range) {
        cashFlowExtractor.requirePortfolio(portfolioId);
        List<PeriodReturn> portfolioReturns = cashFlowExtractor.periodicReturns(portfolioId, range);
        List<PeriodReturn> benchmarkReturns = benchmark.returns().stream()
                .filter(point -> range.contains(point.date()))
                .toList();
        return compare(portfolioReturns, new BenchmarkSeries(benchmark.name(), benchmarkReturns));
    }

    /**
     * 按日期精确对齐两条收益序列后计算 alpha、beta、相关系数与跟踪误差
     */
    public BenchmarkComparison compare(List<PeriodReturn> portfolioReturns, BenchmarkSeries benchmark) {
        Map<LocalDate, BigDecimal> benchmarkByDate = new HashMap<>();
        for (PeriodReturn point : benchmark.returns()) {
            benchmarkByDate.put(point.date(), point.value());
        }
        List<BigDecimal> portfolio = new ArrayList<>();
        List<BigDecimal> index = new ArrayList<>();
        List<BigDecimal> differences = new ArrayList<>();
        for (PeriodReturn point : portfolioReturns) {
            BigDecimal benchmarkValue = benchmarkByDate.get(point.date());
            if (benchmarkValue == null) {
                continue;
            }
            portfolio.add(point.value());
            index.add(benchmarkValue);
            differences.add(point.value().subtract(benchmarkValue));
        }
        if (portfolio.size() < MIN_ALIGNED_PERIODS) {
            throw new InsufficientDataException("与基准 " + benchmark.name() + " 对齐的区间数为 " + portfolio.size()
                    + "，至少需要 " + MIN_ALIGNED_PERIODS + " 个");
        }

        BigDecimal portfolioReturn = MetricMath.compound(portfolio);
        BigDecimal benchmarkReturn = MetricMath.compound(index);
        BigDecimal covariance = MetricMath.populationCovariance(portfolio, index);
        BigDecimal benchmarkVariance = MetricMath.populationVariance(index);
        BigDecimal beta = benchmarkVariance.signum() == 0
                ? BigDecimal.ZERO : covariance.divide(benchmarkVariance, MATH_CONTEXT);
        BigDecimal alpha = portfolioReturn.subtract(beta.multiply(benchmarkReturn, MATH_CONTEXT));

        BigDecimal stdDevProduct = MetricMath.populationStdDev(portfolio).multiply(MetricMath.populationStdDev(index));
        BigDecimal correlation = stdDevProduct.signum() == 0
                ? BigDecimal.ZERO : covariance.divide(stdDevProduct, MATH_CONTEXT);

        return new BenchmarkComparison(
                benchmark.name(),
                portfolio.size(),
                scale(portfolioReturn),
                scale(benchmarkReturn),
                scale(portfolioReturn.subtract(benchmarkReturn)),
                scale(alpha),
                scale(beta),
                scale(correlation),
                scale(MetricMath.populationStdDev(differences)));
    }

    /**
     * 百分位 = 收益严格低于组合的同类数量 / n × 100；中位数取排序后第 ⌊n/2⌋ 个，上下四分位取 ⌊0.75n⌋ 与 ⌊0.25n⌋
     */
    public PeerComparison compareToPeers(BigDecimal portfolioReturn, List<BigDecimal> peerReturns) {
        if (peerReturns == null || peerReturns.isEmpty()) {
            throw new InsufficientDataException("没有可比较的同类组合收益");
        }
        List<BigDecimal> sorted = new ArrayList<>(peerReturns);
        sorted.sort(BigDecimal::compareTo);
        int n = sorted.size();

        long below = sorted.stream().filter(peer -> portfolioReturn.compareTo(peer) > 0).count();
        BigDecimal percentile = BigDecimal.valueOf(below).multiply(HUNDRED).divide(BigDecimal.valueOf(n), MATH_CONTEXT);

        return new PeerComparison(
                scale(portfolioReturn),
                n,
                scale(percentile),
                scale(MetricMath.mean(sorted)),
                scale(sorted.get(n / 2)),
                scale(sorted.get((int) Math.floor(n * 0.75))),
                scale(sorted.get((int) Math.floor(n * 0.25))));
    }
}
