package world.willfrog.angelmarket.valuationservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.angelmarket.valuationservice.cache.ResultCache;
import world.willfrog.angelmarket.valuationservice.calculator.BenchmarkComparator;
import world.willfrog.angelmarket.valuationservice.calculator.BenchmarkSeriesLoader;
import world.willfrog.angelmarket.valuationservice.calculator.CashFlowExtractor;
import world.willfrog.angelmarket.valuationservice.calculator.ConcentrationRiskAnalyzer;
import world.willfrog.angelmarket.valuationservice.calculator.MetricMath;
import world.willfrog.angelmarket.valuationservice.calculator.PerformanceCalculator;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.domain.InvestmentPo;
import world.willfrog.angelmarket.valuationservice.domain.ValuationSnapshotPo;
import world.willfrog.angelmarket.valuationservice.dto.BenchmarkComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PeerComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PerformanceResponse;
import world.willfrog.angelmarket.valuationservice.dto.RiskMetricsResponse;
import world.willfrog.angelmarket.valuationservice.exception.InsufficientDataException;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.BenchmarkDataMapper;
import world.willfrog.angelmarket.valuationservice.mapper.InvestmentMapper;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkComparison;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkSeries;
import world.willfrog.angelmarket.valuationservice.model.ConcentrationBand;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.model.PeerComparison;
import world.willfrog.angelmarket.valuationservice.model.PortfolioCashFlows;
import world.willfrog.angelmarket.valuationservice.model.RiskAssessment;
import world.willfrog.angelmarket.valuationservice.model.RiskLevel;
import world.willfrog.angelmarket.valuationservice.model.SectorConcentration;
import world.willfrog.angelmarket.valuationservice.service.PortfolioAnalyticsService;
import world.willfrog.angelmarket.valuationservice.util.AnalyticsConverter;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 组合分析入口。每类结果各有一个短期缓存，同一 key 并发请求只计算一次。
 */
@Slf4j
@Service
public class PortfolioAnalyticsServiceImpl implements PortfolioAnalyticsService {

    private final CashFlowExtractor cashFlowExtractor;
    private final PerformanceCalculator performanceCalculator;
    private final BenchmarkComparator benchmarkComparator;
    private final BenchmarkSeriesLoader benchmarkSeriesLoader;
    private final ConcentrationRiskAnalyzer riskAnalyzer;
    private final InvestmentMapper investmentMapper;
    private final BenchmarkDataMapper benchmarkDataMapper;

    private final ResultCache<String, PerformanceResponse> performanceCache;
    private final ResultCache<String, BenchmarkComparisonResponse> benchmarkCache;
    private final ResultCache<String, PeerComparisonResponse> peerCache;
    private final ResultCache<String, RiskMetricsResponse> riskCache;

    public PortfolioAnalyticsServiceImpl(CashFlowExtractor cashFlowExtractor,
                                         PerformanceCalculator performanceCalculator,
                                         BenchmarkComparator benchmarkComparator,
                                         BenchmarkSeriesLoader benchmarkSeriesLoader,
                                         ConcentrationRiskAnalyzer riskAnalyzer,
                                         InvestmentMapper investmentMapper,
                                         BenchmarkDataMapper benchmarkDataMapper,
                                         ValuationProperties properties,
                                         Clock clock) {
        this.cashFlowExtractor = cashFlowExtractor;
        this.performanceCalculator = performanceCalculator;
        this.benchmarkComparator = benchmarkComparator;
        this.benchmarkSeriesLoader = benchmarkSeriesLoader;
        this.riskAnalyzer = riskAnalyzer;
        this.investmentMapper = investmentMapper;
        this.benchmarkDataMapper = benchmarkDataMapper;

        ValuationProperties.Cache cache = properties.getCache();
        this.performanceCache = new ResultCache<>("performance", clock, cache.getTtl(), cache.getMaxEntries());
        this.benchmarkCache = new ResultCache<>("benchmarks", clock, cache.getTtl(), cache.getMaxEntries());
        this.peerCache = new ResultCache<>("peers", clock, cache.getTtl(), cache.getMaxEntries());
        this.riskCache = new ResultCache<>("risk", clock, cache.getTtl(), cache.getMaxEntries());
    }

    @Override
    public PerformanceResponse getPerformance(Long portfolioId, DateRange range) {
        String key = "performance:" + portfolioId + ":" + range.cacheKey();
        return performanceCache.getOrCompute(key, () -> {
            log.debug("Computing performance portfolioId={} range={}", portfolioId, range.cacheKey());
            return AnalyticsConverter.toResponse(performanceCalculator.calculatePortfolioPerformance(portfolioId, range));
        });
    }

    @Override
    public BenchmarkComparisonResponse compareToIndex(Long portfolioId, String indexCode, DateRange range) {
        if (StringUtils.isBlank(indexCode)) {
            throw new ValidationException("indexCode", "不能为空");
        }
        String key = "benchmarks:" + portfolioId + ":" + indexCode + ":" + range.cacheKey();
        return benchmarkCache.getOrCompute(key, () -> {
            cashFlowExtractor.requirePortfolio(portfolioId);
            List<LocalDate> observationDates = cashFlowExtractor.snapshots(portfolioId, range).stream()
                    .map(ValuationSnapshotPo::getSnapshotDate)
                    .toList();
            BenchmarkSeries series = benchmarkSeriesLoader.loadIndexReturns(indexCode, observationDates);
            BenchmarkComparison comparison = benchmarkComparator.compareToIndex(portfolioId, series, range);
            return AnalyticsConverter.toResponse(portfolioId, range, comparison);
        });
    }

    @Override
    public PeerComparisonResponse compareToPeers(Long portfolioId, String cohort, DateRange range) {
        if (StringUtils.isBlank(cohort)) {
            throw new ValidationException("cohort", "不能为空");
        }
        String key = "peers:" + portfolioId + ":" + cohort + ":" + range.cacheKey();
        return peerCache.getOrCompute(key, () -> {
            PortfolioCashFlows flows = cashFlowExtractor.extract(portfolioId, range);
            if (flows.totalInvested().signum() <= 0) {
                throw new InsufficientDataException(
                        "组合 " + portfolioId + " 在区间内没有投入资本，无法与同类比较");
            }
            BigDecimal portfolioReturn = performanceCalculator.totalReturn(
                    flows.currentValue(), flows.realizedDistributions(), flows.totalInvested());
            List<BigDecimal> peers = benchmarkDataMapper.listPeerReturns(cohort, portfolioId, range.start(), range.end());
            PeerComparison comparison = benchmarkComparator.compareToPeers(portfolioReturn, peers);
            return AnalyticsConverter.toResponse(portfolioId, cohort, range, comparison);
        });
    }

    @Override
    public RiskMetricsResponse getRiskMetrics(Long portfolioId, DateRange range) {
        String key = "risk:" + portfolioId + ":" + range.cacheKey();
        return riskCache.getOrCompute(key, () -> AnalyticsConverter.toResponse(assessRisk(portfolioId, range)));
    }

    private RiskAssessment assessRisk(Long portfolioId, DateRange range) {
        PortfolioCashFlows flows = cashFlowExtractor.extract(portfolioId, range);
        List<InvestmentPo> active = riskAnalyzer.activeInvestments(investmentMapper.listByPortfolio(portfolioId));

        BigDecimal hhi = riskAnalyzer.herfindahlIndex(active);
        ConcentrationBand band = riskAnalyzer.classifyConcentration(hhi);
        SectorConcentration sectors = riskAnalyzer.sectorConcentration(active);

        BigDecimal volatility = MetricMath.scale(performanceCalculator.volatility(flows.periodicReturns()));
        // 区间内没有新增投资时无法年化，夏普比率按 0 处理
        BigDecimal sharpe = flows.totalInvested().signum() > 0
                ? performanceCalculator.sharpeRatio(performanceCalculator.annualizedReturn(flows), volatility)
                : MetricMath.scale(BigDecimal.ZERO);

        int score = riskAnalyzer.riskScore(volatility, hhi, active.size());
        RiskLevel level = riskAnalyzer.overallRiskLevel(volatility, hhi, active.size());
        return new RiskAssessment(portfolioId, range, active.size(), hhi, band, sectors, volatility,
                riskAnalyzer.volatilityLabel(volatility), sharpe, riskAnalyzer.sharpeLabel(sharpe), score, level);
    }
}
