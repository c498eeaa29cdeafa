package world.willfrog.angelmarket.valuationservice.util;

import lombok.experimental.UtilityClass;
import world.willfrog.angelmarket.valuationservice.dto.BenchmarkComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PeerComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PerformanceResponse;
import world.willfrog.angelmarket.valuationservice.dto.RiskMetricsResponse;
import world.willfrog.angelmarket.valuationservice.dto.SectorShareResponse;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkComparison;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.model.PeerComparison;
import world.willfrog.angelmarket.valuationservice.model.PerformanceSnapshot;
import world.willfrog.angelmarket.valuationservice.model.RiskAssessment;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.METRIC_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MONEY_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

@UtilityClass
public class AnalyticsConverter {

    public static PerformanceResponse toResponse(PerformanceSnapshot snapshot) {
        return PerformanceResponse.builder()
                .portfolioId(snapshot.portfolioId())
                .fromDate(snapshot.range().start())
                .toDate(snapshot.range().end())
                .totalInvested(money(snapshot.totalInvested()))
                .realizedDistributions(money(snapshot.realizedDistributions()))
                .currentValue(money(snapshot.currentValue()))
                .irr(snapshot.irr())
                .moic(snapshot.moic())
                .cashOnCash(snapshot.cashOnCash())
                .totalReturn(snapshot.totalReturn())
                .annualizedReturn(snapshot.annualizedReturn())
                .volatility(snapshot.volatility())
                .sharpeRatio(snapshot.sharpeRatio())
                .cashFlowCount(snapshot.cashFlowCount())
                .build();
    }

    public static BenchmarkComparisonResponse toResponse(Long portfolioId, DateRange range, BenchmarkComparison comparison) {
        return BenchmarkComparisonResponse.builder()
                .portfolioId(portfolioId)
                .benchmark(comparison.benchmarkName())
                .fromDate(range.start())
                .toDate(range.end())
                .alignedPeriods(comparison.alignedPeriods())
                .portfolioReturn(comparison.portfolioReturn())
                .benchmarkReturn(comparison.benchmarkReturn())
                .outperformance(comparison.outperformance())
                .alpha(comparison.alpha())
                .beta(comparison.beta())
                .correlation(comparison.correlation())
                .trackingError(comparison.trackingError())
                .build();
    }

    public static PeerComparisonResponse toResponse(Long portfolioId, String cohort, DateRange range,
                                                    PeerComparison comparison) {
        return PeerComparisonResponse.builder()
                .portfolioId(portfolioId)
                .cohort(cohort)
                .fromDate(range.start())
                .toDate(range.end())
                .portfolioReturn(comparison.portfolioReturn())
                .peerCount(comparison.peerCount())
                .percentileRank(comparison.percentileRank())
                .averageReturn(comparison.averageReturn())
                .medianReturn(comparison.medianReturn())
                .topQuartileReturn(comparison.topQuartileReturn())
                .bottomQuartileReturn(comparison.bottomQuartileReturn())
                .build();
    }

    public static RiskMetricsResponse toResponse(RiskAssessment assessment) {
        return RiskMetricsResponse.builder()
                .portfolioId(assessment.portfolioId())
                .fromDate(assessment.range().start())
                .toDate(assessment.range().end())
                .investmentCount(assessment.investmentCount())
                .herfindahlIndex(assessment.herfindahlIndex())
                .concentrationBand(assessment.concentrationBand().name())
                .concentrationLabel(assessment.concentrationBand().getLabel())
                .sectors(toSectorShares(assessment.sectorConcentration().investedBySector()))
                .topSector(assessment.sectorConcentration().topSector())
                .topSectorShare(assessment.sectorConcentration().topSectorShare())
                .volatility(assessment.volatility())
                .volatilityLabel(assessment.volatilityLabel())
                .sharpeRatio(assessment.sharpeRatio())
                .sharpeLabel(assessment.sharpeLabel())
                .riskScore(assessment.riskScore())
                .riskLevel(assessment.riskLevel().name())
                .build();
    }

    private static List<SectorShareResponse> toSectorShares(Map<String, BigDecimal> investedBySector) {
        BigDecimal total = investedBySector.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return investedBySector.entrySet().stream()
                .map(entry -> SectorShareResponse.builder()
                        .sector(entry.getKey())
                        .invested(money(entry.getValue()))
                        .share(total.signum() == 0 ? BigDecimal.ZERO
                                : entry.getValue().divide(total, MATH_CONTEXT).setScale(METRIC_SCALE, ROUNDING))
                        .build())
                .toList();
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(MONEY_SCALE, ROUNDING);
    }
}
