package world.willfrog.angelmarket.valuationservice.service;

import world.willfrog.angelmarket.valuationservice.dto.BenchmarkComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PeerComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PerformanceResponse;
import world.willfrog.angelmarket.valuationservice.dto.RiskMetricsResponse;
import world.willfrog.angelmarket.valuationservice.model.DateRange;

public interface PortfolioAnalyticsService {

    PerformanceResponse getPerformance(Long portfolioId, DateRange range);

    BenchmarkComparisonResponse compareToIndex(Long portfolioId, String indexCode, DateRange range);

    PeerComparisonResponse compareToPeers(Long portfolioId, String cohort, DateRange range);

    RiskMetricsResponse getRiskMetrics(Long portfolioId, DateRange range);
}
