package world.willfrog.angelmarket.valuationservice.controller;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;
import world.willfrog.angelmarket.common.dto.ResponseWrapper;
import world.willfrog.angelmarket.valuationservice.dto.BenchmarkComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PeerComparisonResponse;
import world.willfrog.angelmarket.valuationservice.dto.PerformanceResponse;
import world.willfrog.angelmarket.valuationservice.dto.RiskMetricsResponse;
import world.willfrog.angelmarket.valuationservice.model.DateRange;
import world.willfrog.angelmarket.valuationservice.service.PortfolioAnalyticsService;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/portfolios/{portfolioId}/analytics")
public class PortfolioAnalyticsController {

    private final PortfolioAnalyticsService analyticsService;

    public PortfolioAnalyticsController(PortfolioAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/performance")
    public ResponseWrapper<PerformanceResponse> performance(
            @PathVariable("portfolioId") Long portfolioId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseWrapper.success(analyticsService.getPerformance(portfolioId, new DateRange(from, to)));
    }

    @GetMapping("/benchmarks/{indexCode}")
    public ResponseWrapper<BenchmarkComparisonResponse> benchmark(
            @PathVariable("portfolioId") Long portfolioId,
            @PathVariable("indexCode") String indexCode,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseWrapper.success(analyticsService.compareToIndex(portfolioId, indexCode, new DateRange(from, to)));
    }

    @GetMapping("/peers")
    public ResponseWrapper<PeerComparisonResponse> peers(
            @PathVariable("portfolioId") Long portfolioId,
            @RequestParam("cohort") String cohort,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseWrapper.success(analyticsService.compareToPeers(portfolioId, cohort, new DateRange(from, to)));
    }

    @GetMapping("/risk")
    public ResponseWrapper<RiskMetricsResponse> risk(
            @PathVariable("portfolioId") Long portfolioId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseWrapper.success(analyticsService.getRiskMetrics(portfolioId, new DateRange(from, to)));
    }
}
