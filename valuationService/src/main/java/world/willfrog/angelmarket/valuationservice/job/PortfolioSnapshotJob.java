package world.willfrog.angelmarket.valuationservice.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.exception.BizException;
import world.willfrog.angelmarket.valuationservice.service.PortfolioSnapshotService;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 日终估值快照：每个组合写一条日度快照，月末再写一条月度快照，最后清理过期的日度快照。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "valuation.snapshot", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PortfolioSnapshotJob {

    private final PortfolioSnapshotService snapshotService;
    private final ValuationProperties properties;
    private final Clock clock;

    public PortfolioSnapshotJob(PortfolioSnapshotService snapshotService,
                                ValuationProperties properties,
                                Clock clock) {
        this.snapshotService = snapshotService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${valuation.snapshot.cron:0 55 23 * * *}")
    public void run() {
        runOnce();
    }

    public SnapshotRunSummary runOnce() {
        LocalDate today = LocalDate.now(clock);
        boolean monthEnd = today.plusDays(1).getDayOfMonth() == 1;
        List<Long> portfolioIds = snapshotService.listSnapshotPortfolios();
        log.info("Portfolio snapshot started date={} portfolios={} monthEnd={}", today, portfolioIds.size(), monthEnd);

        int daily = 0;
        int monthly = 0;
        int failed = 0;
        for (Long portfolioId : portfolioIds) {
            try {
                snapshotService.createDailySnapshot(portfolioId, today);
                daily++;
                if (monthEnd) {
                    snapshotService.createMonthlySnapshot(portfolioId, today);
                    monthly++;
                }
            } catch (BizException e) {
                failed++;
                log.warn("Portfolio snapshot skipped portfolioId={} code={} msg={}", portfolioId, e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Portfolio snapshot failed portfolioId={}", portfolioId, e);
            }
        }

        int purged = 0;
        try {
            purged = snapshotService.cleanupOldSnapshots(properties.getSnapshot().getRetentionDays(), today);
        } catch (RuntimeException e) {
            // 清理失败不影响当天快照结果
            log.error("Snapshot cleanup failed date={}", today, e);
        }

        SnapshotRunSummary summary = new SnapshotRunSummary(portfolioIds.size(), daily, monthly, failed, purged);
        log.info("Portfolio snapshot finished date={} summary={}", today, summary);
        return summary;
    }

    public record SnapshotRunSummary(int portfolios, int dailyCreated, int monthlyCreated, int failed, int purged) {
    }
}
