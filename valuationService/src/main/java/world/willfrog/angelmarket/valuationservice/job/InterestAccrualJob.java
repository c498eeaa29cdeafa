package world.willfrog.angelmarket.valuationservice.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.engine.ConvertibleInstrumentEngine;
import world.willfrog.angelmarket.valuationservice.exception.BizException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 每日计息任务：为所有 ACTIVE 工具计提利息，并对临近到期与已逾期的工具告警。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "valuation.accrual", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InterestAccrualJob {

    private final ConvertibleInstrumentEngine instrumentEngine;
    private final ValuationProperties properties;
    private final Clock clock;

    public InterestAccrualJob(ConvertibleInstrumentEngine instrumentEngine,
                              ValuationProperties properties,
                              Clock clock) {
        this.instrumentEngine = instrumentEngine;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${valuation.accrual.cron:0 5 0 * * *}")
    public void run() {
        runOnce();
    }

    public AccrualRunSummary runOnce() {
        List<ConvertibleInstrumentPo> active = instrumentEngine.listActive();
        LocalDate today = LocalDate.now(clock);
        int warningDays = properties.getAccrual().getMaturityWarningDays();
        log.info("Interest accrual started date={} activeInstruments={}", today, active.size());

        int processed = 0;
        int failed = 0;
        int maturingSoon = 0;
        int overdue = 0;
        for (ConvertibleInstrumentPo instrument : active) {
            Long id = instrument.getId();
            try {
                instrumentEngine.accrueInterest(id);
                processed++;
            } catch (BizException e) {
                failed++;
                log.warn("Interest accrual skipped instrumentId={} code={} msg={}", id, e.getCode(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                failed++;
                log.error("Interest accrual failed instrumentId={}", id, e);
                continue;
            }

            LocalDate maturity = instrument.getMaturityDate();
            if (maturity == null) {
                continue;
            }
            long daysLeft = ChronoUnit.DAYS.between(today, maturity);
            if (daysLeft < 0) {
                overdue++;
                log.error("Instrument overdue instrumentId={} maturityDate={} daysOverdue={}", id, maturity, -daysLeft);
            } else if (daysLeft <= warningDays) {
                maturingSoon++;
                log.warn("Instrument maturing soon instrumentId={} maturityDate={} daysLeft={}", id, maturity, daysLeft);
            }
        }

        AccrualRunSummary summary = new AccrualRunSummary(processed, failed, maturingSoon, overdue);
        log.info("Interest accrual finished date={} summary={}", today, summary);
        return summary;
    }

    public record AccrualRunSummary(int processed, int failed, int maturingSoon, int overdue) {
    }
}
