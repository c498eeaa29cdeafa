package world.willfrog.angelmarket.valuationservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import world.willfrog.angelmarket.valuationservice.constants.ValuationConstants;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "valuation")
public class ValuationProperties {

    /** 计息起点与到期判断使用的时区 */
    private String zoneId = ValuationConstants.DEFAULT_ZONE_ID;

    private Cache cache = new Cache();
    private Performance performance = new Performance();
    private Risk risk = new Risk();
    private Accrual accrual = new Accrual();
    private Snapshot snapshot = new Snapshot();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(5);
        private int maxEntries = 1000;
    }

    @Data
    public static class Performance {
        private BigDecimal riskFreeRate = new BigDecimal("0.02");
        /** 快照收益的年化频率，月度快照为 12 */
        private int periodsPerYear = 12;
        private int irrMaxIterations = 100;
        private double irrTolerance = 1e-7;
        private double irrInitialGuess = 0.1;
    }

    @Data
    public static class Risk {
        private BigDecimal wellDiversifiedBelow = new BigDecimal("0.15");
        private BigDecimal moderatelyConcentratedBelow = new BigDecimal("0.25");
        private BigDecimal highlyConcentratedBelow = new BigDecimal("0.5");

        private BigDecimal lowVolatilityBelow = new BigDecimal("0.15");
        private BigDecimal moderateVolatilityBelow = new BigDecimal("0.25");
        private BigDecimal highVolatilityBelow = new BigDecimal("0.40");

        private int fewHoldingsBelow = 5;
        private int limitedHoldingsBelow = 10;

        private int highRiskScore = 6;
        private int moderateRiskScore = 3;
    }

    @Data
    public static class Accrual {
        private boolean enabled = true;
        private String cron = "0 5 0 * * *";
        private int maturityWarningDays = 30;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = true;
        /** 日终执行，快照代表当天收盘后的组合估值 */
        private String cron = "0 55 23 * * *";
        /** 日度快照保留天数，月度快照不清理 */
        private int retentionDays = 90;
    }
}
