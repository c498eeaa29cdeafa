package world.willfrog.angelmarket.valuationservice.engine;

import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.HUNDRED;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.PRECISE_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.SECONDS_PER_DAY;

/**
 * 应计利息计算。
 * <p>
 * 计息天数按秒精确折算为小数天，一年固定 365 天：
 * <ul>
 *     <li>单利：principal × rate × days / 365</li>
 *     <li>复利：以本金加已计利息为基数，balance × ((1 + rate)^(days/365) − 1)。
 *     每次计息只对本区间复利，不回溯到发行日重算。</li>
 * </ul>
 */
final class InterestAccrualCalculator {

    private static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * SECONDS_PER_DAY);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(PRECISE_SCALE);

    private InterestAccrualCalculator() {}

    static BigDecimal interestBetween(ConvertibleInstrumentPo instrument, OffsetDateTime from, OffsetDateTime to) {
        long seconds = elapsedSeconds(from, to);
        BigDecimal rate = instrument.getInterestRate();
        if (seconds == 0 || rate == null || rate.signum() == 0) {
            return ZERO;
        }
        if (instrument.getCompounding() == CompoundingMode.COMPOUND) {
            BigDecimal balance = instrument.getPrincipal().add(accruedOrZero(instrument));
            return compoundInterest(balance, rate, seconds);
        }
        return simpleInterest(instrument.getPrincipal(), rate, seconds);
    }

    static BigDecimal simpleInterest(BigDecimal principal, BigDecimal ratePercent, long seconds) {
        return principal.multiply(ratePercent)
                .multiply(BigDecimal.valueOf(seconds))
                .divide(HUNDRED.multiply(SECONDS_PER_YEAR), PRECISE_SCALE, ROUNDING);
    }

    static BigDecimal compoundInterest(BigDecimal balance, BigDecimal ratePercent, long seconds) {
        double years = seconds / SECONDS_PER_YEAR.doubleValue();
        double rate = ratePercent.doubleValue() / 100d;
        double growth = Math.expm1(years * Math.log1p(rate));
        return balance.multiply(BigDecimal.valueOf(growth)).setScale(PRECISE_SCALE, ROUNDING);
    }

    /**
     * 时钟早于上次计息时返回 0，应计利息不会倒退
     */
    static long elapsedSeconds(OffsetDateTime from, OffsetDateTime to) {
        if (from == null || to == null) {
            return 0L;
        }
        long seconds = Duration.between(from, to).getSeconds();
        return Math.max(seconds, 0L);
    }

    /**
     * 计息截止时刻：上次计息时间加上整秒数，不足一秒的部分留到下次计息
     */
    static OffsetDateTime accrualCutoff(OffsetDateTime from, OffsetDateTime to) {
        return from.plusSeconds(elapsedSeconds(from, to));
    }

    static BigDecimal accruedOrZero(ConvertibleInstrumentPo instrument) {
        return instrument.getAccruedInterest() == null ? ZERO : instrument.getAccruedInterest();
    }
}
