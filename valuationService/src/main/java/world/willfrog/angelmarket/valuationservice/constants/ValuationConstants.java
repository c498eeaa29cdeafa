package world.willfrog.angelmarket.valuationservice.constants;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class ValuationConstants {
    private ValuationConstants() {}

    public static final int MONEY_SCALE = 2;
    public static final int METRIC_SCALE = 6;
    /** 应计利息与转换价格的存储精度 */
    public static final int PRECISE_SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final MathContext MATH_CONTEXT = MathContext.DECIMAL64;

    public static final BigDecimal HUNDRED = new BigDecimal("100");
    public static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365");
    public static final long SECONDS_PER_DAY = 86_400L;

    public static final String DEFAULT_SECURITY_TYPE = "Preferred";
    public static final String DEFAULT_SECTOR = "Other";
    public static final String DEFAULT_ZONE_ID = "UTC";
}
