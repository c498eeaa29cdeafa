package world.willfrog.angelmarket.valuationservice.calculator;

import java.math.BigDecimal;
import java.util.List;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.METRIC_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

/**
 * 总体统计量（除以 n），与收益波动、beta、跟踪误差的口径一致
 */
public final class MetricMath {

    private MetricMath() {}

    public static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            sum = sum.add(value);
        }
        return sum.divide(BigDecimal.valueOf(values.size()), MATH_CONTEXT);
    }

    public static BigDecimal populationVariance(List<BigDecimal> values) {
        return populationCovariance(values, values);
    }

    public static BigDecimal populationCovariance(List<BigDecimal> left, List<BigDecimal> right) {
        if (left.size() != right.size()) {
            throw new IllegalArgumentException("series length mismatch: " + left.size() + " vs " + right.size());
        }
        if (left.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal leftMean = mean(left);
        BigDecimal rightMean = mean(right);
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < left.size(); i++) {
            sum = sum.add(left.get(i).subtract(leftMean).multiply(right.get(i).subtract(rightMean), MATH_CONTEXT));
        }
        return sum.divide(BigDecimal.valueOf(left.size()), MATH_CONTEXT);
    }

    public static BigDecimal populationStdDev(List<BigDecimal> values) {
        return sqrt(populationVariance(values));
    }

    public static BigDecimal sqrt(BigDecimal value) {
        if (value.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return value.sqrt(MATH_CONTEXT);
    }

    /**
     * 多期收益复合为区间收益：Π(1 + r) − 1
     */
    public static BigDecimal compound(List<BigDecimal> returns) {
        BigDecimal growth = BigDecimal.ONE;
        for (BigDecimal value : returns) {
            growth = growth.multiply(BigDecimal.ONE.add(value), MATH_CONTEXT);
        }
        return growth.subtract(BigDecimal.ONE);
    }

    public static BigDecimal scale(BigDecimal value) {
        return value.setScale(METRIC_SCALE, ROUNDING);
    }
}
