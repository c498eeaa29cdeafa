package world.willfrog.angelmarket.valuationservice.calculator;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.angelmarket.valuationservice.exception.NonConvergenceException;
import world.willfrog.angelmarket.valuationservice.model.CashFlowEvent;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 不规则日期现金流的内部收益率（XIRR）。
 * <p>
 * 求解 Σ cf_i / (1 + r)^(days_i / 365) = 0：先做有界次数的 Newton-Raphson，
 * 未收敛时在逐步放大的区间上二分。两者都失败时抛出 {@link NonConvergenceException}。
 */
@Slf4j
public class IrrSolver {

    private static final double DAYS_PER_YEAR = 365d;
    private static final double LOWER_BOUND = -0.9999d;
    private static final double MAX_UPPER_BOUND = 1e6d;

    private final int maxIterations;
    private final double tolerance;
    private final double initialGuess;

    public IrrSolver(int maxIterations, double tolerance, double initialGuess) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.initialGuess = initialGuess;
    }

    public double solve(List<CashFlowEvent> cashFlows) {
        if (cashFlows == null || cashFlows.isEmpty()) {
            throw new NonConvergenceException("现金流为空，无法求解 IRR", 0);
        }
        boolean hasInflow = false;
        boolean hasOutflow = false;
        LocalDate origin = cashFlows.get(0).date();
        for (CashFlowEvent flow : cashFlows) {
            hasInflow |= flow.amount().signum() > 0;
            hasOutflow |= flow.amount().signum() < 0;
            if (flow.date().isBefore(origin)) {
                origin = flow.date();
            }
        }
        if (!hasInflow || !hasOutflow) {
            throw new NonConvergenceException("现金流没有正负号变化，IRR 不存在", 0);
        }

        double[] amounts = new double[cashFlows.size()];
        double[] years = new double[cashFlows.size()];
        for (int i = 0; i < cashFlows.size(); i++) {
            CashFlowEvent flow = cashFlows.get(i);
            amounts[i] = flow.amount().doubleValue();
            years[i] = ChronoUnit.DAYS.between(origin, flow.date()) / DAYS_PER_YEAR;
        }

        Double newton = newtonRaphson(amounts, years);
        if (newton != null) {
            return newton;
        }
        log.debug("Newton-Raphson did not converge within {} iterations, falling back to bisection", maxIterations);
        return bisection(amounts, years);
    }

    private Double newtonRaphson(double[] amounts, double[] years) {
        double rate = initialGuess;
        for (int i = 0; i < maxIterations; i++) {
            double value = npv(amounts, years, rate);
            double derivative = npvDerivative(amounts, years, rate);
            if (!Double.isFinite(value) || !Double.isFinite(derivative) || derivative == 0d) {
                return null;
            }
            double next = rate - value / derivative;
            if (next <= -1d) {
                // 保持在 (1 + r) > 0 的定义域内
                next = (rate - 1d) / 2d;
            }
            if (Math.abs(next - rate) < tolerance) {
                return next;
            }
            rate = next;
        }
        return null;
    }

    private double bisection(double[] amounts, double[] years) {
        double low = LOWER_BOUND;
        double high = 1d;
        double lowValue = npv(amounts, years, low);
        double highValue = npv(amounts, years, high);
        while (sameSign(lowValue, highValue) && high < MAX_UPPER_BOUND) {
            high *= 10d;
            highValue = npv(amounts, years, high);
        }
        if (!Double.isFinite(lowValue) || !Double.isFinite(highValue) || sameSign(lowValue, highValue)) {
            throw new NonConvergenceException("未找到包含 IRR 的求解区间", maxIterations);
        }

        for (int i = 0; i < maxIterations; i++) {
            double mid = (low + high) / 2d;
            double midValue = npv(amounts, years, mid);
            if (midValue == 0d || (high - low) / 2d < tolerance) {
                return mid;
            }
            if (sameSign(midValue, lowValue)) {
                low = mid;
                lowValue = midValue;
            } else {
                high = mid;
            }
        }
        throw new NonConvergenceException("IRR 在 " + maxIterations + " 次迭代内未收敛", maxIterations);
    }

    static double npv(double[] amounts, double[] years, double rate) {
        double logGrowth = Math.log1p(rate);
        double total = 0d;
        for (int i = 0; i < amounts.length; i++) {
            total += amounts[i] * Math.exp(-years[i] * logGrowth);
        }
        return total;
    }

    static double npvDerivative(double[] amounts, double[] years, double rate) {
        double logGrowth = Math.log1p(rate);
        double total = 0d;
        for (int i = 0; i < amounts.length; i++) {
            total -= years[i] * amounts[i] * Math.exp(-(years[i] + 1d) * logGrowth);
        }
        return total;
    }

    private static boolean sameSign(double left, double right) {
        return Math.signum(left) == Math.signum(right);
    }
}
