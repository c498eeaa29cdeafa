package world.willfrog.angelmarket.valuationservice.calculator;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.angelmarket.valuationservice.domain.PricePoint;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.BenchmarkDataMapper;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkSeries;
import world.willfrog.angelmarket.valuationservice.model.PeriodReturn;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MATH_CONTEXT;

/**
 * 把指数收盘价重采样到组合快照日期上，得到可与组合分期收益按日期对齐的基准收益序列
 */
@Component
public class BenchmarkSeriesLoader {

    private final BenchmarkDataMapper benchmarkDataMapper;

    public BenchmarkSeriesLoader(BenchmarkDataMapper benchmarkDataMapper) {
        this.benchmarkDataMapper = benchmarkDataMapper;
    }

    /**
     * @param observationDates 升序的组合快照日期，第一天只作为起点，不产生收益
     */
    public BenchmarkSeries loadIndexReturns(String indexCode, List<LocalDate> observationDates) {
        if (StringUtils.isBlank(indexCode)) {
            throw new ValidationException("indexCode", "不能为空");
        }
        if (observationDates.isEmpty()) {
            return new BenchmarkSeries(indexCode, List.of());
        }
        LocalDate first = observationDates.get(0);
        LocalDate last = observationDates.get(observationDates.size() - 1);

        NavigableMap<LocalDate, BigDecimal> closes = new TreeMap<>();
        PricePoint prior = benchmarkDataMapper.findLastCloseBefore(indexCode, first);
        if (prior != null && prior.getClose() != null) {
            closes.put(prior.getTradeDate(), prior.getClose());
        }
        for (PricePoint point : benchmarkDataMapper.listIndexCloses(indexCode, first, last)) {
            if (point.getTradeDate() != null && point.getClose() != null) {
                closes.put(point.getTradeDate(), point.getClose());
            }
        }

        CloseTracker tracker = new CloseTracker(closes);
        List<PeriodReturn> returns = new ArrayList<>();
        BigDecimal previous = null;
        for (LocalDate date : observationDates) {
            BigDecimal level = tracker.resolve(date);
            if (previous != null && previous.signum() > 0 && level != null) {
                returns.add(new PeriodReturn(date, level.divide(previous, MATH_CONTEXT).subtract(BigDecimal.ONE)));
            }
            previous = level;
        }
        return new BenchmarkSeries(indexCode, returns);
    }

    /**
     * 非交易日沿用此前最近一个收盘价
     */
    private static class CloseTracker {
        private final NavigableMap<LocalDate, BigDecimal> closes;

        CloseTracker(NavigableMap<LocalDate, BigDecimal> closes) {
            this.closes = closes;
        }

        BigDecimal resolve(LocalDate date) {
            Map.Entry<LocalDate, BigDecimal> entry = closes.floorEntry(date);
            return entry == null ? null : entry.getValue();
        }
    }
}
