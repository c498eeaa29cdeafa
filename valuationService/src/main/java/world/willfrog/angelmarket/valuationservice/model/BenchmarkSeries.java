package world.willfrog.angelmarket.valuationservice.model;

import java.util.List;

/**
 * 外部基准的按日期收益序列
 */
public record BenchmarkSeries(String name, List<PeriodReturn> returns) {
}
