package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 截至 date 的单期收益率
 */
public record PeriodReturn(LocalDate date, BigDecimal value) {
}
