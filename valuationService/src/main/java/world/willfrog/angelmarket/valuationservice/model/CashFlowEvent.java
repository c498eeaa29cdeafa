package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 带符号的现金流，投资为负，分配与期末估值为正。期末估值对应组合整体，investmentId 为 null。
 */
public record CashFlowEvent(LocalDate date, BigDecimal amount, Long investmentId, CashFlowType type) {
}
