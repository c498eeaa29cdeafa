package world.willfrog.angelmarket.valuationservice.model;

import world.willfrog.angelmarket.valuationservice.exception.ValidationException;

import java.time.LocalDate;

/**
 * 闭区间日期范围
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null) {
            throw new ValidationException("start", "不能为空");
        }
        if (end == null) {
            throw new ValidationException("end", "不能为空");
        }
        if (start.isAfter(end)) {
            throw new ValidationException("start", "不能晚于 end");
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public String cacheKey() {
        return start + ":" + end;
    }
}
