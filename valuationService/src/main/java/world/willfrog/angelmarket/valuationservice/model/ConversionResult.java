package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record ConversionResult(
        Long instrumentId,
        BigDecimal principal,
        BigDecimal accruedInterest,
        BigDecimal totalAmount,
        BigDecimal conversionPrice,
        long shares,
        OffsetDateTime convertedAt
) {
}
