package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
public class ConversionResponse {
    private Long instrumentId;
    private BigDecimal principal;
    private BigDecimal accruedInterest;
    private BigDecimal totalAmount;
    private BigDecimal conversionPrice;
    private Long shares;
    private OffsetDateTime convertedAt;
}
