package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ConversionPriceResponse {
    private Long instrumentId;
    private BigDecimal roundPricePerShare;
    private BigDecimal conversionPrice;
}
