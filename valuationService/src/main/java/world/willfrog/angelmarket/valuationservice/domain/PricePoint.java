package world.willfrog.angelmarket.valuationservice.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PricePoint {
    private LocalDate tradeDate;
    private BigDecimal close;
}
