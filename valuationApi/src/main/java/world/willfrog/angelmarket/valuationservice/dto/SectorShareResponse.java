package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class SectorShareResponse {
    private String sector;
    private BigDecimal invested;
    private BigDecimal share;
}
