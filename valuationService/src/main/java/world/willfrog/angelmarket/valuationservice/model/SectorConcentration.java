package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * @param investedBySector 按投资额降序排列的行业分布
 */
public record SectorConcentration(
        Map<String, BigDecimal> investedBySector,
        String topSector,
        BigDecimal topSectorShare
) {
}
