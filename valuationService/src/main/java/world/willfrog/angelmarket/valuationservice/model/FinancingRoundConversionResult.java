package world.willfrog.angelmarket.valuationservice.model;

import java.util.List;

/**
 * @param skippedInstrumentIds 未达到合格融资门槛或转换失败的工具
 */
public record FinancingRoundConversionResult(
        Long startupId,
        List<ConversionResult> conversions,
        List<Long> skippedInstrumentIds
) {
}
