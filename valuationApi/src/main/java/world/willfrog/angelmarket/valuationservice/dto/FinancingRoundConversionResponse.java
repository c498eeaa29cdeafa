package world.willfrog.angelmarket.valuationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class FinancingRoundConversionResponse {
    private Long startupId;
    private List<ConversionResponse> conversions;
    private List<Long> skippedInstrumentIds;
}
