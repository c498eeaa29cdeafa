package world.willfrog.angelmarket.valuationservice.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.angelmarket.common.dto.ResponseWrapper;
import world.willfrog.angelmarket.valuationservice.dto.FinancingRoundConversionResponse;
import world.willfrog.angelmarket.valuationservice.dto.FinancingRoundRequest;
import world.willfrog.angelmarket.valuationservice.service.FinancingRoundConversionService;
import world.willfrog.angelmarket.valuationservice.util.InstrumentConverter;

@RestController
@RequestMapping("/api/startups/{startupId}/financing-rounds")
public class FinancingRoundController {

    private final FinancingRoundConversionService conversionService;

    public FinancingRoundController(FinancingRoundConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @PostMapping("/close")
    public ResponseWrapper<FinancingRoundConversionResponse> close(
            @PathVariable("startupId") Long startupId,
            @Valid @RequestBody FinancingRoundRequest request) {
        return ResponseWrapper.success(InstrumentConverter.toResponse(
                conversionService.convertQualifiedInstruments(startupId, InstrumentConverter.toRound(request))));
    }
}
