package world.willfrog.angelmarket.valuationservice.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.angelmarket.common.dto.ResponseWrapper;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.dto.*;
import world.willfrog.angelmarket.valuationservice.engine.ConvertibleInstrumentEngine;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.util.InstrumentConverter;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/instruments")
public class ConvertibleInstrumentController {

    private final ConvertibleInstrumentEngine instrumentEngine;

    public ConvertibleInstrumentController(ConvertibleInstrumentEngine instrumentEngine) {
        this.instrumentEngine = instrumentEngine;
    }

    @PostMapping
    public ResponseWrapper<InstrumentResponse> create(@Valid @RequestBody InstrumentCreateRequest request) {
        ConvertibleInstrumentPo po = instrumentEngine.createInstrument(InstrumentConverter.toTerms(request));
        return ResponseWrapper.success(InstrumentConverter.toResponse(po));
    }

    @GetMapping("/{id}")
    public ResponseWrapper<InstrumentResponse> getById(@PathVariable("id") Long id) {
        return ResponseWrapper.success(InstrumentConverter.toResponse(instrumentEngine.getInstrument(id)));
    }

    @GetMapping
    public ResponseWrapper<List<InstrumentResponse>> list(
            @RequestParam(value = "startupId", required = false) Long startupId,
            @RequestParam(value = "investorId", required = false) Long investorId) {
        List<ConvertibleInstrumentPo> instruments;
        if (startupId != null) {
            instruments = instrumentEngine.listByStartup(startupId);
        } else if (investorId != null) {
            instruments = instrumentEngine.listByInvestor(investorId);
        } else {
            throw new ValidationException("startupId", "startupId 与 investorId 至少提供一个");
        }
        return ResponseWrapper.success(toResponses(instruments));
    }

    @GetMapping("/maturing")
    public ResponseWrapper<List<InstrumentResponse>> listMaturing(
            @RequestParam(value = "days", defaultValue = "30") int days) {
        return ResponseWrapper.success(toResponses(instrumentEngine.listMaturingWithin(days)));
    }

    @PostMapping("/{id}/accrual")
    public ResponseWrapper<InstrumentResponse> accrue(@PathVariable("id") Long id) {
        return ResponseWrapper.success(InstrumentConverter.toResponse(instrumentEngine.accrueInterest(id)));
    }

    @PostMapping("/{id}/conversion-price")
    public ResponseWrapper<ConversionPriceResponse> conversionPrice(
            @PathVariable("id") Long id,
            @Valid @RequestBody FinancingRoundRequest request) {
        FinancingRound round = InstrumentConverter.toRound(request);
        BigDecimal price = instrumentEngine.calculateConversionPrice(id, round);
        return ResponseWrapper.success(ConversionPriceResponse.builder()
                .instrumentId(id)
                .roundPricePerShare(round.pricePerShare())
                .conversionPrice(price)
                .build());
    }

    @PostMapping("/{id}/conversion")
    public ResponseWrapper<ConversionResponse> convert(
            @PathVariable("id") Long id,
            @Valid @RequestBody FinancingRoundRequest request) {
        return ResponseWrapper.success(InstrumentConverter.toResponse(
                instrumentEngine.convert(id, InstrumentConverter.toRound(request))));
    }

    @PostMapping("/{id}/repayment")
    public ResponseWrapper<RepaymentResponse> repay(
            @PathVariable("id") Long id,
            @Valid @RequestBody RepaymentRequest request) {
        return ResponseWrapper.success(InstrumentConverter.toResponse(
                instrumentEngine.repay(id, request.getRepaymentAmount())));
    }

    @GetMapping("/{id}/qualified-financing")
    public ResponseWrapper<QualifiedFinancingResponse> qualifiedFinancing(
            @PathVariable("id") Long id,
            @RequestParam("roundAmount") BigDecimal roundAmount) {
        boolean qualified = instrumentEngine.checkQualifiedFinancing(id, roundAmount);
        return ResponseWrapper.success(QualifiedFinancingResponse.builder()
                .instrumentId(id)
                .roundAmount(roundAmount)
                .threshold(instrumentEngine.getInstrument(id).getQualifiedFinancingThreshold())
                .qualified(qualified)
                .build());
    }

    private List<InstrumentResponse> toResponses(List<ConvertibleInstrumentPo> instruments) {
        return instruments.stream().map(InstrumentConverter::toResponse).toList();
    }
}
