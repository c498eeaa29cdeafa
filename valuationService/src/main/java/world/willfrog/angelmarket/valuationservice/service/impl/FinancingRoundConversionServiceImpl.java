package world.willfrog.angelmarket.valuationservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.engine.ConvertibleInstrumentEngine;
import world.willfrog.angelmarket.valuationservice.exception.BizException;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.model.ConversionResult;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.model.FinancingRoundConversionResult;
import world.willfrog.angelmarket.valuationservice.service.FinancingRoundConversionService;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class FinancingRoundConversionServiceImpl implements FinancingRoundConversionService {

    private final ConvertibleInstrumentEngine instrumentEngine;

    public FinancingRoundConversionServiceImpl(ConvertibleInstrumentEngine instrumentEngine) {
        this.instrumentEngine = instrumentEngine;
    }

    /**
     * 每个工具独立转换，单个失败只记录并跳过，不影响其他工具
     */
    @Override
    public FinancingRoundConversionResult convertQualifiedInstruments(Long startupId, FinancingRound round) {
        if (startupId == null) {
            throw new ValidationException("startupId", "不能为空");
        }
        if (round == null || round.roundAmount() == null) {
            throw new ValidationException("roundAmount", "不能为空");
        }

        List<ConvertibleInstrumentPo> candidates = instrumentEngine.listAutoConvertible(startupId);
        List<ConversionResult> conversions = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();

        for (ConvertibleInstrumentPo instrument : candidates) {
            Long id = instrument.getId();
            try {
                if (!instrumentEngine.checkQualifiedFinancing(id, round.roundAmount())) {
                    log.info("Round below qualified threshold, skip instrumentId={} threshold={} roundAmount={}",
                            id, instrument.getQualifiedFinancingThreshold(), round.roundAmount());
                    skipped.add(id);
                    continue;
                }
                conversions.add(instrumentEngine.convert(id, round));
            } catch (BizException e) {
                log.warn("Auto conversion failed instrumentId={} code={} msg={}", id, e.getCode(), e.getMessage());
                skipped.add(id);
            }
        }

        log.info("Financing round conversion finished startupId={} candidates={} converted={} skipped={}",
                startupId, candidates.size(), conversions.size(), skipped.size());
        return new FinancingRoundConversionResult(startupId, conversions, skipped);
    }
}
