package world.willfrog.angelmarket.valuationservice.service;

import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.model.FinancingRoundConversionResult;

public interface FinancingRoundConversionService {

    /**
     * 一轮融资关闭后，转换该公司所有达到合格融资门槛、开启自动转换的 ACTIVE 工具
     */
    FinancingRoundConversionResult convertQualifiedInstruments(Long startupId, FinancingRound round);
}
