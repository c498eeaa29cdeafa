package world.willfrog.angelmarket.valuationservice.engine;

import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.HUNDRED;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.PRECISE_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

final class ConversionPriceCalculator {

    private ConversionPriceCalculator() {}

    /**
     * min(折扣价, 估值上限价, 本轮价格)。估值上限价 = valuationCap / 本轮完全稀释股本。
     */
    static BigDecimal conversionPrice(ConvertibleInstrumentPo instrument, FinancingRound round) {
        if (round == null || round.pricePerShare() == null || round.pricePerShare().signum() <= 0) {
            throw new ValidationException("pricePerShare", "本轮每股价格必须大于 0");
        }
        BigDecimal roundPrice = round.pricePerShare();
        BigDecimal price = roundPrice;

        BigDecimal discountRate = instrument.getDiscountRate();
        if (discountRate != null) {
            BigDecimal discountPrice = roundPrice.multiply(HUNDRED.subtract(discountRate)).divide(HUNDRED);
            price = price.min(discountPrice);
        }

        BigDecimal cap = instrument.getValuationCap();
        if (cap != null) {
            BigDecimal shares = round.fullyDilutedShares();
            if (shares == null || shares.signum() <= 0) {
                throw new ValidationException("fullyDilutedShares", "设置了估值上限的工具需要本轮完全稀释股本");
            }
            price = price.min(cap.divide(shares, PRECISE_SCALE, ROUNDING));
        }

        BigDecimal resolved = price.setScale(PRECISE_SCALE, ROUNDING);
        if (resolved.signum() <= 0) {
            throw new ValidationException("conversionPrice", "转换价格必须大于 0");
        }
        return resolved;
    }

    static long shares(BigDecimal totalAmount, BigDecimal conversionPrice) {
        return totalAmount.divide(conversionPrice, 0, RoundingMode.FLOOR).longValueExact();
    }
}
