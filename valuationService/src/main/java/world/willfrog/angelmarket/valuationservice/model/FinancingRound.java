package world.willfrog.angelmarket.valuationservice.model;

import java.math.BigDecimal;

/**
 * 一轮定价融资的关键数据
 *
 * @param pricePerShare      本轮每股价格
 * @param fullyDilutedShares 本轮投前完全稀释股本，估值上限换算价格的分母
 * @param roundAmount        本轮融资总额，用于判断是否达到合格融资门槛
 */
public record FinancingRound(BigDecimal pricePerShare, BigDecimal fullyDilutedShares, BigDecimal roundAmount) {
}
