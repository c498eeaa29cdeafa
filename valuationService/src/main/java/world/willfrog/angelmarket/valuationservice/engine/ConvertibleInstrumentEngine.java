package world.willfrog.angelmarket.valuationservice.engine;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentStatus;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;
import world.willfrog.angelmarket.valuationservice.domain.SafeType;
import world.willfrog.angelmarket.valuationservice.exception.BizException;
import world.willfrog.angelmarket.valuationservice.exception.InstrumentConflictException;
import world.willfrog.angelmarket.valuationservice.exception.InsufficientRepaymentException;
import world.willfrog.angelmarket.valuationservice.exception.InvalidInstrumentStateException;
import world.willfrog.angelmarket.valuationservice.exception.ResourceNotFoundException;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.ConvertibleInstrumentMapper;
import world.willfrog.angelmarket.valuationservice.model.ConversionResult;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.model.InstrumentTerms;
import world.willfrog.angelmarket.valuationservice.model.RepaymentResult;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.DEFAULT_SECURITY_TYPE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MONEY_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.PRECISE_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

/**
 * 可转换工具（可转债 / SAFE）的生命周期：创建、计息、转股、还款。
 * <p>
 * 状态只能 ACTIVE → CONVERTED 或 ACTIVE → REPAID。所有写操作先在内存中算出新状态，
 * 再用一条带 version 与 ACTIVE 条件的 UPDATE 落库，更新 0 行即视为失败，库中记录保持原样。
 */
@Slf4j
@Component
public class ConvertibleInstrumentEngine {

    private final ConvertibleInstrumentMapper instrumentMapper;
    private final Clock clock;

    public ConvertibleInstrumentEngine(ConvertibleInstrumentMapper instrumentMapper, Clock clock) {
        this.instrumentMapper = instrumentMapper;
        this.clock = clock;
    }

    @Transactional
    public ConvertibleInstrumentPo createInstrument(InstrumentTerms terms) {
        InstrumentTermsValidator.validate(terms);
        OffsetDateTime now = OffsetDateTime.now(clock);

        ConvertibleInstrumentPo po = new ConvertibleInstrumentPo();
        po.setInvestmentId(terms.investmentId());
        po.setStartupId(terms.startupId());
        po.setInvestorId(terms.investorId());
        po.setInstrumentType(terms.instrumentType());
        if (terms.instrumentType() == InstrumentType.SAFE) {
            po.setSafeType(terms.safeType() == null ? SafeType.POST_MONEY : terms.safeType());
        }
        po.setPrincipal(terms.principal());
        po.setInterestRate(terms.interestRate() == null ? BigDecimal.ZERO : terms.interestRate());
        po.setIssueDate(terms.issueDate());
        po.setMaturityDate(terms.maturityDate());
        po.setDiscountRate(terms.discountRate());
        po.setValuationCap(terms.valuationCap());
        po.setQualifiedFinancingThreshold(terms.qualifiedFinancingThreshold());
        po.setCompounding(terms.compounding() == null ? CompoundingMode.SIMPLE : terms.compounding());
        po.setAutoConversion(terms.autoConversion() == null ? Boolean.TRUE : terms.autoConversion());
        po.setSecurityType(StringUtils.isBlank(terms.securityType()) ? DEFAULT_SECURITY_TYPE : terms.securityType().trim());
        po.setProRataRight(Boolean.TRUE.equals(terms.proRataRight()));
        po.setMfnProvision(Boolean.TRUE.equals(terms.mfnProvision()));
        po.setDocumentUrl(StringUtils.trimToNull(terms.documentUrl()));
        po.setAccruedInterest(BigDecimal.ZERO.setScale(PRECISE_SCALE));
        po.setLastAccrualAt(terms.issueDate().atStartOfDay(clock.getZone()).toOffsetDateTime());
        po.setStatus(InstrumentStatus.ACTIVE);
        po.setVersion(0);
        po.setCreatedAt(now);
        po.setUpdatedAt(now);
        instrumentMapper.insert(po);

        log.info("Instrument created id={} type={} investmentId={} principal={}",
                po.getId(), po.getInstrumentType(), po.getInvestmentId(), po.getPrincipal());
        return po;
    }

    public ConvertibleInstrumentPo getInstrument(Long id) {
        ConvertibleInstrumentPo po = instrumentMapper.findById(id);
        if (po == null) {
            throw new ResourceNotFoundException("工具不存在: " + id);
        }
        return po;
    }

    public List<ConvertibleInstrumentPo> listByStartup(Long startupId) {
        return instrumentMapper.listByStartup(startupId);
    }

    public List<ConvertibleInstrumentPo> listByInvestor(Long investorId) {
        return instrumentMapper.listByInvestor(investorId);
    }

    public List<ConvertibleInstrumentPo> listActive() {
        return instrumentMapper.listActive();
    }

    public List<ConvertibleInstrumentPo> listAutoConvertible(Long startupId) {
        return instrumentMapper.listActiveAutoConvertibleByStartup(startupId);
    }

    /**
     * 计提自上次计息以来的利息。同一时刻重复调用不产生新利息，也不写库。
     */
    @Transactional
    public ConvertibleInstrumentPo accrueInterest(Long id) {
        ConvertibleInstrumentPo po = requireActive(id);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime accrualAt = InterestAccrualCalculator.accrualCutoff(po.getLastAccrualAt(), now);
        if (!accrualAt.isAfter(po.getLastAccrualAt())) {
            return po;
        }

        BigDecimal interest = InterestAccrualCalculator.interestBetween(po, po.getLastAccrualAt(), accrualAt);
        BigDecimal accrued = InterestAccrualCalculator.accruedOrZero(po).add(interest);
        int updated = instrumentMapper.updateAccrual(id, po.getVersion(), accrued, accrualAt, now);
        if (updated == 0) {
            throw resolveWriteConflict(id);
        }

        po.setAccruedInterest(accrued);
        po.setLastAccrualAt(accrualAt);
        po.setVersion(po.getVersion() + 1);
        po.setUpdatedAt(now);
        log.debug("Interest accrued id={} interest={} accrued={}", id, interest, accrued);
        return po;
    }

    public BigDecimal calculateConversionPrice(Long id, FinancingRound round) {
        return ConversionPriceCalculator.conversionPrice(getInstrument(id), round);
    }

    /**
     * 完成最终计息后按转换价格转股，股数向下取整。转股后工具不可再变更。
     */
    @Transactional
    public ConversionResult convert(Long id, FinancingRound round) {
        ConvertibleInstrumentPo po = requireActive(id);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime accrualAt = latest(po.getLastAccrualAt(), now);

        BigDecimal accrued = accruedThrough(po, accrualAt);
        BigDecimal totalAmount = po.getPrincipal().add(accrued);
        BigDecimal price = ConversionPriceCalculator.conversionPrice(po, round);
        long shares = ConversionPriceCalculator.shares(totalAmount, price);

        int updated = instrumentMapper.markConverted(id, po.getVersion(), accrued, accrualAt, price, shares, now);
        if (updated == 0) {
            throw resolveWriteConflict(id);
        }

        log.info("Instrument converted id={} totalAmount={} price={} shares={}",
                id, totalAmount.setScale(MONEY_SCALE, ROUNDING), price, shares);
        return new ConversionResult(id, po.getPrincipal(), accrued, totalAmount, price, shares, now);
    }

    /**
     * 完成最终计息后还款，还款金额不得低于本金加应计利息（按分取整）。
     */
    @Transactional
    public RepaymentResult repay(Long id, BigDecimal repaymentAmount) {
        if (repaymentAmount == null || repaymentAmount.signum() <= 0) {
            throw new ValidationException("repaymentAmount", "必须大于 0");
        }
        ConvertibleInstrumentPo po = requireActive(id);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime accrualAt = latest(po.getLastAccrualAt(), now);

        BigDecimal accrued = accruedThrough(po, accrualAt);
        BigDecimal totalOwed = po.getPrincipal().add(accrued).setScale(MONEY_SCALE, ROUNDING);
        if (repaymentAmount.compareTo(totalOwed) < 0) {
            throw new InsufficientRepaymentException(totalOwed, repaymentAmount);
        }

        int updated = instrumentMapper.markRepaid(id, po.getVersion(), accrued, accrualAt, repaymentAmount, now);
        if (updated == 0) {
            throw resolveWriteConflict(id);
        }

        log.info("Instrument repaid id={} totalOwed={} repaymentAmount={}", id, totalOwed, repaymentAmount);
        return new RepaymentResult(id, accrued, totalOwed, repaymentAmount, repaymentAmount.subtract(totalOwed), now);
    }

    /**
     * 未设置门槛时任何一轮都视为合格融资
     */
    public boolean checkQualifiedFinancing(Long id, BigDecimal roundAmount) {
        ConvertibleInstrumentPo po = getInstrument(id);
        BigDecimal threshold = po.getQualifiedFinancingThreshold();
        if (threshold == null) {
            return true;
        }
        if (roundAmount == null) {
            throw new ValidationException("roundAmount", "不能为空");
        }
        return roundAmount.compareTo(threshold) >= 0;
    }

    /**
     * 返回到期日不晚于 today + days 的 ACTIVE 工具（含已逾期），按到期日升序
     */
    public List<ConvertibleInstrumentPo> listMaturingWithin(int days) {
        if (days < 0) {
            throw new ValidationException("days", "不能为负数");
        }
        LocalDate until = LocalDate.now(clock).plusDays(days);
        return instrumentMapper.listActiveMaturingOnOrBefore(until);
    }

    private ConvertibleInstrumentPo requireActive(Long id) {
        ConvertibleInstrumentPo po = getInstrument(id);
        if (po.getStatus() != InstrumentStatus.ACTIVE) {
            throw new InvalidInstrumentStateException(id, po.getStatus());
        }
        return po;
    }

    private BigDecimal accruedThrough(ConvertibleInstrumentPo po, OffsetDateTime accrualAt) {
        BigDecimal interest = InterestAccrualCalculator.interestBetween(po, po.getLastAccrualAt(), accrualAt);
        return InterestAccrualCalculator.accruedOrZero(po).add(interest);
    }

    private OffsetDateTime latest(OffsetDateTime lastAccrualAt, OffsetDateTime now) {
        return lastAccrualAt != null && lastAccrualAt.isAfter(now) ? lastAccrualAt : now;
    }

    /**
     * 条件更新未命中时重新读取，区分状态已终结与版本冲突
     */
    private BizException resolveWriteConflict(Long id) {
        ConvertibleInstrumentPo current = instrumentMapper.findById(id);
        if (current == null) {
            return new ResourceNotFoundException("工具不存在: " + id);
        }
        if (current.getStatus().isTerminal()) {
            log.warn("Instrument left ACTIVE concurrently id={} status={}", id, current.getStatus());
            return new InvalidInstrumentStateException(id, current.getStatus());
        }
        log.warn("Instrument version conflict id={} version={}", id, current.getVersion());
        return new InstrumentConflictException(id);
    }
}
