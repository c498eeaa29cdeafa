package world.willfrog.angelmarket.valuationservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import world.willfrog.angelmarket.valuationservice.calculator.CashFlowExtractor;
import world.willfrog.angelmarket.valuationservice.domain.SnapshotType;
import world.willfrog.angelmarket.valuationservice.domain.ValuationSnapshotPo;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.InvestmentMapper;
import world.willfrog.angelmarket.valuationservice.mapper.ValuationSnapshotMapper;
import world.willfrog.angelmarket.valuationservice.service.PortfolioSnapshotService;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.MONEY_SCALE;
import static world.willfrog.angelmarket.valuationservice.constants.ValuationConstants.ROUNDING;

@Slf4j
@Service
public class PortfolioSnapshotServiceImpl implements PortfolioSnapshotService {

    private final CashFlowExtractor cashFlowExtractor;
    private final InvestmentMapper investmentMapper;
    private final ValuationSnapshotMapper snapshotMapper;

    public PortfolioSnapshotServiceImpl(CashFlowExtractor cashFlowExtractor,
                                        InvestmentMapper investmentMapper,
                                        ValuationSnapshotMapper snapshotMapper) {
        this.cashFlowExtractor = cashFlowExtractor;
        this.investmentMapper = investmentMapper;
        this.snapshotMapper = snapshotMapper;
    }

    @Override
    public List<Long> listSnapshotPortfolios() {
        return investmentMapper.listPortfolioIdsWithActiveInvestments();
    }

    @Override
    public ValuationSnapshotPo createDailySnapshot(Long portfolioId, LocalDate snapshotDate) {
        return createSnapshot(portfolioId, SnapshotType.DAILY, snapshotDate);
    }

    @Override
    public ValuationSnapshotPo createMonthlySnapshot(Long portfolioId, LocalDate snapshotDate) {
        return createSnapshot(portfolioId, SnapshotType.MONTHLY, snapshotDate);
    }

    @Override
    public int cleanupOldSnapshots(int retentionDays, LocalDate today) {
        if (retentionDays < 1) {
            throw new ValidationException("retentionDays", "必须大于 0");
        }
        LocalDate cutoff = today.minusDays(retentionDays);
        int deleted = snapshotMapper.deleteBefore(SnapshotType.DAILY, cutoff);
        log.info("Daily snapshots purged before={} deleted={}", cutoff, deleted);
        return deleted;
    }

    private ValuationSnapshotPo createSnapshot(Long portfolioId, SnapshotType type, LocalDate snapshotDate) {
        if (portfolioId == null) {
            throw new ValidationException("portfolioId", "不能为空");
        }
        if (snapshotDate == null) {
            throw new ValidationException("snapshotDate", "不能为空");
        }
        ValuationSnapshotPo existing = snapshotMapper.findOne(portfolioId, type, snapshotDate);
        if (existing != null) {
            log.debug("Snapshot already exists portfolioId={} type={} date={}", portfolioId, type, snapshotDate);
            return existing;
        }

        BigDecimal totalValue = cashFlowExtractor.valueAsOf(portfolioId, snapshotDate);
        ValuationSnapshotPo snapshot = new ValuationSnapshotPo();
        snapshot.setPortfolioId(portfolioId);
        snapshot.setSnapshotType(type);
        snapshot.setSnapshotDate(snapshotDate);
        snapshot.setTotalValue(totalValue.setScale(MONEY_SCALE, ROUNDING));
        try {
            snapshotMapper.insert(snapshot);
        } catch (DuplicateKeyException e) {
            // 并发写入同一快照，以先写入的为准
            log.info("Snapshot written concurrently portfolioId={} type={} date={}", portfolioId, type, snapshotDate);
            return snapshotMapper.findOne(portfolioId, type, snapshotDate);
        }
        log.info("Snapshot created portfolioId={} type={} date={} totalValue={}",
                portfolioId, type, snapshotDate, snapshot.getTotalValue());
        return snapshot;
    }
}
