package world.willfrog.angelmarket.valuationservice.service;

import world.willfrog.angelmarket.valuationservice.domain.ValuationSnapshotPo;

import java.time.LocalDate;
import java.util.List;

public interface PortfolioSnapshotService {

    /**
     * 需要记录快照的组合：至少有一笔有效投资
     */
    List<Long> listSnapshotPortfolios();

    /**
     * 写入当天的日度快照，同一天已存在时直接返回已有快照
     */
    ValuationSnapshotPo createDailySnapshot(Long portfolioId, LocalDate snapshotDate);

    /**
     * 写入月末快照，供分期收益、波动率与基准比较使用
     */
    ValuationSnapshotPo createMonthlySnapshot(Long portfolioId, LocalDate snapshotDate);

    /**
     * 删除早于 today - retentionDays 的日度快照，返回删除行数
     */
    int cleanupOldSnapshots(int retentionDays, LocalDate today);
}
