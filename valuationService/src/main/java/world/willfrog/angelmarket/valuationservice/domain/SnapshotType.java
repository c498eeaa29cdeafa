package world.willfrog.angelmarket.valuationservice.domain;

/**
 * 估值快照粒度。分期收益只读取 MONTHLY，DAILY 按保留天数定期清理
 */
public enum SnapshotType {
    DAILY,
    MONTHLY
}
