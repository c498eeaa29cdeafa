package world.willfrog.angelmarket.valuationservice.domain;

public enum InvestmentStatus {
    PENDING,
    APPROVED,
    COMPLETED,
    REJECTED,
    CANCELLED;

    /**
     * 计入组合收益与集中度的投资状态
     */
    public boolean isActive() {
        return this == APPROVED || this == COMPLETED;
    }
}
