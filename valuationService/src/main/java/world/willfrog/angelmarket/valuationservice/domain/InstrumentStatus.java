package world.willfrog.angelmarket.valuationservice.domain;

/**
 * 可转换工具生命周期状态，只允许 ACTIVE 单向流转到 CONVERTED 或 REPAID。
 */
public enum InstrumentStatus {
    ACTIVE,
    CONVERTED,
    REPAID;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
