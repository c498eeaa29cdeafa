package world.willfrog.angelmarket.valuationservice.model;

public enum CashFlowType {
    INVESTMENT,
    DISTRIBUTION,
    TERMINAL_VALUATION
}
