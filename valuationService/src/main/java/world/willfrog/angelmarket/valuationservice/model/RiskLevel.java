package world.willfrog.angelmarket.valuationservice.model;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH
}
