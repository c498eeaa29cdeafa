package world.willfrog.angelmarket.valuationservice.domain;

public enum CompoundingMode {
    SIMPLE,
    COMPOUND
}
