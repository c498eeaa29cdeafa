package world.willfrog.angelmarket.valuationservice.domain;

public enum InstrumentType {
    NOTE,
    SAFE
}
