package world.willfrog.angelmarket.valuationservice.domain;

public enum SafeType {
    POST_MONEY,
    PRE_MONEY
}
