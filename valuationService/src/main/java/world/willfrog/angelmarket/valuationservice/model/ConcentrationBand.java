package world.willfrog.angelmarket.valuationservice.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ConcentrationBand {
    WELL_DIVERSIFIED("Well diversified"),
    MODERATELY_CONCENTRATED("Moderately concentrated"),
    HIGHLY_CONCENTRATED("Highly concentrated"),
    VERY_HIGHLY_CONCENTRATED("Very highly concentrated");

    private final String label;
}
