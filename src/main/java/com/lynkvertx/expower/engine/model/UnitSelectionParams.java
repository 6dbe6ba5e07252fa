package com.lynkvertx.expower.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

import static com.lynkvertx.expower.engine.model.ParameterChecks.requirePositive;

/**
 * Fallback enclosure size and mass, used only when the dimensions table has no entry.
 */
@Value
public class UnitSelectionParams {

    public static final UnitDimensions DEFAULT_DIMENSIONS = new UnitDimensions(3, 2.5, 2.5);
    public static final double DEFAULT_WEIGHT_PER_UNIT = 15;

    UnitDimensions dimensions;

    /** Mass per unit (t) */
    double weightPerUnit;

    @Builder(toBuilder = true)
    private UnitSelectionParams(UnitDimensions dimensions, double weightPerUnit) {
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        this.weightPerUnit = requirePositive("weightPerUnit", weightPerUnit);
    }

    public static UnitSelectionParams defaults() {
        return builder().build();
    }

    public static class UnitSelectionParamsBuilder {
        private UnitDimensions dimensions = DEFAULT_DIMENSIONS;
        private double weightPerUnit = DEFAULT_WEIGHT_PER_UNIT;
    }
}
