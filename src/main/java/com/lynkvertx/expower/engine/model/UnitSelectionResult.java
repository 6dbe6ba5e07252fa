package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Selected catalog rating with its enclosure size and mass.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UnitSelectionResult {

    /** Installed power (kW), a multiple of the catalog step */
    double unitSelection;

    UnitDimensions unitDimensions;

    /** Mass per unit (t) */
    double unitWeight;

    /** Key used for the dimensions lookup */
    double lookupPower;
}
