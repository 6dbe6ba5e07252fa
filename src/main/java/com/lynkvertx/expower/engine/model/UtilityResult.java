package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Utility stage output.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UtilityResult {

    /** Lubrication oil amount (L/h), key into the oil pump table */
    double lubricationOilAmount;

    /** Oil cooler circulating water (t/h) */
    double oilCoolerCirculationWater;

    double oilPumpPower;

    double utilitySelfConsumption;

    /** Carried from the main engine stage for unit selection */
    double totalPowerGeneration;

    double netPowerOutput;

    double airDemand;

    double nitrogenDemand;

    ComponentPowers componentPowers;
}
