package com.lynkvertx.expower.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;

/**
 * Optional overrides of the engineering constants.
 * A null field keeps its default value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationParametersDTO {

    // --- Main engine factors, each in (0, 1] ---

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double wheelLossFactor;

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double generatorEfficiency;

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double mainLossFactor;

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double coolingLossFactor;

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double frequencyLossFactor;

    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private Double wheelResistanceFactor;

    // --- Utility ---

    @Positive
    private Double mechanicalLossRatio;

    /** kg/m³ */
    @Positive
    private Double lubricationOilDensity;

    /** kJ/kg·°C */
    @Positive
    private Double lubricationOilHeatCapacity;

    /** °C */
    @Positive
    private Double oilCoolerTempRise;

    /** kJ/kg·°C */
    @Positive
    private Double coolingWaterSpecificHeat;

    /** kW */
    @Positive
    private Double coolingLoopPumpPower;

    /** kW */
    @Positive
    private Double circulationPumpPower;

    /** Nm³/h */
    @Positive
    private Double airDemand;

    /** Nm³/h */
    @Positive
    private Double nitrogenDemand;

    // --- Economics ---

    @PositiveOrZero @DecimalMax("8760")
    private Double annualOperatingHours;

    /** yuan/kWh */
    @PositiveOrZero
    private Double electricityPrice;

    @PositiveOrZero
    private Double standardCoalCoefficient;

    /** yuan/t */
    @PositiveOrZero
    private Double standardCoalPrice;

    @PositiveOrZero
    private Double co2EmissionFactor;

    // --- Unit selection fallback (used when the dimensions table is empty) ---

    /** m */
    @Positive
    private Double defaultUnitLength;

    /** m */
    @Positive
    private Double defaultUnitWidth;

    /** m */
    @Positive
    private Double defaultUnitHeight;

    /** t */
    @Positive
    private Double defaultUnitWeight;
}
