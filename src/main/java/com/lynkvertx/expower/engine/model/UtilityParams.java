package com.lynkvertx.expower.engine.model;

import lombok.Builder;
import lombok.Value;

import static com.lynkvertx.expower.engine.model.ParameterChecks.requirePositive;

/**
 * Utility (auxiliary consumption) parameters. Every value is a strictly positive constant.
 */
@Value
public class UtilityParams {

    public static final double DEFAULT_MECHANICAL_LOSS_RATIO = 0.04;
    public static final double DEFAULT_LUBRICATION_OIL_DENSITY = 850;
    public static final double DEFAULT_LUBRICATION_OIL_HEAT_CAPACITY = 2;
    public static final double DEFAULT_OIL_COOLER_TEMP_RISE = 8;
    public static final double DEFAULT_COOLING_WATER_SPECIFIC_HEAT = 4.2;
    public static final double DEFAULT_COOLING_LOOP_PUMP_POWER = 1.5;
    public static final double DEFAULT_CIRCULATION_PUMP_POWER = 2.0;
    public static final double DEFAULT_AIR_DEMAND = 4;
    public static final double DEFAULT_NITROGEN_DEMAND = 40;

    /** Fraction of main output power dissipated into the lubrication oil */
    double mechanicalLossRatio;

    /** Lubrication oil density (kg/m³) */
    double lubricationOilDensity;

    /** Lubrication oil specific heat (kJ/kg·°C) */
    double lubricationOilHeatCapacity;

    /** Oil cooler water-side temperature rise (°C) */
    double oilCoolerTempRise;

    /** Cooling water specific heat (kJ/kg·°C) */
    double coolingWaterSpecificHeat;

    /** Fixed cooling-loop pump draw (kW) */
    double coolingLoopPumpPower;

    /** Fixed circulation pump draw (kW) */
    double circulationPumpPower;

    /** Instrument air demand (Nm³/h) */
    double airDemand;

    /** Nitrogen demand (Nm³/h) */
    double nitrogenDemand;

    @Builder(toBuilder = true)
    private UtilityParams(double mechanicalLossRatio, double lubricationOilDensity,
                          double lubricationOilHeatCapacity, double oilCoolerTempRise,
                          double coolingWaterSpecificHeat, double coolingLoopPumpPower,
                          double circulationPumpPower, double airDemand, double nitrogenDemand) {
        this.mechanicalLossRatio = requirePositive("mechanicalLossRatio", mechanicalLossRatio);
        this.lubricationOilDensity = requirePositive("lubricationOilDensity", lubricationOilDensity);
        this.lubricationOilHeatCapacity = requirePositive("lubricationOilHeatCapacity", lubricationOilHeatCapacity);
        this.oilCoolerTempRise = requirePositive("oilCoolerTempRise", oilCoolerTempRise);
        this.coolingWaterSpecificHeat = requirePositive("coolingWaterSpecificHeat", coolingWaterSpecificHeat);
        this.coolingLoopPumpPower = requirePositive("coolingLoopPumpPower", coolingLoopPumpPower);
        this.circulationPumpPower = requirePositive("circulationPumpPower", circulationPumpPower);
        this.airDemand = requirePositive("airDemand", airDemand);
        this.nitrogenDemand = requirePositive("nitrogenDemand", nitrogenDemand);
    }

    public static UtilityParams defaults() {
        return builder().build();
    }

    public static class UtilityParamsBuilder {
        private double mechanicalLossRatio = DEFAULT_MECHANICAL_LOSS_RATIO;
        private double lubricationOilDensity = DEFAULT_LUBRICATION_OIL_DENSITY;
        private double lubricationOilHeatCapacity = DEFAULT_LUBRICATION_OIL_HEAT_CAPACITY;
        private double oilCoolerTempRise = DEFAULT_OIL_COOLER_TEMP_RISE;
        private double coolingWaterSpecificHeat = DEFAULT_COOLING_WATER_SPECIFIC_HEAT;
        private double coolingLoopPumpPower = DEFAULT_COOLING_LOOP_PUMP_POWER;
        private double circulationPumpPower = DEFAULT_CIRCULATION_PUMP_POWER;
        private double airDemand = DEFAULT_AIR_DEMAND;
        private double nitrogenDemand = DEFAULT_NITROGEN_DEMAND;
    }
}
