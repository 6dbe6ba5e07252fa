package com.lynkvertx.expower.engine.model;

import lombok.Builder;
import lombok.Value;

import static com.lynkvertx.expower.engine.model.ParameterChecks.requireFactor;
import static com.lynkvertx.expower.engine.model.ParameterChecks.requireNonZeroFinite;

/**
 * Main engine parameters.
 *
 * {@code mainPower} comes from the process simulation (kW). A negative value marks power-absorbing
 * machinery and propagates through every stage unchanged in sign. All factors are dimensionless,
 * in (0, 1].
 */
@Value
public class MainEngineParams {

    public static final double DEFAULT_WHEEL_LOSS_FACTOR = 0.85;
    public static final double DEFAULT_GENERATOR_EFFICIENCY = 0.85;
    public static final double DEFAULT_MAIN_LOSS_FACTOR = 0.80;
    public static final double DEFAULT_COOLING_LOSS_FACTOR = 0.98;
    public static final double DEFAULT_FREQUENCY_LOSS_FACTOR = 0.98;
    public static final double DEFAULT_WHEEL_RESISTANCE_FACTOR = 0.98;

    /** Shaft power from the simulator (kW) */
    double mainPower;

    double wheelLossFactor;

    double generatorEfficiency;

    /** Only scales the loss power: {@code mainLossPower = mainPower × (1 - mainLossFactor) × chain} */
    double mainLossFactor;

    double coolingLossFactor;

    double frequencyLossFactor;

    double wheelResistanceFactor;

    @Builder(toBuilder = true)
    private MainEngineParams(double mainPower, double wheelLossFactor, double generatorEfficiency,
                             double mainLossFactor, double coolingLossFactor,
                             double frequencyLossFactor, double wheelResistanceFactor) {
        this.mainPower = requireNonZeroFinite("mainPower", mainPower);
        this.wheelLossFactor = requireFactor("wheelLossFactor", wheelLossFactor);
        this.generatorEfficiency = requireFactor("generatorEfficiency", generatorEfficiency);
        this.mainLossFactor = requireFactor("mainLossFactor", mainLossFactor);
        this.coolingLossFactor = requireFactor("coolingLossFactor", coolingLossFactor);
        this.frequencyLossFactor = requireFactor("frequencyLossFactor", frequencyLossFactor);
        this.wheelResistanceFactor = requireFactor("wheelResistanceFactor", wheelResistanceFactor);
    }

    public static MainEngineParams of(double mainPower) {
        return builder().mainPower(mainPower).build();
    }

    public static class MainEngineParamsBuilder {
        private double wheelLossFactor = DEFAULT_WHEEL_LOSS_FACTOR;
        private double generatorEfficiency = DEFAULT_GENERATOR_EFFICIENCY;
        private double mainLossFactor = DEFAULT_MAIN_LOSS_FACTOR;
        private double coolingLossFactor = DEFAULT_COOLING_LOSS_FACTOR;
        private double frequencyLossFactor = DEFAULT_FREQUENCY_LOSS_FACTOR;
        private double wheelResistanceFactor = DEFAULT_WHEEL_RESISTANCE_FACTOR;
    }
}
