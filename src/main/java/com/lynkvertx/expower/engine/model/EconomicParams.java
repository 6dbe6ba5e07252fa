package com.lynkvertx.expower.engine.model;

import lombok.Builder;
import lombok.Value;

import static com.lynkvertx.expower.engine.model.ParameterChecks.requireNonNegative;
import static com.lynkvertx.expower.engine.model.ParameterChecks.requireWithin;

/**
 * Economic analysis parameters. Out-of-range values are rejected here, not inside the stage.
 */
@Value
public class EconomicParams {

    public static final double HOURS_PER_YEAR = 8760;

    public static final double DEFAULT_ANNUAL_OPERATING_HOURS = 8000;
    public static final double DEFAULT_ELECTRICITY_PRICE = 0.6;
    public static final double DEFAULT_STANDARD_COAL_COEFFICIENT = 0.35;
    public static final double DEFAULT_STANDARD_COAL_PRICE = 500;
    public static final double DEFAULT_CO2_EMISSION_FACTOR = 0.96;

    /** Operating hours per year, 0..8760 */
    double annualOperatingHours;

    /** Electricity price (yuan/kWh) */
    double electricityPrice;

    /** Standard coal saved per unit of generated energy */
    double standardCoalCoefficient;

    /** Standard coal price (yuan/t) */
    double standardCoalPrice;

    /** CO2 avoided per unit of generated energy */
    double co2EmissionFactor;

    @Builder(toBuilder = true)
    private EconomicParams(double annualOperatingHours, double electricityPrice,
                           double standardCoalCoefficient, double standardCoalPrice,
                           double co2EmissionFactor) {
        this.annualOperatingHours = requireWithin("annualOperatingHours", annualOperatingHours, 0, HOURS_PER_YEAR);
        this.electricityPrice = requireNonNegative("electricityPrice", electricityPrice);
        this.standardCoalCoefficient = requireNonNegative("standardCoalCoefficient", standardCoalCoefficient);
        this.standardCoalPrice = requireNonNegative("standardCoalPrice", standardCoalPrice);
        this.co2EmissionFactor = requireNonNegative("co2EmissionFactor", co2EmissionFactor);
    }

    public static EconomicParams defaults() {
        return builder().build();
    }

    public static class EconomicParamsBuilder {
        private double annualOperatingHours = DEFAULT_ANNUAL_OPERATING_HOURS;
        private double electricityPrice = DEFAULT_ELECTRICITY_PRICE;
        private double standardCoalCoefficient = DEFAULT_STANDARD_COAL_COEFFICIENT;
        private double standardCoalPrice = DEFAULT_STANDARD_COAL_PRICE;
        private double co2EmissionFactor = DEFAULT_CO2_EMISSION_FACTOR;
    }
}
