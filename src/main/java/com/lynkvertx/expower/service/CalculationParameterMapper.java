package com.lynkvertx.expower.service;

import com.lynkvertx.expower.dto.CalculationParametersDTO;
import com.lynkvertx.expower.engine.model.EconomicParams;
import com.lynkvertx.expower.engine.model.MainEngineParams;
import com.lynkvertx.expower.engine.model.UnitDimensions;
import com.lynkvertx.expower.engine.model.UnitSelectionParams;
import com.lynkvertx.expower.engine.model.UtilityParams;
import org.springframework.stereotype.Component;

import static com.lynkvertx.expower.engine.model.EconomicParams.*;
import static com.lynkvertx.expower.engine.model.MainEngineParams.*;
import static com.lynkvertx.expower.engine.model.UnitSelectionParams.DEFAULT_DIMENSIONS;
import static com.lynkvertx.expower.engine.model.UnitSelectionParams.DEFAULT_WEIGHT_PER_UNIT;
import static com.lynkvertx.expower.engine.model.UtilityParams.*;

/**
 * Builds the stage parameter records from request overrides.
 * A null override keeps the engineering default; the records validate the result.
 */
@Component
public class CalculationParameterMapper {

    public MainEngineParams toMainEngineParams(double mainPower, CalculationParametersDTO dto) {
        CalculationParametersDTO p = orEmpty(dto);
        return MainEngineParams.builder()
            .mainPower(mainPower)
            .wheelLossFactor(or(p.getWheelLossFactor(), DEFAULT_WHEEL_LOSS_FACTOR))
            .generatorEfficiency(or(p.getGeneratorEfficiency(), DEFAULT_GENERATOR_EFFICIENCY))
            .mainLossFactor(or(p.getMainLossFactor(), DEFAULT_MAIN_LOSS_FACTOR))
            .coolingLossFactor(or(p.getCoolingLossFactor(), DEFAULT_COOLING_LOSS_FACTOR))
            .frequencyLossFactor(or(p.getFrequencyLossFactor(), DEFAULT_FREQUENCY_LOSS_FACTOR))
            .wheelResistanceFactor(or(p.getWheelResistanceFactor(), DEFAULT_WHEEL_RESISTANCE_FACTOR))
            .build();
    }

    public UtilityParams toUtilityParams(CalculationParametersDTO dto) {
        CalculationParametersDTO p = orEmpty(dto);
        return UtilityParams.builder()
            .mechanicalLossRatio(or(p.getMechanicalLossRatio(), DEFAULT_MECHANICAL_LOSS_RATIO))
            .lubricationOilDensity(or(p.getLubricationOilDensity(), DEFAULT_LUBRICATION_OIL_DENSITY))
            .lubricationOilHeatCapacity(or(p.getLubricationOilHeatCapacity(), DEFAULT_LUBRICATION_OIL_HEAT_CAPACITY))
            .oilCoolerTempRise(or(p.getOilCoolerTempRise(), DEFAULT_OIL_COOLER_TEMP_RISE))
            .coolingWaterSpecificHeat(or(p.getCoolingWaterSpecificHeat(), DEFAULT_COOLING_WATER_SPECIFIC_HEAT))
            .coolingLoopPumpPower(or(p.getCoolingLoopPumpPower(), DEFAULT_COOLING_LOOP_PUMP_POWER))
            .circulationPumpPower(or(p.getCirculationPumpPower(), DEFAULT_CIRCULATION_PUMP_POWER))
            .airDemand(or(p.getAirDemand(), DEFAULT_AIR_DEMAND))
            .nitrogenDemand(or(p.getNitrogenDemand(), DEFAULT_NITROGEN_DEMAND))
            .build();
    }

    public EconomicParams toEconomicParams(CalculationParametersDTO dto) {
        CalculationParametersDTO p = orEmpty(dto);
        return EconomicParams.builder()
            .annualOperatingHours(or(p.getAnnualOperatingHours(), DEFAULT_ANNUAL_OPERATING_HOURS))
            .electricityPrice(or(p.getElectricityPrice(), DEFAULT_ELECTRICITY_PRICE))
            .standardCoalCoefficient(or(p.getStandardCoalCoefficient(), DEFAULT_STANDARD_COAL_COEFFICIENT))
            .standardCoalPrice(or(p.getStandardCoalPrice(), DEFAULT_STANDARD_COAL_PRICE))
            .co2EmissionFactor(or(p.getCo2EmissionFactor(), DEFAULT_CO2_EMISSION_FACTOR))
            .build();
    }

    public UnitSelectionParams toUnitSelectionParams(CalculationParametersDTO dto) {
        CalculationParametersDTO p = orEmpty(dto);
        return UnitSelectionParams.builder()
            .dimensions(new UnitDimensions(
                or(p.getDefaultUnitLength(), DEFAULT_DIMENSIONS.getLength()),
                or(p.getDefaultUnitWidth(), DEFAULT_DIMENSIONS.getWidth()),
                or(p.getDefaultUnitHeight(), DEFAULT_DIMENSIONS.getHeight())))
            .weightPerUnit(or(p.getDefaultUnitWeight(), DEFAULT_WEIGHT_PER_UNIT))
            .build();
    }

    /**
     * Every parameter at its default value.
     */
    public CalculationParametersDTO defaults() {
        return CalculationParametersDTO.builder()
            .wheelLossFactor(DEFAULT_WHEEL_LOSS_FACTOR)
            .generatorEfficiency(DEFAULT_GENERATOR_EFFICIENCY)
            .mainLossFactor(DEFAULT_MAIN_LOSS_FACTOR)
            .coolingLossFactor(DEFAULT_COOLING_LOSS_FACTOR)
            .frequencyLossFactor(DEFAULT_FREQUENCY_LOSS_FACTOR)
            .wheelResistanceFactor(DEFAULT_WHEEL_RESISTANCE_FACTOR)
            .mechanicalLossRatio(DEFAULT_MECHANICAL_LOSS_RATIO)
            .lubricationOilDensity(DEFAULT_LUBRICATION_OIL_DENSITY)
            .lubricationOilHeatCapacity(DEFAULT_LUBRICATION_OIL_HEAT_CAPACITY)
            .oilCoolerTempRise(DEFAULT_OIL_COOLER_TEMP_RISE)
            .coolingWaterSpecificHeat(DEFAULT_COOLING_WATER_SPECIFIC_HEAT)
            .coolingLoopPumpPower(DEFAULT_COOLING_LOOP_PUMP_POWER)
            .circulationPumpPower(DEFAULT_CIRCULATION_PUMP_POWER)
            .airDemand(DEFAULT_AIR_DEMAND)
            .nitrogenDemand(DEFAULT_NITROGEN_DEMAND)
            .annualOperatingHours(DEFAULT_ANNUAL_OPERATING_HOURS)
            .electricityPrice(DEFAULT_ELECTRICITY_PRICE)
            .standardCoalCoefficient(DEFAULT_STANDARD_COAL_COEFFICIENT)
            .standardCoalPrice(DEFAULT_STANDARD_COAL_PRICE)
            .co2EmissionFactor(DEFAULT_CO2_EMISSION_FACTOR)
            .defaultUnitLength(DEFAULT_DIMENSIONS.getLength())
            .defaultUnitWidth(DEFAULT_DIMENSIONS.getWidth())
            .defaultUnitHeight(DEFAULT_DIMENSIONS.getHeight())
            .defaultUnitWeight(DEFAULT_WEIGHT_PER_UNIT)
            .build();
    }

    private static CalculationParametersDTO orEmpty(CalculationParametersDTO dto) {
        return dto != null ? dto : new CalculationParametersDTO();
    }

    private static double or(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
