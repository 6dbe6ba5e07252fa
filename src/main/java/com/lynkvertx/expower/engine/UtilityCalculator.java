package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.lookup.CeilingLookupTable;
import com.lynkvertx.expower.engine.model.ComponentPowers;
import com.lynkvertx.expower.engine.model.MainEngineResult;
import com.lynkvertx.expower.engine.model.UtilityParams;
import com.lynkvertx.expower.engine.model.UtilityResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static com.lynkvertx.expower.engine.StageChecks.requireFinite;

/**
 * Utility stage: auxiliary self-consumption and exportable net power.
 *
 * The lubrication oil amount is the heat carried away by the oil circuit expressed as an oil
 * flow (L/h); it selects the oil pump rating from the oil pump table.
 */
@Slf4j
public class UtilityCalculator {

    /** Sizing margin applied to the heat load of both oil and water circuits */
    static final double HEAT_LOAD_SAFETY_FACTOR = 1.2;

    /** min → h and m³ → L */
    static final double OIL_FLOW_UNIT_CONVERSION = 60 * 1000;

    /** kW → t/h of water */
    static final double WATER_FLOW_UNIT_CONVERSION = 3.6;

    /** The oil heater is rated at half the oil pump */
    static final double LUBRICATION_HEATER_RATIO = 0.5;

    private final CeilingLookupTable<Double> oilPumpPowerTable;

    public UtilityCalculator(CeilingLookupTable<Double> oilPumpPowerTable) {
        this.oilPumpPowerTable = Objects.requireNonNull(oilPumpPowerTable, "oilPumpPowerTable");
        if (oilPumpPowerTable.isEmpty()) {
            throw new IllegalArgumentException("Oil pump power table must not be empty");
        }
    }

    public UtilityResult compute(MainEngineResult mainEngine, UtilityParams params) {
        Objects.requireNonNull(mainEngine, "mainEngine");
        Objects.requireNonNull(params, "params");

        double heatLoad = HEAT_LOAD_SAFETY_FACTOR * mainEngine.getMainOutputPower() * params.getMechanicalLossRatio();

        double lubricationOilAmount = heatLoad
            / (params.getLubricationOilDensity() * params.getLubricationOilHeatCapacity() * params.getOilCoolerTempRise())
            * OIL_FLOW_UNIT_CONVERSION;
        double oilCoolerCirculationWater = heatLoad
            / params.getCoolingWaterSpecificHeat()
            / params.getOilCoolerTempRise()
            * WATER_FLOW_UNIT_CONVERSION;

        requireFinite("lubricationOilAmount", lubricationOilAmount);
        requireFinite("oilCoolerCirculationWater", oilCoolerCirculationWater);
        double oilPumpPower = lookupOilPumpPower(lubricationOilAmount);

        ComponentPowers components = ComponentPowers.builder()
            .lubricationPump(oilPumpPower)
            .lubricationHeater(LUBRICATION_HEATER_RATIO * oilPumpPower)
            .coolingLoopPump(params.getCoolingLoopPumpPower())
            .circulationPump(params.getCirculationPumpPower())
            .build();
        double selfConsumption = components.total();

        UtilityResult result = UtilityResult.builder()
            .lubricationOilAmount(lubricationOilAmount)
            .oilCoolerCirculationWater(oilCoolerCirculationWater)
            .oilPumpPower(oilPumpPower)
            .utilitySelfConsumption(selfConsumption)
            .totalPowerGeneration(mainEngine.getTotalPowerGeneration())
            .netPowerOutput(requireFinite("netPowerOutput", mainEngine.getTotalPowerGeneration() - selfConsumption))
            .airDemand(params.getAirDemand())
            .nitrogenDemand(params.getNitrogenDemand())
            .componentPowers(components)
            .build();
        log.debug("Utility stage completed: {}", result);
        return result;
    }

    /**
     * Oil pump rating for the given oil amount. Amounts beyond the table use the largest pump.
     */
    double lookupOilPumpPower(double lubricationOilAmount) {
        if (oilPumpPowerTable.exceedsRange(lubricationOilAmount)) {
            log.warn("Lubrication oil amount {} exceeds oil pump table, using largest pump", lubricationOilAmount);
        }
        return oilPumpPowerTable.lookup(lubricationOilAmount)
            .orElseThrow(() -> new IllegalStateException("Oil pump power table is empty"));
    }
}
