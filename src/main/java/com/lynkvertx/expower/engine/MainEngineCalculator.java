package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.model.MainEngineParams;
import com.lynkvertx.expower.engine.model.MainEngineResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static com.lynkvertx.expower.engine.StageChecks.requireFinite;

/**
 * Main engine stage: shaft power to loss power, mechanical output and generated electrical power.
 *
 * Formulas:
 * <pre>
 * chain                  = cooling × frequency × wheelResistance
 * mainLossPower          = mainPower × (1 - mainLossFactor) × chain
 * mainOutputPower        = mainPower × chain
 * totalPowerGeneration   = mainOutputPower × wheelLossFactor × generatorEfficiency
 * </pre>
 */
@Slf4j
public class MainEngineCalculator {

    public MainEngineResult compute(MainEngineParams params) {
        Objects.requireNonNull(params, "params");

        double mainPower = params.getMainPower();
        double mainLossPower = mainPower
            * (1 - params.getMainLossFactor())
            * params.getCoolingLossFactor()
            * params.getFrequencyLossFactor()
            * params.getWheelResistanceFactor();
        double mainOutputPower = mainPower
            * params.getCoolingLossFactor()
            * params.getFrequencyLossFactor()
            * params.getWheelResistanceFactor();
        double totalPowerGeneration = mainOutputPower
            * params.getWheelLossFactor()
            * params.getGeneratorEfficiency();

        MainEngineResult result = MainEngineResult.builder()
            .mainLossPower(requireFinite("mainLossPower", mainLossPower))
            .mainOutputPower(requireFinite("mainOutputPower", mainOutputPower))
            .totalPowerGeneration(requireFinite("totalPowerGeneration", totalPowerGeneration))
            .inputPower(mainPower)
            .build();
        log.debug("Main engine stage completed: {}", result);
        return result;
    }
}
