package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.model.CalculationSummary;
import com.lynkvertx.expower.engine.model.EconomicParams;
import com.lynkvertx.expower.engine.model.EconomicResult;
import com.lynkvertx.expower.engine.model.MainEngineParams;
import com.lynkvertx.expower.engine.model.MainEngineResult;
import com.lynkvertx.expower.engine.model.PowerCalculationResult;
import com.lynkvertx.expower.engine.model.UnitSelectionParams;
import com.lynkvertx.expower.engine.model.UnitSelectionResult;
import com.lynkvertx.expower.engine.model.UtilityParams;
import com.lynkvertx.expower.engine.model.UtilityResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the four stages in dependency order:
 * main engine → utility → {economics, unit selection}.
 *
 * Stateless; one instance may serve concurrent runs.
 */
@Slf4j
@RequiredArgsConstructor
public class PowerCalculationPipeline {

    private final MainEngineCalculator mainEngineCalculator;
    private final UtilityCalculator utilityCalculator;
    private final EconomicCalculator economicCalculator;
    private final UnitSelectionCalculator unitSelectionCalculator;

    public PowerCalculationResult run(MainEngineParams mainParams,
                                      UtilityParams utilityParams,
                                      EconomicParams economicParams,
                                      UnitSelectionParams unitParams) {
        log.debug("Running power calculation for main power {} kW", mainParams.getMainPower());

        MainEngineResult mainEngine = mainEngineCalculator.compute(mainParams);
        UtilityResult utility = utilityCalculator.compute(mainEngine, utilityParams);
        EconomicResult economics = economicCalculator.compute(utility, economicParams);
        UnitSelectionResult unitSelection = unitSelectionCalculator.compute(utility, unitParams);

        return PowerCalculationResult.builder()
            .mainEngine(mainEngine)
            .utilityPower(utility)
            .economicAnalysis(economics)
            .unitSelection(unitSelection)
            .calculationSummary(CalculationSummary.builder()
                .inputMainPower(mainParams.getMainPower())
                .finalNetPower(utility.getNetPowerOutput())
                .annualIncome(economics.getAnnualPowerIncome())
                .selectedUnitPower(unitSelection.getUnitSelection())
                .build())
            .build();
    }
}
