package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Combined output of one pipeline run.
 */
@Value
@Builder
public class PowerCalculationResult {

    @JsonProperty("main_engine")
    MainEngineResult mainEngine;

    @JsonProperty("utility_power")
    UtilityResult utilityPower;

    @JsonProperty("economic_analysis")
    EconomicResult economicAnalysis;

    @JsonProperty("unit_selection")
    UnitSelectionResult unitSelection;

    @JsonProperty("calculation_summary")
    CalculationSummary calculationSummary;
}
