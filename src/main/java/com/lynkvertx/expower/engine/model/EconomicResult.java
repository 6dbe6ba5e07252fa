package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Annual economics. Energy is reported in units of 10⁴ kWh.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EconomicResult {

    double annualPowerGeneration;

    double annualPowerIncome;

    double annualCoalSavings;

    double annualCoalCostSavings;

    double annualCo2Reduction;
}
