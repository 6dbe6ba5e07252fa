package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CalculationSummary {

    double inputMainPower;

    double finalNetPower;

    double annualIncome;

    double selectedUnitPower;
}
