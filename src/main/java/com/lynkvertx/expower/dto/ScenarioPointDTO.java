package com.lynkvertx.expower.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Headline figures of one sweep run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioPointDTO {

    private double mainPower;

    private double totalPowerGeneration;

    private double netPowerOutput;

    /** 10k yuan */
    private double annualIncome;

    private double selectedUnitPower;

    private String unitModel;

    private double paybackPeriodYears;
}
