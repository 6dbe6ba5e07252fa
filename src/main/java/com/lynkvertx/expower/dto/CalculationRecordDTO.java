package com.lynkvertx.expower.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Calculation history Data Transfer Object
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalculationRecordDTO {

    private Long id;

    private String label;

    private Double mainPower;

    private Double netPowerOutput;

    private Double annualIncome;

    private Double selectedUnitPower;

    private String unitModel;

    private Double paybackPeriodYears;

    /** Full result as stored; only present on single-record reads */
    private JsonNode snapshot;

    private LocalDateTime createdAt;
}
