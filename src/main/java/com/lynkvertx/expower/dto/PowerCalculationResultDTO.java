package com.lynkvertx.expower.dto;

import com.lynkvertx.expower.engine.model.PowerCalculationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result DTO for a single power calculation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PowerCalculationResultDTO {

    /** History record id of this calculation */
    private Long recordId;

    /** Stage results and summary */
    private PowerCalculationResult result;

    /** Catalog model code, e.g. TP400 */
    private String unitModel;

    /** Investment estimate (10k yuan) */
    private double investmentCost;

    /** Investment / annual income, one decimal; 0 when the unit earns nothing */
    private double paybackPeriodYears;

    /** Step-by-step calculation trace */
    private List<String> calculationSteps;
}
