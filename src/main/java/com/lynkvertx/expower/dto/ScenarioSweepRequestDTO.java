package com.lynkvertx.expower.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.util.List;

/**
 * Request DTO for a scenario sweep: many shaft powers, one parameter set
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioSweepRequestDTO {

    @NotEmpty(message = "At least one main power value is required")
    @Size(max = 1000, message = "A sweep is limited to 1000 values")
    private List<@NotNull Double> mainPowers;

    @Valid
    private CalculationParametersDTO parameters;
}
