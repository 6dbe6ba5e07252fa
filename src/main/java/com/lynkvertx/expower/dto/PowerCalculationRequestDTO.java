package com.lynkvertx.expower.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;

/**
 * Request DTO for a single power calculation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PowerCalculationRequestDTO {

    /** Shaft power from the process simulation (kW); negative for absorbing machinery */
    @NotNull(message = "Main power is required")
    private Double mainPower;

    /** Free-text case name stored with the history record */
    @Size(max = 255, message = "Label must not exceed 255 characters")
    private String label;

    @Valid
    private CalculationParametersDTO parameters;
}
