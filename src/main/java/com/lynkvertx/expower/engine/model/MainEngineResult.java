package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Main engine stage output (kW).
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MainEngineResult {

    double mainLossPower;

    double mainOutputPower;

    double totalPowerGeneration;

    /** Echo of the shaft power the stage was run with */
    double inputPower;
}
