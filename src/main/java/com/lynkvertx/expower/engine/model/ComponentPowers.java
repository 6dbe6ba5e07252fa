package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Per-component breakdown of utility self-consumption (kW).
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComponentPowers {

    double lubricationPump;

    double lubricationHeater;

    double coolingLoopPump;

    double circulationPump;

    public double total() {
        return lubricationPump + lubricationHeater + coolingLoopPump + circulationPump;
    }
}
