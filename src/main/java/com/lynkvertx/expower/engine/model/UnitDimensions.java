package com.lynkvertx.expower.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import static com.lynkvertx.expower.engine.model.ParameterChecks.requirePositive;

/**
 * Enclosure size, length × width × height in meters. Serialized as a three-element array.
 */
@Value
public class UnitDimensions {

    double length;
    double width;
    double height;

    public UnitDimensions(double length, double width, double height) {
        this.length = requirePositive("length", length);
        this.width = requirePositive("width", width);
        this.height = requirePositive("height", height);
    }

    @JsonValue
    public double[] toArray() {
        return new double[]{length, width, height};
    }

    @Override
    public String toString() {
        return length + "×" + width + "×" + height;
    }
}
