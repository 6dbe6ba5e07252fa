package com.lynkvertx.expower.engine.model;

import com.lynkvertx.expower.engine.CalculationInputException;

/**
 * Construction-time checks shared by the parameter records.
 */
final class ParameterChecks {

    private ParameterChecks() {
    }

    static double requireNonZeroFinite(String name, double value) {
        if (!Double.isFinite(value) || value == 0.0) {
            throw CalculationInputException.invalid(name, value, "finite and non-zero");
        }
        return value;
    }

    /** Loss and efficiency factors live in (0, 1]. */
    static double requireFactor(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0 || value > 1.0) {
            throw CalculationInputException.invalid(name, value, "in (0, 1]");
        }
        return value;
    }

    static double requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw CalculationInputException.invalid(name, value, "finite and > 0");
        }
        return value;
    }

    static double requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw CalculationInputException.outOfRange(name, value, "finite and >= 0");
        }
        return value;
    }

    static double requireWithin(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw CalculationInputException.outOfRange(name, value,
                String.format("between %s and %s", min, max));
        }
        return value;
    }
}
