package com.lynkvertx.expower.engine;

/**
 * Checks applied to stage results before they are handed on.
 */
final class StageChecks {

    private StageChecks() {
    }

    static double requireFinite(String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw CalculationInputException.nonFinite(quantity, value);
        }
        return value;
    }
}
