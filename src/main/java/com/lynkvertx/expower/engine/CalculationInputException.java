package com.lynkvertx.expower.engine;

import lombok.Getter;

/**
 * Raised when a parameter record is built from values the calculation cannot accept,
 * or when a stage result would leave the finite range. No partial result is returned.
 */
@Getter
public class CalculationInputException extends IllegalArgumentException {

    public enum Kind {
        /**
         * Non-finite or zero shaft power, a loss/efficiency factor outside (0, 1],
         * or inputs whose magnitude drives a stage result out of the finite range
         */
        INVALID_INPUT,
        /** Economic parameter outside its accepted range */
        PARAMETER_RANGE
    }

    private final Kind kind;
    private final String parameter;

    public CalculationInputException(Kind kind, String parameter, String message) {
        super(message);
        this.kind = kind;
        this.parameter = parameter;
    }

    public static CalculationInputException invalid(String parameter, double value, String requirement) {
        return new CalculationInputException(Kind.INVALID_INPUT, parameter,
            String.format("%s must be %s, got %s", parameter, requirement, value));
    }

    public static CalculationInputException outOfRange(String parameter, double value, String requirement) {
        return new CalculationInputException(Kind.PARAMETER_RANGE, parameter,
            String.format("%s must be %s, got %s", parameter, requirement, value));
    }

    /**
     * A stage result overflowed; {@code quantity} names the result, not the input that caused it.
     */
    public static CalculationInputException nonFinite(String quantity, double value) {
        return new CalculationInputException(Kind.INVALID_INPUT, quantity,
            String.format("%s evaluated to %s, input magnitude is too large", quantity, value));
    }
}
