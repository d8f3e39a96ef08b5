package com.optionsanalytics.exception;

import java.util.Map;

/**
 * Raised for inputs the engine refuses to coerce: non-positive spot or strike, negative
 * days to expiry, non-finite numbers, and out-of-order strategy strikes.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message, Map.of());
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_INPUT, message, details);
    }

    /** Fails with a message naming {@code field} unless {@code value} is finite and strictly positive. */
    public static double requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidInputException(field + " must be a positive number, got: " + value, Map.of(field, value));
        }
        return value;
    }

    public static double requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field + " must be a finite number, got: " + value, Map.of(field, value));
        }
        return value;
    }

    public static int requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new InvalidInputException(field + " must not be negative, got: " + value, Map.of(field, value));
        }
        return value;
    }
}
