package com.optionsanalytics.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the analytics engine's failures. Each carries an {@link ErrorCode} and a details map
 * with the offending values, ready for a caller to put into its own error response.
 *
 * <p>Degenerate pricing inputs (zero time, zero volatility) are not failures and never reach
 * this hierarchy.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /** Stable machine-readable code, e.g. {@code INVALID_INPUT}. */
    public String code() {
        return errorCode.getCode();
    }
}
