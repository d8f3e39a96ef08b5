package com.optionsanalytics.exception;

import java.util.Map;

/** Raised when a statistic is requested over fewer observations than it needs. */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String message, int required, int actual) {
        super(ErrorCode.INSUFFICIENT_DATA, message, Map.of("required", required, "actual", actual));
    }
}
