package com.optionsanalytics.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the analytics engine. Degenerate boundaries (zero time to expiry or
 * zero volatility) are not errors and have no code here.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_INPUT("INVALID_INPUT"),
    INSUFFICIENT_DATA("INSUFFICIENT_DATA");

    private final String code;
}
