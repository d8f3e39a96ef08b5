package com.optionsanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Annualised volatility together with how much it can be trusted.
 *
 * <p>{@code fallback} marks the configured default used when no usable price series exists.
 */
@Value
@Builder
public class VolatilityEstimate {

    double volatility;

    /** Number of log returns the estimate is based on (0 for a fallback). */
    int observations;

    boolean lowConfidence;
    boolean fallback;
}
