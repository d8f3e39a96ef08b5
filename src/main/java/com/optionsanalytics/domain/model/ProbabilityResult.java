package com.optionsanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Probability-of-outcome statistics for one strike under a driftless lognormal model.
 *
 * <p>Probabilities are fractions in [0, 1], not percentages.
 */
@Value
@Builder
public class ProbabilityResult {

    /** Probability of finishing above the strike (call in-the-money). */
    double probItm;

    /** Probability of finishing below the strike (put in-the-money). */
    double probPutItm;

    /** Probability of touching the strike before expiry (reflection heuristic). */
    double probTouch;

    /** One standard deviation move in price units: S * sigma * sqrt(T). */
    double expectedMove;

    /** {@link #expectedMove} as a percentage of spot. */
    double expectedMovePercent;

    double oneStdDevLow;
    double oneStdDevHigh;
}
