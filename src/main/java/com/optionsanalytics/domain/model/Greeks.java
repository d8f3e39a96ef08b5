package com.optionsanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Option Greeks calculated via Black-Scholes, in trading-desk display units.
 *
 * <p>Computed fresh for every request. {@link #plus} and {@link #scale} build position-level
 * Greeks for multi-leg strategies (a sold leg is scaled by a negative quantity).
 */
@Value
@Builder
public class Greeks {

    /** Price sensitivity to underlying movement. Range: -1 (deep ITM put) to +1 (deep ITM call). */
    double delta;

    /** Rate of change of delta. Highest for ATM options. Never negative for a single option. */
    double gamma;

    /** Time decay per calendar day. Negative for long options. */
    double theta;

    /** Sensitivity to a 1% change in volatility. */
    double vega;

    /** Sensitivity to a 1% change in the risk-free rate. Positive for calls, negative for puts. */
    double rho;

    public static final Greeks ZERO = Greeks.builder().build();

    public Greeks plus(Greeks other) {
        return new Greeks(
                delta + other.delta,
                gamma + other.gamma,
                theta + other.theta,
                vega + other.vega,
                rho + other.rho);
    }

    public Greeks scale(double factor) {
        return new Greeks(delta * factor, gamma * factor, theta * factor, vega * factor, rho * factor);
    }
}
