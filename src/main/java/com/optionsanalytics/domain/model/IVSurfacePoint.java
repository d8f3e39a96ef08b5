package com.optionsanalytics.domain.model;

import lombok.Value;

/** One (expiry, strike) cell of an {@link IVSurface}. */
@Value
public class IVSurfacePoint {

    int expiryDays;
    double strike;

    /** Theoretical call price at this cell. */
    double theoreticalPrice;

    double impliedVol;
}
