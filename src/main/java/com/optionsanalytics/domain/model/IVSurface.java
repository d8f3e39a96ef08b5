package com.optionsanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Rectangular grid of theoretical prices and volatilities, expiries x strikes.
 *
 * <p>{@link #points} is row-major: ascending expiry, then ascending strike within an expiry.
 * The surface is flat: every point carries {@link #baseVolatility}.
 */
@Value
@Builder
public class IVSurface {

    double spotPrice;
    double baseVolatility;
    List<Integer> expiries;
    List<Double> strikes;
    List<IVSurfacePoint> points;

    public IVSurfacePoint pointAt(int expiryIndex, int strikeIndex) {
        if (expiryIndex < 0 || expiryIndex >= expiries.size() || strikeIndex < 0 || strikeIndex >= strikes.size()) {
            throw new IndexOutOfBoundsException(
                    "No surface point at [" + expiryIndex + ", " + strikeIndex + "] in a " + expiries.size() + "x"
                            + strikes.size() + " surface");
        }
        return points.get(expiryIndex * strikes.size() + strikeIndex);
    }
}
