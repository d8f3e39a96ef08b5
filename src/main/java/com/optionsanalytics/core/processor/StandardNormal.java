package com.optionsanalytics.core.processor;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Standard normal CDF and PDF used by every pricing component.
 *
 * <p>Backed by commons-math3's erf-based {@link NormalDistribution}, accurate far beyond
 * 1e-7 over the d1/d2 range. Beyond |x| = 8 the CDF saturates to exactly 0 or 1.
 *
 * <p>This class is stateless and thread-safe.
 */
@Component
public class StandardNormal {

    static final double SATURATION = 8.0;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    public double cdf(double x) {
        if (x > SATURATION) {
            return 1.0;
        }
        if (x < -SATURATION) {
            return 0.0;
        }
        return NORM.cumulativeProbability(x);
    }

    public double pdf(double x) {
        return NORM.density(x);
    }
}
