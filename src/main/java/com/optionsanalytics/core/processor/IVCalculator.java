package com.optionsanalytics.core.processor;

import com.optionsanalytics.domain.enums.OptionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver with bisection fallback for European options.
 *
 * <p>Solves IV from the Black-Scholes pricing equation by inverting the price function.
 * Newton-Raphson uses raw vega (dPrice/dSigma) as the derivative and typically converges in
 * 3-5 iterations near the money. Deep ITM/OTM options, where vega is near zero and
 * Newton-Raphson oscillates, fall back to bisection.
 *
 * <p>IV sanity: values outside [1%, 200%] are clamped. Unsolvable cases (price outside the
 * achievable Black-Scholes range, price &lt;= 0, or no time left) return -1.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class IVCalculator {

    // Newton-Raphson parameters
    private static final double NR_INITIAL_GUESS = 0.30;
    private static final double NR_TOLERANCE = 0.0001;
    private static final int NR_MAX_ITERATIONS = 100;

    // Bisection fallback parameters
    private static final double BISECTION_LOWER = 0.001;
    private static final double BISECTION_UPPER = 5.0;
    private static final int BISECTION_MAX_ITERATIONS = 200;

    static final double IV_MIN = 0.01;
    static final double IV_MAX = 2.0;

    private final StandardNormal normal;
    private final BlackScholesPricer pricer;

    public IVCalculator(StandardNormal normal, BlackScholesPricer pricer) {
        this.normal = normal;
        this.pricer = pricer;
    }

    /**
     * Solves implied volatility from an observed option price.
     *
     * @param S     spot price
     * @param K     strike price
     * @param T     time to expiry in years (must be &gt; 0)
     * @param r     risk-free rate as a decimal
     * @param price observed market price of the option
     * @return implied volatility as a decimal (e.g., 0.16 = 16%), or -1 if unsolvable
     */
    public double solve(OptionType type, double S, double K, double T, double r, double price) {
        if (!(price > 0) || !(S > 0) || !(K > 0) || !(T > 0) || !Double.isFinite(r)) {
            return -1;
        }

        double iv = solveRaw(type, S, K, T, r, price);
        if (iv < 0) {
            return -1;
        }
        return validateIV(iv);
    }

    /**
     * Solves IV without the sanity clamp.
     *
     * @return raw IV as a decimal, or -1 if the solver fails
     */
    double solveRaw(OptionType type, double S, double K, double T, double r, double price) {
        Double iv = tryNewtonRaphson(type, S, K, T, r, price);
        if (iv != null) {
            return iv;
        }

        log.debug(
                "Newton-Raphson did not converge for {} S={}, K={}, T={}, price={}, falling back to bisection",
                type,
                S,
                K,
                T,
                price);
        return bisectionMethod(type, S, K, T, r, price);
    }

    /**
     * Returns the number of Newton-Raphson iterations needed to converge, or -1 if it
     * doesn't converge (the solver would then need bisection).
     */
    public int convergenceIterations(OptionType type, double S, double K, double T, double r, double price) {
        if (!(price > 0) || !(S > 0) || !(K > 0) || !(T > 0)) {
            return -1;
        }

        double sigma = NR_INITIAL_GUESS;
        for (int i = 0; i < NR_MAX_ITERATIONS; i++) {
            double diff = pricer.price(type, S, K, T, r, sigma) - price;
            if (Math.abs(diff) < NR_TOLERANCE) {
                return i + 1;
            }

            double vega = rawVega(S, K, T, r, sigma);
            if (Math.abs(vega) < 1e-10) {
                return -1;
            }
            sigma = clampStep(sigma - diff / vega);
        }
        return -1;
    }

    /**
     * Validates that the calculated IV falls within a sane range (1% - 200%) and clamps to
     * the nearest bound otherwise.
     */
    public double validateIV(double iv) {
        if (iv < IV_MIN || iv > IV_MAX) {
            log.warn("Suspect IV calculated: {}%. Clamping to [{}%, {}%].", iv * 100, IV_MIN * 100, IV_MAX * 100);
            return Math.max(IV_MIN, Math.min(iv, IV_MAX));
        }
        return iv;
    }

    private Double tryNewtonRaphson(OptionType type, double S, double K, double T, double r, double price) {
        double sigma = NR_INITIAL_GUESS;

        for (int i = 0; i < NR_MAX_ITERATIONS; i++) {
            double diff = pricer.price(type, S, K, T, r, sigma) - price;
            if (Math.abs(diff) < NR_TOLERANCE) {
                return sigma;
            }

            double vega = rawVega(S, K, T, r, sigma);
            if (Math.abs(vega) < 1e-10) {
                return null;
            }
            sigma = clampStep(sigma - diff / vega);
        }
        return null;
    }

    /**
     * Bisection over [0.1%, 500%]. Returns -1 if the target price is outside the range those
     * volatilities can produce.
     */
    private double bisectionMethod(OptionType type, double S, double K, double T, double r, double price) {
        double lower = BISECTION_LOWER;
        double upper = BISECTION_UPPER;

        double lowerPrice = pricer.price(type, S, K, T, r, lower);
        double upperPrice = pricer.price(type, S, K, T, r, upper);

        if (price < lowerPrice || price > upperPrice) {
            log.debug("Option price {} outside bisection range [{}, {}], IV unsolvable", price, lowerPrice, upperPrice);
            return -1;
        }

        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = pricer.price(type, S, K, T, r, mid);

            if (Math.abs(midPrice - price) < NR_TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return (lower + upper) / 2.0;
    }

    /** Vega per unit of volatility (not divided by 100), used as the Newton derivative. */
    private double rawVega(double S, double K, double T, double r, double sigma) {
        double d1 = pricer.d1(S, K, T, r, sigma);
        return S * normal.pdf(d1) * Math.sqrt(T);
    }

    private static double clampStep(double sigma) {
        return Math.max(BISECTION_LOWER, Math.min(sigma, BISECTION_UPPER));
    }
}
