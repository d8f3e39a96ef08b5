package com.optionsanalytics.core.processor;

import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.exception.InvalidInputException;
import org.springframework.stereotype.Component;

/**
 * Theoretical Black-Scholes price of a European option on a non-dividend-paying underlying.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * N(-d1)
 * </ul>
 *
 * <p>With no time or no volatility left (T &lt;= 0 or sigma &lt;= 0) the option is worth its
 * intrinsic value. Spot and strike must be positive.
 */
@Component
public class BlackScholesPricer {

    private final StandardNormal normal;

    public BlackScholesPricer(StandardNormal normal) {
        this.normal = normal;
    }

    public double price(OptionQuote quote) {
        return price(
                quote.getOptionType(),
                quote.getSpot(),
                quote.getStrike(),
                quote.timeToExpiry(),
                quote.getRiskFreeRate(),
                quote.getVolatility());
    }

    /**
     * @param T     time to expiry in years
     * @param r     risk-free rate as a decimal (e.g., 0.05)
     * @param sigma volatility as a decimal (e.g., 0.30)
     * @return price, never negative
     * @throws InvalidInputException if S or K is not a positive number, or T, r or sigma is not finite
     */
    public double price(OptionType type, double S, double K, double T, double r, double sigma) {
        validate(S, K, T, r, sigma);
        if (isExpiredOrFlat(T, sigma)) {
            return intrinsicValue(type, S, K);
        }

        double d1 = d1(S, K, T, r, sigma);
        double d2 = d2(d1, T, sigma);
        double discountedStrike = K * Math.exp(-r * T);

        double price;
        if (type.isCall()) {
            price = S * normal.cdf(d1) - discountedStrike * normal.cdf(d2);
        } else {
            price = discountedStrike * normal.cdf(-d2) - S * normal.cdf(-d1);
        }
        // Deep OTM prices can dip a few ulps below zero
        return Math.max(price, 0.0);
    }

    public double intrinsicValue(OptionType type, double S, double K) {
        return type.isCall() ? Math.max(S - K, 0.0) : Math.max(K - S, 0.0);
    }

    public double d1(double S, double K, double T, double r, double sigma) {
        return (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * Math.sqrt(T));
    }

    public double d2(double d1, double T, double sigma) {
        return d1 - sigma * Math.sqrt(T);
    }

    /** True on the degenerate boundary where time value vanishes. */
    static boolean isExpiredOrFlat(double T, double sigma) {
        return T <= 0 || sigma <= 0;
    }

    static void validate(double S, double K, double T, double r, double sigma) {
        InvalidInputException.requirePositive("spot", S);
        InvalidInputException.requirePositive("strike", K);
        InvalidInputException.requireFinite("timeToExpiry", T);
        InvalidInputException.requireFinite("riskFreeRate", r);
        InvalidInputException.requireFinite("volatility", sigma);
    }
}
