package com.optionsanalytics.core.processor;

import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.Greeks;
import com.optionsanalytics.domain.model.OptionQuote;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes Greeks calculator for European options.
 *
 * <p>Greeks are derived analytically from d1/d2 at a known volatility. Units follow the usual
 * trading-desk display: theta per calendar day, vega and rho per 1% move.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>Delta: N(d1) for calls, N(d1) - 1 for puts
 *   <li>Gamma: n(d1) / (S * sigma * sqrt(T))
 *   <li>Theta: per-day decay (separate formulas for calls/puts)
 *   <li>Vega: S * n(d1) * sqrt(T) / 100
 *   <li>Rho: K * T * e^(-rT) * N(d2) / 100 for calls, -K * T * e^(-rT) * N(-d2) / 100 for puts
 * </ul>
 *
 * <p>At expiry (T &lt;= 0) or with zero volatility, gamma, theta, vega and rho are 0 and delta is
 * the terminal step function: 1 for an ITM call, -1 for an ITM put, 0 otherwise.
 */
@Component
public class GreeksCalculator {

    private static final double DAYS_PER_YEAR = OptionQuote.DAYS_PER_YEAR;

    private final StandardNormal normal;
    private final BlackScholesPricer pricer;

    public GreeksCalculator(StandardNormal normal, BlackScholesPricer pricer) {
        this.normal = normal;
        this.pricer = pricer;
    }

    public Greeks greeks(OptionQuote quote) {
        return greeks(
                quote.getOptionType(),
                quote.getSpot(),
                quote.getStrike(),
                quote.timeToExpiry(),
                quote.getRiskFreeRate(),
                quote.getVolatility());
    }

    /**
     * Calculates all Greeks from known parameters including volatility.
     *
     * @param T     time to expiry in years
     * @param r     risk-free rate as a decimal
     * @param sigma volatility as a decimal
     * @throws com.optionsanalytics.exception.InvalidInputException if S or K is not positive
     */
    public Greeks greeks(OptionType type, double S, double K, double T, double r, double sigma) {
        BlackScholesPricer.validate(S, K, T, r, sigma);
        if (BlackScholesPricer.isExpiredOrFlat(T, sigma)) {
            return terminalGreeks(type, S, K);
        }

        double sqrtT = Math.sqrt(T);
        double d1 = pricer.d1(S, K, T, r, sigma);
        double d2 = pricer.d2(d1, T, sigma);

        double nd1 = normal.pdf(d1);
        double expRT = Math.exp(-r * T);
        double decay = -S * nd1 * sigma / (2.0 * sqrtT);

        double delta;
        double theta;
        double rho;

        if (type.isCall()) {
            double Nd2 = normal.cdf(d2);
            delta = normal.cdf(d1);
            theta = (decay - r * K * expRT * Nd2) / DAYS_PER_YEAR;
            rho = K * T * expRT * Nd2 / 100.0;
        } else {
            double NminusD2 = normal.cdf(-d2);
            delta = normal.cdf(d1) - 1.0;
            theta = (decay + r * K * expRT * NminusD2) / DAYS_PER_YEAR;
            rho = -K * T * expRT * NminusD2 / 100.0;
        }

        // Gamma and Vega are the same for calls and puts
        double gamma = nd1 / (S * sigma * sqrtT);
        double vega = S * nd1 * sqrtT / 100.0;

        return Greeks.builder()
                .delta(delta)
                .gamma(gamma)
                .theta(theta)
                .vega(vega)
                .rho(rho)
                .build();
    }

    private Greeks terminalGreeks(OptionType type, double S, double K) {
        double delta;
        if (type.isCall()) {
            delta = S > K ? 1.0 : 0.0;
        } else {
            delta = S < K ? -1.0 : 0.0;
        }
        return Greeks.builder().delta(delta).build();
    }
}
