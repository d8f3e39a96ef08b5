package com.optionsanalytics.core.processor;

import com.optionsanalytics.exception.InsufficientDataException;
import com.optionsanalytics.exception.InvalidInputException;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.springframework.stereotype.Component;

/**
 * Annualised historical volatility from a series of closing prices.
 *
 * <p>Daily log returns r_i = ln(P_i / P_i-1) are reduced to their population variance
 * (mean-subtracted, divided by N) and annualised as sqrt(variance * tradingDaysPerYear).
 * Used as an implied-volatility proxy when no market IV is available.
 *
 * <p>Two prices are enough to produce a number. Deciding whether a short series is
 * trustworthy is left to the caller.
 */
@Component
public class VolatilityEstimator {

    public static final int DEFAULT_TRADING_DAYS_PER_YEAR = 252;

    static final int MIN_PRICES = 2;

    public double annualizedVolatility(List<Double> prices) {
        return annualizedVolatility(prices, DEFAULT_TRADING_DAYS_PER_YEAR);
    }

    /**
     * @param prices             closing prices, oldest first
     * @param tradingDaysPerYear periods per year used for annualisation
     * @throws InsufficientDataException with fewer than two prices
     * @throws InvalidInputException     for a non-positive price or non-positive tradingDaysPerYear
     */
    public double annualizedVolatility(List<Double> prices, int tradingDaysPerYear) {
        double[] returns = logReturns(prices);
        if (tradingDaysPerYear <= 0) {
            throw new InvalidInputException(
                    "tradingDaysPerYear must be positive, got: " + tradingDaysPerYear,
                    Map.of("tradingDaysPerYear", tradingDaysPerYear));
        }

        double variance = new Variance(false).evaluate(returns);
        return Math.sqrt(variance * tradingDaysPerYear);
    }

    /**
     * Consecutive log returns of the series.
     *
     * @throws InsufficientDataException with fewer than two prices
     */
    public double[] logReturns(List<Double> prices) {
        int size = prices == null ? 0 : prices.size();
        if (size < MIN_PRICES) {
            throw new InsufficientDataException(
                    "Volatility needs at least " + MIN_PRICES + " prices, got " + size, MIN_PRICES, size);
        }

        double[] returns = new double[size - 1];
        double previous = requirePrice(prices, 0);
        for (int i = 1; i < size; i++) {
            double current = requirePrice(prices, i);
            returns[i - 1] = Math.log(current / previous);
            previous = current;
        }
        return returns;
    }

    private static double requirePrice(List<Double> prices, int index) {
        Double price = prices.get(index);
        if (price == null || !Double.isFinite(price) || price <= 0) {
            throw new InvalidInputException(
                    "Price at index " + index + " must be a positive number, got: " + price,
                    Map.of("index", index));
        }
        return price;
    }
}
