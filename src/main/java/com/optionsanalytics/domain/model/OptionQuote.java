package com.optionsanalytics.domain.model;

import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.exception.InvalidInputException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable input to every pricing call: one European option on one underlying.
 *
 * <p>Time is carried as calendar days and converted with {@link #DAYS_PER_YEAR}. A volatility
 * of zero (or below) is accepted and prices the option at intrinsic value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OptionQuote {

    /** Calendar-day year used to turn days to expiry into a year fraction. */
    public static final double DAYS_PER_YEAR = 365.0;

    OptionType optionType;
    double spot;
    double strike;
    int daysToExpiry;
    double riskFreeRate;
    double volatility;

    /**
     * Validating factory.
     *
     * @throws InvalidInputException for non-positive spot/strike, negative days, or non-finite rate/volatility
     */
    public static OptionQuote of(
            OptionType optionType, double spot, double strike, int daysToExpiry, double riskFreeRate, double volatility) {
        if (optionType == null) {
            throw new InvalidInputException("optionType is required");
        }
        InvalidInputException.requirePositive("spot", spot);
        InvalidInputException.requirePositive("strike", strike);
        InvalidInputException.requireNonNegative("daysToExpiry", daysToExpiry);
        InvalidInputException.requireFinite("riskFreeRate", riskFreeRate);
        InvalidInputException.requireFinite("volatility", volatility);
        return new OptionQuote(optionType, spot, strike, daysToExpiry, riskFreeRate, volatility);
    }

    public double timeToExpiry() {
        return yearFraction(daysToExpiry);
    }

    public static double yearFraction(int days) {
        return days / DAYS_PER_YEAR;
    }
}
