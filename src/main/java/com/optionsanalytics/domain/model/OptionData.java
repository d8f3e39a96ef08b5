package com.optionsanalytics.domain.model;

import com.optionsanalytics.domain.enums.OptionType;
import lombok.Builder;
import lombok.Value;

/**
 * Theoretical quote and Greeks for a single option (call or put) at a specific strike.
 *
 * <p>Used as a building block of {@link OptionChainEntry}, which pairs a call and put at the
 * same strike. Bid and ask are a synthetic symmetric spread around the theoretical mid.
 */
@Value
@Builder
public class OptionData {

    OptionType optionType;
    double strike;

    /** Black-Scholes theoretical price. */
    double price;

    double bid;
    double ask;

    /** Volatility the option was priced with (decimal). */
    double volatility;

    Greeks greeks;
}
