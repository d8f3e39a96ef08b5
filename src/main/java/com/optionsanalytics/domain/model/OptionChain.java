package com.optionsanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Synthetic option chain for a single underlying price and expiry.
 *
 * <p>Every entry is priced with the same volatility (no skew). Entries keep the order of the
 * strikes the chain was generated from, which callers supply ascending.
 */
@Value
@Builder
public class OptionChain {

    double spotPrice;

    /** Flat volatility used for every strike (decimal). */
    double volatility;

    int daysToExpiry;

    double riskFreeRate;

    /** Strike price nearest to spot. */
    double atmStrike;

    /** Chain entries ordered by strike (ascending). Each entry has call + put at same strike. */
    List<OptionChainEntry> entries;
}
