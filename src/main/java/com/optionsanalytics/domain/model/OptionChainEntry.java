package com.optionsanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single row in the option chain: pairs call and put data at the same strike price.
 */
@Value
@Builder
public class OptionChainEntry {

    double strike;
    OptionData call;
    OptionData put;

    /** (spot - strike) / strike in percent. Positive when the call is in the money. */
    double moneynessPercent;

    /** Call-side convention: true when spot is above the strike. */
    boolean itm;
}
