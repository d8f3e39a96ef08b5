package com.optionsanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/** Price, Greeks and outcome probabilities of a single option. */
@Value
@Builder
public class OptionAnalysis {

    OptionQuote quote;
    double price;
    Greeks greeks;
    ProbabilityResult probabilities;

    /** Underlying price at expiry where a long position breaks even: K + price (call), K - price (put). */
    double breakeven;
}
