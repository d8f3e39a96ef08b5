package com.optionsanalytics.domain.model;

import com.optionsanalytics.domain.enums.StrategyType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * An evaluated multi-leg strategy. All legs share spot, time to expiry, rate and volatility.
 *
 * <p>{@link #netPremium} is reported as a positive amount: the debit paid for long-volatility
 * strategies (straddle, strangle) and the credit received for an iron condor.
 */
@Value
@Builder
public class Strategy {

    StrategyType type;
    double spotPrice;
    int daysToExpiry;
    double volatility;

    List<StrategyLeg> legs;

    double netPremium;

    /** Underlying prices at expiry where the strategy breaks even, ascending. */
    List<Double> breakevens;

    PayoffBound maxProfit;
    PayoffBound maxLoss;

    /** Position Greeks: sum over legs, with sold legs negated. */
    Greeks greeks;

    /**
     * Set when the numbers describe a likely misconfigured strategy, e.g. an iron condor whose
     * credit exceeds its wing width (max loss is then clamped to zero).
     */
    boolean degenerate;

    PayoffProfile payoff;
}
