package com.optionsanalytics.domain.model;

import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.enums.OrderSide;
import lombok.Builder;
import lombok.Value;

/**
 * A single leg of a multi-leg option strategy.
 *
 * <p>For example, a straddle has 2 legs (call buy + put buy at one strike), while an iron
 * condor has 4 legs (put buy, put sell, call sell, call buy at ascending strikes).
 * Quantity is always positive; the direction lives in {@link #side}.
 */
@Value
@Builder
public class StrategyLeg {

    OptionType optionType;
    double strike;
    OrderSide side;
    int quantity;

    /** Theoretical price of one unit of this option when the strategy was composed. */
    double premium;

    /** Signed cash flow of the leg at entry: negative for a debit (buy), positive for a credit (sell). */
    public double entryCashFlow() {
        return -side.sign() * quantity * premium;
    }

    /** Profit or loss of the leg if the underlying settles at {@code price} on expiry. */
    public double payoffAtExpiry(double price) {
        double intrinsic = optionType.isCall() ? Math.max(price - strike, 0) : Math.max(strike - price, 0);
        return side.sign() * quantity * (intrinsic - premium);
    }
}
