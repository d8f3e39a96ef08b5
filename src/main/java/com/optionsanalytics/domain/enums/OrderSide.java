package com.optionsanalytics.domain.enums;

/** Buy or sell side of a strategy leg. */
public enum OrderSide {
    BUY,
    SELL;

    /** +1 for BUY, -1 for SELL. Used to sign premiums, Greeks and payoffs of a leg. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
