package com.optionsanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

/**
 * Maximum profit or loss of a strategy: either a finite amount or {@link #UNLIMITED}.
 *
 * <p>Serialises to a plain JSON number, or to the string {@code "unlimited"} for the sentinel.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PayoffBound {

    public static final PayoffBound UNLIMITED = new PayoffBound(true, Double.POSITIVE_INFINITY);

    private static final String UNLIMITED_LABEL = "unlimited";

    private final boolean unlimited;
    private final double amount;

    public static PayoffBound of(double amount) {
        return new PayoffBound(false, amount);
    }

    public boolean isUnlimited() {
        return unlimited;
    }

    /**
     * @throws IllegalStateException for {@link #UNLIMITED}; check {@link #isUnlimited()} first
     */
    public double amount() {
        if (unlimited) {
            throw new IllegalStateException("Unlimited payoff has no finite amount");
        }
        return amount;
    }

    @JsonValue
    public Object toJson() {
        return unlimited ? UNLIMITED_LABEL : amount;
    }

    @Override
    public String toString() {
        return unlimited ? UNLIMITED_LABEL : Double.toString(amount);
    }
}
