package com.optionsanalytics.service;

import com.optionsanalytics.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Strike selection policy for synthetic chains and surfaces.
 *
 * <p>Strikes are spaced by a denomination-dependent step (5 above a spot of 100, 2.5 above 50,
 * 1 otherwise) around the at-the-money strike round(spot / step) * step, floored at one step so
 * the ladder always holds its ATM strike. Non-positive strikes at the low end are dropped.
 */
@Component
public class StrikeLadder {

    public double strikeStep(double spot) {
        InvalidInputException.requirePositive("spot", spot);
        if (spot > 100) {
            return 5.0;
        }
        if (spot > 50) {
            return 2.5;
        }
        return 1.0;
    }

    /** Spot rounded to the nearest step, never below one step. */
    public double atmStrike(double spot) {
        double step = strikeStep(spot);
        return Math.max(step, Math.round(spot / step) * step);
    }

    /**
     * Ladder of ATM +/- {@code stepsPerSide} steps, ascending.
     *
     * @throws InvalidInputException for a non-positive spot or negative stepsPerSide
     */
    public List<Double> chainStrikes(double spot, int stepsPerSide) {
        InvalidInputException.requireNonNegative("stepsPerSide", stepsPerSide);
        return ladder(spot, stepsPerSide, stepsPerSide);
    }

    /**
     * Ladder of {@code count} strikes around ATM, ascending. An even count puts the extra
     * strike above ATM. Fewer strikes come back when the low end would go non-positive.
     *
     * @throws InvalidInputException for a non-positive spot or count below 1
     */
    public List<Double> centeredStrikes(double spot, int count) {
        if (count < 1) {
            throw new InvalidInputException("strikeCount must be at least 1, got: " + count, Map.of("strikeCount", count));
        }
        int below = (count - 1) / 2;
        return ladder(spot, below, count - 1 - below);
    }

    private List<Double> ladder(double spot, int below, int above) {
        double step = strikeStep(spot);
        double atm = atmStrike(spot);

        List<Double> strikes = new ArrayList<>(below + above + 1);
        for (int i = -below; i <= above; i++) {
            double strike = atm + i * step;
            if (strike > 0) {
                strikes.add(strike);
            }
        }
        return strikes;
    }
}
