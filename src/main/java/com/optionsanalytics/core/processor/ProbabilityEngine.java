package com.optionsanalytics.core.processor;

import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.domain.model.ProbabilityResult;
import com.optionsanalytics.exception.InvalidInputException;
import org.springframework.stereotype.Component;

/**
 * Probability-of-outcome statistics for retail display, under a driftless lognormal model.
 *
 * <ul>
 *   <li>P(finish above K) = N((ln(S/K) + sigma^2 * T / 2) / (sigma * sqrt(T))), put side is the complement
 *   <li>P(touch K) = 2 * P(finish beyond K on the side K currently lies), capped at 1
 *   <li>Expected move = S * sigma * sqrt(T), giving the one standard deviation range
 * </ul>
 *
 * <p>The touch figure is the reflection-principle heuristic, not an exact barrier probability.
 * With no time or no volatility left every probability is a step function of the current
 * spot: 1 if already in the money, 0 otherwise.
 */
@Component
public class ProbabilityEngine {

    private final StandardNormal normal;

    public ProbabilityEngine(StandardNormal normal) {
        this.normal = normal;
    }

    /**
     * @throws InvalidInputException for non-positive S or K, negative days, or non-finite sigma
     */
    public ProbabilityResult probabilities(double S, double K, double sigma, int daysToExpiry) {
        InvalidInputException.requirePositive("spot", S);
        InvalidInputException.requirePositive("strike", K);
        InvalidInputException.requireFinite("volatility", sigma);
        InvalidInputException.requireNonNegative("daysToExpiry", daysToExpiry);

        double T = OptionQuote.yearFraction(daysToExpiry);
        if (BlackScholesPricer.isExpiredOrFlat(T, sigma)) {
            return terminal(S, K);
        }

        double sigmaSqrtT = sigma * Math.sqrt(T);
        double d = (Math.log(S / K) + 0.5 * sigma * sigma * T) / sigmaSqrtT;
        double probItm = normal.cdf(d);
        double probPutItm = normal.cdf(-d);

        // The strike sits above spot (or at it): touching means the call side finishing through it
        double otmSide = K >= S ? probItm : probPutItm;
        double probTouch = Math.min(1.0, 2.0 * otmSide);

        double expectedMove = S * sigmaSqrtT;

        return ProbabilityResult.builder()
                .probItm(probItm)
                .probPutItm(probPutItm)
                .probTouch(probTouch)
                .expectedMove(expectedMove)
                .expectedMovePercent(expectedMove / S * 100.0)
                .oneStdDevLow(S - expectedMove)
                .oneStdDevHigh(S + expectedMove)
                .build();
    }

    private ProbabilityResult terminal(double S, double K) {
        return ProbabilityResult.builder()
                .probItm(S > K ? 1.0 : 0.0)
                .probPutItm(S < K ? 1.0 : 0.0)
                .probTouch(S == K ? 1.0 : 0.0)
                .expectedMove(0.0)
                .expectedMovePercent(0.0)
                .oneStdDevLow(S)
                .oneStdDevHigh(S)
                .build();
    }
}
