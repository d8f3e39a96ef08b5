package com.optionsanalytics.service;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.core.processor.BlackScholesPricer;
import com.optionsanalytics.core.processor.GreeksCalculator;
import com.optionsanalytics.core.processor.IVCalculator;
import com.optionsanalytics.core.processor.ProbabilityEngine;
import com.optionsanalytics.core.processor.VolatilityEstimator;
import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.OptionAnalysis;
import com.optionsanalytics.domain.model.OptionChain;
import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.domain.model.VolatilityEstimate;
import com.optionsanalytics.exception.InsufficientDataException;
import com.optionsanalytics.exception.InvalidInputException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers that hold a live quote and maybe a price history, and want
 * analytics with the engine's defaults filled in.
 *
 * <p>Owns the policies the numerical components deliberately leave out:
 * <ol>
 *   <li>Volatility resolution: historical estimate when a series exists, the configured default
 *       (30%) when it doesn't, and a low-confidence flag for short series</li>
 *   <li>Strike selection for chains via {@link StrikeLadder}</li>
 *   <li>The configured risk-free rate when the caller has none</li>
 * </ol>
 */
@Slf4j
@Service
public class OptionsAnalyticsService {

    private final BlackScholesPricer pricer;
    private final GreeksCalculator greeksCalculator;
    private final ProbabilityEngine probabilityEngine;
    private final VolatilityEstimator volatilityEstimator;
    private final IVCalculator ivCalculator;
    private final OptionChainService optionChainService;
    private final StrikeLadder strikeLadder;
    private final PricingConfig pricingConfig;

    public OptionsAnalyticsService(
            BlackScholesPricer pricer,
            GreeksCalculator greeksCalculator,
            ProbabilityEngine probabilityEngine,
            VolatilityEstimator volatilityEstimator,
            IVCalculator ivCalculator,
            OptionChainService optionChainService,
            StrikeLadder strikeLadder,
            PricingConfig pricingConfig) {
        this.pricer = pricer;
        this.greeksCalculator = greeksCalculator;
        this.probabilityEngine = probabilityEngine;
        this.volatilityEstimator = volatilityEstimator;
        this.ivCalculator = ivCalculator;
        this.optionChainService = optionChainService;
        this.strikeLadder = strikeLadder;
        this.pricingConfig = pricingConfig;
    }

    public OptionAnalysis analyze(OptionType type, double spot, double strike, int daysToExpiry, double sigma) {
        return analyze(OptionQuote.of(type, spot, strike, daysToExpiry, pricingConfig.getRiskFreeRate(), sigma));
    }

    /**
     * Price, Greeks, probabilities and long-position breakeven of one option.
     */
    public OptionAnalysis analyze(OptionQuote quote) {
        double price = pricer.price(quote);
        double breakeven = quote.getOptionType().isCall() ? quote.getStrike() + price : quote.getStrike() - price;

        return OptionAnalysis.builder()
                .quote(quote)
                .price(price)
                .greeks(greeksCalculator.greeks(quote))
                .probabilities(probabilityEngine.probabilities(
                        quote.getSpot(), quote.getStrike(), quote.getVolatility(), quote.getDaysToExpiry()))
                .breakeven(breakeven)
                .build();
    }

    /**
     * Resolves the volatility to price with from a closing-price history (oldest first).
     *
     * <p>No history, or too little to compute a return, yields the configured default flagged as
     * a fallback. Fewer returns than {@code analytics.pricing.min-volatility-observations} yield
     * the estimate flagged low-confidence.
     */
    public VolatilityEstimate resolveVolatility(List<Double> closes) {
        try {
            double volatility =
                    volatilityEstimator.annualizedVolatility(closes, pricingConfig.getTradingDaysPerYear());
            int observations = closes.size() - 1;
            boolean lowConfidence = observations < pricingConfig.getMinVolatilityObservations();
            if (lowConfidence) {
                log.warn(
                        "Volatility {} estimated from only {} returns (minimum {}), flagging low confidence",
                        volatility,
                        observations,
                        pricingConfig.getMinVolatilityObservations());
            }
            return VolatilityEstimate.builder()
                    .volatility(volatility)
                    .observations(observations)
                    .lowConfidence(lowConfidence)
                    .fallback(false)
                    .build();
        } catch (InsufficientDataException e) {
            log.warn(
                    "No usable price history ({}), using default volatility {}",
                    e.getMessage(),
                    pricingConfig.getDefaultVolatility());
            return VolatilityEstimate.builder()
                    .volatility(pricingConfig.getDefaultVolatility())
                    .observations(0)
                    .lowConfidence(true)
                    .fallback(true)
                    .build();
        }
    }

    /**
     * Implied volatility that reproduces {@code marketPrice}.
     *
     * @return volatility as a decimal, or -1 when no volatility reproduces the price
     * @throws InvalidInputException for invalid spot, strike or days
     */
    public double impliedVolatility(OptionType type, double spot, double strike, int daysToExpiry, double marketPrice) {
        InvalidInputException.requirePositive("spot", spot);
        InvalidInputException.requirePositive("strike", strike);
        InvalidInputException.requireNonNegative("daysToExpiry", daysToExpiry);

        double iv = ivCalculator.solve(
                type,
                spot,
                strike,
                OptionQuote.yearFraction(daysToExpiry),
                pricingConfig.getRiskFreeRate(),
                marketPrice);
        if (iv < 0) {
            log.debug("IV unsolvable for {} S={}, K={}, dte={}, price={}", type, spot, strike, daysToExpiry, marketPrice);
        }
        return iv;
    }

    /**
     * Chain over the standard ladder: ATM +/- {@code analytics.pricing.chain-strikes-per-side} steps.
     */
    public OptionChain chainFor(double spot, double sigma, int daysToExpiry) {
        List<Double> strikes = strikeLadder.chainStrikes(spot, pricingConfig.getChainStrikesPerSide());
        return optionChainService.generateChain(spot, sigma, strikes, daysToExpiry);
    }
}
