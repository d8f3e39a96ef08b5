package com.optionsanalytics.service;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.core.processor.BlackScholesPricer;
import com.optionsanalytics.core.processor.GreeksCalculator;
import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.OptionChain;
import com.optionsanalytics.domain.model.OptionChainEntry;
import com.optionsanalytics.domain.model.OptionData;
import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds synthetic option chains from Black-Scholes prices and Greeks.
 *
 * <p>The chain is a pure map over the strikes the caller supplies: for each strike a call and a
 * put are priced at the same flat volatility (no skew). Strike selection itself lives in
 * {@link StrikeLadder}. Each side carries a symmetric synthetic bid/ask around the theoretical
 * price, {@code analytics.pricing.quote-spread-percent} wide on each side.
 *
 * <p>Strike selection helpers are provided for callers that need specific moneyness levels
 * (ATM, specific delta targets, N strikes away from ATM).
 */
@Slf4j
@Service
public class OptionChainService {

    private final BlackScholesPricer pricer;
    private final GreeksCalculator greeksCalculator;
    private final PricingConfig pricingConfig;

    public OptionChainService(
            BlackScholesPricer pricer, GreeksCalculator greeksCalculator, PricingConfig pricingConfig) {
        this.pricer = pricer;
        this.greeksCalculator = greeksCalculator;
        this.pricingConfig = pricingConfig;
    }

    /** Generates a chain at the configured risk-free rate. */
    public OptionChain generateChain(double spot, double sigma, List<Double> strikes, int daysToExpiry) {
        return generateChain(spot, sigma, strikes, daysToExpiry, pricingConfig.getRiskFreeRate());
    }

    /**
     * Prices a call and a put at every strike.
     *
     * @param strikes ascending, positive strike prices; output rows keep this order
     * @throws InvalidInputException for a non-positive spot, non-finite volatility or rate, negative days, or strikes that are
     *                               missing, non-positive or not ascending
     */
    public OptionChain generateChain(double spot, double sigma, List<Double> strikes, int daysToExpiry, double r) {
        InvalidInputException.requirePositive("spot", spot);
        InvalidInputException.requireFinite("volatility", sigma);
        InvalidInputException.requireFinite("riskFreeRate", r);
        InvalidInputException.requireNonNegative("daysToExpiry", daysToExpiry);
        validateStrikes(strikes);

        List<OptionChainEntry> entries = new ArrayList<>(strikes.size());
        for (double strike : strikes) {
            OptionData call = buildOptionData(OptionQuote.of(OptionType.CALL, spot, strike, daysToExpiry, r, sigma));
            OptionData put = buildOptionData(OptionQuote.of(OptionType.PUT, spot, strike, daysToExpiry, r, sigma));
            double moneyness = (spot - strike) / strike * 100.0;

            entries.add(OptionChainEntry.builder()
                    .strike(strike)
                    .call(call)
                    .put(put)
                    .moneynessPercent(moneyness)
                    .itm(moneyness > 0)
                    .build());
        }

        log.debug("Generated chain: spot={}, sigma={}, dte={}, strikes={}", spot, sigma, daysToExpiry, strikes.size());

        return OptionChain.builder()
                .spotPrice(spot)
                .volatility(sigma)
                .daysToExpiry(daysToExpiry)
                .riskFreeRate(r)
                .atmStrike(findATMStrike(spot, strikes))
                .entries(List.copyOf(entries))
                .build();
    }

    /**
     * Finds the ATM strike: the strike price nearest to the spot price. Ties go to the lower strike.
     *
     * @return the nearest strike, or NaN if strikes is empty
     */
    public double findATMStrike(double spotPrice, Collection<Double> strikes) {
        double closest = Double.NaN;
        double minDiff = Double.MAX_VALUE;
        for (double strike : strikes) {
            double diff = Math.abs(strike - spotPrice);
            if (diff < minDiff) {
                minDiff = diff;
                closest = strike;
            }
        }
        return closest;
    }

    /**
     * Selects a strike N positions away from ATM in the chain.
     * Positive offset = higher strike (OTM calls / ITM puts),
     * negative offset = lower strike (ITM calls / OTM puts).
     *
     * @return the strike at the requested offset, or null if out of range
     */
    public Double getStrikeByOffset(OptionChain chain, int offset) {
        if (chain == null || chain.getEntries() == null) {
            return null;
        }

        List<OptionChainEntry> entries = chain.getEntries();
        int atmIndex = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (Double.compare(entries.get(i).getStrike(), chain.getAtmStrike()) == 0) {
                atmIndex = i;
                break;
            }
        }
        if (atmIndex < 0) {
            return null;
        }

        int targetIndex = atmIndex + offset;
        if (targetIndex < 0 || targetIndex >= entries.size()) {
            return null;
        }
        return entries.get(targetIndex).getStrike();
    }

    /**
     * Finds the option whose absolute delta is closest to the target delta,
     * e.g. "the 0.20 delta call".
     *
     * @return the closest match, or null for an empty chain
     */
    public OptionData findByDelta(OptionChain chain, double targetDelta, OptionType type) {
        if (chain == null || chain.getEntries() == null) {
            return null;
        }

        OptionData closest = null;
        double minDiff = Double.MAX_VALUE;

        for (OptionChainEntry entry : chain.getEntries()) {
            OptionData option = type.isCall() ? entry.getCall() : entry.getPut();
            double diff = Math.abs(Math.abs(option.getGreeks().getDelta()) - Math.abs(targetDelta));
            if (diff < minDiff) {
                minDiff = diff;
                closest = option;
            }
        }
        return closest;
    }

    // ---- Private builders ----

    private OptionData buildOptionData(OptionQuote quote) {
        double price = pricer.price(quote);
        double spread = pricingConfig.getQuoteSpreadPercent() / 100.0;

        return OptionData.builder()
                .optionType(quote.getOptionType())
                .strike(quote.getStrike())
                .price(price)
                .bid(price * (1.0 - spread))
                .ask(price * (1.0 + spread))
                .volatility(quote.getVolatility())
                .greeks(greeksCalculator.greeks(quote))
                .build();
    }

    private static void validateStrikes(List<Double> strikes) {
        if (strikes == null) {
            throw new InvalidInputException("strikes are required");
        }
        double previous = 0.0;
        for (int i = 0; i < strikes.size(); i++) {
            Double strike = strikes.get(i);
            if (strike == null || !Double.isFinite(strike) || strike <= 0) {
                throw new InvalidInputException(
                        "Strike at index " + i + " must be a positive number, got: " + strike, Map.of("index", i));
            }
            if (strike <= previous) {
                throw new InvalidInputException(
                        "Strikes must be strictly ascending, got " + strike + " after " + previous,
                        Map.of("index", i));
            }
            previous = strike;
        }
    }
}
