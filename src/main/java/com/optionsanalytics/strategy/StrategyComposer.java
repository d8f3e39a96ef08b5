package com.optionsanalytics.strategy;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.core.processor.BlackScholesPricer;
import com.optionsanalytics.core.processor.GreeksCalculator;
import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.enums.OrderSide;
import com.optionsanalytics.domain.enums.StrategyType;
import com.optionsanalytics.domain.model.Greeks;
import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.domain.model.PayoffBound;
import com.optionsanalytics.domain.model.Strategy;
import com.optionsanalytics.domain.model.StrategyLeg;
import com.optionsanalytics.exception.InvalidInputException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Composes multi-leg option strategies and derives their premium, breakevens and payoff bounds.
 *
 * <p>Supported shapes:
 * <ul>
 *   <li><b>Straddle:</b> buy call + buy put at one strike. Debit; loss capped at the debit,
 *       upside unlimited.</li>
 *   <li><b>Strangle:</b> buy put at a lower strike + buy call at a higher strike. Debit;
 *       same bounds as the straddle.</li>
 *   <li><b>Iron condor:</b> short put spread + short call spread
 *       (putBuy &lt; putSell &lt; callSell &lt; callBuy). Credit; profit capped at the credit,
 *       loss capped at the wider wing minus the credit.</li>
 * </ul>
 *
 * <p>Every leg is priced at the same spot, expiry, rate and volatility. Each call returns a
 * fresh immutable {@link Strategy}.
 */
@Slf4j
@Component
public class StrategyComposer {

    private final BlackScholesPricer pricer;
    private final GreeksCalculator greeksCalculator;
    private final PayoffCalculator payoffCalculator;
    private final PricingConfig pricingConfig;

    public StrategyComposer(
            BlackScholesPricer pricer,
            GreeksCalculator greeksCalculator,
            PayoffCalculator payoffCalculator,
            PricingConfig pricingConfig) {
        this.pricer = pricer;
        this.greeksCalculator = greeksCalculator;
        this.payoffCalculator = payoffCalculator;
        this.pricingConfig = pricingConfig;
    }

    // ========================
    // STRADDLE
    // ========================

    public Strategy straddle(double spot, double strike, double sigma, int daysToExpiry) {
        return straddle(spot, strike, sigma, daysToExpiry, pricingConfig.getRiskFreeRate());
    }

    /**
     * Long straddle: breakevens are exactly strike -/+ the debit paid.
     */
    public Strategy straddle(double spot, double strike, double sigma, int daysToExpiry, double r) {
        List<StrategyLeg> legs = List.of(
                leg(OptionType.CALL, strike, OrderSide.BUY, spot, daysToExpiry, r, sigma),
                leg(OptionType.PUT, strike, OrderSide.BUY, spot, daysToExpiry, r, sigma));

        double debit = netDebit(legs);
        return longVolatility(StrategyType.STRADDLE, legs, debit, List.of(strike - debit, strike + debit))
                .spotPrice(spot)
                .daysToExpiry(daysToExpiry)
                .volatility(sigma)
                .greeks(positionGreeks(legs, spot, daysToExpiry, r, sigma))
                .payoff(payoffCalculator.profile(legs, spot))
                .build();
    }

    // ========================
    // STRANGLE
    // ========================

    public Strategy strangle(double spot, double putStrike, double callStrike, double sigma, int daysToExpiry) {
        return strangle(spot, putStrike, callStrike, sigma, daysToExpiry, pricingConfig.getRiskFreeRate());
    }

    /**
     * Long strangle: breakevens are putStrike - debit and callStrike + debit.
     *
     * @throws InvalidInputException if putStrike is above callStrike
     */
    public Strategy strangle(
            double spot, double putStrike, double callStrike, double sigma, int daysToExpiry, double r) {
        if (putStrike > callStrike) {
            throw new InvalidInputException(
                    "Strangle put strike " + putStrike + " must not be above call strike " + callStrike,
                    Map.of("putStrike", putStrike, "callStrike", callStrike));
        }

        List<StrategyLeg> legs = List.of(
                leg(OptionType.PUT, putStrike, OrderSide.BUY, spot, daysToExpiry, r, sigma),
                leg(OptionType.CALL, callStrike, OrderSide.BUY, spot, daysToExpiry, r, sigma));

        double debit = netDebit(legs);
        return longVolatility(StrategyType.STRANGLE, legs, debit, List.of(putStrike - debit, callStrike + debit))
                .spotPrice(spot)
                .daysToExpiry(daysToExpiry)
                .volatility(sigma)
                .greeks(positionGreeks(legs, spot, daysToExpiry, r, sigma))
                .payoff(payoffCalculator.profile(legs, spot))
                .build();
    }

    // ========================
    // IRON CONDOR
    // ========================

    public Strategy ironCondor(
            double spot,
            double putBuyStrike,
            double putSellStrike,
            double callSellStrike,
            double callBuyStrike,
            double sigma,
            int daysToExpiry) {
        return ironCondor(
                spot,
                putBuyStrike,
                putSellStrike,
                callSellStrike,
                callBuyStrike,
                sigma,
                daysToExpiry,
                pricingConfig.getRiskFreeRate());
    }

    /**
     * Iron condor. Max loss is computed from the wider wing and clamped at zero; a clamp marks
     * the strategy {@link Strategy#isDegenerate() degenerate}.
     *
     * @throws InvalidInputException unless putBuy &lt; putSell &lt; callSell &lt; callBuy
     */
    public Strategy ironCondor(
            double spot,
            double putBuyStrike,
            double putSellStrike,
            double callSellStrike,
            double callBuyStrike,
            double sigma,
            int daysToExpiry,
            double r) {
        validateCondorStrikes(putBuyStrike, putSellStrike, callSellStrike, callBuyStrike);

        List<StrategyLeg> legs = List.of(
                leg(OptionType.PUT, putBuyStrike, OrderSide.BUY, spot, daysToExpiry, r, sigma),
                leg(OptionType.PUT, putSellStrike, OrderSide.SELL, spot, daysToExpiry, r, sigma),
                leg(OptionType.CALL, callSellStrike, OrderSide.SELL, spot, daysToExpiry, r, sigma),
                leg(OptionType.CALL, callBuyStrike, OrderSide.BUY, spot, daysToExpiry, r, sigma));

        double credit = -netDebit(legs);
        double wingWidth = Math.max(putSellStrike - putBuyStrike, callBuyStrike - callSellStrike);
        double maxLoss = wingWidth - credit;
        boolean degenerate = maxLoss < 0;
        if (degenerate) {
            log.warn(
                    "Iron condor credit {} exceeds wing width {} (strikes {}/{}/{}/{}); clamping max loss to 0",
                    credit,
                    wingWidth,
                    putBuyStrike,
                    putSellStrike,
                    callSellStrike,
                    callBuyStrike);
            maxLoss = 0.0;
        }

        log.debug("Iron condor composed: credit={}, wingWidth={}, maxLoss={}", credit, wingWidth, maxLoss);

        return Strategy.builder()
                .type(StrategyType.IRON_CONDOR)
                .spotPrice(spot)
                .daysToExpiry(daysToExpiry)
                .volatility(sigma)
                .legs(legs)
                .netPremium(credit)
                .breakevens(List.of(putSellStrike - credit, callSellStrike + credit))
                .maxProfit(PayoffBound.of(credit))
                .maxLoss(PayoffBound.of(maxLoss))
                .degenerate(degenerate)
                .greeks(positionGreeks(legs, spot, daysToExpiry, r, sigma))
                .payoff(payoffCalculator.profile(legs, spot))
                .build();
    }

    // ---- Helpers ----

    private Strategy.StrategyBuilder longVolatility(
            StrategyType type, List<StrategyLeg> legs, double debit, List<Double> breakevens) {
        log.debug("{} composed: debit={}, breakevens={}", type, debit, breakevens);
        return Strategy.builder()
                .type(type)
                .legs(legs)
                .netPremium(debit)
                .breakevens(breakevens)
                .maxProfit(PayoffBound.UNLIMITED)
                .maxLoss(PayoffBound.of(debit));
    }

    private StrategyLeg leg(
            OptionType type, double strike, OrderSide side, double spot, int daysToExpiry, double r, double sigma) {
        OptionQuote quote = OptionQuote.of(type, spot, strike, daysToExpiry, r, sigma);
        return StrategyLeg.builder()
                .optionType(type)
                .strike(strike)
                .side(side)
                .quantity(1)
                .premium(pricer.price(quote))
                .build();
    }

    /** Debit paid to open the legs; negative when the legs open for a net credit. */
    private static double netDebit(List<StrategyLeg> legs) {
        double cashFlow = 0.0;
        for (StrategyLeg leg : legs) {
            cashFlow += leg.entryCashFlow();
        }
        return -cashFlow;
    }

    private Greeks positionGreeks(List<StrategyLeg> legs, double spot, int daysToExpiry, double r, double sigma) {
        Greeks total = Greeks.ZERO;
        for (StrategyLeg leg : legs) {
            Greeks legGreeks = greeksCalculator.greeks(
                    OptionQuote.of(leg.getOptionType(), spot, leg.getStrike(), daysToExpiry, r, sigma));
            total = total.plus(legGreeks.scale(leg.getSide().sign() * leg.getQuantity()));
        }
        return total;
    }

    private static void validateCondorStrikes(
            double putBuyStrike, double putSellStrike, double callSellStrike, double callBuyStrike) {
        if (!(putBuyStrike < putSellStrike && putSellStrike < callSellStrike && callSellStrike < callBuyStrike)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("putBuyStrike", putBuyStrike);
            details.put("putSellStrike", putSellStrike);
            details.put("callSellStrike", callSellStrike);
            details.put("callBuyStrike", callBuyStrike);
            throw new InvalidInputException(
                    "Iron condor strikes must satisfy putBuy < putSell < callSell < callBuy, got " + putBuyStrike + " / "
                            + putSellStrike + " / " + callSellStrike + " / " + callBuyStrike,
                    details);
        }
    }
}
