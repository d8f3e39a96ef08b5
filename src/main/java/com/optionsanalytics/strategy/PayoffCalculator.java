package com.optionsanalytics.strategy;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.domain.model.PayoffProfile;
import com.optionsanalytics.domain.model.StrategyLeg;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Samples the expiry P&L of a set of legs across a band of underlying prices.
 *
 * <p>The band runs from spot * (1 - range%) to spot * (1 + range%) in step% increments,
 * both taken from {@link PricingConfig}.
 */
@Component
public class PayoffCalculator {

    private final PricingConfig pricingConfig;

    public PayoffCalculator(PricingConfig pricingConfig) {
        this.pricingConfig = pricingConfig;
    }

    public PayoffProfile profile(List<StrategyLeg> legs, double spot) {
        int range = pricingConfig.getPayoffRangePercent();
        int step = pricingConfig.getPayoffStepPercent();

        List<Double> prices = new ArrayList<>();
        List<Double> pnl = new ArrayList<>();
        for (int pct = -range; pct <= range; pct += step) {
            double price = spot * (1.0 + pct / 100.0);
            prices.add(price);
            pnl.add(pnlAt(legs, price));
        }
        return new PayoffProfile(List.copyOf(prices), List.copyOf(pnl));
    }

    public double pnlAt(List<StrategyLeg> legs, double price) {
        double total = 0.0;
        for (StrategyLeg leg : legs) {
            total += leg.payoffAtExpiry(price);
        }
        return total;
    }
}
