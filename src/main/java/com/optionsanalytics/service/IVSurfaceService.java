package com.optionsanalytics.service;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.core.processor.BlackScholesPricer;
import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.IVSurface;
import com.optionsanalytics.domain.model.IVSurfacePoint;
import com.optionsanalytics.domain.model.OptionQuote;
import com.optionsanalytics.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a strikes x expiries grid of theoretical call prices at one flat volatility.
 *
 * <p>The surface does not model skew or smile: every point carries the input volatility.
 * The strike ladder is the same for every expiry, centred on ATM with the
 * {@link StrikeLadder} step rule, so the grid is always rectangular.
 */
@Slf4j
@Service
public class IVSurfaceService {

    private final BlackScholesPricer pricer;
    private final StrikeLadder strikeLadder;
    private final PricingConfig pricingConfig;

    public IVSurfaceService(BlackScholesPricer pricer, StrikeLadder strikeLadder, PricingConfig pricingConfig) {
        this.pricer = pricer;
        this.strikeLadder = strikeLadder;
        this.pricingConfig = pricingConfig;
    }

    /** Surface over the configured default expiries and strike count. */
    public IVSurface generateSurface(double spot, double sigma) {
        return generateSurface(
                spot, sigma, pricingConfig.getSurfaceExpiries(), pricingConfig.getSurfaceStrikeCount());
    }

    /**
     * @param expiriesDays calendar days to expiry; sorted ascending and de-duplicated
     * @param strikeCount  strikes per expiry row
     * @throws InvalidInputException for a non-positive spot, empty or negative expiries, or strikeCount below 1
     */
    public IVSurface generateSurface(double spot, double sigma, List<Integer> expiriesDays, int strikeCount) {
        List<Integer> expiries = normalizeExpiries(expiriesDays);
        List<Double> strikes = strikeLadder.centeredStrikes(spot, strikeCount);
        double r = pricingConfig.getRiskFreeRate();

        List<IVSurfacePoint> points = new ArrayList<>(expiries.size() * strikes.size());
        for (int days : expiries) {
            for (double strike : strikes) {
                double price = pricer.price(OptionQuote.of(OptionType.CALL, spot, strike, days, r, sigma));
                points.add(new IVSurfacePoint(days, strike, price, sigma));
            }
        }

        log.debug("Generated IV surface: spot={}, sigma={}, {}x{}", spot, sigma, expiries.size(), strikes.size());

        return IVSurface.builder()
                .spotPrice(spot)
                .baseVolatility(sigma)
                .expiries(expiries)
                .strikes(List.copyOf(strikes))
                .points(List.copyOf(points))
                .build();
    }

    private static List<Integer> normalizeExpiries(List<Integer> expiriesDays) {
        if (expiriesDays == null || expiriesDays.isEmpty()) {
            throw new InvalidInputException("At least one expiry is required");
        }
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer days : expiriesDays) {
            if (days == null || days < 0) {
                throw new InvalidInputException(
                        "Expiry days must be non-negative, got: " + days, Map.of("expiriesDays", expiriesDays));
            }
            sorted.add(days);
        }
        return List.copyOf(sorted);
    }
}
