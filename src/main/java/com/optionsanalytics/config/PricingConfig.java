package com.optionsanalytics.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for pricing defaults and result shaping.
 *
 * <p>Properties are read from the {@code analytics.pricing} prefix. The engine components
 * themselves take every number as an argument; these values only fill in what a caller
 * leaves out (rate, fallback volatility, strike ladder width, payoff sampling).
 */
@Configuration
@ConfigurationProperties(prefix = "analytics.pricing")
@Validated
@Getter
@Setter
public class PricingConfig {

    /** Annual risk-free rate as a decimal. */
    private double riskFreeRate = 0.05;

    /** Trading days used to annualise daily log-return variance. */
    @Min(1)
    private int tradingDaysPerYear = 252;

    /** Volatility assumed when no usable price history exists. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double defaultVolatility = 0.30;

    /** Below this many log returns a volatility estimate is flagged low-confidence. */
    @Min(1)
    private int minVolatilityObservations = 20;

    /** Strikes generated on each side of ATM for a chain. */
    @Min(0)
    private int chainStrikesPerSide = 10;

    @Min(1)
    private int surfaceStrikeCount = 11;

    @NotEmpty
    private List<Integer> surfaceExpiries = new ArrayList<>(List.of(7, 14, 30, 45, 60, 90, 120, 180));

    /** Half-width of the synthetic bid/ask spread around the theoretical price, in percent. */
    @DecimalMin("0.0")
    private double quoteSpreadPercent = 2.0;

    /** Payoff profiles cover spot +/- this percentage. */
    @Min(1)
    private int payoffRangePercent = 30;

    @Min(1)
    private int payoffStepPercent = 2;
}
