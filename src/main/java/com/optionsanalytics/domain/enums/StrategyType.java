package com.optionsanalytics.domain.enums;

/**
 * Multi-leg strategies the composer can build. STRADDLE and STRANGLE are long volatility
 * (debit); IRON_CONDOR is a short-volatility credit spread pair.
 */
public enum StrategyType {
    STRADDLE,
    STRANGLE,
    IRON_CONDOR
}
