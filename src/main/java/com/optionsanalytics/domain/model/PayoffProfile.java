package com.optionsanalytics.domain.model;

import java.util.List;
import lombok.Value;

/** Strategy P&L at expiry sampled over a range of underlying prices. Lists are parallel. */
@Value
public class PayoffProfile {

    List<Double> prices;
    List<Double> pnl;
}
