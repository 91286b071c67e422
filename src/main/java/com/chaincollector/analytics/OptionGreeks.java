package com.chaincollector.analytics;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Black-Scholes sensitivities of one option, computed locally since Kite quotes carry none.
 * {@code iv} is in percent. {@link #UNAVAILABLE} marks an option whose IV could not be solved.
 */
@Value
@Builder
public class OptionGreeks {

    BigDecimal delta;
    BigDecimal gamma;

    /** Per calendar day. */
    BigDecimal theta;

    /** Per 1% volatility change. */
    BigDecimal vega;

    BigDecimal iv;

    public static final OptionGreeks UNAVAILABLE = OptionGreeks.builder()
            .delta(BigDecimal.ZERO)
            .gamma(BigDecimal.ZERO)
            .theta(BigDecimal.ZERO)
            .vega(BigDecimal.ZERO)
            .iv(BigDecimal.valueOf(-1))
            .build();

    public boolean isAvailable() {
        return this != UNAVAILABLE && iv != null && iv.signum() > 0;
    }
}
