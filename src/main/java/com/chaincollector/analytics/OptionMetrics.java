package com.chaincollector.analytics;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-option figures derived from the quote alone: intrinsic value, time value (premium above
 * intrinsic, floored at zero) and the option's share of its side's open interest.
 */
@Value
@Builder
public class OptionMetrics {

    BigDecimal intrinsic;
    BigDecimal timeValue;

    /** Fraction of total CE (or PE) open interest of the expiry, 4 decimals. */
    BigDecimal oiShare;
}
