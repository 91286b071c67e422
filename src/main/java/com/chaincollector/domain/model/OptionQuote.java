package com.chaincollector.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Live quote for one instrument, produced per enrichment call. Not persisted by the collector
 * itself; sinks decide what to keep.
 */
@Value
@Builder
public class OptionQuote {

    BigDecimal lastPrice;
    long volume;
    long openInterest;
    BigDecimal averagePrice;
    Ohlc ohlc;
}
