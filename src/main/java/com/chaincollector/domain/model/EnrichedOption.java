package com.chaincollector.domain.model;

import com.chaincollector.domain.enums.OptionKind;
import java.math.BigDecimal;
import lombok.Value;

/**
 * An option instrument joined with its live quote. This is the row shape handed to sinks.
 */
@Value
public class EnrichedOption {

    Instrument instrument;
    OptionQuote quote;

    public String getKey() {
        return instrument.getQuoteKey();
    }

    public OptionKind getKind() {
        return instrument.getKind();
    }

    public BigDecimal getStrike() {
        return instrument.getStrike();
    }

    public long getOpenInterest() {
        return quote.getOpenInterest();
    }
}
