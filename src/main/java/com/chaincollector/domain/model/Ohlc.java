package com.chaincollector.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Ohlc {

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;

    public static Ohlc empty() {
        return Ohlc.builder()
                .open(BigDecimal.ZERO)
                .high(BigDecimal.ZERO)
                .low(BigDecimal.ZERO)
                .close(BigDecimal.ZERO)
                .build();
    }

    /** High minus low; zero when either side is missing. */
    public BigDecimal getRange() {
        if (high == null || low == null) {
            return BigDecimal.ZERO;
        }
        return high.subtract(low);
    }
}
