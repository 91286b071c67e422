package com.chaincollector.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Spot price and day OHLC of an index, plus the ATM strike derived from it.
 */
@Value
@Builder
public class IndexData {

    String index;
    BigDecimal price;
    Ohlc ohlc;
    int atmStrike;
}
