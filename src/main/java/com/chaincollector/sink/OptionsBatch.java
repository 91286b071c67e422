package com.chaincollector.sink;

import com.chaincollector.analytics.OptionGreeks;
import com.chaincollector.analytics.OptionMetrics;
import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Ohlc;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One expiry's worth of enriched options, handed to a sink in a single write.
 *
 * <p>{@code greeks} and {@code metrics} are keyed by {@code exchange:tradingSymbol} and may be
 * empty when memory pressure turned them off.
 */
@Value
@Builder
public class OptionsBatch {

    String index;
    LocalDate expiry;

    /** Rule the expiry was resolved for; null lets the sink derive a code from the date. */
    ExpiryRule rule;

    List<EnrichedOption> rows;
    Instant timestamp;
    BigDecimal indexPrice;
    Ohlc indexOhlc;
    int atmStrike;

    @Builder.Default
    Map<String, OptionGreeks> greeks = Map.of();

    @Builder.Default
    Map<String, OptionMetrics> metrics = Map.of();
}
