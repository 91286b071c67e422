package com.chaincollector.sink;

import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Ohlc;
import com.chaincollector.expiry.StrikeLadder;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Destination for collected option chains. Implementations must tolerate concurrent calls for
 * different indices; failures surface as {@link com.chaincollector.exception.SinkWriteException}.
 */
public interface OptionsDataSink {

    /**
     * Persists one expiry's options.
     *
     * @return number of option contracts written
     */
    int write(OptionsBatch batch);

    default int writeOptionsData(
            String index, LocalDate expiry, List<EnrichedOption> rows, Instant timestamp, BigDecimal indexPrice,
            Ohlc indexOhlc) {
        return write(OptionsBatch.builder()
                .index(index)
                .expiry(expiry)
                .rows(rows)
                .timestamp(timestamp)
                .indexPrice(indexPrice)
                .indexOhlc(indexOhlc)
                .atmStrike(indexPrice != null ? StrikeLadder.atmFromPrice(indexPrice.doubleValue()) : 0)
                .build());
    }

    /**
     * Appends one overview line per index: PCR per expected rule (absent rules as null) and the
     * index day width.
     */
    void writeOverviewSnapshot(
            String index,
            Map<ExpiryRule, BigDecimal> pcrByRule,
            Instant timestamp,
            BigDecimal dayWidth,
            List<ExpiryRule> expectedRules);

    /** Creates the minimal directory layout for an index so downstream readers find it. */
    void ensureIndexStructure(String index, LocalDate today);
}
