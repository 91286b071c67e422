package com.chaincollector.cache;

import com.chaincollector.domain.model.Instrument;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call options for {@link InstrumentCache#getOrFetch(String, Supplier, FetchOptions)}.
 */
@Value
@Builder(toBuilder = true)
public class FetchOptions {

    @Builder.Default
    Duration ttl = Duration.ofSeconds(600);

    @Builder.Default
    Duration shortEmptyTtl = Duration.ofSeconds(5);

    /** Skip the freshness check and always fetch. */
    boolean forceRefresh;

    /** Retry once with {@link #retryFetch} when the primary fetch comes back empty. */
    @Builder.Default
    boolean retryOnEmpty = true;

    Supplier<List<Instrument>> retryFetch;

    public static FetchOptions defaults() {
        return FetchOptions.builder().build();
    }
}
