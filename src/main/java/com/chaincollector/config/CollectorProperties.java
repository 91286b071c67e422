package com.chaincollector.config;

import com.chaincollector.collector.IndexParams;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Collection cycle settings, bound from {@code collector.*}.
 *
 * <p>Indices are keyed by derivatives symbol (NIFTY, BANKNIFTY, ...). An index missing from
 * the map is not collected.
 */
@Configuration
@ConfigurationProperties(prefix = "collector")
@Validated
@Getter
@Setter
public class CollectorProperties {

    /** Delay between the end of one cycle and the start of the next. */
    @NotNull
    private Duration cycleInterval = Duration.ofSeconds(60);

    /** Index tasks run concurrently per cycle. */
    @Min(1)
    private int parallelism = 4;

    /** A task still running after this long is cancelled and recorded as timed out. */
    @NotNull
    private Duration indexTaskTimeout = Duration.ofSeconds(45);

    @Min(1)
    private int sinkPoolSize = 2;

    @Valid
    private MarketHours marketHours = new MarketHours();

    @Valid
    private Sink sink = new Sink();

    @Valid
    private Credentials credentials = new Credentials();

    @Valid
    private Greeks greeks = new Greeks();

    @Valid
    private Map<String, IndexParams> indices = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class MarketHours {

        /** When false, indices are collected outside 09:15-15:30 and on holidays. */
        private boolean enforce = true;
    }

    @Getter
    @Setter
    public static class Sink {

        @NotBlank
        private String baseDir = "data/options";
    }

    @Getter
    @Setter
    public static class Credentials {

        /** Fail startup when no Kite credentials are configured or discoverable. */
        private boolean required = false;
    }

    @Getter
    @Setter
    public static class Greeks {

        private boolean enabled = true;

        /** Annualised, as a decimal. */
        private double riskFreeRate = 0.07;
    }
}
