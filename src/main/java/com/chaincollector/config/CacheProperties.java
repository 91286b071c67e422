package com.chaincollector.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "collector.cache")
@Validated
@Getter
@Setter
public class CacheProperties {

    /** Lifetime of a non-empty instruments dump. */
    @NotNull
    private Duration instrumentTtl = Duration.ofSeconds(600);

    /** Lifetime of an empty instruments dump, so an empty answer is re-queried soon. */
    @NotNull
    private Duration shortEmptyTtl = Duration.ofSeconds(5);

    /** Lifetime of a resolved expiry list per index. */
    @NotNull
    private Duration expiryTtl = Duration.ofSeconds(600);

    @NotNull
    private Duration quoteTtl = Duration.ofSeconds(2);

    @Min(1)
    private long quoteMaxSize = 5_000;
}
