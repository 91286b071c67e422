package com.chaincollector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit breaker and retry knobs, bound from {@code collector.resilience.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "collector.resilience")
@Validated
@Getter
@Setter
public class ResilienceProperties {

    @Valid
    private Breaker breaker = new Breaker();

    @Valid
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Breaker {

        @Min(1)
        private int failureThreshold = 5;

        @NotNull
        private Duration minResetTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration maxResetTimeout = Duration.ofSeconds(300);

        @DecimalMin("1.0")
        private double backoffFactor = 2.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.2;

        @Min(1)
        private int halfOpenSuccesses = 1;

        /** Directory for per-breaker state files; persistence is off when unset. */
        private String stateDir;
    }

    @Getter
    @Setter
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration maxElapsed = Duration.ofSeconds(8);

        @NotNull
        private Duration backoffBase = Duration.ofMillis(200);

        @NotNull
        private Duration backoffCap = Duration.ofMillis(2500);

        private boolean jitter = true;

        /** Fully qualified exception class names; when non-empty only these are retried. */
        private List<String> whitelist = new ArrayList<>();

        /** Fully qualified exception class names that are never retried. */
        private List<String> blacklist = new ArrayList<>();
    }
}
