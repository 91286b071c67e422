package com.chaincollector.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single {@link Clock} for all time-dependent components, so tests can substitute a fixed one.
 */
@Configuration
public class ClockConfig {

    public static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Kolkata");

    @Bean
    public Clock clock() {
        return Clock.system(MARKET_ZONE);
    }
}
