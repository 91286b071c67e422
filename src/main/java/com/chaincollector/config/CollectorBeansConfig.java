package com.chaincollector.config;

import com.chaincollector.analytics.GreeksCalculator;
import com.chaincollector.analytics.ImpliedVolatilitySolver;
import com.chaincollector.broker.MarketDataProvider;
import com.chaincollector.cache.InstrumentCache;
import com.chaincollector.cache.QuoteCache;
import com.chaincollector.calendar.ExpiryCalendarService;
import com.chaincollector.calendar.TradingCalendarService;
import com.chaincollector.collector.CollectionOrchestrator;
import com.chaincollector.collector.ProviderFacade;
import com.chaincollector.error.ErrorClassifier;
import com.chaincollector.error.ErrorRouter;
import com.chaincollector.exception.ConfigurationException;
import com.chaincollector.expiry.ExpiryResolver;
import com.chaincollector.memory.MemoryPressureController;
import com.chaincollector.memory.MemorySampler;
import com.chaincollector.memory.PressureSnapshot;
import com.chaincollector.memory.ProcessMemorySampler;
import com.chaincollector.observability.CollectorMetrics;
import com.chaincollector.resilience.BreakerConfig;
import com.chaincollector.resilience.BreakerRegistry;
import com.chaincollector.resilience.BreakerStateStore;
import com.chaincollector.resilience.ResilientCall;
import com.chaincollector.resilience.RetryPolicy;
import com.chaincollector.resilience.RetrySettings;
import com.chaincollector.sink.JsonLinesOptionsSink;
import com.chaincollector.sink.OptionsDataSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the collector's plain-Java components from the typed properties. The components
 * themselves carry no Spring annotations so tests construct them directly.
 */
@Configuration
public class CollectorBeansConfig {

    private static final Logger log = LoggerFactory.getLogger(CollectorBeansConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public BreakerRegistry breakerRegistry(ResilienceProperties properties, Clock clock, ObjectMapper objectMapper) {
        ResilienceProperties.Breaker breaker = properties.getBreaker();
        if (breaker.getMaxResetTimeout().compareTo(breaker.getMinResetTimeout()) < 0) {
            throw new ConfigurationException("collector.resilience.breaker.max-reset-timeout must not be below"
                    + " min-reset-timeout");
        }
        BreakerConfig config = BreakerConfig.builder()
                .failureThreshold(breaker.getFailureThreshold())
                .minResetTimeout(breaker.getMinResetTimeout())
                .maxResetTimeout(breaker.getMaxResetTimeout())
                .backoffFactor(breaker.getBackoffFactor())
                .jitter(breaker.getJitter())
                .halfOpenSuccesses(breaker.getHalfOpenSuccesses())
                .build();
        BreakerStateStore store = null;
        if (breaker.getStateDir() != null && !breaker.getStateDir().isBlank()) {
            store = new BreakerStateStore(Path.of(breaker.getStateDir()), objectMapper);
            log.info("Circuit breaker state persisted under {}", breaker.getStateDir());
        }
        return new BreakerRegistry(config, clock, RandomGenerator.getDefault(), store);
    }

    @Bean
    public RetryPolicy retryPolicy(ResilienceProperties properties, Clock clock) {
        ResilienceProperties.Retry retry = properties.getRetry();
        RetrySettings settings = RetrySettings.builder()
                .maxAttempts(retry.getMaxAttempts())
                .maxElapsed(retry.getMaxElapsed())
                .backoffBase(retry.getBackoffBase())
                .backoffCap(retry.getBackoffCap())
                .jitter(retry.isJitter())
                .whitelist(throwableClasses(retry.getWhitelist(), "whitelist"))
                .blacklist(throwableClasses(retry.getBlacklist(), "blacklist"))
                .build();
        return new RetryPolicy(settings, clock, RandomGenerator.getDefault());
    }

    @Bean
    public ResilientCall resilientCall(BreakerRegistry breakerRegistry, RetryPolicy retryPolicy) {
        return ResilientCall.of(breakerRegistry, retryPolicy);
    }

    @Bean
    public InstrumentCache instrumentCache(Clock clock) {
        return new InstrumentCache(clock);
    }

    @Bean
    public QuoteCache quoteCache(CacheProperties properties) {
        return new QuoteCache(properties.getQuoteTtl(), properties.getQuoteMaxSize());
    }

    @Bean
    public ExpiryResolver expiryResolver(Clock clock, CacheProperties properties) {
        return new ExpiryResolver(clock, properties.getExpiryTtl());
    }

    @Bean
    public ProviderFacade providerFacade(
            MarketDataProvider marketDataProvider,
            ResilientCall resilientCall,
            InstrumentCache instrumentCache,
            QuoteCache quoteCache,
            ExpiryResolver expiryResolver,
            ExpiryCalendarService expiryCalendarService,
            TradingCalendarService tradingCalendarService,
            CacheProperties cacheProperties) {
        return new ProviderFacade(
                marketDataProvider,
                resilientCall,
                instrumentCache,
                quoteCache,
                expiryResolver,
                expiryCalendarService,
                tradingCalendarService,
                cacheProperties);
    }

    @Bean
    public MemorySampler memorySampler() {
        return new ProcessMemorySampler();
    }

    @Bean
    public MemoryPressureController memoryPressureController(
            MemoryPressureProperties properties,
            MemorySampler sampler,
            Clock clock,
            InstrumentCache instrumentCache,
            QuoteCache quoteCache,
            ExpiryResolver expiryResolver) {
        MemorySampler effective = properties.isEnabled() ? sampler : () -> 0.0;
        MemoryPressureController controller = new MemoryPressureController(
                effective,
                properties.toPressureTiers(),
                properties.getAlpha(),
                Duration.ofSeconds(properties.getRecoverySeconds()),
                Duration.ofSeconds(properties.getRollbackCooldownSeconds()),
                properties.getAtmMetricWindow(),
                clock);
        controller.register(instrumentCache);
        controller.register(quoteCache);
        controller.register(expiryResolver);
        if (!properties.isEnabled()) {
            log.info("Memory pressure control disabled; collecting at tier {}", PressureSnapshot.normal().getTierName());
        }
        return controller;
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public ErrorRouter errorRouter(ErrorClassifier classifier, Clock clock, ObjectMapper objectMapper) {
        return new ErrorRouter(classifier, clock, objectMapper, ErrorRouter.DEFAULT_HISTORY_CAP);
    }

    @Bean
    public CollectorMetrics collectorMetrics(
            MeterRegistry meterRegistry, MemoryPressureController memoryPressureController, ErrorRouter errorRouter) {
        return new CollectorMetrics(meterRegistry, memoryPressureController, errorRouter);
    }

    @Bean
    public GreeksCalculator greeksCalculator(CollectorProperties properties, TradingCalendarService calendar, Clock clock) {
        return new GreeksCalculator(
                new ImpliedVolatilitySolver(), properties.getGreeks().getRiskFreeRate(), calendar.zone(), clock);
    }

    @Bean
    public OptionsDataSink optionsDataSink(
            CollectorProperties properties, ObjectMapper objectMapper, TradingCalendarService calendar) {
        Path baseDir = Path.of(properties.getSink().getBaseDir());
        log.info("Writing option chains under {}", baseDir.toAbsolutePath());
        return new JsonLinesOptionsSink(baseDir, objectMapper, calendar.zone());
    }

    @Bean
    public CollectionOrchestrator collectionOrchestrator(
            ProviderFacade providerFacade,
            OptionsDataSink optionsDataSink,
            MemoryPressureController memoryPressureController,
            ErrorRouter errorRouter,
            TradingCalendarService tradingCalendarService,
            GreeksCalculator greeksCalculator,
            CollectorMetrics collectorMetrics,
            @Qualifier("indexCollectorExecutor") ThreadPoolTaskExecutor indexCollectorExecutor,
            @Qualifier("sinkWriterExecutor") ThreadPoolTaskExecutor sinkWriterExecutor,
            CollectorProperties collectorProperties,
            Clock clock) {
        return new CollectionOrchestrator(
                providerFacade,
                optionsDataSink,
                memoryPressureController,
                errorRouter,
                tradingCalendarService,
                greeksCalculator,
                collectorMetrics,
                indexCollectorExecutor,
                sinkWriterExecutor,
                collectorProperties,
                clock);
    }

    // ---- Private helpers ----

    private static List<Class<? extends Throwable>> throwableClasses(List<String> names, String property) {
        List<Class<? extends Throwable>> classes = new ArrayList<>();
        for (String name : names) {
            try {
                Class<?> type = Class.forName(name.trim());
                if (!Throwable.class.isAssignableFrom(type)) {
                    throw new ConfigurationException("collector.resilience.retry." + property + ": " + name
                            + " is not a Throwable");
                }
                classes.add(type.asSubclass(Throwable.class));
            } catch (ClassNotFoundException e) {
                throw new ConfigurationException(
                        "collector.resilience.retry." + property + ": unknown class " + name, e);
            }
        }
        return classes;
    }
}
