package com.chaincollector.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.chaincollector.collector.CollectionStatus;
import com.chaincollector.collector.CycleReport;
import com.chaincollector.collector.IndexCollectionOutcome;
import com.chaincollector.error.ErrorClassifier;
import com.chaincollector.error.ErrorRouter;
import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.exception.NoQuotesException;
import com.chaincollector.memory.MemoryPressureController;
import com.chaincollector.memory.PressureTier;
import com.chaincollector.observability.CollectorMetrics;
import com.chaincollector.unit.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CollectorMetricsTest {

    private SimpleMeterRegistry registry;
    private MemoryPressureController pressure;
    private ErrorRouter errorRouter;
    private CollectorMetrics metrics;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atIst(2025, 6, 11, 10, 0);
        registry = new SimpleMeterRegistry();
        pressure = new MemoryPressureController(
                () -> 0.85, PressureTier.defaults(), 1.0, Duration.ofSeconds(60), Duration.ofSeconds(120), 10, clock);
        errorRouter = new ErrorRouter(
                new ErrorClassifier(), clock, new ObjectMapper().registerModule(new JavaTimeModule()), 100);
        metrics = new CollectorMetrics(registry, pressure, errorRouter);
    }

    @Test
    @DisplayName("A cycle report counts the cycle, its duration, written options and closed-market skips")
    void recordCycle() {
        Map<String, IndexCollectionOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("NIFTY", IndexCollectionOutcome.builder()
                .index("NIFTY").status(CollectionStatus.COLLECTED).optionsWritten(22).build());
        outcomes.put("SENSEX", IndexCollectionOutcome.of("SENSEX", CollectionStatus.MARKET_CLOSED, null));
        CycleReport report = CycleReport.builder()
                .cycleId(1)
                .elapsed(Duration.ofMillis(850))
                .outcomes(outcomes)
                .build();

        metrics.recordCycle(report);

        assertThat(registry.get("collector.cycles").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("collector.cycle.duration").timer().count()).isEqualTo(1);
        assertThat(registry.get("collector.options.written").tag("index", "NIFTY").counter().count())
                .isEqualTo(22.0);
        assertThat(registry.get("collector.collection.skipped")
                        .tag("index", "SENSEX")
                        .tag("reason", "market_closed")
                        .counter()
                        .count())
                .isEqualTo(1.0);
        assertThat(registry.find("collector.options.written").tag("index", "SENSEX").counter()).isNull();
    }

    @Test
    @DisplayName("Routed errors are counted by index and exception type")
    void routedErrors() {
        errorRouter.handle(new NoQuotesException("NIFTY", LocalDate.of(2025, 6, 12), "this_week", 10), "collector", null);
        errorRouter.handle(new IllegalStateException("boom"), "scheduler", null);

        assertThat(registry.get("collector.collection.errors")
                        .tag("index", "none")
                        .tag("type", "NoQuotesException")
                        .counter()
                        .count())
                .isEqualTo(1.0);
        assertThat(registry.get("collector.collection.errors").tag("type", "IllegalStateException").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("collector.errors.total").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Open-circuit rejections are counted per breaker")
    void breakerRejections() {
        errorRouter.handle(new CircuitOpenException("kite.quote", Duration.ofSeconds(10)), "collector", null);

        assertThat(registry.get("collector.breaker.open.rejections").tag("breaker", "kite.quote").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Gauges follow the pressure controller and the latest index price")
    void gauges() {
        pressure.evaluate();
        metrics.recordIndexPrice("NIFTY", new BigDecimal("24810.40"));
        metrics.recordIndexPrice("NIFTY", new BigDecimal("24822.15"));
        metrics.recordIndexPrice("BANKNIFTY", null);

        assertThat(registry.get("collector.memory.pressure.level").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("collector.memory.depth.scale").gauge().value()).isEqualTo(0.6);
        assertThat(registry.get("collector.index.price").tag("index", "NIFTY").gauge().value()).isEqualTo(24822.15);
        assertThat(registry.find("collector.index.price").tag("index", "BANKNIFTY").gauge()).isNull();
    }
}
