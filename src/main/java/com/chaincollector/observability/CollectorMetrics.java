package com.chaincollector.observability;

import com.chaincollector.collector.CollectionStatus;
import com.chaincollector.collector.CycleReport;
import com.chaincollector.collector.IndexCollectionOutcome;
import com.chaincollector.error.ErrorRecord;
import com.chaincollector.error.ErrorRouter;
import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.memory.MemoryPressureController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer metrics for the collector.
 *
 * <ul>
 *   <li><b>collector.cycles</b> (counter): completed cycles</li>
 *   <li><b>collector.cycle.duration</b> (timer): wall time of a cycle</li>
 *   <li><b>collector.collection.errors</b> (counter, index/type): routed errors</li>
 *   <li><b>collector.collection.skipped</b> (counter, index/reason): indices not collected</li>
 *   <li><b>collector.options.written</b> (counter, index): option contracts handed to the sink</li>
 *   <li><b>collector.breaker.open.rejections</b> (counter, breaker): calls refused by an open circuit</li>
 *   <li><b>collector.memory.pressure.level</b>, <b>collector.memory.depth.scale</b>,
 *       <b>collector.errors.total</b>, <b>collector.index.price</b> (gauges)</li>
 * </ul>
 *
 * <p>Routed errors arrive through an {@link ErrorRouter} listener registered in the constructor.
 */
public class CollectorMetrics {

    private static final Logger log = LoggerFactory.getLogger(CollectorMetrics.class);

    static final String UNKNOWN_INDEX = "none";

    private final MeterRegistry meterRegistry;
    private final Counter cyclesCounter;
    private final Timer cycleTimer;
    private final Map<String, AtomicReference<Double>> indexPrices = new ConcurrentHashMap<>();

    public CollectorMetrics(
            MeterRegistry meterRegistry, MemoryPressureController pressureController, ErrorRouter errorRouter) {
        this.meterRegistry = meterRegistry;

        this.cyclesCounter = Counter.builder("collector.cycles")
                .description("Completed collection cycles")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("collector.cycle.duration")
                .description("Wall time of one collection cycle")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        meterRegistry.gauge("collector.memory.pressure.level", pressureController, c -> c.getCurrentLevel());
        meterRegistry.gauge("collector.memory.depth.scale", pressureController, MemoryPressureController::getDepthScale);
        meterRegistry.gauge("collector.errors.total", errorRouter, r -> r.getTotalErrors());

        errorRouter.addListener(this::onError);
    }

    public void recordCycle(CycleReport report) {
        cyclesCounter.increment();
        cycleTimer.record(report.getElapsed());
        for (IndexCollectionOutcome outcome : report.getOutcomes().values()) {
            if (outcome.getOptionsWritten() > 0) {
                recordOptionsWritten(outcome.getIndex(), outcome.getOptionsWritten());
            }
            if (outcome.getStatus() == CollectionStatus.MARKET_CLOSED) {
                recordSkip(outcome.getIndex(), "market_closed");
            }
        }
        log.debug("Cycle {} recorded: {} options", report.getCycleId(), report.totalOptionsWritten());
    }

    public void recordSkip(String index, String reason) {
        Counter.builder("collector.collection.skipped")
                .tag("index", index)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordOptionsWritten(String index, int count) {
        Counter.builder("collector.options.written")
                .tag("index", index)
                .register(meterRegistry)
                .increment(count);
    }

    public void recordIndexPrice(String index, BigDecimal price) {
        if (price == null) {
            return;
        }
        indexPrices
                .computeIfAbsent(index, i -> {
                    AtomicReference<Double> holder = new AtomicReference<>(0.0);
                    meterRegistry.gauge("collector.index.price", Tags.of("index", i), holder, h -> h.get());
                    return holder;
                })
                .set(price.doubleValue());
    }

    void onError(ErrorRecord record) {
        String index = record.getIndexName() != null ? record.getIndexName() : UNKNOWN_INDEX;
        Counter.builder("collector.collection.errors")
                .tag("index", index)
                .tag("type", record.getExceptionType())
                .register(meterRegistry)
                .increment();
        if (record.getException() instanceof CircuitOpenException) {
            CircuitOpenException open = (CircuitOpenException) record.getException();
            Counter.builder("collector.breaker.open.rejections")
                    .tag("breaker", open.getBreakerName())
                    .register(meterRegistry)
                    .increment();
        }
    }
}
