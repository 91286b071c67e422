package com.chaincollector.collector;

import com.chaincollector.analytics.ChainAnalytics;
import com.chaincollector.analytics.GreeksCalculator;
import com.chaincollector.analytics.OptionGreeks;
import com.chaincollector.analytics.OptionMetrics;
import com.chaincollector.calendar.TradingCalendarService;
import com.chaincollector.config.CollectorProperties;
import com.chaincollector.domain.CycleContext;
import com.chaincollector.domain.IndexMeta;
import com.chaincollector.domain.IndexRegistry;
import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.IndexData;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.error.ErrorCategory;
import com.chaincollector.error.ErrorRouter;
import com.chaincollector.error.ErrorSeverity;
import com.chaincollector.exception.NoInstrumentsException;
import com.chaincollector.exception.NoQuotesException;
import com.chaincollector.exception.SinkWriteException;
import com.chaincollector.expiry.StrikeLadder;
import com.chaincollector.memory.MemoryPressureController;
import com.chaincollector.memory.PressureSnapshot;
import com.chaincollector.observability.CollectorMetrics;
import com.chaincollector.sink.OptionsBatch;
import com.chaincollector.sink.OptionsDataSink;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Runs one collection cycle across all enabled indices.
 *
 * <p>Memory pressure is evaluated once per cycle and the resulting {@link PressureSnapshot} is
 * shared by every index task. Each index runs on the index pool: market-hours gate, index
 * quote, then per expiry rule the pipeline resolve expiry, strike ladder, instruments,
 * enrichment, Greeks, metrics, sink write. Every stage yields a {@link StageResult}; a failed
 * stage is routed through {@link ErrorRouter} and the task moves on to the next rule.
 *
 * <p>Tasks are joined against a shared deadline ({@code collector.index-task-timeout} from the
 * cycle start). A task still running at the deadline is cancelled and recorded as
 * {@link CollectionStatus#TIMED_OUT}. A cycle never throws for an index or expiry failure.
 */
public class CollectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CollectionOrchestrator.class);

    static final String COMPONENT = "collector";
    private static final String SINK_COMPONENT = "sink";

    private final ProviderFacade facade;
    private final OptionsDataSink sink;
    private final MemoryPressureController pressureController;
    private final ErrorRouter errorRouter;
    private final TradingCalendarService tradingCalendarService;
    private final GreeksCalculator greeksCalculator;
    private final CollectorMetrics metrics;
    private final AsyncTaskExecutor indexExecutor;
    private final Executor sinkExecutor;
    private final CollectorProperties properties;
    private final Clock clock;

    private final AtomicLong cycles = new AtomicLong();
    private final ReentrantLock matrixLock = new ReentrantLock();
    private boolean matrixPrinted;
    private final AtomicBoolean chainRealized = new AtomicBoolean();

    public CollectionOrchestrator(
            ProviderFacade facade,
            OptionsDataSink sink,
            MemoryPressureController pressureController,
            ErrorRouter errorRouter,
            TradingCalendarService tradingCalendarService,
            GreeksCalculator greeksCalculator,
            CollectorMetrics metrics,
            AsyncTaskExecutor indexExecutor,
            Executor sinkExecutor,
            CollectorProperties properties,
            Clock clock) {
        this.facade = facade;
        this.sink = sink;
        this.pressureController = pressureController;
        this.errorRouter = errorRouter;
        this.tradingCalendarService = tradingCalendarService;
        this.greeksCalculator = greeksCalculator;
        this.metrics = metrics;
        this.indexExecutor = indexExecutor;
        this.sinkExecutor = sinkExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public CycleReport runCycle() {
        return runCycle(properties.getIndices());
    }

    public CycleReport runCycle(Map<String, IndexParams> indices) {
        long cycleId = cycles.incrementAndGet();
        Instant startedAt = clock.instant();
        CycleContext cycleContext = CycleContext.forCycle(cycleId);

        PressureSnapshot pressure = evaluatePressure(cycleContext);

        List<String> enabled = new ArrayList<>();
        for (Map.Entry<String, IndexParams> entry : indices.entrySet()) {
            if (entry.getValue() != null && entry.getValue().isEnabled()) {
                enabled.add(entry.getKey());
            }
        }
        log.info("Cycle {} starting: indices={} pressure={}(level {})",
                cycleId, enabled, pressure.getTierName(), pressure.getLevel());

        Map<String, Future<IndexCollectionOutcome>> futures = new LinkedHashMap<>();
        for (String index : enabled) {
            IndexParams params = indices.get(index);
            CycleContext indexContext = cycleContext.withIndex(index);
            futures.put(index, indexExecutor.submit(
                    () -> collectIndex(index, params, indexContext, pressure, startedAt, enabled)));
        }

        Map<String, IndexCollectionOutcome> outcomes = join(futures, cycleContext, startedAt);

        for (String index : enabled) {
            ensureStructure(index, cycleContext.withIndex(index));
        }
        if (chainRealized.get()) {
            printMatrixOnce(enabled);
        }

        CycleReport report = CycleReport.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .elapsed(Duration.between(startedAt, clock.instant()))
                .outcomes(outcomes)
                .pressureLevel(pressure.getLevel())
                .build();
        metrics.recordCycle(report);
        log.info("Cycle {} done in {} ms: collected={} partial={} closed={} failed={} timedOut={} options={}",
                cycleId,
                report.getElapsed().toMillis(),
                report.count(CollectionStatus.COLLECTED),
                report.count(CollectionStatus.PARTIAL),
                report.count(CollectionStatus.MARKET_CLOSED),
                report.count(CollectionStatus.FAILED)
                        + report.count(CollectionStatus.INDEX_DATA_FAILED)
                        + report.count(CollectionStatus.NOTHING_WRITTEN),
                report.count(CollectionStatus.TIMED_OUT),
                report.totalOptionsWritten());
        return report;
    }

    /** True while the current pressure tier asks for slower cycles. */
    public boolean isSlowCyclesActive() {
        return pressureController.snapshot().isSlowCycles();
    }

    boolean isMatrixPrinted() {
        matrixLock.lock();
        try {
            return matrixPrinted;
        } finally {
            matrixLock.unlock();
        }
    }

    // ---- Per-index task ----

    IndexCollectionOutcome collectIndex(
            String index,
            IndexParams params,
            CycleContext ctx,
            PressureSnapshot pressure,
            Instant timestamp,
            List<String> enabledIndices) {
        Map<String, String> mdc = ctx.asMdc();
        mdc.forEach(MDC::put);
        try {
            return collect(index, params, ctx, pressure, timestamp, enabledIndices);
        } finally {
            mdc.keySet().forEach(MDC::remove);
        }
    }

    private IndexCollectionOutcome collect(
            String index,
            IndexParams params,
            CycleContext ctx,
            PressureSnapshot pressure,
            Instant timestamp,
            List<String> enabledIndices) {
        if (properties.getMarketHours().isEnforce() && !tradingCalendarService.isMarketOpen()) {
            log.debug("Market closed, skipping {}", index);
            ensureStructure(index, ctx);
            return IndexCollectionOutcome.of(index, CollectionStatus.MARKET_CLOSED, null);
        }

        StageResult<IndexData> indexData =
                StageResult.attempt(CollectionStage.INDEX_DATA, null, () -> facade.getIndexData(index));
        if (!indexData.isSuccess()) {
            StageResult.Failure<IndexData> failure = indexData.asFailure();
            errorRouter.handleProviderError(failure.getCause(), COMPONENT, ctx, Map.of("stage", "index_data"));
            ensureStructure(index, ctx);
            return IndexCollectionOutcome.of(index, CollectionStatus.INDEX_DATA_FAILED, failure);
        }
        IndexData data = indexData.getValue();
        metrics.recordIndexPrice(index, data.getPrice());
        Optional<BigDecimal> dayWidth = ChainAnalytics.dayWidth(data.getOhlc());

        IndexCollectionOutcome.IndexCollectionOutcomeBuilder outcome = IndexCollectionOutcome.builder().index(index);
        Map<ExpiryRule, BigDecimal> pcrByRule = new LinkedHashMap<>();
        List<StageResult.Failure<?>> failures = new ArrayList<>();
        int written = 0;

        for (ExpiryRule rule : params.getExpiries()) {
            StageResult<Integer> result = collectRule(index, rule, params, data, ctx, pressure, timestamp, enabledIndices, pcrByRule);
            if (result.isSuccess()) {
                outcome.writtenRule(rule);
                written += result.getValue();
            } else {
                failures.add(result.asFailure());
            }
        }

        if (!pcrByRule.isEmpty()) {
            StageResult<Boolean> overview = StageResult.attempt(CollectionStage.OVERVIEW, null, () -> {
                sink.writeOverviewSnapshot(index, pcrByRule, timestamp, dayWidth.orElse(null), params.getExpiries());
                return true;
            });
            if (!overview.isSuccess()) {
                errorRouter.handle(
                        overview.asFailure().getCause(), null, null, SINK_COMPONENT, ctx, Map.of("stage", "overview"));
                failures.add(overview.asFailure());
            }
        }
        if (written == 0) {
            ensureStructure(index, ctx);
        }

        CollectionStatus status;
        if (written == 0 && pcrByRule.isEmpty()) {
            status = CollectionStatus.NOTHING_WRITTEN;
        } else if (!failures.isEmpty()) {
            status = CollectionStatus.PARTIAL;
        } else {
            status = CollectionStatus.COLLECTED;
        }
        log.debug("{} collected: status={} options={} failures={}", index, status, written, failures.size());
        return outcome.status(status).failures(failures).pcrByRule(pcrByRule).optionsWritten(written).build();
    }

    /**
     * One expiry rule end to end. Returns the number of options written, or the first failing
     * stage (already routed).
     */
    private StageResult<Integer> collectRule(
            String index,
            ExpiryRule rule,
            IndexParams params,
            IndexData data,
            CycleContext ctx,
            PressureSnapshot pressure,
            Instant timestamp,
            List<String> enabledIndices,
            Map<ExpiryRule, BigDecimal> pcrByRule) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule", rule.getCode());

        StageResult<LocalDate> expiry =
                StageResult.attempt(CollectionStage.RESOLVE_EXPIRY, rule, () -> facade.resolveExpiry(index, rule));
        if (!expiry.isSuccess()) {
            errorRouter.handle(expiry.asFailure().getCause(), null, null, COMPONENT, ctx, details);
            return expiry.map(d -> 0);
        }
        LocalDate expiryDate = expiry.getValue();
        details.put("expiry", expiryDate.toString());

        IndexMeta meta = IndexRegistry.get(index);
        List<Integer> strikes = StrikeLadder.build(
                data.getAtmStrike(),
                params.getStrikesItm(),
                params.getStrikesOtm(),
                meta.getStrikeStep(),
                pressure.effectiveDepthScale());
        if (strikes.isEmpty()) {
            NoInstrumentsException empty = new NoInstrumentsException(index, expiryDate, rule.getCode(), strikes);
            errorRouter.handleDataCollectionError(empty, COMPONENT, ctx, details);
            return StageResult.failure(CollectionStage.STRIKES, rule, "empty strike ladder", empty);
        }

        StageResult<List<Instrument>> instruments = StageResult.attempt(
                CollectionStage.INSTRUMENTS, rule, () -> facade.getOptionInstruments(index, expiryDate, strikes));
        if (!instruments.isSuccess()) {
            errorRouter.handle(instruments.asFailure().getCause(), null, null, COMPONENT, ctx, details);
            return instruments.map(i -> 0);
        }
        if (instruments.getValue().isEmpty()) {
            NoInstrumentsException empty = new NoInstrumentsException(index, expiryDate, rule.getCode(), strikes);
            errorRouter.handleDataCollectionError(empty, COMPONENT, ctx, details);
            return StageResult.failure(CollectionStage.INSTRUMENTS, rule, empty.getMessage(), empty);
        }

        StageResult<List<EnrichedOption>> enriched = StageResult.attempt(
                CollectionStage.ENRICHMENT, rule, () -> facade.enrichWithQuotes(instruments.getValue()));
        if (!enriched.isSuccess()) {
            errorRouter.handle(enriched.asFailure().getCause(), null, null, COMPONENT, ctx, details);
            return enriched.map(e -> 0);
        }
        List<EnrichedOption> rows = enriched.getValue();
        if (rows.isEmpty()) {
            NoQuotesException empty =
                    new NoQuotesException(index, expiryDate, rule.getCode(), instruments.getValue().size());
            errorRouter.handleDataCollectionError(empty, COMPONENT, ctx, details);
            return StageResult.failure(CollectionStage.ENRICHMENT, rule, empty.getMessage(), empty);
        }

        chainRealized.set(true);
        printMatrixOnce(enabledIndices);

        Map<String, OptionGreeks> greeks = Map.of();
        if (greeksCalculator != null && properties.getGreeks().isEnabled() && !pressure.isSkipGreeks()) {
            StageResult<Map<String, OptionGreeks>> computed = StageResult.attempt(
                    CollectionStage.GREEKS, rule, () -> greeksCalculator.calculateAll(data.getPrice(), expiryDate, rows));
            if (computed.isSuccess()) {
                greeks = computed.getValue();
            } else {
                errorRouter.handle(computed.asFailure().getCause(), ErrorCategory.CALCULATION, ErrorSeverity.MEDIUM,
                        "analytics", ctx, details);
            }
        }

        Map<String, OptionMetrics> perOption = pressure.isDropPerOptionMetrics()
                ? Map.of()
                : ChainAnalytics.perOptionMetrics(
                        rows, data.getPrice(), data.getAtmStrike(), meta.getStrikeStep(), pressure.getMetricStrikeWindow());

        pcrByRule.put(rule, ChainAnalytics.putCallRatio(rows));

        OptionsBatch batch = OptionsBatch.builder()
                .index(index)
                .expiry(expiryDate)
                .rule(rule)
                .rows(rows)
                .timestamp(timestamp)
                .indexPrice(data.getPrice())
                .indexOhlc(data.getOhlc())
                .atmStrike(data.getAtmStrike())
                .greeks(greeks)
                .metrics(perOption)
                .build();
        StageResult<Integer> write = StageResult.attempt(CollectionStage.SINK_WRITE, rule, () -> writeOnSinkPool(batch));
        if (!write.isSuccess()) {
            errorRouter.handle(write.asFailure().getCause(), null, null, SINK_COMPONENT, ctx, details);
        }
        return write;
    }

    // ---- Private helpers ----

    private PressureSnapshot evaluatePressure(CycleContext ctx) {
        try {
            pressureController.evaluate();
            return pressureController.snapshot();
        } catch (RuntimeException e) {
            errorRouter.handle(e, ErrorCategory.MEMORY, ErrorSeverity.MEDIUM, "memory", ctx, null);
            return PressureSnapshot.normal();
        }
    }

    private Map<String, IndexCollectionOutcome> join(
            Map<String, Future<IndexCollectionOutcome>> futures, CycleContext ctx, Instant startedAt) {
        Instant deadline = startedAt.plus(properties.getIndexTaskTimeout());
        Map<String, IndexCollectionOutcome> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, Future<IndexCollectionOutcome>> entry : futures.entrySet()) {
            String index = entry.getKey();
            Future<IndexCollectionOutcome> future = entry.getValue();
            CycleContext indexContext = ctx.withIndex(index);
            long remaining = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
            try {
                outcomes.put(index, future.get(remaining, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                errorRouter.handleCollectorError(e, COMPONENT, indexContext,
                        Map.of("timeoutMs", properties.getIndexTaskTimeout().toMillis()));
                outcomes.put(index, IndexCollectionOutcome.of(index, CollectionStatus.TIMED_OUT,
                        StageResult.<Void>failure(CollectionStage.TASK, null, "timed out", e).asFailure()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                errorRouter.handleCollectorError(cause, COMPONENT, indexContext, Map.of());
                outcomes.put(index, IndexCollectionOutcome.of(index, CollectionStatus.FAILED,
                        StageResult.<Void>failure(CollectionStage.TASK, null, String.valueOf(cause.getMessage()), cause).asFailure()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                errorRouter.handleCollectorError(e, COMPONENT, indexContext, Map.of("interrupted", true));
                outcomes.put(index, IndexCollectionOutcome.of(index, CollectionStatus.FAILED,
                        StageResult.<Void>failure(CollectionStage.TASK, null, "interrupted", e).asFailure()));
            }
        }
        return outcomes;
    }

    private int writeOnSinkPool(OptionsBatch batch) {
        if (sinkExecutor == null) {
            return sink.write(batch);
        }
        try {
            return CompletableFuture.supplyAsync(() -> sink.write(batch), sinkExecutor).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SinkWriteException) {
                throw (SinkWriteException) cause;
            }
            throw new SinkWriteException("Sink write failed for " + batch.getIndex() + " " + batch.getExpiry(), cause);
        }
    }

    private void ensureStructure(String index, CycleContext ctx) {
        try {
            sink.ensureIndexStructure(index, tradingCalendarService.today());
        } catch (RuntimeException e) {
            errorRouter.handle(e, null, null, SINK_COMPONENT, ctx, Map.of("stage", "ensure_structure"));
        }
    }

    /**
     * Logs the expiry matrix once per orchestrator. The lock only claims the one-shot; rules are
     * resolved after it is released.
     */
    private void printMatrixOnce(List<String> indices) {
        matrixLock.lock();
        try {
            if (matrixPrinted) {
                return;
            }
            matrixPrinted = true;
        } finally {
            matrixLock.unlock();
        }
        if (indices.isEmpty()) {
            return;
        }
        String table = ExpiryMatrix.render(indices, facade::resolveExpiry, tradingCalendarService.today());
        log.info("Expiry matrix:\n{}", table);
    }
}
