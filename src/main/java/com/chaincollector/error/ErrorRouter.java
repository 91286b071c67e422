package com.chaincollector.error;

import com.chaincollector.domain.CycleContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central sink for every handled exception in the collector.
 *
 * <p>Each call to {@link #handle} classifies the exception (category and severity, defaulted by
 * {@link ErrorClassifier} when not given), derives the destination once via
 * {@link ErrorDestination#route}, logs it at a level matching the severity, appends it to a
 * bounded history (oldest evicted beyond the cap) and updates running counts by exception type,
 * category and severity.
 *
 * <p>Two filtered views are exposed: the live collection view (last 20 records that reach
 * LIVE_COLLECTION) and the alerts view (last 50 records that reach ALERTS). Listeners registered
 * with {@link #addListener} see each record after it is stored; a failing listener is logged and
 * skipped.
 *
 * <p>Thread-safe: history and counters are guarded by one lock; logging and listeners run
 * outside it.
 */
public class ErrorRouter {

    private static final Logger log = LoggerFactory.getLogger(ErrorRouter.class);

    public static final int DEFAULT_HISTORY_CAP = 1000;
    static final int LIVE_VIEW_SIZE = 20;
    static final int ALERTS_VIEW_SIZE = 50;
    static final int DESCRIPTION_LIMIT = 100;

    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final int historyCap;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ErrorRecord> history = new ArrayDeque<>();
    private final Map<String, Long> countsByType = new TreeMap<>();
    private final Map<ErrorCategory, Long> countsByCategory = new EnumMap<>(ErrorCategory.class);
    private final Map<ErrorSeverity, Long> countsBySeverity = new EnumMap<>(ErrorSeverity.class);
    private long totalErrors;

    private final AtomicLong ids = new AtomicLong();
    private final List<Consumer<ErrorRecord>> listeners = new CopyOnWriteArrayList<>();

    public ErrorRouter(ErrorClassifier classifier, Clock clock, ObjectMapper objectMapper, int historyCap) {
        this.classifier = classifier;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.historyCap = Math.max(1, historyCap);
    }

    /**
     * Classifies, routes and records an exception.
     *
     * @param category explicit category, or null to classify from the exception type
     * @param severity explicit severity, or null to classify from the exception type
     * @param cycleContext cycle/index context, may be null outside a cycle
     * @param context free-form details (stage, rule, expiry, ...), may be null
     */
    public ErrorRecord handle(
            Throwable exception,
            ErrorCategory category,
            ErrorSeverity severity,
            String component,
            CycleContext cycleContext,
            Map<String, Object> context) {
        ErrorClassifier.Classification defaults = classifier.classify(exception);
        ErrorCategory resolvedCategory = category != null ? category : defaults.getCategory();
        ErrorSeverity resolvedSeverity = severity != null ? severity : defaults.getSeverity();

        ErrorRecord record = ErrorRecord.builder()
                .id(ids.incrementAndGet())
                .timestamp(clock.instant())
                .exception(exception)
                .exceptionType(exception.getClass().getSimpleName())
                .message(String.valueOf(exception.getMessage()))
                .category(resolvedCategory)
                .severity(resolvedSeverity)
                .component(component)
                .indexName(cycleContext != null ? cycleContext.getIndex() : null)
                .cycleId(cycleContext != null ? cycleContext.getCycleId() : null)
                .context(context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of())
                .destination(ErrorDestination.route(resolvedCategory, resolvedSeverity))
                .build();

        store(record);
        logRecord(record);
        notifyListeners(record);
        return record;
    }

    public ErrorRecord handle(Throwable exception, String component, CycleContext cycleContext) {
        return handle(exception, null, null, component, cycleContext, null);
    }

    public ErrorRecord handleCollectorError(
            Throwable exception, String component, CycleContext cycleContext, Map<String, Object> context) {
        return handle(exception, ErrorCategory.COLLECTOR, ErrorSeverity.HIGH, component, cycleContext, context);
    }

    public ErrorRecord handleProviderError(
            Throwable exception, String component, CycleContext cycleContext, Map<String, Object> context) {
        return handle(exception, ErrorCategory.PROVIDER_API, ErrorSeverity.HIGH, component, cycleContext, context);
    }

    public ErrorRecord handleDataCollectionError(
            Throwable exception, String component, CycleContext cycleContext, Map<String, Object> context) {
        return handle(
                exception, ErrorCategory.DATA_COLLECTION, ErrorSeverity.MEDIUM, component, cycleContext, context);
    }

    public void addListener(Consumer<ErrorRecord> listener) {
        listeners.add(listener);
    }

    /** Records in insertion order, oldest first. */
    public List<ErrorRecord> history() {
        lock.lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.unlock();
        }
    }

    /** Last 20 records reaching the live collection destination, newest last. */
    public List<LiveCollectionEntry> liveCollectionView() {
        List<ErrorRecord> records = lastReaching(ErrorDestination.LIVE_COLLECTION, LIVE_VIEW_SIZE);
        List<LiveCollectionEntry> entries = new ArrayList<>(records.size());
        for (ErrorRecord r : records) {
            entries.add(LiveCollectionEntry.builder()
                    .time(r.getTimestamp())
                    .index(r.getIndexName() != null ? r.getIndexName() : "-")
                    .status(r.getSeverity().isAtLeast(ErrorSeverity.HIGH) ? "ERROR" : "WARN")
                    .description(truncate(r.getMessage(), DESCRIPTION_LIMIT))
                    .component(r.getComponent())
                    .severity(r.getSeverity())
                    .cycle(r.getCycleId())
                    .build());
        }
        return entries;
    }

    /** Last 50 records reaching the alerts destination, newest last. */
    public List<AlertEntry> alertsView() {
        List<ErrorRecord> records = lastReaching(ErrorDestination.ALERTS, ALERTS_VIEW_SIZE);
        List<AlertEntry> entries = new ArrayList<>(records.size());
        for (ErrorRecord r : records) {
            entries.add(AlertEntry.builder()
                    .time(r.getTimestamp())
                    .level(levelOf(r.getSeverity()))
                    .component(r.getComponent())
                    .message(r.getMessage())
                    .context(r.getContext())
                    .build());
        }
        return entries;
    }

    public ErrorSummary summary() {
        lock.lock();
        try {
            long live = history.stream()
                    .filter(r -> r.getDestination().reaches(ErrorDestination.LIVE_COLLECTION))
                    .count();
            long alerts = history.stream()
                    .filter(r -> r.getDestination().reaches(ErrorDestination.ALERTS))
                    .count();
            return ErrorSummary.builder()
                    .totalErrors(totalErrors)
                    .historySize(history.size())
                    .liveCollectionCount(live)
                    .alertsCount(alerts)
                    .byExceptionType(new TreeMap<>(countsByType))
                    .byCategory(new EnumMap<>(countsByCategory))
                    .bySeverity(new EnumMap<>(countsBySeverity))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serializes the summary and the full history to JSON.
     */
    public String exportJson() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("exportedAt", clock.instant());
        payload.put("summary", summary());
        payload.put("errors", history());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export error history", e);
        }
    }

    public long getTotalErrors() {
        lock.lock();
        try {
            return totalErrors;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            history.clear();
            countsByType.clear();
            countsByCategory.clear();
            countsBySeverity.clear();
            totalErrors = 0;
        } finally {
            lock.unlock();
        }
    }

    // ---- Private helpers ----

    private void store(ErrorRecord record) {
        lock.lock();
        try {
            history.addLast(record);
            while (history.size() > historyCap) {
                history.removeFirst();
            }
            countsByType.merge(record.getExceptionType(), 1L, Long::sum);
            countsByCategory.merge(record.getCategory(), 1L, Long::sum);
            countsBySeverity.merge(record.getSeverity(), 1L, Long::sum);
            totalErrors++;
        } finally {
            lock.unlock();
        }
    }

    private List<ErrorRecord> lastReaching(ErrorDestination destination, int limit) {
        lock.lock();
        try {
            List<ErrorRecord> selected = new ArrayList<>();
            Iterator<ErrorRecord> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && selected.size() < limit) {
                ErrorRecord record = newestFirst.next();
                if (record.getDestination().reaches(destination)) {
                    selected.add(record);
                }
            }
            Collections.reverse(selected);
            return selected;
        } finally {
            lock.unlock();
        }
    }

    private void logRecord(ErrorRecord r) {
        String where = r.getIndexName() != null ? r.getComponent() + "/" + r.getIndexName() : r.getComponent();
        switch (r.getSeverity()) {
            case LOW:
                log.debug("[{}|{}] {}: {}", r.getCategory(), where, r.getExceptionType(), r.getMessage());
                break;
            case MEDIUM:
                log.warn("[{}|{}] {}: {}", r.getCategory(), where, r.getExceptionType(), r.getMessage());
                break;
            case HIGH:
                log.error("[{}|{}] {}: {}", r.getCategory(), where, r.getExceptionType(), r.getMessage());
                break;
            default:
                log.error("[CRITICAL {}|{}] {}", r.getCategory(), where, r.getMessage(), r.getException());
                break;
        }
    }

    private void notifyListeners(ErrorRecord record) {
        for (Consumer<ErrorRecord> listener : listeners) {
            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                log.warn("Error listener failed for record {}: {}", record.getId(), e.getMessage());
            }
        }
    }

    private static String levelOf(ErrorSeverity severity) {
        switch (severity) {
            case CRITICAL:
                return "CRITICAL";
            case HIGH:
                return "ERROR";
            case MEDIUM:
                return "WARNING";
            default:
                return "INFO";
        }
    }

    private static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit - 3) + "...";
    }

    @Value
    @Builder
    public static class LiveCollectionEntry {
        Instant time;
        String index;
        String status;
        String description;
        String component;
        ErrorSeverity severity;
        Long cycle;
    }

    @Value
    @Builder
    public static class AlertEntry {
        Instant time;
        String level;
        String component;
        String message;
        Map<String, Object> context;
    }

    @Value
    @Builder
    public static class ErrorSummary {
        long totalErrors;
        int historySize;
        long liveCollectionCount;
        long alertsCount;
        Map<String, Long> byExceptionType;
        Map<ErrorCategory, Long> byCategory;
        Map<ErrorSeverity, Long> bySeverity;
    }
}
