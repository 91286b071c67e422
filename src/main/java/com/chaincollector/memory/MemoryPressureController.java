package com.chaincollector.memory;

import com.chaincollector.cache.Purgeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tiered memory-pressure degradation with hysteresis.
 *
 * <p>Each {@link #evaluate()} takes one sample, smooths it with an exponential moving average
 * ({@code ema = alpha * sample + (1 - alpha) * ema}) and picks the raw tier: the highest tier
 * whose threshold is at or below the EMA.
 *
 * <ul>
 *   <li>Upgrade (raw above current): applied immediately; resets the recovery timer.</li>
 *   <li>Downgrade (raw below current): applied only after raw has stayed below the current tier
 *       for {@code recovery} without interruption.</li>
 * </ul>
 *
 * <p>On every tier change the new tier's actions are applied: caches are purged for
 * SHRINK_CACHE, the REDUCE_DEPTH and SLOW_CYCLES flags follow the tier, and the depth scale is
 * recomputed. SKIP_GREEKS and DROP_PER_OPTION_METRICS are sticky: once set they are cleared only
 * after a downgrade, once {@code rollbackCooldown} (Greeks) or twice that (per-option metrics)
 * has passed since the downgrade, and only if the current tier no longer asks for them.
 *
 * <p>Called by a single evaluator once per cycle; readers take a {@link #snapshot()}.
 */
public class MemoryPressureController {

    private static final Logger log = LoggerFactory.getLogger(MemoryPressureController.class);

    private static final double[] DEPTH_SCALE_BY_LEVEL = {1.0, 0.85, 0.6, 0.4};
    private static final double EXTREME_EMA = 0.95;

    private final MemorySampler sampler;
    private final List<PressureTier> tiers;
    private final double alpha;
    private final Duration recovery;
    private final Duration rollbackCooldown;
    private final int atmMetricWindow;
    private final Clock clock;
    private final List<Purgeable> purgeables = new CopyOnWriteArrayList<>();

    private final Set<PressureAction> activeFlags = EnumSet.noneOf(PressureAction.class);
    private Double ema;
    private PressureTier current;
    private Instant belowSince;
    private Instant lastDowngradeAt;
    private boolean downgradePending;
    private double depthScale = 1.0;

    public MemoryPressureController(
            MemorySampler sampler,
            List<PressureTier> tiers,
            double alpha,
            Duration recovery,
            Duration rollbackCooldown,
            int atmMetricWindow,
            Clock clock) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one pressure tier is required");
        }
        List<PressureTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(PressureTier::getLevel));
        this.sampler = sampler;
        this.tiers = List.copyOf(sorted);
        this.alpha = alpha;
        this.recovery = recovery;
        this.rollbackCooldown = rollbackCooldown;
        this.atmMetricWindow = atmMetricWindow;
        this.clock = clock;
        this.current = this.tiers.get(0);
    }

    public void register(Purgeable purgeable) {
        purgeables.add(purgeable);
    }

    public PressureTier evaluate() {
        return evaluate(sampler.sampleFraction(), clock.instant());
    }

    /**
     * Testable version: evaluates with an explicit sample and time.
     */
    public synchronized PressureTier evaluate(double sample, Instant now) {
        ema = ema == null ? sample : alpha * sample + (1 - alpha) * ema;
        PressureTier raw = rawTier(ema);
        PressureTier chosen = raw;

        if (raw.getLevel() < current.getLevel()) {
            if (belowSince == null) {
                belowSince = now;
            }
            Duration stable = Duration.between(belowSince, now);
            if (stable.compareTo(recovery) < 0) {
                chosen = current;
            } else {
                log.info(
                        "Memory pressure downgrade allowed after {}s below threshold -> {}",
                        stable.toSeconds(),
                        raw.getName());
                belowSince = null;
            }
        } else {
            belowSince = null;
        }
        downgradePending = raw.getLevel() < current.getLevel() && chosen == current;

        if (chosen.getLevel() != current.getLevel()) {
            int previous = current.getLevel();
            log.warn(
                    "Memory pressure transition {} -> {} ({}) ema={}%",
                    previous,
                    chosen.getLevel(),
                    chosen.getName(),
                    String.format("%.1f", ema * 100));
            current = chosen;
            if (chosen.getLevel() < previous) {
                lastDowngradeAt = now;
            }
            applyActions(chosen);
        }
        maybeReenableFeatures(now);
        return current;
    }

    public synchronized PressureSnapshot snapshot() {
        return PressureSnapshot.builder()
                .level(current.getLevel())
                .tierName(current.getName())
                .ema(ema == null ? 0.0 : ema)
                .depthScale(depthScale)
                .reduceDepth(activeFlags.contains(PressureAction.REDUCE_DEPTH))
                .skipGreeks(activeFlags.contains(PressureAction.SKIP_GREEKS))
                .slowCycles(activeFlags.contains(PressureAction.SLOW_CYCLES))
                .dropPerOptionMetrics(activeFlags.contains(PressureAction.DROP_PER_OPTION_METRICS))
                .downgradePending(downgradePending)
                .metricStrikeWindow(effectiveStrikeWindow())
                .build();
    }

    /** Number of strikes each side of ATM worth emitting per-option metrics for. */
    public synchronized int effectiveStrikeWindow() {
        int level = current.getLevel();
        if (level <= 1) {
            return atmMetricWindow;
        }
        if (level == 2) {
            return Math.max(1, atmMetricWindow / 2);
        }
        return 1;
    }

    public synchronized int getCurrentLevel() {
        return current.getLevel();
    }

    public synchronized double getDepthScale() {
        return depthScale;
    }

    public synchronized boolean isActive(PressureAction action) {
        return activeFlags.contains(action);
    }

    // ---- Private helpers ----

    private PressureTier rawTier(double value) {
        PressureTier raw = tiers.get(0);
        for (PressureTier tier : tiers) {
            if (value >= tier.getThreshold()) {
                raw = tier;
            }
        }
        return raw;
    }

    private void applyActions(PressureTier tier) {
        if (tier.has(PressureAction.SHRINK_CACHE)) {
            int purged = 0;
            for (Purgeable purgeable : purgeables) {
                purged += purgeable.purge();
            }
            log.info("Shrink cache at tier {}: purged {} entries across {} cache(s)", tier.getName(), purged, purgeables.size());
        }
        setFlag(PressureAction.REDUCE_DEPTH, tier.has(PressureAction.REDUCE_DEPTH));
        setFlag(PressureAction.SLOW_CYCLES, tier.has(PressureAction.SLOW_CYCLES));
        if (tier.has(PressureAction.SKIP_GREEKS)) {
            activeFlags.add(PressureAction.SKIP_GREEKS);
        }
        if (tier.has(PressureAction.DROP_PER_OPTION_METRICS)) {
            activeFlags.add(PressureAction.DROP_PER_OPTION_METRICS);
        }
        depthScale = computeDepthScale(tier.getLevel());
    }

    private void maybeReenableFeatures(Instant now) {
        if (lastDowngradeAt == null) {
            return;
        }
        Duration sinceDowngrade = Duration.between(lastDowngradeAt, now);
        if (activeFlags.contains(PressureAction.SKIP_GREEKS)
                && !current.has(PressureAction.SKIP_GREEKS)
                && sinceDowngrade.compareTo(rollbackCooldown) >= 0) {
            activeFlags.remove(PressureAction.SKIP_GREEKS);
            log.info("Re-enabled Greeks after {}s rollback cooldown", sinceDowngrade.toSeconds());
        }
        if (activeFlags.contains(PressureAction.DROP_PER_OPTION_METRICS)
                && !current.has(PressureAction.DROP_PER_OPTION_METRICS)
                && sinceDowngrade.compareTo(rollbackCooldown.multipliedBy(2)) >= 0) {
            activeFlags.remove(PressureAction.DROP_PER_OPTION_METRICS);
            log.info("Re-enabled per-option metrics after {}s extended cooldown", sinceDowngrade.toSeconds());
        }
    }

    private double computeDepthScale(int level) {
        double base = DEPTH_SCALE_BY_LEVEL[Math.max(0, Math.min(level, DEPTH_SCALE_BY_LEVEL.length - 1))];
        if (ema != null && ema > EXTREME_EMA) {
            base *= 0.8;
        }
        return Math.max(0.2, Math.min(1.0, base));
    }

    private void setFlag(PressureAction action, boolean on) {
        if (on) {
            activeFlags.add(action);
        } else {
            activeFlags.remove(action);
        }
    }
}
