package com.chaincollector.expiry;

import com.chaincollector.cache.Purgeable;
import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.exception.ResolveExpiryException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the list of listed expiry dates for an index from an instrument universe.
 *
 * <p>Resolution per index is TTL-cached. On a miss the universe is fetched, an ATM strike is
 * requested to narrow the scan to nearby strikes, and qualifying expiries are extracted. When
 * the universe is non-empty but nothing qualifies, a deterministic pair of dates is fabricated
 * so collection can still proceed; an empty universe yields an empty list. Either result is
 * cached.
 *
 * @see ExpiryRule for how a date is picked out of the resolved list
 */
public class ExpiryResolver implements Purgeable {

    private static final Logger log = LoggerFactory.getLogger(ExpiryResolver.class);

    public static final int DEFAULT_STRIKE_WINDOW = 500;

    static final DayOfWeek FABRICATED_EXPIRY_DAY = DayOfWeek.THURSDAY;

    private final Clock clock;
    private final Duration defaultTtl;
    private final Map<String, ResolvedExpiries> cache = new ConcurrentHashMap<>();

    public ExpiryResolver(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    /**
     * Sorted distinct expiries of option instruments for {@code index}.
     *
     * <p>An instrument qualifies when its segment ends in {@code -OPT}, its trading symbol
     * contains the index name (and its root name, when present, equals it), its expiry is not
     * before {@code today}, and, when {@code atmStrike} is given, its strike lies within
     * {@code strikeWindow} of it. The result does not depend on the input order.
     */
    public List<LocalDate> extract(
            String index, Collection<Instrument> instruments, Integer atmStrike, int strikeWindow, LocalDate today) {
        String symbol = index.toUpperCase();
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (Instrument instrument : instruments) {
            if (!instrument.isOption() || instrument.getExpiry() == null) {
                continue;
            }
            if (!instrument.belongsTo(symbol)) {
                continue;
            }
            if (instrument.getExpiry().isBefore(today)) {
                continue;
            }
            if (atmStrike != null && atmStrike > 0) {
                if (instrument.getStrike() == null
                        || Math.abs(instrument.getStrike().doubleValue() - atmStrike) > strikeWindow) {
                    continue;
                }
            }
            dates.add(instrument.getExpiry());
        }
        return List.copyOf(dates);
    }

    public List<LocalDate> extract(String index, Collection<Instrument> instruments, LocalDate today) {
        return extract(index, instruments, null, DEFAULT_STRIKE_WINDOW, today);
    }

    /**
     * Two placeholder expiries: the next Thursday on or after {@code today}, and a week later.
     */
    public List<LocalDate> fabricate(LocalDate today) {
        LocalDate first = today.with(TemporalAdjusters.nextOrSame(FABRICATED_EXPIRY_DAY));
        return List.of(first, first.plusDays(7));
    }

    /**
     * Resolves the expiry list for {@code index}, using the per-index cache while it is younger
     * than {@code ttl}. An empty list is re-resolved on every call.
     *
     * @param fetchInstruments supplies the option universe for the index's exchange
     * @param atmProvider supplies the current ATM strike; null or a failure disables the strike filter
     */
    public List<LocalDate> resolve(
            String index,
            Supplier<List<Instrument>> fetchInstruments,
            Supplier<Integer> atmProvider,
            Duration ttl,
            Instant now,
            LocalDate today) {
        String key = index.toUpperCase();
        ResolvedExpiries cached = cache.get(key);
        // an empty result is stored but never served
        if (cached != null
                && !cached.getDates().isEmpty()
                && Duration.between(cached.getResolvedAt(), now).compareTo(ttl) < 0) {
            return cached.getDates();
        }

        List<Instrument> universe;
        try {
            List<Instrument> fetched = fetchInstruments.get();
            universe = fetched != null ? fetched : List.of();
        } catch (RuntimeException e) {
            log.warn("Instrument fetch for expiry resolution of {} failed: {}", key, e.getMessage());
            universe = List.of();
        }

        Integer atm = safeAtm(key, atmProvider);
        List<LocalDate> dates = extract(key, universe, atm, DEFAULT_STRIKE_WINDOW, today);
        if (dates.isEmpty() && atm != null) {
            // nothing near the ATM; widen to the whole chain before giving up
            dates = extract(key, universe, null, DEFAULT_STRIKE_WINDOW, today);
        }
        if (dates.isEmpty() && !universe.isEmpty()) {
            dates = fabricate(today);
            log.warn("No listed expiries matched for {} in {} instruments; using fabricated {}", key, universe.size(), dates);
        }

        cache.put(key, new ResolvedExpiries(dates, now));
        log.debug("Resolved expiries for {}: {}", key, dates);
        return dates;
    }

    public List<LocalDate> resolve(
            String index, Supplier<List<Instrument>> fetchInstruments, Supplier<Integer> atmProvider, LocalDate today) {
        return resolve(index, fetchInstruments, atmProvider, defaultTtl, clock.instant(), today);
    }

    /**
     * Picks the date an expiry rule refers to.
     *
     * <ul>
     *   <li>THIS_WEEK: first date</li>
     *   <li>NEXT_WEEK: second date, or the first when only one is listed</li>
     *   <li>THIS_MONTH: last date of the first month present</li>
     *   <li>NEXT_MONTH: last date of the second month present, or THIS_MONTH when only one</li>
     * </ul>
     *
     * @throws ResolveExpiryException when {@code dates} is empty
     */
    public LocalDate selectForRule(String index, List<LocalDate> dates, ExpiryRule rule) {
        if (dates == null || dates.isEmpty()) {
            throw new ResolveExpiryException(index, rule.getCode(), "no expiries available");
        }
        switch (rule) {
            case THIS_WEEK:
                return dates.get(0);
            case NEXT_WEEK:
                return dates.size() > 1 ? dates.get(1) : dates.get(0);
            case THIS_MONTH:
                return monthlyView(dates).get(0);
            case NEXT_MONTH:
                List<LocalDate> monthly = monthlyView(dates);
                return monthly.size() > 1 ? monthly.get(1) : monthly.get(0);
            default:
                throw new ResolveExpiryException(index, rule.getCode(), "unsupported rule");
        }
    }

    /** The nearest two expiries. */
    public static List<LocalDate> weeklyView(List<LocalDate> dates) {
        return dates.size() <= 2 ? List.copyOf(dates) : List.copyOf(dates.subList(0, 2));
    }

    /** The last expiry of each month, in ascending order. */
    public static List<LocalDate> monthlyView(List<LocalDate> dates) {
        Map<YearMonth, LocalDate> lastPerMonth = new LinkedHashMap<>();
        new TreeSet<>(dates).forEach(d -> lastPerMonth.put(YearMonth.from(d), d));
        return new ArrayList<>(lastPerMonth.values());
    }

    public void invalidate(String index) {
        cache.remove(index.toUpperCase());
    }

    @Override
    public int purge() {
        int removed = cache.size();
        cache.clear();
        return removed;
    }

    @Override
    public String getCacheName() {
        return "expiries";
    }

    // ---- Private helpers ----

    private static Integer safeAtm(String index, Supplier<Integer> atmProvider) {
        if (atmProvider == null) {
            return null;
        }
        try {
            Integer atm = atmProvider.get();
            return atm != null && atm > 0 ? atm : null;
        } catch (RuntimeException e) {
            log.debug("ATM lookup for {} failed, resolving expiries without strike filter: {}", index, e.getMessage());
            return null;
        }
    }

    @Value
    private static class ResolvedExpiries {
        List<LocalDate> dates;
        Instant resolvedAt;
    }
}
