package com.chaincollector.unit.expiry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.exception.ResolveExpiryException;
import com.chaincollector.expiry.ExpiryResolver;
import com.chaincollector.unit.support.Fixtures;
import com.chaincollector.unit.support.MutableClock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for ExpiryResolver: extraction from an instrument universe, the fabricated fallback,
 * TTL caching and rule selection.
 */
class ExpiryResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 11);
    private static final LocalDate JUN_12 = LocalDate.of(2025, 6, 12);
    private static final LocalDate JUN_19 = LocalDate.of(2025, 6, 19);
    private static final LocalDate JUN_26 = LocalDate.of(2025, 6, 26);
    private static final LocalDate JUL_31 = LocalDate.of(2025, 7, 31);
    private static final LocalDate SEP_25 = LocalDate.of(2025, 9, 25);

    private MutableClock clock;
    private ExpiryResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atIst(2025, 6, 11, 10, 0);
        resolver = new ExpiryResolver(clock, Duration.ofSeconds(300));
    }

    private static List<Instrument> universe() {
        List<Instrument> instruments = new ArrayList<>();
        instruments.addAll(Fixtures.chain("NIFTY", JUN_26, 24700, 24900, 50));
        instruments.addAll(Fixtures.chain("NIFTY", JUN_12, 24700, 24900, 50));
        instruments.addAll(Fixtures.chain("NIFTY", JUL_31, 24700, 24900, 50));
        instruments.addAll(Fixtures.chain("NIFTY", JUN_19, 24700, 24900, 50));
        instruments.addAll(Fixtures.chain("BANKNIFTY", JUN_26, 55000, 55200, 100));
        instruments.add(Fixtures.option("NIFTY", LocalDate.of(2025, 6, 5), 24800, OptionKind.CE));
        instruments.add(Fixtures.option("NIFTY", SEP_25, 30000, OptionKind.CE));
        instruments.add(Fixtures.future("NIFTY", LocalDate.of(2025, 8, 28)));
        return instruments;
    }

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        @DisplayName("Returns sorted distinct future option expiries of the index only")
        void sortedDistinct() {
            List<LocalDate> dates = resolver.extract("nifty", universe(), TODAY);

            assertThat(dates).containsExactly(JUN_12, JUN_19, JUN_26, JUL_31, SEP_25);
        }

        @Test
        @DisplayName("The ATM window excludes far strikes")
        void atmWindow() {
            List<LocalDate> dates = resolver.extract("NIFTY", universe(), 24800, 500, TODAY);

            assertThat(dates).doesNotContain(SEP_25).contains(JUN_12, JUL_31);
        }

        @Test
        @DisplayName("Result does not depend on input order and is idempotent")
        void orderIndependent() {
            List<Instrument> shuffled = universe();
            Collections.shuffle(shuffled, new Random(42));

            List<LocalDate> a = resolver.extract("NIFTY", universe(), TODAY);
            List<LocalDate> b = resolver.extract("NIFTY", shuffled, TODAY);

            assertThat(b).isEqualTo(a);
            assertThat(resolver.extract("NIFTY", universe(), TODAY)).isEqualTo(a);
        }

        @Test
        @DisplayName("NIFTY does not pick up BANKNIFTY contracts")
        void rootNameMustMatch() {
            List<Instrument> bank = Fixtures.chain("BANKNIFTY", JUL_31, 55000, 55000, 100);

            assertThat(resolver.extract("NIFTY", bank, TODAY)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("A non-empty universe with no match yields exactly two fabricated dates")
        void fabricatesForUnmatchedUniverse() {
            List<Instrument> other = Fixtures.chain("BANKNIFTY", JUN_26, 55000, 55200, 100);

            List<LocalDate> dates = resolver.resolve("NIFTY", () -> other, () -> 24800, TODAY);

            assertThat(dates).hasSize(2);
            assertThat(dates.get(0).getDayOfWeek()).isEqualTo(DayOfWeek.THURSDAY);
            assertThat(dates.get(0)).isAfterOrEqualTo(TODAY);
            assertThat(dates.get(1)).isEqualTo(dates.get(0).plusDays(7));
            assertThat(dates).isEqualTo(resolver.fabricate(TODAY));
        }

        @Test
        @DisplayName("An empty universe yields an empty list")
        void emptyUniverse() {
            assertThat(resolver.resolve("NIFTY", List::of, () -> 24800, TODAY)).isEmpty();
        }

        @Test
        @DisplayName("A failing fetch is treated as an empty universe")
        void failingFetch() {
            List<LocalDate> dates = resolver.resolve(
                    "NIFTY",
                    () -> {
                        throw new IllegalStateException("down");
                    },
                    () -> 24800,
                    TODAY);

            assertThat(dates).isEmpty();
        }

        @Test
        @DisplayName("Falls back to the whole chain when nothing is near the ATM")
        void widensWhenAtmMisses() {
            List<LocalDate> dates = resolver.resolve("NIFTY", ExpiryResolverTest::universe, () -> 10000, TODAY);

            assertThat(dates).contains(JUN_12, SEP_25);
        }

        @Test
        @DisplayName("Cached until the TTL passes")
        void cachedForTtl() {
            AtomicInteger fetches = new AtomicInteger();

            resolver.resolve("NIFTY", () -> {
                fetches.incrementAndGet();
                return universe();
            }, () -> 24800, TODAY);
            clock.advance(Duration.ofSeconds(299));
            resolver.resolve("NIFTY", () -> {
                fetches.incrementAndGet();
                return universe();
            }, () -> 24800, TODAY);
            assertThat(fetches).hasValue(1);

            clock.advance(Duration.ofSeconds(1));
            resolver.resolve("NIFTY", () -> {
                fetches.incrementAndGet();
                return universe();
            }, () -> 24800, TODAY);
            assertThat(fetches).hasValue(2);
        }

        @Test
        @DisplayName("An empty result is not served from cache once listings return")
        void emptyNotServedFromCache() {
            assertThat(resolver.resolve("NIFTY", List::of, () -> 24800, TODAY)).isEmpty();

            clock.advance(Duration.ofSeconds(10));
            List<LocalDate> dates = resolver.resolve(
                    "NIFTY", () -> Fixtures.chain("NIFTY", JUN_12, 24700, 24900, 50), () -> 24800, TODAY);

            assertThat(dates).containsExactly(JUN_12);
        }

        @Test
        @DisplayName("purge forces a fresh resolution")
        void purge() {
            AtomicInteger fetches = new AtomicInteger();
            resolver.resolve("NIFTY", () -> {
                fetches.incrementAndGet();
                return universe();
            }, null, TODAY);

            assertThat(resolver.purge()).isEqualTo(1);
            resolver.resolve("NIFTY", () -> {
                fetches.incrementAndGet();
                return universe();
            }, null, TODAY);
            assertThat(fetches).hasValue(2);
        }
    }

    @Nested
    @DisplayName("Rule selection")
    class RuleSelection {

        private final List<LocalDate> dates = List.of(JUN_12, JUN_19, JUN_26, JUL_31, SEP_25);

        @Test
        @DisplayName("Each rule picks its date")
        void rules() {
            assertThat(resolver.selectForRule("NIFTY", dates, ExpiryRule.THIS_WEEK)).isEqualTo(JUN_12);
            assertThat(resolver.selectForRule("NIFTY", dates, ExpiryRule.NEXT_WEEK)).isEqualTo(JUN_19);
            assertThat(resolver.selectForRule("NIFTY", dates, ExpiryRule.THIS_MONTH)).isEqualTo(JUN_26);
            assertThat(resolver.selectForRule("NIFTY", dates, ExpiryRule.NEXT_MONTH)).isEqualTo(JUL_31);
        }

        @Test
        @DisplayName("A single listed expiry serves every rule")
        void singleDate() {
            List<LocalDate> one = List.of(JUN_26);

            for (ExpiryRule rule : ExpiryRule.values()) {
                assertThat(resolver.selectForRule("BANKNIFTY", one, rule)).isEqualTo(JUN_26);
            }
        }

        @Test
        @DisplayName("No dates is a resolve failure")
        void empty() {
            assertThatThrownBy(() -> resolver.selectForRule("NIFTY", List.of(), ExpiryRule.THIS_WEEK))
                    .isInstanceOf(ResolveExpiryException.class);
        }

        @Test
        @DisplayName("Weekly and monthly views")
        void views() {
            assertThat(ExpiryResolver.weeklyView(dates)).containsExactly(JUN_12, JUN_19);
            assertThat(ExpiryResolver.monthlyView(dates)).containsExactly(JUN_26, JUL_31, SEP_25);
        }
    }
}
