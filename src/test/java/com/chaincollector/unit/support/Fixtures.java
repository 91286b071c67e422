package com.chaincollector.unit.support;

import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.domain.model.Ohlc;
import com.chaincollector.domain.model.OptionQuote;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builders for instruments and quotes shaped like Kite's NFO dump.
 */
public final class Fixtures {

    private static final DateTimeFormatter SYMBOL_MONTH = DateTimeFormatter.ofPattern("yyMMM", Locale.ENGLISH);

    private static long nextToken = 1000;

    private Fixtures() {}

    public static Instrument option(String index, LocalDate expiry, int strike, OptionKind kind) {
        return option(index, "NFO", expiry, strike, kind);
    }

    public static Instrument option(String index, String exchange, LocalDate expiry, int strike, OptionKind kind) {
        return Instrument.builder()
                .token(nextToken++)
                .exchange(exchange)
                .tradingSymbol(index + expiry.format(SYMBOL_MONTH).toUpperCase() + strike + kind.name())
                .name(index)
                .segment(exchange + "-OPT")
                .strike(BigDecimal.valueOf(strike))
                .expiry(expiry)
                .kind(kind)
                .lotSize(75)
                .build();
    }

    /** CE and PE contracts for every strike in {@code [from, to]} stepping by {@code step}. */
    public static List<Instrument> chain(String index, LocalDate expiry, int from, int to, int step) {
        List<Instrument> instruments = new ArrayList<>();
        for (int strike = from; strike <= to; strike += step) {
            instruments.add(option(index, expiry, strike, OptionKind.CE));
            instruments.add(option(index, expiry, strike, OptionKind.PE));
        }
        return instruments;
    }

    public static Instrument future(String index, LocalDate expiry) {
        return Instrument.builder()
                .token(nextToken++)
                .exchange("NFO")
                .tradingSymbol(index + expiry.format(SYMBOL_MONTH).toUpperCase() + "FUT")
                .name(index)
                .segment("NFO-FUT")
                .expiry(expiry)
                .lotSize(75)
                .build();
    }

    public static OptionQuote quote(String lastPrice, long volume, long openInterest) {
        return OptionQuote.builder()
                .lastPrice(new BigDecimal(lastPrice))
                .volume(volume)
                .openInterest(openInterest)
                .averagePrice(new BigDecimal(lastPrice))
                .ohlc(Ohlc.empty())
                .build();
    }

    public static EnrichedOption enriched(
            String index, LocalDate expiry, int strike, OptionKind kind, String lastPrice, long openInterest) {
        return new EnrichedOption(option(index, expiry, strike, kind), quote(lastPrice, 100, openInterest));
    }

    public static Ohlc ohlc(String open, String high, String low, String close) {
        return Ohlc.builder()
                .open(new BigDecimal(open))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .build();
    }
}
