package com.chaincollector.broker;

import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.domain.model.Ohlc;
import com.chaincollector.domain.model.OptionQuote;
import com.chaincollector.exception.CredentialsException;
import com.chaincollector.exception.ProviderException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.NetworkException;
import com.zerodhatech.models.LTPQuote;
import com.zerodhatech.models.Quote;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarketDataProvider} backed by the Kite Connect REST API.
 *
 * <p>Each call obtains the client from {@link CredentialManager}. Kite's {@link KiteException}
 * extends {@code Throwable}, so it is caught explicitly and wrapped into
 * {@link ProviderException}; JSON and I/O failures are wrapped the same way. HTTP 429, 5xx,
 * Kite network exceptions and I/O failures are flagged transient and become eligible for
 * retry. Auth-class failures mark the credential manager failed and surface as
 * {@link CredentialsException}.
 *
 * <p>Retry and circuit breaking are applied by the caller; this class only rate-limits.
 */
public class KiteMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataProvider.class);

    private static final ZoneId EXCHANGE_ZONE = ZoneId.of("Asia/Kolkata");

    private final CredentialManager credentialManager;

    public KiteMarketDataProvider(CredentialManager credentialManager) {
        this.credentialManager = credentialManager;
    }

    @Override
    @RateLimiter(name = "kiteQuotes")
    public Map<String, BigDecimal> getLtp(Collection<String> symbols) {
        if (symbols.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, LTPQuote> quotes = credentialManager.requireClient().getLTP(symbols.toArray(String[]::new));
            Map<String, BigDecimal> result = new LinkedHashMap<>();
            if (quotes != null) {
                quotes.forEach((key, quote) -> result.put(key, BigDecimal.valueOf(quote.lastPrice)));
            }
            return result;
        } catch (KiteException e) {
            throw wrap("LTP", e);
        } catch (JSONException | IOException e) {
            throw wrap("LTP", e);
        }
    }

    @Override
    @RateLimiter(name = "kiteQuotes")
    public Map<String, OptionQuote> getQuote(Collection<String> symbols) {
        if (symbols.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, Quote> quotes = credentialManager.requireClient().getQuote(symbols.toArray(String[]::new));
            Map<String, OptionQuote> result = new LinkedHashMap<>();
            if (quotes != null) {
                quotes.forEach((key, quote) -> result.put(key, toOptionQuote(quote)));
            }
            return result;
        } catch (KiteException e) {
            throw wrap("quote", e);
        } catch (JSONException | IOException e) {
            throw wrap("quote", e);
        }
    }

    @Override
    @RateLimiter(name = "kiteInstruments")
    public List<Instrument> getInstruments(String exchange) {
        try {
            List<com.zerodhatech.models.Instrument> dump = credentialManager.requireClient().getInstruments(exchange);
            if (dump == null) {
                return List.of();
            }
            List<Instrument> instruments = new ArrayList<>(dump.size());
            for (com.zerodhatech.models.Instrument kiteInstrument : dump) {
                instruments.add(toInstrument(kiteInstrument));
            }
            log.info("Downloaded {} {} instruments from Kite", instruments.size(), exchange);
            return instruments;
        } catch (KiteException e) {
            throw wrap("instruments " + exchange, e);
        } catch (JSONException | IOException e) {
            throw wrap("instruments " + exchange, e);
        }
    }

    // ---- Private helpers ----

    private RuntimeException wrap(String operation, KiteException e) {
        if (CredentialManager.isAuthError(e)) {
            credentialManager.markAuthFailed(e.message);
            return new CredentialsException("Kite rejected credentials during " + operation + ": " + e.message, e);
        }
        boolean transientFailure = e instanceof NetworkException || e.code == 429 || e.code >= 500;
        log.debug("Kite {} failed (code {}, transient={}): {}", operation, e.code, transientFailure, e.message);
        return new ProviderException("Kite " + operation + " failed: " + e.message, e, transientFailure);
    }

    private RuntimeException wrap(String operation, Exception e) {
        boolean transientFailure = e instanceof IOException;
        return new ProviderException("Error during Kite " + operation + ": " + e.getMessage(), e, transientFailure);
    }

    static OptionQuote toOptionQuote(Quote quote) {
        Ohlc ohlc = quote.ohlc == null
                ? Ohlc.empty()
                : Ohlc.builder()
                        .open(BigDecimal.valueOf(quote.ohlc.open))
                        .high(BigDecimal.valueOf(quote.ohlc.high))
                        .low(BigDecimal.valueOf(quote.ohlc.low))
                        .close(BigDecimal.valueOf(quote.ohlc.close))
                        .build();
        return OptionQuote.builder()
                .lastPrice(BigDecimal.valueOf(quote.lastPrice))
                .volume((long) quote.volumeTradedToday)
                .openInterest((long) quote.oi)
                .averagePrice(BigDecimal.valueOf(quote.averagePrice))
                .ohlc(ohlc)
                .build();
    }

    static Instrument toInstrument(com.zerodhatech.models.Instrument kite) {
        return Instrument.builder()
                .token(kite.instrument_token)
                .exchange(kite.exchange)
                .tradingSymbol(kite.tradingsymbol)
                .name(kite.name)
                .segment(kite.segment)
                .strike(parseStrike(kite.strike))
                .expiry(toLocalDate(kite.expiry))
                .kind(OptionKind.fromKiteType(kite.instrument_type))
                .lotSize(kite.lot_size)
                .build();
    }

    private static BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(strike);
        } catch (NumberFormatException e) {
            log.debug("Unparseable strike value: {}", strike);
            return null;
        }
    }

    private static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toInstant().atZone(EXCHANGE_ZONE).toLocalDate();
    }
}
