package com.chaincollector.broker;

import com.chaincollector.domain.model.Instrument;
import com.chaincollector.domain.model.OptionQuote;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Upstream market-data calls. Results are keyed by {@code exchange:symbol}; keys the broker
 * does not recognise are simply absent.
 *
 * <p>Implementations wrap every broker failure in
 * {@link com.chaincollector.exception.ProviderException}, flagging transient ones.
 */
public interface MarketDataProvider {

    Map<String, BigDecimal> getLtp(Collection<String> symbols);

    Map<String, OptionQuote> getQuote(Collection<String> symbols);

    /** Full instruments dump for one exchange (NFO, BFO, NSE, BSE). */
    List<Instrument> getInstruments(String exchange);
}
