package com.chaincollector.sink;

import com.chaincollector.analytics.OptionGreeks;
import com.chaincollector.analytics.OptionMetrics;
import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Ohlc;
import com.chaincollector.domain.model.OptionQuote;
import com.chaincollector.exception.SinkWriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends option chains as JSON lines, one file per strike offset per day.
 *
 * <p>Layout under the base directory:
 * <pre>
 * &lt;INDEX&gt;/&lt;expiry_code&gt;/&lt;offset&gt;/&lt;yyyy-MM-dd&gt;.jsonl   one line per strike per write (CE and PE side by side)
 * overview/&lt;INDEX&gt;/&lt;yyyy-MM-dd&gt;.jsonl                  one line per cycle with PCR per rule
 * </pre>
 * Offsets are signed strike distances from ATM ({@code +100}, {@code 0}, {@code -50}). Appends to
 * the same file are serialized; different files are written concurrently.
 */
public class JsonLinesOptionsSink implements OptionsDataSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesOptionsSink.class);

    static final String OVERVIEW_DIR = "overview";
    static final String FILE_SUFFIX = ".jsonl";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public JsonLinesOptionsSink(Path baseDir, ObjectMapper objectMapper, ZoneId zone) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    @Override
    public int write(OptionsBatch batch) {
        if (batch.getRows().isEmpty()) {
            return 0;
        }
        LocalDate day = batch.getTimestamp().atZone(zone).toLocalDate();
        String expiryCode = batch.getRule() != null ? batch.getRule().getCode() : expiryCode(batch.getExpiry(), day);

        Map<BigDecimal, List<EnrichedOption>> byStrike = new TreeMap<>();
        for (EnrichedOption row : batch.getRows()) {
            if (row.getStrike() != null) {
                byStrike.computeIfAbsent(row.getStrike(), k -> new ArrayList<>()).add(row);
            }
        }

        int written = 0;
        for (Map.Entry<BigDecimal, List<EnrichedOption>> entry : byStrike.entrySet()) {
            int offset = entry.getKey().intValue() - batch.getAtmStrike();
            Path file = baseDir.resolve(batch.getIndex())
                    .resolve(expiryCode)
                    .resolve(offsetDir(offset))
                    .resolve(day.format(DAY) + FILE_SUFFIX);
            ObjectNode line = strikeLine(batch, entry.getKey(), offset, entry.getValue());
            append(file, line);
            written += entry.getValue().size();
        }
        log.debug("Wrote {} options for {} {} ({}) across {} strikes",
                written, batch.getIndex(), batch.getExpiry(), expiryCode, byStrike.size());
        return written;
    }

    @Override
    public void writeOverviewSnapshot(
            String index,
            Map<ExpiryRule, BigDecimal> pcrByRule,
            Instant timestamp,
            BigDecimal dayWidth,
            List<ExpiryRule> expectedRules) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put("timestamp", timestamp.toString());
        line.put("index", index);
        for (ExpiryRule rule : expectedRules) {
            BigDecimal pcr = pcrByRule.get(rule);
            if (pcr != null) {
                line.put("pcr_" + rule.getCode(), pcr);
            } else {
                line.putNull("pcr_" + rule.getCode());
            }
        }
        if (dayWidth != null) {
            line.put("day_width", dayWidth);
        } else {
            line.putNull("day_width");
        }
        LocalDate day = timestamp.atZone(zone).toLocalDate();
        append(baseDir.resolve(OVERVIEW_DIR).resolve(index).resolve(day.format(DAY) + FILE_SUFFIX), line);
    }

    @Override
    public void ensureIndexStructure(String index, LocalDate today) {
        try {
            Files.createDirectories(baseDir.resolve(index).resolve(ExpiryRule.THIS_WEEK.getCode()).resolve("0"));
            Files.createDirectories(baseDir.resolve(OVERVIEW_DIR).resolve(index));
        } catch (IOException e) {
            throw new SinkWriteException("Failed to create output structure for " + index + " on " + today, e);
        }
    }

    /**
     * Expiry code from the distance to expiry, for writes made without a rule.
     */
    static String expiryCode(LocalDate expiry, LocalDate today) {
        long days = ChronoUnit.DAYS.between(today, expiry);
        if (days <= 7) {
            return ExpiryRule.THIS_WEEK.getCode();
        }
        if (days <= 14) {
            return ExpiryRule.NEXT_WEEK.getCode();
        }
        if (expiry.getMonth() == today.getMonth() && expiry.getYear() == today.getYear()) {
            return ExpiryRule.THIS_MONTH.getCode();
        }
        return ExpiryRule.NEXT_MONTH.getCode();
    }

    static String offsetDir(int offset) {
        return offset > 0 ? "+" + offset : String.valueOf(offset);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    // ---- Private helpers ----

    private ObjectNode strikeLine(OptionsBatch batch, BigDecimal strike, int offset, List<EnrichedOption> options) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put("timestamp", batch.getTimestamp().toString());
        line.put("index", batch.getIndex());
        line.put("expiry", batch.getExpiry().toString());
        line.put("strike", strike);
        line.put("offset", offset);
        line.put("atm", batch.getAtmStrike());
        if (batch.getIndexPrice() != null) {
            line.put("index_price", batch.getIndexPrice());
        }
        Ohlc ohlc = batch.getIndexOhlc();
        if (ohlc != null) {
            ObjectNode node = line.putObject("index_ohlc");
            node.put("open", ohlc.getOpen());
            node.put("high", ohlc.getHigh());
            node.put("low", ohlc.getLow());
            node.put("close", ohlc.getClose());
        }
        for (EnrichedOption option : options) {
            if (option.getKind() == null) {
                continue;
            }
            String side = option.getKind() == OptionKind.CE ? "ce" : "pe";
            ObjectNode node = line.putObject(side);
            OptionQuote quote = option.getQuote();
            node.put("symbol", option.getInstrument().getTradingSymbol());
            node.put("last_price", quote.getLastPrice());
            node.put("volume", quote.getVolume());
            node.put("oi", quote.getOpenInterest());
            if (quote.getAveragePrice() != null) {
                node.put("avg_price", quote.getAveragePrice());
            }
            OptionGreeks greeks = batch.getGreeks().get(option.getKey());
            if (greeks != null && greeks.isAvailable()) {
                node.put("iv", greeks.getIv());
                node.put("delta", greeks.getDelta());
                node.put("gamma", greeks.getGamma());
                node.put("theta", greeks.getTheta());
                node.put("vega", greeks.getVega());
            }
            OptionMetrics metrics = batch.getMetrics().get(option.getKey());
            if (metrics != null) {
                node.put("intrinsic", metrics.getIntrinsic());
                node.put("time_value", metrics.getTimeValue());
                node.put("oi_share", metrics.getOiShare());
            }
        }
        return line;
    }

    private void append(Path file, ObjectNode line) {
        String json;
        try {
            json = objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new SinkWriteException("Failed to serialize line for " + file, e);
        }
        Object lock = fileLocks.computeIfAbsent(file, f -> new Object());
        synchronized (lock) {
            try {
                Files.createDirectories(file.getParent());
                try (BufferedWriter writer = Files.newBufferedWriter(
                        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    writer.write(json);
                    writer.newLine();
                }
            } catch (IOException e) {
                throw new SinkWriteException("Failed to append to " + file, e);
            }
        }
    }
}
