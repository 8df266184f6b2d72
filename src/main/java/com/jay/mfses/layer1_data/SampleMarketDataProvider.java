package com.jay.mfses.layer1_data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.mfses.config.ConfigurationException;
import com.jay.mfses.config.MfsesConfig;
import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.enums.Sector;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Serves the bundled snapshot set in sample-data.yaml. Used as the fallback when the live
 * provider fails, or on its own with {@code market_data.provider: sample}.
 *
 * Each entry carries a last price, daily change and volume; a two-point history is
 * derived from them (previous close, then last price) so momentum and activity still work.
 */
@Slf4j
@Component
public class SampleMarketDataProvider implements MarketDataProvider {

    /** Previous-session volume as a share of the latest; puts the 2-day average at 0.9× latest. */
    private static final double PREVIOUS_VOLUME_FACTOR = 0.8;

    private final Map<String, SampleEntry> entries;
    private final Double bondYield;

    @Autowired
    public SampleMarketDataProvider(MfsesConfig config) {
        this(config.marketData().getSampleDataFile(), config.marketData().getAaaBondYield());
    }

    SampleMarketDataProvider(String resource, Double bondYield) {
        this.bondYield = bondYield;
        this.entries = load(resource);
        log.info("Sample data loaded from '{}': {} tickers", resource, entries.size());
    }

    @Override
    public String name() {
        return "sample";
    }

    public boolean has(String ticker) {
        return ticker != null && entries.containsKey(ticker.toUpperCase(Locale.ROOT));
    }

    public Set<String> tickers() {
        return entries.keySet();
    }

    @Override
    public SecuritySnapshot fetch(String ticker) {
        SampleEntry e = ticker == null ? null : entries.get(ticker.toUpperCase(Locale.ROOT));
        if (e == null) {
            throw new MarketDataException("No sample data for " + ticker);
        }
        LocalDateTime close = LocalDate.now().atTime(LocalTime.of(16, 0));
        PricePoint previous = new PricePoint(close.minusDays(1), e.getPrice() - e.getChange(),
            Math.round(e.getVolume() * PREVIOUS_VOLUME_FACTOR));
        PricePoint latest = new PricePoint(close, e.getPrice(), e.getVolume());

        return SecuritySnapshot.builder()
            .ticker(ticker.toUpperCase(Locale.ROOT))
            .name(e.getName())
            .marketCap(e.getMarketCap())
            .epsGrowthRate(e.getEpsGrowth())
            .debtToEquity(e.getDebtEquity())
            .trailingEps(e.getEps())
            .expectedGrowthRate(e.getEpsGrowth())
            .currentPrice(e.getPrice())
            .dividendYield(e.getDividendYield())
            .sector(Sector.fromDescription(e.getSector()))
            .bondYield(bondYield)
            .recentPriceHistory(List.of(previous, latest))
            .build();
    }

    private static Map<String, SampleEntry> load(String resource) {
        InputStream is = SampleMarketDataProvider.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            log.warn("Sample data file '{}' not found on classpath — fallback disabled", resource);
            return Map.of();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (is) {
            SampleFile file = mapper.readValue(is, SampleFile.class);
            Map<String, SampleEntry> byTicker = new LinkedHashMap<>();
            if (file.getStocks() != null) {
                file.getStocks().forEach((t, entry) -> byTicker.put(t.toUpperCase(Locale.ROOT), entry));
            }
            return Collections.unmodifiableMap(byTicker);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read sample data '" + resource + "': " + e.getMessage(), e);
        }
    }

    // ── YAML shape ────────────────────────────────────────────────────────────

    @Data public static class SampleFile {
        private Map<String, SampleEntry> stocks = new LinkedHashMap<>();
    }

    @Data public static class SampleEntry {
        private String name;
        private double price;
        private double change;
        private long   volume;
        private double marketCap;
        private String sector;
        private double eps;
        private double epsGrowth;
        private double debtEquity;
        private double dividendYield;
    }
}
