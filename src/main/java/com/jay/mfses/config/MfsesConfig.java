package com.jay.mfses.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.mfses.layer2_scoring.BreakpointTable;
import com.jay.mfses.layer2_scoring.InterpolationTable;
import com.jay.mfses.model.enums.Horizon;
import com.jay.mfses.model.enums.Sector;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads and exposes all configuration from config.yaml.
 * Values are read once at startup. A missing file falls back to the built-in defaults;
 * an unreadable file or an inconsistent scoring section stops the application, since a
 * broken scoring configuration would silently corrupt every ticker's score.
 */
@Slf4j
@Component
public class MfsesConfig {

    @Value("${mfses.config-file:config.yaml}")
    private String configFile;

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env.getProperty(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private List<String> watchlist = new ConfigRoot().getWatchlist();
    private MarketData marketData = new MarketData();
    private Output output = new Output();
    private ScoringConfig scoringConfig;

    @PostConstruct
    public void load() {
        InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
        if (is == null) {
            log.warn("Config file '{}' not found on classpath — using defaults", configFile);
            this.scoringConfig = new Scoring().toScoringConfig();
            return;
        }
        ConfigRoot root;
        try (is) {
            root = readRoot(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + configFile + ": " + e.getMessage(), e);
        }
        apply(root);
        log.info("MfsesConfig loaded from '{}'. Watchlist: {} tickers, provider: {}",
            configFile, watchlist.size(), marketData.getProvider());
    }

    void apply(ConfigRoot root) {
        this.watchlist = root.getWatchlist() != null ? List.copyOf(root.getWatchlist()) : List.of();
        this.marketData = root.getMarketData() != null ? root.getMarketData() : new MarketData();
        this.output = root.getOutput() != null ? root.getOutput() : new Output();

        // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
        this.marketData.setApiKey(resolve(this.marketData.getApiKey()));

        Scoring scoring = root.getScoring() != null ? root.getScoring() : new Scoring();
        this.scoringConfig = scoring.toScoringConfig();
    }

    /** Parses a config.yaml stream. Unknown keys are ignored; missing keys keep their defaults. */
    public static ConfigRoot readRoot(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper.readValue(is, ConfigRoot.class);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public List<String> watchlist()      { return watchlist; }
    public MarketData marketData()       { return marketData; }
    public Output output()               { return output; }
    public ScoringConfig scoring()       { return scoringConfig; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private List<String> watchlist = List.of(
            "AAPL", "MSFT", "GOOGL", "AMZN", "NVDA", "META", "TSLA", "AMD", "INTC", "CRM");
        private MarketData marketData = new MarketData();
        private Output output = new Output();
        private Scoring scoring = new Scoring();
    }

    @Data public static class MarketData {
        private String provider = "polygon";             // polygon | sample
        private String apiKey = "${POLYGON_API_KEY:}";
        private String baseUrl = "https://api.polygon.io";
        private int historyDays = 30;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private Double aaaBondYield;                     // null → no yield adjustment
        private boolean fallbackToSample = true;
        private String sampleDataFile = "sample-data.yaml";
        private int maxConcurrentRequests = 4;
    }

    @Data public static class Output {
        private boolean writeFeed = true;
        private String feedPath = "docs/data.json";
        private boolean logReport = true;
    }

    /**
     * Scoring section. Defaults here are the documented breakpoint and weight tables;
     * config.yaml repeats them so they can be tuned without touching code.
     */
    @Data public static class Scoring {
        private TableSpec moat = new TableSpec("INCREASING", 4, bands(
            1e9, 6,   5e9, 8,   10e9, 10,  20e9, 12,  50e9, 14,
            100e9, 16, 200e9, 17, 500e9, 18, 1e12, 19, 2e12, 20));
        private TableSpec growth = new TableSpec("INCREASING", 2, bands(
            -25, 4,  -10, 6,  0, 8,  5, 10,  10, 12,  15, 14,  25, 16,  35, 18,  50, 20));
        private TableSpec balance = new TableSpec("DECREASING", 20, bands(
            0.1, 18,  0.3, 16,  0.5, 14,  0.7, 12,  1.0, 10,  1.5, 8,  2.0, 6,  3.0, 4));
        private ValuationSpec valuation = new ValuationSpec();
        private SentimentSpec sentiment = new SentimentSpec();
        private CompositeSpec composite = new CompositeSpec();
        private ActivitySpec activity = new ActivitySpec();
        private AuditSpec audit = new AuditSpec();

        public ScoringConfig toScoringConfig() {
            Map<Horizon, ScoringConfig.HorizonWeights> weights = new EnumMap<>(Horizon.class);
            if (composite == null) throw new ConfigurationException("composite section is required");
            putWeights(weights, Horizon.SHORT, composite.getShortTerm());
            putWeights(weights, Horizon.MID, composite.getMidTerm());
            putWeights(weights, Horizon.LONG, composite.getLongTerm());

            return new ScoringConfig(
                table("moat", moat),
                table("growth", growth),
                table("balance", balance),
                valuation().toValuation(),
                sentiment().toSentiment(),
                weights,
                activity().toActivity(),
                audit().toAudit());
        }

        private ValuationSpec valuation() {
            if (valuation == null) throw new ConfigurationException("valuation section is required");
            return valuation;
        }

        private SentimentSpec sentiment() {
            if (sentiment == null) throw new ConfigurationException("sentiment section is required");
            return sentiment;
        }

        private ActivitySpec activity() {
            return activity != null ? activity : new ActivitySpec();
        }

        private AuditSpec audit() {
            return audit != null ? audit : new AuditSpec();
        }

        private static void putWeights(Map<Horizon, ScoringConfig.HorizonWeights> target,
                                       Horizon horizon, WeightSpec spec) {
            if (spec == null) return; // reported by ScoringConfig as a missing horizon
            target.put(horizon, new ScoringConfig.HorizonWeights(
                spec.getMoat(), spec.getGrowth(), spec.getBalance(), spec.getValuation(), spec.getSentiment()));
        }
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class TableSpec {
        private String direction;
        private int baseScore;
        private List<BandSpec> bands;
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class BandSpec {
        private double min;
        private int score;
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class PointSpec {
        private double ratio;
        private int score;
    }

    @Data public static class ValuationSpec {
        private double baseMultiple = 8.5;
        private double growthMultiplier = 2.0;
        private double referenceYield = 4.4;
        private double growthFloor = 0;
        private double growthCap = 15;
        private List<PointSpec> ratioPoints = List.of(
            new PointSpec(0.5, 20), new PointSpec(1.0, 10), new PointSpec(2.0, 1));

        ScoringConfig.Valuation toValuation() {
            if (ratioPoints == null) throw new ConfigurationException("valuation ratio_points are required");
            List<InterpolationTable.Point> points = ratioPoints.stream()
                .map(p -> new InterpolationTable.Point(p.getRatio(), p.getScore()))
                .toList();
            return new ScoringConfig.Valuation(baseMultiple, growthMultiplier, referenceYield,
                growthFloor, growthCap,
                new InterpolationTable("valuation", BreakpointTable.Direction.DECREASING, points));
        }
    }

    @Data public static class SentimentSpec {
        private double dividendWeight = 0.3;
        private double sectorWeight = 0.3;
        private double momentumWeight = 0.4;
        private TableSpec dividend = new TableSpec("INCREASING", 6, bands(
            0.01, 8,  1, 10,  2, 12,  3, 14,  4, 16));
        private TableSpec momentum = new TableSpec("INCREASING", 2, bands(
            -10, 5,  -5, 8,  -1, 10,  1, 12,  5, 15,  10, 18));
        private Map<String, Integer> sectorScores = defaultSectorScores();
        private int defaultSectorScore = 10;
        private int neutralMomentumScore = 10;

        ScoringConfig.Sentiment toSentiment() {
            Map<Sector, Integer> scores = new EnumMap<>(Sector.class);
            if (sectorScores != null) {
                sectorScores.forEach((name, score) -> scores.put(parseSector(name), score));
            }
            return new ScoringConfig.Sentiment(dividendWeight, sectorWeight, momentumWeight,
                table("dividend", dividend), table("momentum", momentum),
                scores, defaultSectorScore, neutralMomentumScore);
        }

        private static Map<String, Integer> defaultSectorScores() {
            Map<String, Integer> m = new LinkedHashMap<>();
            m.put("TECHNOLOGY", 14);
            m.put("COMMUNICATION", 12);
            m.put("HEALTHCARE", 11);
            m.put("CONSUMER", 10);
            m.put("INDUSTRIAL", 10);
            m.put("FINANCIAL", 9);
            m.put("MATERIALS", 9);
            m.put("UTILITIES", 9);
            m.put("ENERGY", 8);
            m.put("REAL_ESTATE", 8);
            return m;
        }
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class WeightSpec {
        private double moat;
        private double growth;
        private double balance;
        private double valuation;
        private double sentiment;
    }

    @Data public static class CompositeSpec {
        private WeightSpec shortTerm = new WeightSpec(0.10, 0.20, 0.10, 0.25, 0.35);
        private WeightSpec midTerm   = new WeightSpec(0.20, 0.20, 0.20, 0.20, 0.20);
        private WeightSpec longTerm  = new WeightSpec(0.30, 0.15, 0.25, 0.20, 0.10);
    }

    @Data public static class ActivitySpec {
        private double surgeVolumeRatio = 2.5;
        private double highVolumeRatio = 1.5;
        private double activeVolumeRatio = 1.0;
        private double quietVolumeRatio = 0.5;
        private double largeMovePct = 5;
        private double mediumMovePct = 3;
        private double smallMovePct = 1.5;
        private int hotPoints = 5;
        private int warmPoints = 3;
        private int coldPoints = 1;

        ScoringConfig.Activity toActivity() {
            return new ScoringConfig.Activity(surgeVolumeRatio, highVolumeRatio, activeVolumeRatio,
                quietVolumeRatio, largeMovePct, mediumMovePct, smallMovePct, hotPoints, warmPoints, coldPoints);
        }
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class CapRangeSpec {
        private double low;
        private double high;
    }

    @Data public static class AuditSpec {
        private double largeCapZeroEpsThreshold = 50e9;
        private Map<String, CapRangeSpec> expectedMarketCaps = new LinkedHashMap<>();

        ScoringConfig.Audit toAudit() {
            Map<String, ScoringConfig.MarketCapRange> ranges = new LinkedHashMap<>();
            if (expectedMarketCaps != null) {
                expectedMarketCaps.forEach((ticker, r) -> ranges.put(ticker.toUpperCase(Locale.ROOT),
                    r == null ? null : new ScoringConfig.MarketCapRange(r.getLow(), r.getHigh())));
            }
            return new ScoringConfig.Audit(largeCapZeroEpsThreshold, ranges);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static BreakpointTable table(String name, TableSpec spec) {
        if (spec == null) throw new ConfigurationException(name + " table is required");
        if (spec.getBands() == null) throw new ConfigurationException(name + " table needs bands");
        BreakpointTable.Direction direction;
        try {
            direction = BreakpointTable.Direction.valueOf(
                String.valueOf(spec.getDirection()).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + " table has unknown direction '" + spec.getDirection() + "'", e);
        }
        List<BreakpointTable.Band> bands = spec.getBands().stream()
            .map(b -> new BreakpointTable.Band(b.getMin(), b.getScore()))
            .toList();
        return new BreakpointTable(name, direction, spec.getBaseScore(), bands);
    }

    private static Sector parseSector(String name) {
        try {
            return Sector.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown sector '" + name + "' in sector_scores", e);
        }
    }

    /** Flat (bound, score, bound, score, ...) list → band specs. */
    private static List<BandSpec> bands(double... boundScorePairs) {
        List<BandSpec> list = new ArrayList<>();
        for (int i = 0; i + 1 < boundScorePairs.length; i += 2) {
            list.add(new BandSpec(boundScorePairs[i], (int) boundScorePairs[i + 1]));
        }
        return list;
    }
}
