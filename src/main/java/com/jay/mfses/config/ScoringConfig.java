package com.jay.mfses.config;

import com.jay.mfses.layer2_scoring.BreakpointTable;
import com.jay.mfses.layer2_scoring.InterpolationTable;
import com.jay.mfses.layer2_scoring.ScoreRange;
import com.jay.mfses.model.SubScores;
import com.jay.mfses.model.enums.Horizon;
import com.jay.mfses.model.enums.Sector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable, validated scoring configuration handed to the engine at construction.
 * Every table, weight vector and formula constant the engine uses lives here, so several
 * configurations (e.g. an alternate weighting for a backtest) can be used side by side.
 *
 * Construction fails with {@link ConfigurationException} on any inconsistency.
 */
public record ScoringConfig(
    BreakpointTable moatTable,
    BreakpointTable growthTable,
    BreakpointTable balanceTable,
    Valuation valuation,
    Sentiment sentiment,
    Map<Horizon, HorizonWeights> horizonWeights,
    Activity activity,
    Audit audit
) {

    /** Allowed deviation of a weight vector's sum from 1.0. */
    public static final double WEIGHT_TOLERANCE = 1e-9;

    public ScoringConfig {
        require(moatTable, "moat table");
        require(growthTable, "growth table");
        require(balanceTable, "balance table");
        require(valuation, "valuation settings");
        require(sentiment, "sentiment settings");
        require(horizonWeights, "horizon weights");
        require(activity, "activity settings");
        require(audit, "audit settings");
        if (moatTable.direction() != BreakpointTable.Direction.INCREASING) {
            throw new ConfigurationException("moat table must be INCREASING (larger market cap, higher score)");
        }
        if (growthTable.direction() != BreakpointTable.Direction.INCREASING) {
            throw new ConfigurationException("growth table must be INCREASING (higher EPS growth, higher score)");
        }
        if (balanceTable.direction() != BreakpointTable.Direction.DECREASING) {
            throw new ConfigurationException("balance table must be DECREASING (more leverage, lower score)");
        }
        EnumMap<Horizon, HorizonWeights> copy = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            HorizonWeights weights = horizonWeights.get(horizon);
            if (weights == null) {
                throw new ConfigurationException("missing weight vector for horizon " + horizon);
            }
            weights.validate(horizon.name());
            copy.put(horizon, weights);
        }
        horizonWeights = Collections.unmodifiableMap(copy);
    }

    /** Built-in defaults, identical to the shipped config.yaml. */
    public static ScoringConfig defaults() {
        return new MfsesConfig.Scoring().toScoringConfig();
    }

    public HorizonWeights weights(Horizon horizon) {
        return horizonWeights.get(horizon);
    }

    // ── Horizon weights ───────────────────────────────────────────────────────

    public record HorizonWeights(double moat, double growth, double balance, double valuation, double sentiment) {

        public double sum() {
            return moat + growth + balance + valuation + sentiment;
        }

        public double apply(SubScores s) {
            return s.moat() * moat
                + s.growth() * growth
                + s.balance() * balance
                + s.valuation() * valuation
                + s.sentiment() * sentiment;
        }

        void validate(String label) {
            double[] all = {moat, growth, balance, valuation, sentiment};
            for (double w : all) {
                if (!Double.isFinite(w) || w < 0) {
                    throw new ConfigurationException(label + " weights must be finite and non-negative, got " + w);
                }
            }
            if (Math.abs(sum() - 1.0) > WEIGHT_TOLERANCE) {
                throw new ConfigurationException(String.format(
                    "%s weights sum to %.12f, expected 1.0", label, sum()));
            }
        }
    }

    // ── Valuation model constants ─────────────────────────────────────────────

    /**
     * Graham-style capitalisation constants:
     * {@code V = EPS × (baseMultiple + growthMultiplier × g) × referenceYield / currentYield},
     * with {@code g} clamped to [growthFloor, growthCap].
     */
    public record Valuation(
        double baseMultiple,
        double growthMultiplier,
        double referenceYield,
        double growthFloor,
        double growthCap,
        InterpolationTable ratioTable
    ) {
        public Valuation {
            if (!(baseMultiple > 0)) {
                throw new ConfigurationException("valuation base multiple must be positive, got " + baseMultiple);
            }
            if (!(growthMultiplier >= 0)) {
                throw new ConfigurationException("valuation growth multiplier must be non-negative, got " + growthMultiplier);
            }
            if (!(referenceYield > 0)) {
                throw new ConfigurationException("valuation reference yield must be positive, got " + referenceYield);
            }
            if (!(growthFloor <= growthCap)) {
                throw new ConfigurationException(String.format(
                    "valuation growth floor %.2f exceeds growth cap %.2f", growthFloor, growthCap));
            }
            // the multiple at the growth floor must stay positive, or positive EPS values to < 0
            if (!(baseMultiple + growthMultiplier * growthFloor > 0)) {
                throw new ConfigurationException(String.format(
                    "valuation multiple at growth floor must be positive, got %.2f + %.2f × %.2f",
                    baseMultiple, growthMultiplier, growthFloor));
            }
            require(ratioTable, "valuation ratio table");
            if (ratioTable.direction() != BreakpointTable.Direction.DECREASING) {
                throw new ConfigurationException("valuation ratio table must be DECREASING (dearer price, lower score)");
            }
        }
    }

    // ── Sentiment aggregator settings ─────────────────────────────────────────

    public record Sentiment(
        double dividendWeight,
        double sectorWeight,
        double momentumWeight,
        BreakpointTable dividendTable,
        BreakpointTable momentumTable,
        Map<Sector, Integer> sectorScores,
        int defaultSectorScore,
        int neutralMomentumScore
    ) {
        public Sentiment {
            require(dividendTable, "dividend table");
            require(momentumTable, "momentum table");
            require(sectorScores, "sector score table");
            for (double w : new double[] {dividendWeight, sectorWeight, momentumWeight}) {
                if (!Double.isFinite(w) || w < 0) {
                    throw new ConfigurationException("sentiment weights must be finite and non-negative, got " + w);
                }
            }
            double sum = dividendWeight + sectorWeight + momentumWeight;
            if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
                throw new ConfigurationException(String.format("sentiment weights sum to %.12f, expected 1.0", sum));
            }
            if (dividendWeight >= 1.0) {
                throw new ConfigurationException("dividend weight must stay below 1.0 so dividends alone cannot max out sentiment");
            }
            if (dividendTable.direction() != BreakpointTable.Direction.INCREASING
                    || momentumTable.direction() != BreakpointTable.Direction.INCREASING) {
                throw new ConfigurationException("dividend and momentum tables must be INCREASING");
            }
            sectorScores.forEach((sector, score) -> {
                if (score == null || !ScoreRange.contains(score)) {
                    throw new ConfigurationException("sector score for " + sector + " outside [1, 20]: " + score);
                }
            });
            if (!ScoreRange.contains(defaultSectorScore)) {
                throw new ConfigurationException("default sector score outside [1, 20]: " + defaultSectorScore);
            }
            if (!ScoreRange.contains(neutralMomentumScore)) {
                throw new ConfigurationException("neutral momentum score outside [1, 20]: " + neutralMomentumScore);
            }
            EnumMap<Sector, Integer> copy = new EnumMap<>(Sector.class);
            copy.putAll(sectorScores);
            sectorScores = Collections.unmodifiableMap(copy);
        }

        public int sectorScore(Sector sector) {
            if (sector == null) return defaultSectorScore;
            return sectorScores.getOrDefault(sector, defaultSectorScore);
        }
    }

    // ── Activity classifier thresholds ────────────────────────────────────────

    public record Activity(
        double surgeVolumeRatio,
        double highVolumeRatio,
        double activeVolumeRatio,
        double quietVolumeRatio,
        double largeMovePct,
        double mediumMovePct,
        double smallMovePct,
        int hotPoints,
        int warmPoints,
        int coldPoints
    ) {
        public Activity {
            if (!(quietVolumeRatio < activeVolumeRatio && activeVolumeRatio < highVolumeRatio
                    && highVolumeRatio < surgeVolumeRatio)) {
                throw new ConfigurationException("activity volume ratios must be strictly ascending: quiet < active < high < surge");
            }
            if (!(smallMovePct < mediumMovePct && mediumMovePct < largeMovePct)) {
                throw new ConfigurationException("activity move thresholds must be strictly ascending: small < medium < large");
            }
            if (!(coldPoints < warmPoints && warmPoints < hotPoints)) {
                throw new ConfigurationException("activity point thresholds must be strictly ascending: cold < warm < hot");
            }
        }
    }

    // ── Audit / fact-check settings ───────────────────────────────────────────

    public record MarketCapRange(double low, double high) {
        public boolean contains(double marketCap) {
            return marketCap >= low && marketCap <= high;
        }
    }

    public record Audit(double largeCapZeroEpsThreshold, Map<String, MarketCapRange> expectedMarketCaps) {
        public Audit {
            require(expectedMarketCaps, "expected market cap ranges");
            expectedMarketCaps.forEach((ticker, range) -> {
                if (range == null || !(range.low() <= range.high())) {
                    throw new ConfigurationException("expected market cap range for " + ticker + " is inverted or empty");
                }
            });
            expectedMarketCaps = Map.copyOf(expectedMarketCaps);
        }
    }

    private static void require(Object value, String what) {
        if (value == null) {
            throw new ConfigurationException(what + " is required");
        }
    }
}
