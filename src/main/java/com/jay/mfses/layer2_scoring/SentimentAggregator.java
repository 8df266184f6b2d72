package com.jay.mfses.layer2_scoring;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.SecuritySnapshot;

import java.util.List;

/**
 * Stage 3 — Sentiment Aggregator.
 * Three component scores on the 1-20 scale, blended by the configured weights:
 *   Dividend — yield bands, top band capped below 20
 *   Sector   — fixed lookup with a default for unlisted sectors
 *   Momentum — % change from the earliest to the latest price in the history window;
 *              fewer than two points gives the neutral score
 */
public class SentimentAggregator {

    private final ScoringConfig.Sentiment cfg;

    public record SentimentResult(
        int score,
        double weightedScore,
        int dividendScore,
        int sectorScore,
        int momentumScore,
        Double momentumPct   // null when the window is too short
    ) {
        public String breakdown() {
            return String.format("Div(%d) Sector(%d) Momentum(%d) → %.2f",
                dividendScore, sectorScore, momentumScore, weightedScore);
        }
    }

    public SentimentAggregator(ScoringConfig config) {
        this.cfg = config.sentiment();
    }

    public SentimentResult evaluate(SecuritySnapshot s) {
        int dividend = cfg.dividendTable().score(s.getDividendYield());
        int sector = cfg.sectorScore(s.getSector());

        Double momentumPct = momentumPct(s.getRecentPriceHistory());
        int momentum = momentumPct == null
            ? cfg.neutralMomentumScore()
            : cfg.momentumTable().score(momentumPct);

        double weighted = dividend * cfg.dividendWeight()
            + sector * cfg.sectorWeight()
            + momentum * cfg.momentumWeight();

        return new SentimentResult(ScoreRange.round(weighted), weighted, dividend, sector, momentum, momentumPct);
    }

    /** Percentage change from the earliest to the latest price; null for fewer than two points. */
    public static Double momentumPct(List<PricePoint> history) {
        if (history == null || history.size() < 2) return null;
        double earliest = history.get(0).price();
        double latest = history.get(history.size() - 1).price();
        return (latest - earliest) / earliest * 100;
    }
}
