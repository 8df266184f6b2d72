package com.jay.mfses.layer2_scoring;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.SecuritySnapshot;

/**
 * Stage 1 — Metric Normalizer.
 * Maps market cap, EPS growth and debt/equity onto the 1-20 scale through the configured
 * breakpoint tables:
 *   Moat    — larger market cap → higher score (size as a proxy for competitive position)
 *   Growth  — faster EPS growth → higher score
 *   Balance — lower leverage → higher score
 */
public class MetricNormalizer {

    private final BreakpointTable moatTable;
    private final BreakpointTable growthTable;
    private final BreakpointTable balanceTable;

    public record NormalizedMetrics(
        BreakpointTable.Match moat,
        BreakpointTable.Match growth,
        BreakpointTable.Match balance
    ) {}

    public MetricNormalizer(ScoringConfig config) {
        this.moatTable = config.moatTable();
        this.growthTable = config.growthTable();
        this.balanceTable = config.balanceTable();
    }

    /** Expects a snapshot that already passed {@link SnapshotValidator}. */
    public NormalizedMetrics normalize(SecuritySnapshot s) {
        return new NormalizedMetrics(
            moatTable.match(s.getMarketCap()),
            growthTable.match(s.getEpsGrowthRate()),
            balanceTable.match(s.getDebtToEquity()));
    }

    public int moatScore(double marketCap)         { return moatTable.score(marketCap); }
    public int growthScore(double epsGrowthRate)   { return growthTable.score(epsGrowthRate); }
    public int balanceScore(double debtToEquity)   { return balanceTable.score(debtToEquity); }
}
