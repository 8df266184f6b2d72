package com.jay.mfses.layer2_scoring;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.SecuritySnapshot;

/**
 * Stage 2 — Valuation Model.
 *
 * Graham-style intrinsic value per share:
 * <pre>
 *   V = EPS × (baseMultiple + growthMultiplier × g) × (referenceYield / bondYield)
 * </pre>
 * {@code g} is the expected growth rate clamped to [growthFloor, growthCap]. Without a
 * positive bond yield the yield factor is 1.0. The price/value ratio is then scored through
 * the configured interpolation table (defaults: ≤ 0.5 → 20, 1.0 → 10, ≥ 2.0 → 1).
 *
 * Non-positive trailing EPS has no meaningful intrinsic value and scores the minimum.
 */
public class ValuationModel {

    private final ScoringConfig.Valuation cfg;

    public record ValuationResult(
        int score,
        Double intrinsicValue,   // null when degenerate
        Double priceToValue,
        Double upsidePct,
        double growthUsed,
        double yieldFactor,
        boolean degenerate,
        String bracket
    ) {}

    public ValuationModel(ScoringConfig config) {
        this.cfg = config.valuation();
    }

    public ValuationResult evaluate(SecuritySnapshot s) {
        double eps = s.getTrailingEps();
        double growth = cappedGrowth(s.getExpectedGrowthRate());
        double yieldFactor = yieldFactor(s.getBondYield());

        if (eps <= 0) {
            return new ValuationResult(ScoreRange.MIN, null, null, null,
                growth, yieldFactor, true, "EPS ≤ 0 (no earnings to capitalise)");
        }

        double intrinsic = eps * (cfg.baseMultiple() + cfg.growthMultiplier() * growth) * yieldFactor;
        double price = s.getCurrentPrice();
        double ratio = price / intrinsic;
        double upside = (intrinsic - price) / price * 100;
        int score = cfg.ratioTable().score(ratio);

        return new ValuationResult(score, intrinsic, ratio, upside,
            growth, yieldFactor, false, "P/V " + cfg.ratioTable().describe(ratio));
    }

    /** Intrinsic value for the given inputs, or 0 when EPS is not positive. */
    public double intrinsicValue(double trailingEps, double expectedGrowthRate, Double bondYield) {
        if (trailingEps <= 0) return 0;
        return trailingEps
            * (cfg.baseMultiple() + cfg.growthMultiplier() * cappedGrowth(expectedGrowthRate))
            * yieldFactor(bondYield);
    }

    double cappedGrowth(double expectedGrowthRate) {
        return Math.max(cfg.growthFloor(), Math.min(cfg.growthCap(), expectedGrowthRate));
    }

    double yieldFactor(Double bondYield) {
        if (bondYield == null || !(bondYield > 0)) return 1.0;
        return cfg.referenceYield() / bondYield;
    }
}
