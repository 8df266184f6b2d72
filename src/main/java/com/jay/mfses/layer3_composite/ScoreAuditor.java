package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.layer2_scoring.BreakpointTable;
import com.jay.mfses.layer2_scoring.MetricNormalizer.NormalizedMetrics;
import com.jay.mfses.layer2_scoring.SentimentAggregator.SentimentResult;
import com.jay.mfses.layer2_scoring.ValuationModel.ValuationResult;
import com.jay.mfses.model.FactorAudit;
import com.jay.mfses.model.ScoreAudit;
import com.jay.mfses.model.SecuritySnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the fact-check block for a scored ticker: what went into each factor, which
 * bracket it landed in, and data-quality warnings. Warnings are informational only.
 */
public class ScoreAuditor {

    private final ScoringConfig.Audit cfg;

    public ScoreAuditor(ScoringConfig config) {
        this.cfg = config.audit();
    }

    public ScoreAudit audit(SecuritySnapshot s, NormalizedMetrics metrics,
                            ValuationResult valuation, SentimentResult sentiment) {
        return new ScoreAudit(
            factor("Market cap: " + money(s.getMarketCap()), metrics.moat()),
            factor(String.format("EPS growth: %.1f%%", s.getEpsGrowthRate()), metrics.growth()),
            factor(String.format("D/E: %.2f", s.getDebtToEquity()), metrics.balance()),
            new FactorAudit(valuationInput(s, valuation), valuation.bracket(), valuation.score()),
            new FactorAudit(sentimentInput(s, sentiment), sentiment.breakdown(), sentiment.score()),
            warnings(s));
    }

    public List<String> warnings(SecuritySnapshot s) {
        List<String> warnings = new ArrayList<>();

        if (s.getDebtToEquity() == 0) {
            warnings.add("D/E is exactly 0 — balance sheet data may be incomplete");
        }
        if (s.getTrailingEps() == 0 && s.getMarketCap() > cfg.largeCapZeroEpsThreshold()) {
            warnings.add(String.format("EPS is 0 on a %s company — verify data", money(s.getMarketCap())));
        }
        if (s.getRecentPriceHistory() == null || s.getRecentPriceHistory().size() < 2) {
            warnings.add("Price history has fewer than 2 points — momentum is neutral");
        }
        ScoringConfig.MarketCapRange expected =
            cfg.expectedMarketCaps().get(s.getTicker().toUpperCase(Locale.ROOT));
        if (expected != null && !expected.contains(s.getMarketCap())) {
            warnings.add(String.format("Market cap %s outside expected range %s – %s",
                money(s.getMarketCap()), money(expected.low()), money(expected.high())));
        }
        return warnings;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static FactorAudit factor(String input, BreakpointTable.Match match) {
        return new FactorAudit(input, match.describe(), match.score());
    }

    private static String valuationInput(SecuritySnapshot s, ValuationResult v) {
        if (v.degenerate()) {
            return String.format("EPS $%.2f, price $%.2f", s.getTrailingEps(), s.getCurrentPrice());
        }
        return String.format("EPS $%.2f, growth %.1f%% (used %.1f), yield factor %.3f → V=$%.2f vs price $%.2f (%+.1f%%)",
            s.getTrailingEps(), s.getExpectedGrowthRate(), v.growthUsed(), v.yieldFactor(),
            v.intrinsicValue(), s.getCurrentPrice(), v.upsidePct());
    }

    private static String sentimentInput(SecuritySnapshot s, SentimentResult r) {
        String momentum = r.momentumPct() == null ? "n/a" : String.format("%+.1f%%", r.momentumPct());
        return String.format("Dividend %.2f%%, sector %s, momentum %s",
            s.getDividendYield(), s.getSector(), momentum);
    }

    static String money(double value) {
        double abs = Math.abs(value);
        if (abs >= 1e12) return String.format("$%.2fT", value / 1e12);
        if (abs >= 1e9)  return String.format("$%.1fB", value / 1e9);
        if (abs >= 1e6)  return String.format("$%.1fM", value / 1e6);
        return String.format("$%.0f", value);
    }
}
