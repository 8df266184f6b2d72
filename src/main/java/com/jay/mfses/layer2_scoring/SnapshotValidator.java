package com.jay.mfses.layer2_scoring;

import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.SecuritySnapshot;

import java.util.List;

/**
 * Checks a snapshot against the field constraints before any scoring happens.
 * Non-positive trailing EPS and short price histories are valid; they have defined
 * fallbacks in the valuation and sentiment stages.
 */
public final class SnapshotValidator {

    private SnapshotValidator() {}

    public static void validate(SecuritySnapshot s) {
        if (s == null) {
            throw new InvalidSnapshotException(null, "Snapshot is missing");
        }
        String ticker = s.getTicker();
        if (ticker == null || ticker.isBlank()) {
            throw new InvalidSnapshotException(ticker, "Ticker is missing");
        }

        positive(ticker, "market_cap", s.getMarketCap());
        finite(ticker, "eps_growth_rate", s.getEpsGrowthRate());
        nonNegative(ticker, "debt_to_equity", s.getDebtToEquity());
        finite(ticker, "trailing_eps", s.getTrailingEps());
        finite(ticker, "expected_growth_rate", s.getExpectedGrowthRate());
        positive(ticker, "current_price", s.getCurrentPrice());
        nonNegative(ticker, "dividend_yield", s.getDividendYield());
        if (s.getSector() == null) {
            throw new InvalidSnapshotException(ticker, "sector is missing");
        }
        if (s.getBondYield() != null && !Double.isFinite(s.getBondYield())) {
            throw new InvalidSnapshotException(ticker, "bond_yield is not a finite number");
        }

        List<PricePoint> history = s.getRecentPriceHistory();
        if (history != null) {
            for (int i = 0; i < history.size(); i++) {
                PricePoint p = history.get(i);
                if (p == null || p.price() == null || !Double.isFinite(p.price()) || p.price() <= 0) {
                    throw new InvalidSnapshotException(ticker, String.format(
                        "recent_price_history[%d] must carry a positive price", i));
                }
                if (p.volume() < 0) {
                    throw new InvalidSnapshotException(ticker, String.format(
                        "recent_price_history[%d] has negative volume", i));
                }
            }
        }
    }

    private static double finite(String ticker, String field, Double value) {
        if (value == null) {
            throw new InvalidSnapshotException(ticker, field + " is missing");
        }
        if (!Double.isFinite(value)) {
            throw new InvalidSnapshotException(ticker, field + " is not a finite number");
        }
        return value;
    }

    private static void positive(String ticker, String field, Double value) {
        if (finite(ticker, field, value) <= 0) {
            throw new InvalidSnapshotException(ticker, String.format("%s must be positive, got %s", field, value));
        }
    }

    private static void nonNegative(String ticker, String field, Double value) {
        if (finite(ticker, field, value) < 0) {
            throw new InvalidSnapshotException(ticker, String.format("%s must be non-negative, got %s", field, value));
        }
    }
}
