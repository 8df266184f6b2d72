package com.jay.mfses.model;

import com.jay.mfses.model.enums.Sector;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw per-ticker input for one scoring run, as supplied by a market data provider.
 * Numeric fields are boxed so that a missing value can be told apart from zero;
 * {@code SnapshotValidator} rejects nulls on required fields.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SecuritySnapshot {
    String ticker;
    String name;                  // display name, optional

    Double marketCap;             // currency units, > 0
    Double epsGrowthRate;         // %, may be negative
    Double debtToEquity;          // >= 0
    Double trailingEps;           // may be <= 0 (degenerate valuation)
    Double expectedGrowthRate;    // %, Graham "g"
    Double currentPrice;          // > 0
    Double dividendYield;         // %, >= 0
    Sector sector;
    Double bondYield;             // current AAA yield %, optional

    @Builder.Default
    List<PricePoint> recentPriceHistory = List.of();   // oldest first

    public String displayName() {
        return name != null && !name.isBlank() ? name : ticker;
    }
}
