package com.jay.mfses.model;

import java.util.List;

/**
 * Fact-check block attached to every scored ticker.
 * Warnings flag inputs that look incomplete; they never change a score.
 */
public record ScoreAudit(
    FactorAudit moat,
    FactorAudit growth,
    FactorAudit balance,
    FactorAudit valuation,
    FactorAudit sentiment,
    List<String> warnings
) {
    public ScoreAudit {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
