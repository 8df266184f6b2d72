package com.jay.mfses.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.mfses.model.enums.ActivityState;
import com.jay.mfses.model.enums.ScoreStatus;
import com.jay.mfses.model.enums.Sector;
import lombok.Builder;
import lombok.Data;

/**
 * Engine output for a single ticker.
 * Either SCORED with sub-scores and composites filled in, or INVALID_SNAPSHOT with only
 * the ticker and {@code errorMessage} set.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TickerScore {

    private String      ticker;
    private String      name;
    private ScoreStatus status;
    private String      errorMessage;   // non-null if the snapshot was rejected

    // ── Inputs echoed for the feed ────────────────────────────────────────────
    private Double price;
    private Double marketCap;
    private Sector sector;

    // ── Scores ────────────────────────────────────────────────────────────────
    private SubScores       subScores;
    private CompositeScores composites;

    // ── Valuation detail ──────────────────────────────────────────────────────
    private Double  intrinsicValue;     // null when trailing EPS <= 0
    private Double  priceToValue;
    private Double  upsidePct;
    private boolean degenerateValuation;

    // ── Sentiment / activity detail ───────────────────────────────────────────
    private Double        momentumPct;  // null when the history window is too short
    private ActivityState activityState;

    private ScoreAudit audit;

    public boolean isScored() {
        return status == ScoreStatus.SCORED;
    }

    public static TickerScore invalid(String ticker, String message) {
        return TickerScore.builder()
            .ticker(ticker)
            .status(ScoreStatus.INVALID_SNAPSHOT)
            .errorMessage(message)
            .build();
    }
}
