package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.CompositeScores;
import com.jay.mfses.model.SubScores;
import com.jay.mfses.model.enums.Horizon;

/**
 * Stage 4 — Composite Builder.
 * One weighted sum per horizon over the five sub-scores. Weights are non-negative and sum
 * to 1.0 (checked by {@link ScoringConfig}), so each composite stays inside [1, 20]
 * without further clamping.
 */
public class CompositeBuilder {

    private final ScoringConfig config;

    public CompositeBuilder(ScoringConfig config) {
        this.config = config;
    }

    public CompositeScores build(SubScores scores) {
        return new CompositeScores(
            composite(Horizon.SHORT, scores),
            composite(Horizon.MID, scores),
            composite(Horizon.LONG, scores));
    }

    public double composite(Horizon horizon, SubScores scores) {
        return config.weights(horizon).apply(scores);
    }
}
