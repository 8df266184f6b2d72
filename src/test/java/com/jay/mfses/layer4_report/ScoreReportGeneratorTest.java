package com.jay.mfses.layer4_report;

import com.jay.mfses.TestSnapshots;
import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.layer3_composite.ScoringEngine;
import com.jay.mfses.model.ScoringRun;
import com.jay.mfses.model.TickerScore;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreReportGeneratorTest {

    private final ScoreReportGenerator generator = new ScoreReportGenerator();
    private final ScoringEngine engine = new ScoringEngine(ScoringConfig.defaults());

    @Test
    void reportCoversEveryTicker() {
        ScoringRun run = ScoringRun.builder()
            .completedAt(LocalDateTime.of(2025, 1, 6, 16, 30))
            .source("polygon")
            .results(List.of(
                engine.score(TestSnapshots.megaCapTech()),
                TickerScore.invalid("BAD", "current_price is missing")))
            .build();

        String report = generator.generate(run);

        assertThat(report)
            .contains("1 scored, 1 failed")
            .contains("MEGA")
            .contains("M:20 G:14 B:18 V:12 S:11")
            .contains("[2T, ∞)")
            .contains("DATA WARNINGS")
            .contains("BAD")
            .contains("current_price is missing");
    }

    @Test
    void degenerateValuationIsCalledOut() {
        TickerScore r = engine.score(TestSnapshots.megaCapTech().toBuilder().trailingEps(-1.0).build());
        assertThat(generator.generate(r)).contains("n/a (EPS ≤ 0)");
    }
}
