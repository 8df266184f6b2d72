package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.CompositeScores;
import com.jay.mfses.model.SubScores;
import com.jay.mfses.model.enums.Horizon;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompositeBuilderTest {

    private final CompositeBuilder builder = new CompositeBuilder(ScoringConfig.defaults());

    @Test
    void uniformSubScoresGiveThatScoreOnEveryHorizon() {
        CompositeScores c = builder.build(new SubScores(7, 7, 7, 7, 7));
        for (Horizon h : Horizon.values()) {
            assertThat(c.get(h)).isCloseTo(7.0, within(1e-9));
        }
    }

    @Test
    void extremesStayInRange() {
        CompositeScores low = builder.build(new SubScores(1, 1, 1, 1, 1));
        CompositeScores high = builder.build(new SubScores(20, 20, 20, 20, 20));
        for (Horizon h : Horizon.values()) {
            assertThat(low.get(h)).isCloseTo(1.0, within(1e-9));
            assertThat(high.get(h)).isCloseTo(20.0, within(1e-9));
        }
    }

    @Test
    void scenarioComposites() {
        CompositeScores c = builder.build(new SubScores(20, 14, 18, 12, 11));

        assertThat(c.shortTerm()).isCloseTo(13.45, within(1e-9));
        assertThat(c.midTerm()).isCloseTo(15.0, within(1e-9));
        assertThat(c.longTerm()).isCloseTo(16.1, within(1e-9));
    }

    @Test
    void sentimentMovesShortHorizonMoreThanLong() {
        CompositeScores base = builder.build(new SubScores(10, 10, 10, 10, 10));
        CompositeScores hot = builder.build(new SubScores(10, 10, 10, 10, 20));

        double shortDelta = hot.shortTerm() - base.shortTerm();
        double longDelta = hot.longTerm() - base.longTerm();
        assertThat(shortDelta).isGreaterThan(longDelta);
    }
}
