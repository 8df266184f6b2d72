package com.jay.mfses.layer2_scoring;

import com.jay.mfses.TestSnapshots;
import com.jay.mfses.config.ScoringConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricNormalizerTest {

    private final MetricNormalizer normalizer = new MetricNormalizer(ScoringConfig.defaults());

    @Test
    void moatNeverDecreasesAsMarketCapGrows() {
        int previous = 0;
        for (double cap = 1e6; cap <= 1e13; cap *= 1.3) {
            int score = normalizer.moatScore(cap);
            assertThat(score).isBetween(1, 20).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void growthNeverDecreasesAsEpsGrowthRises() {
        int previous = 0;
        for (double g = -200; g <= 300; g += 0.5) {
            int score = normalizer.growthScore(g);
            assertThat(score).isBetween(1, 20).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void balanceNeverIncreasesAsLeverageRises() {
        int previous = 21;
        for (double de = 0; de <= 10; de += 0.05) {
            int score = normalizer.balanceScore(de);
            assertThat(score).isBetween(1, 20).isLessThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void scoresTheMegaCapScenario() {
        MetricNormalizer.NormalizedMetrics m = normalizer.normalize(TestSnapshots.megaCapTech());
        assertThat(m.moat().score()).isEqualTo(20);
        assertThat(m.growth().score()).isEqualTo(14);
        assertThat(m.balance().score()).isEqualTo(18);
    }

    @Test
    void bandEdges() {
        assertThat(normalizer.moatScore(2e12)).isEqualTo(20);
        assertThat(normalizer.moatScore(1.99e12)).isEqualTo(19);
        assertThat(normalizer.moatScore(500e6)).isEqualTo(4);
        assertThat(normalizer.growthScore(-30)).isEqualTo(2);
        assertThat(normalizer.growthScore(50)).isEqualTo(20);
        assertThat(normalizer.balanceScore(0)).isEqualTo(20);
        assertThat(normalizer.balanceScore(5)).isEqualTo(4);
    }
}
