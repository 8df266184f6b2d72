package com.jay.mfses.layer3_composite;

import com.jay.mfses.TestSnapshots;
import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.enums.ActivityState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jay.mfses.TestSnapshots.T0;
import static org.assertj.core.api.Assertions.assertThat;

class ActivityClassifierTest {

    private final ActivityClassifier classifier = new ActivityClassifier(ScoringConfig.defaults());

    @Test
    void shortHistoryIsFrozen() {
        assertThat(classifier.classify(List.of())).isEqualTo(ActivityState.FROZEN);
        assertThat(classifier.classify(TestSnapshots.history(100))).isEqualTo(ActivityState.FROZEN);
        assertThat(classifier.classify(null)).isEqualTo(ActivityState.FROZEN);
    }

    @Test
    void volumeSurgeWithLargeMoveIsHot() {
        List<PricePoint> history = List.of(
            new PricePoint(T0, 100.0, 1_000_000L),
            new PricePoint(T0.plusDays(1), 100.0, 1_000_000L),
            new PricePoint(T0.plusDays(2), 100.0, 1_000_000L),
            new PricePoint(T0.plusDays(3), 106.0, 10_000_000L));

        assertThat(classifier.classify(history)).isEqualTo(ActivityState.HOT);
    }

    @Test
    void quietFlatSessionIsFrozen() {
        List<PricePoint> history = List.of(
            new PricePoint(T0, 100.0, 4_000_000L),
            new PricePoint(T0.plusDays(1), 100.2, 1_000_000L));

        assertThat(classifier.classify(history)).isEqualTo(ActivityState.FROZEN);
    }

    @Test
    void pointsFollowThresholds() {
        // ratio 2.0 → +2, move 4% → +2
        assertThat(classifier.points(2.0, 1.0, 4.0)).isEqualTo(4);
        // ratio 0.4 → -1, move -1.6% → +1
        assertThat(classifier.points(0.4, 1.0, -1.6)).isEqualTo(0);
        // unknown volume only counts the move
        assertThat(classifier.points(0, 0, 3.5)).isEqualTo(2);
    }

    @Test
    void stateBoundaries() {
        assertThat(classifier.stateFor(5)).isEqualTo(ActivityState.HOT);
        assertThat(classifier.stateFor(3)).isEqualTo(ActivityState.WARM);
        assertThat(classifier.stateFor(1)).isEqualTo(ActivityState.COLD);
        assertThat(classifier.stateFor(0)).isEqualTo(ActivityState.FROZEN);
        assertThat(classifier.stateFor(-1)).isEqualTo(ActivityState.FROZEN);
    }
}
