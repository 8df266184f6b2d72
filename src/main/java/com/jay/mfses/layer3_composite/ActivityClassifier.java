package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.enums.ActivityState;

import java.util.List;

/**
 * Labels how "active" a ticker is from its latest session: volume against the window's
 * average volume, plus the size of the latest daily move. Informational only; it never
 * feeds a sub-score.
 */
public class ActivityClassifier {

    private final ScoringConfig.Activity cfg;

    public ActivityClassifier(ScoringConfig config) {
        this.cfg = config.activity();
    }

    public ActivityState classify(List<PricePoint> history) {
        if (history == null || history.size() < 2) return ActivityState.FROZEN;

        PricePoint latest = history.get(history.size() - 1);
        PricePoint previous = history.get(history.size() - 2);
        double avgVolume = history.stream().mapToLong(PricePoint::volume).average().orElse(0);
        double changePct = (latest.price() - previous.price()) / previous.price() * 100;

        return stateFor(points(latest.volume(), avgVolume, changePct));
    }

    /** Volume points are skipped when no volume is known (average of 0). */
    public int points(double volume, double avgVolume, double changePct) {
        int points = 0;

        if (avgVolume > 0) {
            double ratio = volume / avgVolume;
            if (ratio > cfg.surgeVolumeRatio())       points += 3;
            else if (ratio > cfg.highVolumeRatio())   points += 2;
            else if (ratio > cfg.activeVolumeRatio()) points += 1;
            else if (ratio < cfg.quietVolumeRatio())  points -= 1;
        }

        double move = Math.abs(changePct);
        if (move > cfg.largeMovePct())       points += 3;
        else if (move > cfg.mediumMovePct()) points += 2;
        else if (move > cfg.smallMovePct())  points += 1;

        return points;
    }

    public ActivityState stateFor(int points) {
        if (points >= cfg.hotPoints())  return ActivityState.HOT;
        if (points >= cfg.warmPoints()) return ActivityState.WARM;
        if (points >= cfg.coldPoints()) return ActivityState.COLD;
        return ActivityState.FROZEN;
    }
}
