package com.jay.mfses.layer2_scoring;

import com.jay.mfses.config.ConfigurationException;

import java.util.List;

/**
 * Ordered step table mapping a raw metric onto the 1 – 20 scale.
 *
 * Bands are lower-inclusive and upper-exclusive: a value takes the score of the last band
 * whose lower bound is {@code <= value}. Values below the first bound (and NaN) take
 * {@code baseScore}. Scores must move monotonically in the declared direction, starting
 * from the base score.
 */
public final class BreakpointTable {

    public enum Direction { INCREASING, DECREASING }

    public record Band(double lowerBound, int score) {}

    /** The band a value fell into, with its bounds for audit output. */
    public record Match(double lowerBound, double upperBound, int score) {
        public String describe() {
            return "[" + ScoreRange.compact(lowerBound) + ", " + ScoreRange.compact(upperBound) + ")";
        }
    }

    private final String name;
    private final Direction direction;
    private final int baseScore;
    private final List<Band> bands;

    public BreakpointTable(String name, Direction direction, int baseScore, List<Band> bands) {
        if (direction == null) {
            throw new ConfigurationException(name + ": table direction is required");
        }
        if (bands == null || bands.isEmpty()) {
            throw new ConfigurationException(name + ": at least one band is required");
        }
        this.name = name;
        this.direction = direction;
        this.baseScore = baseScore;
        this.bands = List.copyOf(bands);
        validate();
    }

    public int score(double value) {
        return match(value).score();
    }

    public Match match(double value) {
        double lower = Double.NEGATIVE_INFINITY;
        int score = baseScore;
        for (Band band : bands) {
            if (!(value >= band.lowerBound())) {
                return new Match(lower, band.lowerBound(), ScoreRange.clamp(score));
            }
            lower = band.lowerBound();
            score = band.score();
        }
        return new Match(lower, Double.POSITIVE_INFINITY, ScoreRange.clamp(score));
    }

    public String name()          { return name; }
    public Direction direction()  { return direction; }
    public int baseScore()        { return baseScore; }
    public List<Band> bands()     { return bands; }

    private void validate() {
        if (!ScoreRange.contains(baseScore)) {
            throw new ConfigurationException(String.format(
                "%s: base score %d outside [%d, %d]", name, baseScore, ScoreRange.MIN, ScoreRange.MAX));
        }
        double previousBound = Double.NEGATIVE_INFINITY;
        int previousScore = baseScore;
        for (Band band : bands) {
            if (!Double.isFinite(band.lowerBound())) {
                throw new ConfigurationException(name + ": band bounds must be finite");
            }
            if (band.lowerBound() <= previousBound) {
                throw new ConfigurationException(String.format(
                    "%s: lower bounds must be strictly ascending (%s after %s)",
                    name, band.lowerBound(), previousBound));
            }
            if (!ScoreRange.contains(band.score())) {
                throw new ConfigurationException(String.format(
                    "%s: score %d at bound %s outside [%d, %d]",
                    name, band.score(), band.lowerBound(), ScoreRange.MIN, ScoreRange.MAX));
            }
            boolean monotonic = direction == Direction.INCREASING
                ? band.score() >= previousScore
                : band.score() <= previousScore;
            if (!monotonic) {
                throw new ConfigurationException(String.format(
                    "%s: score %d at bound %s breaks %s ordering (previous %d)",
                    name, band.score(), band.lowerBound(), direction, previousScore));
            }
            previousBound = band.lowerBound();
            previousScore = band.score();
        }
    }
}
