package com.jay.mfses.layer2_scoring;

import com.jay.mfses.config.ConfigurationException;

import java.util.List;

/**
 * Piecewise-linear table: anchor points with strictly ascending x, linear between anchors,
 * flat beyond both ends. Results are rounded half-up and clamped to 1 – 20.
 */
public final class InterpolationTable {

    public record Point(double x, int score) {}

    private final String name;
    private final BreakpointTable.Direction direction;
    private final List<Point> points;

    public InterpolationTable(String name, BreakpointTable.Direction direction, List<Point> points) {
        if (direction == null) {
            throw new ConfigurationException(name + ": table direction is required");
        }
        if (points == null || points.size() < 2) {
            throw new ConfigurationException(name + ": at least two anchor points are required");
        }
        this.name = name;
        this.direction = direction;
        this.points = List.copyOf(points);
        validate();
    }

    /** Unrounded interpolated value; NaN input yields the midpoint. */
    public double interpolate(double x) {
        if (Double.isNaN(x)) return ScoreRange.MIDPOINT;
        Point first = points.get(0);
        Point last  = points.get(points.size() - 1);
        if (x <= first.x()) return first.score();
        if (x >= last.x())  return last.score();
        for (int i = 1; i < points.size(); i++) {
            Point hi = points.get(i);
            if (x <= hi.x()) {
                Point lo = points.get(i - 1);
                double t = (x - lo.x()) / (hi.x() - lo.x());
                return lo.score() + t * (hi.score() - lo.score());
            }
        }
        return last.score();
    }

    public int score(double x) {
        return ScoreRange.round(interpolate(x));
    }

    /** Segment a value falls into, e.g. "[0.5, 1]" or "≤ 0.5". */
    public String describe(double x) {
        Point first = points.get(0);
        Point last  = points.get(points.size() - 1);
        if (x <= first.x()) return "≤ " + ScoreRange.compact(first.x());
        if (x >= last.x())  return "≥ " + ScoreRange.compact(last.x());
        for (int i = 1; i < points.size(); i++) {
            if (x <= points.get(i).x()) {
                return "[" + ScoreRange.compact(points.get(i - 1).x()) + ", "
                    + ScoreRange.compact(points.get(i).x()) + "]";
            }
        }
        return "≥ " + ScoreRange.compact(last.x());
    }

    public String name()                          { return name; }
    public BreakpointTable.Direction direction()  { return direction; }
    public List<Point> points()                   { return points; }

    private void validate() {
        Point previous = null;
        for (Point p : points) {
            if (!Double.isFinite(p.x())) {
                throw new ConfigurationException(name + ": anchor x values must be finite");
            }
            if (!ScoreRange.contains(p.score())) {
                throw new ConfigurationException(String.format(
                    "%s: score %d at x=%s outside [%d, %d]", name, p.score(), p.x(), ScoreRange.MIN, ScoreRange.MAX));
            }
            if (previous != null) {
                if (p.x() <= previous.x()) {
                    throw new ConfigurationException(String.format(
                        "%s: anchor x values must be strictly ascending (%s after %s)", name, p.x(), previous.x()));
                }
                boolean monotonic = direction == BreakpointTable.Direction.INCREASING
                    ? p.score() >= previous.score()
                    : p.score() <= previous.score();
                if (!monotonic) {
                    throw new ConfigurationException(String.format(
                        "%s: score %d at x=%s breaks %s ordering", name, p.score(), p.x(), direction));
                }
            }
            previous = p;
        }
    }
}
