package org.nowstart.scoring.service.settings;

/**
 * Domain of a numeric setting. Values outside it are replaced by the default, not clamped.
 */
public record NumberConstraint(
        Double min,
        Double max,
        boolean integer
) {

    public static NumberConstraint atLeast(double min) {
        return new NumberConstraint(min, null, false);
    }

    public static NumberConstraint integerAtLeast(double min) {
        return new NumberConstraint(min, null, true);
    }

    public static NumberConstraint between(double min, double max) {
        return new NumberConstraint(min, max, false);
    }

    public boolean accepts(double value) {
        if (!Double.isFinite(value)) {
            return false;
        }
        if (integer && value != Math.rint(value)) {
            return false;
        }
        if (min != null && value < min) {
            return false;
        }
        return max == null || value <= max;
    }
}
