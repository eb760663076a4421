package ou.capstone.rmr.cluster;

import java.util.Locale;

import ou.capstone.rmr.model.Orientation;

/**
 * Rule deciding whether an orientation may join a cluster, given the cluster's mean.
 */
public enum AdmissionMetric {

    /** Circular dip-direction distance and linear dip distance each within tolerance. */
    TWO_THRESHOLD {
        @Override
        public boolean admits(final Orientation mean, final Orientation candidate, final double tolerance) {
            return OrientationMath.circularDistance(mean.getDipDirection(), candidate.getDipDirection()) <= tolerance
                    && Math.abs(mean.getDip() - candidate.getDip()) <= tolerance;
        }

        @Override
        public double deviation(final Orientation mean, final Orientation candidate) {
            return Math.max(
                    OrientationMath.circularDistance(mean.getDipDirection(), candidate.getDipDirection()),
                    Math.abs(mean.getDip() - candidate.getDip()));
        }
    },

    /** Angle between the two planes' normals within tolerance. */
    GREAT_CIRCLE {
        @Override
        public boolean admits(final Orientation mean, final Orientation candidate, final double tolerance) {
            return OrientationMath.angleBetweenPlanes(mean, candidate) <= tolerance;
        }

        @Override
        public double deviation(final Orientation mean, final Orientation candidate) {
            return OrientationMath.angleBetweenPlanes(mean, candidate);
        }
    };

    public abstract boolean admits(Orientation mean, Orientation candidate, double tolerance);

    /** Distance from the mean in degrees under this metric; admits iff deviation <= tolerance. */
    public abstract double deviation(Orientation mean, Orientation candidate);

    /** Accepts "two-threshold", "TWO_THRESHOLD", "great-circle" and similar spellings. */
    public static AdmissionMetric parse(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("Admission metric is required");
        }
        final String key = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown admission metric '" + text
                    + "' (expected two-threshold or great-circle)", e);
        }
    }
}
