package ou.capstone.rmr.cluster;

import java.util.List;

import ou.capstone.rmr.model.Orientation;

/**
 * Angular helpers for orientation data. Dip direction is circular and is averaged
 * through unit vectors; dip is linear.
 */
public final class OrientationMath {

    private OrientationMath() {
    }

    /**
     * Smallest angle between two azimuths, in [0, 180].
     * circularDistance(359, 1) == 2.
     */
    public static double circularDistance(final double d1, final double d2) {
        final double diff = Math.abs(Orientation.normalizeDipDirection(d1) - Orientation.normalizeDipDirection(d2));
        return Math.min(diff, 360.0 - diff);
    }

    /**
     * Vector mean of azimuths in [0, 360). Empty input gives 0.
     */
    public static double circularMeanDirection(final List<Orientation> orientations) {
        double sumSin = 0.0;
        double sumCos = 0.0;
        for (Orientation o : orientations) {
            final double rad = Math.toRadians(o.getDipDirection());
            sumSin += Math.sin(rad);
            sumCos += Math.cos(rad);
        }
        if (orientations.isEmpty()) {
            return 0.0;
        }
        return Orientation.normalizeDipDirection(Math.toDegrees(Math.atan2(sumSin, sumCos)));
    }

    /**
     * Circular mean dip direction with arithmetic mean dip.
     *
     * @param orientations non-empty
     */
    public static Orientation mean(final List<Orientation> orientations) {
        if (orientations.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty set of orientations");
        }
        double dipSum = 0.0;
        for (Orientation o : orientations) {
            dipSum += o.getDip();
        }
        final double dip = Math.max(0.0, Math.min(90.0, dipSum / orientations.size()));
        return new Orientation(circularMeanDirection(orientations), dip);
    }

    /**
     * Acute angle between two planes (between their normals), in [0, 90].
     */
    public static double angleBetweenPlanes(final Orientation a, final Orientation b) {
        final double[] na = normal(a);
        final double[] nb = normal(b);
        final double dot = Math.abs(na[0] * nb[0] + na[1] * nb[1] + na[2] * nb[2]);
        return Math.toDegrees(Math.acos(Math.min(1.0, dot)));
    }

    // east, north, up
    private static double[] normal(final Orientation o) {
        final double dd = Math.toRadians(o.getDipDirection());
        final double dip = Math.toRadians(o.getDip());
        return new double[] {
                Math.sin(dip) * Math.sin(dd),
                Math.sin(dip) * Math.cos(dd),
                Math.cos(dip)
        };
    }
}
