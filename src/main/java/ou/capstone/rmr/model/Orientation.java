package ou.capstone.rmr.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable orientation of a planar discontinuity (dip direction / dip, degrees).
 * Dip direction is circular in [0, 360); dip is linear in [0, 90].
 */
public final class Orientation {

    private final double dipDirection;
    private final double dip;

    /**
     * @param dipDirection azimuth in degrees; any finite value, wrapped into [0, 360)
     * @param dip inclination in degrees, 0 to 90
     * @throws IllegalArgumentException if either value is non-finite or dip is out of range
     */
    public Orientation(final double dipDirection, final double dip) {
        if (!Double.isFinite(dipDirection)) {
            throw new IllegalArgumentException("Dip direction must be finite");
        }
        if (!Double.isFinite(dip) || dip < 0.0 || dip > 90.0) {
            throw new IllegalArgumentException("Dip must be between 0 and 90 degrees");
        }
        this.dipDirection = normalizeDipDirection(dipDirection);
        this.dip = dip;
    }

    public double getDipDirection() {
        return dipDirection;
    }

    public double getDip() {
        return dip;
    }

    /** Wraps any finite azimuth into [0, 360). */
    public static double normalizeDipDirection(final double degrees) {
        final double wrapped = degrees % 360.0;
        final double positive = wrapped < 0.0 ? wrapped + 360.0 : wrapped;
        // -1e-15 % 360 + 360 rounds to exactly 360
        return positive >= 360.0 ? 0.0 : positive;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Orientation)) return false;
        final Orientation that = (Orientation) o;
        return Double.compare(dipDirection, that.dipDirection) == 0
                && Double.compare(dip, that.dip) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dipDirection, dip);
    }

    /** Dip direction / dip, e.g. "045.0/65.0". */
    @Override
    public String toString() {
        return String.format(Locale.US, "%05.1f/%04.1f", dipDirection, dip);
    }
}
