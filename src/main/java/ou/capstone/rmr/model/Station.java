package ou.capstone.rmr.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import ou.capstone.rmr.exceptions.EmptyInputException;

/**
 * Discontinuities logged at one survey location, in traverse order.
 */
public final class Station {

    private final String id;
    private final List<Discontinuity> discontinuities;
    private final Double suppliedRqd;
    private final double traverseLengthM;

    private Station(final String id, final List<Discontinuity> discontinuities,
                    final Double suppliedRqd, final double traverseLengthM) {
        this.id = id;
        this.discontinuities = discontinuities;
        this.suppliedRqd = suppliedRqd;
        this.traverseLengthM = traverseLengthM;
    }

    /**
     * Creates a station whose traverse length is the furthest recorded distance.
     *
     * @param suppliedRqd directly measured RQD percentage, or null to derive it
     * @throws EmptyInputException if there are no discontinuities
     */
    public static Station of(final String id, final List<Discontinuity> discontinuities,
                             final Double suppliedRqd) throws EmptyInputException {
        Objects.requireNonNull(id, "id is required");
        if (discontinuities == null || discontinuities.isEmpty()) {
            throw new EmptyInputException("station " + id);
        }
        final double length = discontinuities.stream()
                .mapToDouble(Discontinuity::getDistanceM)
                .max()
                .orElse(0.0);
        return new Station(id, List.copyOf(discontinuities), suppliedRqd, length);
    }

    public String getId() {
        return id;
    }

    public List<Discontinuity> getDiscontinuities() {
        return discontinuities;
    }

    public int size() {
        return discontinuities.size();
    }

    public OptionalDouble getSuppliedRqd() {
        return suppliedRqd == null ? OptionalDouble.empty() : OptionalDouble.of(suppliedRqd);
    }

    public double getTraverseLengthM() {
        return traverseLengthM;
    }

    @Override
    public String toString() {
        return "Station{id='" + id + "', discontinuities=" + discontinuities.size()
                + ", traverseLengthM=" + traverseLengthM + ", suppliedRqd=" + suppliedRqd + '}';
    }
}
