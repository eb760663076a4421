package ou.capstone.rmr.rating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import ou.capstone.rmr.model.Discontinuity;

/**
 * Result of scoring one station or family. Created fresh per computation.
 *
 * @param unitId station id or family id
 * @param ratings the six partial ratings, in {@link RatingComponent} order
 * @param total sum of the partial ratings
 * @param representative member whose condition represents the group
 */
public record RmrScore(
        String unitId,
        Map<RatingComponent, PartialRating> ratings,
        double total,
        RockMassClass rockMassClass,
        RqdResult rqd,
        int memberCount,
        double meanSpacingMm,
        Discontinuity representative
) {
    public RmrScore {
        ratings = Collections.unmodifiableMap(new EnumMap<>(ratings));
    }

    /** Rating value of one component; 0 when absent. */
    public double rating(final RatingComponent component) {
        final PartialRating r = ratings.get(component);
        return r == null ? 0.0 : r.rating();
    }
}
