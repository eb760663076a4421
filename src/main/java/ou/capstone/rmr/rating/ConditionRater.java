package ou.capstone.rmr.rating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.model.Discontinuity;

/**
 * Condition of discontinuities: persistence + aperture + roughness + infill + weathering.
 *
 * Each sub-rating is the lowest found among the members, never an average, so the
 * five contributions may come from different members. The member with the lowest
 * summed sub-rating is kept as the representative for reports; ties keep the earliest.
 */
public final class ConditionRater implements ParameterRater {
    private static final Logger logger = LoggerFactory.getLogger(ConditionRater.class);

    /** Worst sub-rating per parameter across the group, plus the weakest single member. */
    public record WorstCase(Discontinuity representative, Map<RmrParameter, Double> subRatings, double total) {
        public WorstCase {
            subRatings = Collections.unmodifiableMap(new EnumMap<>(subRatings));
        }
    }

    @Override
    public PartialRating rate(final RatingInput input) throws UnknownCodeException {
        final WorstCase worst = worstCase(input.members(), input.dictionary());
        return new PartialRating(RatingComponent.CONDITION, worst.total(),
                "weakest " + worst.representative().source());
    }

    /**
     * Every member's codes are resolved, so an unknown code anywhere in the group
     * fails the rating even if that member would not be the worst.
     *
     * @param members non-empty
     */
    public static WorstCase worstCase(final List<Discontinuity> members, final CodeDictionary dictionary)
            throws UnknownCodeException {
        final Map<RmrParameter, Double> lowest = new EnumMap<>(RmrParameter.class);
        Discontinuity representative = null;
        double representativeSum = Double.POSITIVE_INFINITY;
        for (Discontinuity d : members) {
            double memberSum = 0.0;
            for (RmrParameter p : RmrParameter.CONDITION) {
                final double r = dictionary.ratingFor(p, d.codeFor(p), d.source());
                lowest.merge(p, r, Math::min);
                memberSum += r;
            }
            if (memberSum < representativeSum) {
                representative = d;
                representativeSum = memberSum;
            }
        }
        if (representative == null) {
            throw new IllegalArgumentException("members must not be empty");
        }
        double total = 0.0;
        for (double r : lowest.values()) {
            total += r;
        }
        final WorstCase worst = new WorstCase(representative, lowest, total);
        logger.debug("Condition {} from per-parameter minima, weakest member {}", worst.total(),
                worst.representative().source());
        return worst;
    }
}
