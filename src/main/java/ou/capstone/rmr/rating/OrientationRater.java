package ou.capstone.rmr.rating;

import java.util.Locale;

/**
 * Applies the run's fixed orientation adjustment; not derived from geometry.
 */
public final class OrientationRater implements ParameterRater {

    @Override
    public PartialRating rate(final RatingInput input) {
        final double penalty = input.orientationPenalty();
        return new PartialRating(RatingComponent.ORIENTATION, penalty,
                String.format(Locale.ROOT, "fixed %.0f", penalty));
    }
}
