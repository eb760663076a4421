package ou.capstone.rmr.rating;

import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.UnknownCodeException;

/**
 * Strength rating read from the UCS class; independent of the discontinuities.
 */
public final class StrengthRater implements ParameterRater {

    @Override
    public PartialRating rate(final RatingInput input) throws UnknownCodeException {
        final double rating = input.dictionary()
                .ratingFor(RmrParameter.STRENGTH, input.ucsClass(), "UCS class of " + input.unitId());
        return new PartialRating(RatingComponent.STRENGTH, rating, input.ucsClass());
    }
}
