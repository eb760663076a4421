package ou.capstone.rmr.rating;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.model.Discontinuity;

/**
 * Rates the most frequent groundwater code among members.
 */
public final class GroundwaterRater implements ParameterRater {

    @Override
    public PartialRating rate(final RatingInput input) throws UnknownCodeException {
        final String dominant = DominantCode.of(input.members(), Discontinuity::getGroundwaterCode);
        final double rating = input.dictionary()
                .ratingFor(RmrParameter.GROUNDWATER, dominant, firstSourceOf(input, dominant));
        return new PartialRating(RatingComponent.GROUNDWATER, rating, "code " + dominant);
    }

    private static String firstSourceOf(final RatingInput input, final String code) {
        for (Discontinuity d : input.members()) {
            if (code != null && code.equals(CodeDictionary.normalizeCode(d.getGroundwaterCode()))) {
                return d.source();
            }
        }
        return input.unitId();
    }
}
