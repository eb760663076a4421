package ou.capstone.rmr.rating;

import java.util.List;
import java.util.Locale;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.model.Discontinuity;

/**
 * Converts each member's spacing code to millimetres, averages, then bands.
 */
public final class SpacingRater implements ParameterRater {

    @Override
    public PartialRating rate(final RatingInput input) throws UnknownCodeException {
        final double meanMm = meanSpacingMm(input.members(), input.dictionary());
        return new PartialRating(RatingComponent.SPACING, RatingTables.spacingRating(meanMm),
                String.format(Locale.ROOT, "mean %.0f mm", meanMm));
    }

    public static double meanSpacingMm(final List<Discontinuity> members, final CodeDictionary dictionary)
            throws UnknownCodeException {
        double sum = 0.0;
        for (Discontinuity d : members) {
            sum += dictionary.ratingFor(RmrParameter.SPACING, d.getSpacingCode(), d.source());
        }
        return members.isEmpty() ? 0.0 : sum / members.size();
    }
}
