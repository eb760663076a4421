package ou.capstone.rmr.rating;

import java.util.Locale;

/**
 * Bands the unit's RQD.
 */
public final class RqdRater implements ParameterRater {

    @Override
    public PartialRating rate(final RatingInput input) {
        final RqdResult rqd = input.rqd();
        final String basis = String.format(Locale.ROOT, "RQD %.1f%%%s", rqd.percent(),
                rqd.derived() ? " (derived)" : "");
        return new PartialRating(RatingComponent.RQD, RatingTables.rqdRating(rqd.percent()), basis);
    }
}
