package ou.capstone.rmr.rating;

import ou.capstone.rmr.exceptions.RmrException;

/**
 * Produces the rating of a single RMR parameter for a group of discontinuities.
 */
@FunctionalInterface
public interface ParameterRater {

    /**
     * @param input the unit being scored; members are never empty
     * @return the partial rating
     * @throws RmrException when a code is unknown or data is missing; never defaults
     */
    PartialRating rate(RatingInput input) throws RmrException;
}
