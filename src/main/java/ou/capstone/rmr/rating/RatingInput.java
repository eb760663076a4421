package ou.capstone.rmr.rating;

import java.util.List;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.model.Discontinuity;

/**
 * Everything a parameter rater may read for one station or family.
 */
public record RatingInput(
        String unitId,
        List<Discontinuity> members,
        RqdResult rqd,
        String ucsClass,
        double orientationPenalty,
        CodeDictionary dictionary
) {
    public RatingInput {
        members = List.copyOf(members);
    }
}
