package ou.capstone.rmr.rating;

import ou.capstone.rmr.exceptions.InvalidRangeException;

/**
 * Maps a total RMR score onto its class. Bands are closed-open except the top one,
 * which includes 100: [81,100] I, [61,81) II, [41,61) III, [21,41) IV, [0,21) V.
 */
public final class ClassificationMapper {

    private ClassificationMapper() {
    }

    public static RockMassClass classify(final double total) throws InvalidRangeException {
        return classify(total, null);
    }

    /**
     * @param source unit the total belongs to, carried into the exception
     * @throws InvalidRangeException when the total is outside [0, 100] or not a number
     */
    public static RockMassClass classify(final double total, final String source) throws InvalidRangeException {
        if (Double.isNaN(total) || total < 0.0 || total > 100.0) {
            throw new InvalidRangeException("RMR total", total, "[0, 100]", source);
        }
        for (RockMassClass c : RockMassClass.values()) {
            if (total >= c.minScore()) {
                return c;
            }
        }
        return RockMassClass.V;
    }
}
