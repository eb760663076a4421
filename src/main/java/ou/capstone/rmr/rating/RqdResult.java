package ou.capstone.rmr.rating;

/**
 * RQD used for a unit and how it was obtained.
 *
 * @param percent RQD in [0, 100]
 * @param derived true when estimated from discontinuity frequency
 * @param frequencyPerM discontinuities per metre when derived, otherwise null
 */
public record RqdResult(double percent, boolean derived, Double frequencyPerM) {
}
