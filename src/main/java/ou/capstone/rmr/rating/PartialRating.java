package ou.capstone.rmr.rating;

/**
 * One parameter's contribution to a total.
 *
 * @param basis short note on what the rating was read from, e.g. "RQD 78.2%"
 */
public record PartialRating(RatingComponent component, double rating, String basis) {
}
