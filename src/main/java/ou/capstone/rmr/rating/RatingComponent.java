package ou.capstone.rmr.rating;

/** The six additive RMR14 parameters, in report order. */
public enum RatingComponent {
    STRENGTH,
    RQD,
    SPACING,
    CONDITION,
    GROUNDWATER,
    ORIENTATION
}
