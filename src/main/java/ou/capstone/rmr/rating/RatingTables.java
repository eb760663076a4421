package ou.capstone.rmr.rating;

/**
 * Banded lookups from measured quantities to ratings (Bieniawski tables).
 */
public final class RatingTables {

    private RatingTables() {
    }

    /** RQD %: [90,100] 20, [75,90) 17, [50,75) 13, [25,50) 8, [0,25) 3. */
    public static double rqdRating(final double rqdPercent) {
        if (rqdPercent >= 90.0) return 20.0;
        if (rqdPercent >= 75.0) return 17.0;
        if (rqdPercent >= 50.0) return 13.0;
        if (rqdPercent >= 25.0) return 8.0;
        return 3.0;
    }

    /** Spacing in mm: >=2000 20, >=600 15, >=200 10, >=60 8, below 5. */
    public static double spacingRating(final double spacingMm) {
        if (spacingMm >= 2000.0) return 20.0;
        if (spacingMm >= 600.0) return 15.0;
        if (spacingMm >= 200.0) return 10.0;
        if (spacingMm >= 60.0) return 8.0;
        return 5.0;
    }
}
