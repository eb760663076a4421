package ou.capstone.rmr.rating;

/**
 * RMR rock-mass classes, best first.
 */
public enum RockMassClass {
    I("Very Good", 81.0),
    II("Good", 61.0),
    III("Fair", 41.0),
    IV("Poor", 21.0),
    V("Very Poor", 0.0);

    private final String quality;
    private final double minScore;

    RockMassClass(final String quality, final double minScore) {
        this.quality = quality;
        this.minScore = minScore;
    }

    public String quality() {
        return quality;
    }

    /** Inclusive lower bound of the band. */
    public double minScore() {
        return minScore;
    }

    /** e.g. "Class II – Good" */
    public String displayName() {
        return "Class " + name() + " – " + quality;
    }
}
