package ou.capstone.rmr;

import java.util.Locale;
import java.util.Objects;

import ou.capstone.rmr.cluster.AdmissionMetric;

/**
 * Inputs that shape one analysis run. Defaults: UCS class R4, orientation penalty -5,
 * tolerance 15 degrees, minimum family size 3, two-threshold admission, families
 * formed across the whole project.
 */
public final class AnalysisConfig {

    /** Whether families are formed over all stations together or per station. */
    public enum ClusterScope {
        PROJECT, STATION;

        public static ClusterScope parse(final String text) {
            if (text == null) {
                throw new IllegalArgumentException("Cluster scope is required");
            }
            try {
                return valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown cluster scope '" + text
                        + "' (expected project or station)", e);
            }
        }
    }

    public static final String DEFAULT_UCS_CLASS = "R4";
    public static final double DEFAULT_ORIENTATION_PENALTY = -5.0;
    public static final double DEFAULT_TOLERANCE_DEG = 15.0;
    public static final int DEFAULT_MIN_MEMBERS = 3;

    // Most unfavourable RMR orientation adjustment (slopes)
    private static final double MIN_ORIENTATION_PENALTY = -60.0;

    private final String ucsClass;
    private final double orientationPenalty;
    private final double toleranceDeg;
    private final int minMembers;
    private final AdmissionMetric metric;
    private final ClusterScope clusterScope;

    public static class Builder {
        private String ucsClass = DEFAULT_UCS_CLASS;
        private double orientationPenalty = DEFAULT_ORIENTATION_PENALTY;
        private double toleranceDeg = DEFAULT_TOLERANCE_DEG;
        private int minMembers = DEFAULT_MIN_MEMBERS;
        private AdmissionMetric metric = AdmissionMetric.TWO_THRESHOLD;
        private ClusterScope clusterScope = ClusterScope.PROJECT;

        public Builder ucsClass(String ucsClass) {
            this.ucsClass = ucsClass;
            return this;
        }

        public Builder orientationPenalty(double orientationPenalty) {
            this.orientationPenalty = orientationPenalty;
            return this;
        }

        public Builder toleranceDeg(double toleranceDeg) {
            this.toleranceDeg = toleranceDeg;
            return this;
        }

        public Builder minMembers(int minMembers) {
            this.minMembers = minMembers;
            return this;
        }

        public Builder metric(AdmissionMetric metric) {
            this.metric = metric;
            return this;
        }

        public Builder clusterScope(ClusterScope clusterScope) {
            this.clusterScope = clusterScope;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is outside its allowed range
         */
        public AnalysisConfig build() {
            if (ucsClass == null || ucsClass.isBlank()) {
                throw new IllegalArgumentException("UCS class is required");
            }
            if (!Double.isFinite(orientationPenalty)
                    || orientationPenalty > 0.0 || orientationPenalty < MIN_ORIENTATION_PENALTY) {
                throw new IllegalArgumentException("Orientation penalty must be between "
                        + MIN_ORIENTATION_PENALTY + " and 0");
            }
            if (!Double.isFinite(toleranceDeg) || toleranceDeg <= 0.0 || toleranceDeg > 90.0) {
                throw new IllegalArgumentException("Tolerance must be in (0, 90] degrees");
            }
            if (minMembers < 1) {
                throw new IllegalArgumentException("Minimum family membership must be at least 1");
            }
            Objects.requireNonNull(metric, "metric is required");
            Objects.requireNonNull(clusterScope, "clusterScope is required");
            return new AnalysisConfig(this);
        }
    }

    private AnalysisConfig(final Builder builder) {
        this.ucsClass = builder.ucsClass.trim();
        this.orientationPenalty = builder.orientationPenalty;
        this.toleranceDeg = builder.toleranceDeg;
        this.minMembers = builder.minMembers;
        this.metric = builder.metric;
        this.clusterScope = builder.clusterScope;
    }

    public static AnalysisConfig defaults() {
        return new Builder().build();
    }

    public String getUcsClass() { return ucsClass; }
    public double getOrientationPenalty() { return orientationPenalty; }
    public double getToleranceDeg() { return toleranceDeg; }
    public int getMinMembers() { return minMembers; }
    public AdmissionMetric getMetric() { return metric; }
    public ClusterScope getClusterScope() { return clusterScope; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "AnalysisConfig{ucsClass=%s, orientationPenalty=%.1f, toleranceDeg=%.1f, minMembers=%d, metric=%s, clusterScope=%s}",
                ucsClass, orientationPenalty, toleranceDeg, minMembers, metric, clusterScope);
    }
}
