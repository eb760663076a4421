package ou.capstone.rmr.model;

import java.util.Objects;

import ou.capstone.rmr.codes.RmrParameter;

/**
 * One measured structural feature, as recorded on a scanline.
 * Immutable once built; codes are kept as recorded and resolved through the
 * code dictionary when scored.
 */
public class Discontinuity {
    private final String stationId;
    private final int row;               // 1-based line in the source file, 0 when built in code
    private final double distanceM;      // cumulative distance along the traverse
    private final String typeCode;       // ex: J, F, SH
    private final Orientation orientation;
    private final String spacingCode;
    private final String persistenceCode;
    private final String apertureCode;
    private final String roughnessCode;
    private final String infillCode;
    private final String weatheringCode;
    private final String groundwaterCode;

    /**
     * Builder for the eleven measured attributes plus provenance.
     * All codes and the station id are required.
     */
    public static class Builder {
        private String stationId;
        private int row;
        private double distanceM;
        private String typeCode;
        private Orientation orientation;
        private String spacingCode;
        private String persistenceCode;
        private String apertureCode;
        private String roughnessCode;
        private String infillCode;
        private String weatheringCode;
        private String groundwaterCode;

        public Builder stationId(String stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder row(int row) {
            this.row = row;
            return this;
        }

        public Builder distanceM(double distanceM) {
            this.distanceM = distanceM;
            return this;
        }

        public Builder typeCode(String typeCode) {
            this.typeCode = typeCode;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder orientation(double dipDirection, double dip) {
            this.orientation = new Orientation(dipDirection, dip);
            return this;
        }

        public Builder spacingCode(String spacingCode) {
            this.spacingCode = spacingCode;
            return this;
        }

        public Builder persistenceCode(String persistenceCode) {
            this.persistenceCode = persistenceCode;
            return this;
        }

        public Builder apertureCode(String apertureCode) {
            this.apertureCode = apertureCode;
            return this;
        }

        public Builder roughnessCode(String roughnessCode) {
            this.roughnessCode = roughnessCode;
            return this;
        }

        public Builder infillCode(String infillCode) {
            this.infillCode = infillCode;
            return this;
        }

        public Builder weatheringCode(String weatheringCode) {
            this.weatheringCode = weatheringCode;
            return this;
        }

        public Builder groundwaterCode(String groundwaterCode) {
            this.groundwaterCode = groundwaterCode;
            return this;
        }

        public Discontinuity build() {
            Objects.requireNonNull(stationId, "stationId is required");
            Objects.requireNonNull(typeCode, "typeCode is required");
            Objects.requireNonNull(orientation, "orientation is required");
            Objects.requireNonNull(spacingCode, "spacingCode is required");
            Objects.requireNonNull(persistenceCode, "persistenceCode is required");
            Objects.requireNonNull(apertureCode, "apertureCode is required");
            Objects.requireNonNull(roughnessCode, "roughnessCode is required");
            Objects.requireNonNull(infillCode, "infillCode is required");
            Objects.requireNonNull(weatheringCode, "weatheringCode is required");
            Objects.requireNonNull(groundwaterCode, "groundwaterCode is required");
            if (!Double.isFinite(distanceM) || distanceM < 0.0) {
                throw new IllegalArgumentException("distanceM must be finite and non-negative");
            }
            return new Discontinuity(this);
        }
    }

    private Discontinuity(Builder builder) {
        this.stationId = builder.stationId;
        this.row = builder.row;
        this.distanceM = builder.distanceM;
        this.typeCode = builder.typeCode;
        this.orientation = builder.orientation;
        this.spacingCode = builder.spacingCode;
        this.persistenceCode = builder.persistenceCode;
        this.apertureCode = builder.apertureCode;
        this.roughnessCode = builder.roughnessCode;
        this.infillCode = builder.infillCode;
        this.weatheringCode = builder.weatheringCode;
        this.groundwaterCode = builder.groundwaterCode;
    }

    public String getStationId() { return stationId; }
    public int getRow() { return row; }
    public double getDistanceM() { return distanceM; }
    public String getTypeCode() { return typeCode; }
    public Orientation getOrientation() { return orientation; }
    public String getSpacingCode() { return spacingCode; }
    public String getPersistenceCode() { return persistenceCode; }
    public String getApertureCode() { return apertureCode; }
    public String getRoughnessCode() { return roughnessCode; }
    public String getInfillCode() { return infillCode; }
    public String getWeatheringCode() { return weatheringCode; }
    public String getGroundwaterCode() { return groundwaterCode; }

    /** The recorded code for a coded parameter; STRENGTH is per station, not per record. */
    public String codeFor(final RmrParameter parameter) {
        return switch (parameter) {
            case STRUCTURE_TYPE -> typeCode;
            case SPACING        -> spacingCode;
            case PERSISTENCE    -> persistenceCode;
            case APERTURE       -> apertureCode;
            case ROUGHNESS      -> roughnessCode;
            case INFILL         -> infillCode;
            case WEATHERING     -> weatheringCode;
            case GROUNDWATER    -> groundwaterCode;
            case STRENGTH       -> throw new IllegalArgumentException("Strength is not recorded per discontinuity");
        };
    }

    /** Human-readable provenance for error messages, e.g. "row 12 (station E-3)". */
    public String source() {
        return (row > 0 ? "row " + row : "record") + " (station " + stationId + ")";
    }

    @Override
    public String toString() {
        return "Discontinuity{" +
                "stationId='" + stationId + '\'' +
                ", row=" + row +
                ", distanceM=" + distanceM +
                ", type='" + typeCode + '\'' +
                ", orientation=" + orientation +
                ", spacing='" + spacingCode + '\'' +
                ", persistence='" + persistenceCode + '\'' +
                ", aperture='" + apertureCode + '\'' +
                ", roughness='" + roughnessCode + '\'' +
                ", infill='" + infillCode + '\'' +
                ", weathering='" + weatheringCode + '\'' +
                ", groundwater='" + groundwaterCode + '\'' +
                '}';
    }
}
