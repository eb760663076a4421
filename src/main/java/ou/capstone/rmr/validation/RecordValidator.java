package ou.capstone.rmr.validation;

import java.util.ArrayList;
import java.util.List;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.InvalidRangeException;
import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Orientation;

/**
 * Turns raw rows into discontinuities, collecting every problem in a row rather
 * than stopping at the first.
 *
 * Dip direction wraps modulo 360. Dip up to {@value #DIP_CLAMP_MARGIN_DEG} degrees
 * outside [0, 90] is clamped as a reading error; beyond that the row is rejected.
 */
public final class RecordValidator {

    static final double DIP_CLAMP_MARGIN_DEG = 1.0;

    private static final RmrParameter[] RECORD_CODES = {
            RmrParameter.STRUCTURE_TYPE, RmrParameter.SPACING, RmrParameter.PERSISTENCE, RmrParameter.APERTURE,
            RmrParameter.ROUGHNESS, RmrParameter.INFILL, RmrParameter.WEATHERING, RmrParameter.GROUNDWATER
    };

    private final CodeDictionary dictionary;

    public RecordValidator(final CodeDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public ValidationResult validate(final RawRecord raw) {
        final List<RmrException> errors = new ArrayList<>();
        final String station = blankToNull(raw.station());
        final String source = "row " + raw.row() + (station == null ? "" : " (station " + station + ")");

        if (station == null) {
            errors.add(new RmrException("Missing station id at " + source));
        }

        final double distance = parse(raw.distanceM(), "distance", source, errors);
        if (Double.isFinite(distance) && distance < 0.0) {
            errors.add(new InvalidRangeException("distance", distance, "[0, inf)", source));
        }

        final double dipDirection = parse(raw.dipDirection(), "dip direction", source, errors);
        final double rawDip = parse(raw.dip(), "dip", source, errors);
        double dip = rawDip;
        if (Double.isFinite(rawDip)) {
            if (rawDip < -DIP_CLAMP_MARGIN_DEG || rawDip > 90.0 + DIP_CLAMP_MARGIN_DEG) {
                errors.add(new InvalidRangeException("dip", rawDip, "[0, 90]", source));
            } else {
                dip = Math.max(0.0, Math.min(90.0, rawDip));
            }
        }

        final String[] codes = {
                raw.type(), raw.spacing(), raw.persistence(), raw.aperture(),
                raw.roughness(), raw.infill(), raw.weathering(), raw.groundwater()
        };
        for (int i = 0; i < RECORD_CODES.length; i++) {
            if (!dictionary.contains(RECORD_CODES[i], codes[i])) {
                errors.add(new UnknownCodeException(RECORD_CODES[i], codes[i], source));
            }
        }

        Double rqd = null;
        if (blankToNull(raw.rqdPercent()) != null) {
            final double value = parse(raw.rqdPercent(), "RQD", source, errors);
            if (Double.isFinite(value)) {
                rqd = value;
            }
        }

        if (!errors.isEmpty()) {
            return ValidationResult.error(errors);
        }

        final Discontinuity d = new Discontinuity.Builder()
                .stationId(station)
                .row(raw.row())
                .distanceM(distance)
                .typeCode(raw.type().trim())
                .orientation(new Orientation(dipDirection, dip))
                .spacingCode(raw.spacing().trim())
                .persistenceCode(raw.persistence().trim())
                .apertureCode(raw.aperture().trim())
                .roughnessCode(raw.roughness().trim())
                .infillCode(raw.infill().trim())
                .weatheringCode(raw.weathering().trim())
                .groundwaterCode(raw.groundwater().trim())
                .build();
        return ValidationResult.success(d, rqd);
    }

    /** Parses a number, recording a range error for blank, malformed or non-finite text. */
    private static double parse(final String text, final String field, final String source,
                                final List<RmrException> errors) {
        if (text == null || text.isBlank()) {
            errors.add(new InvalidRangeException(field, Double.NaN, "a number (blank)", source));
            return Double.NaN;
        }
        try {
            final double value = Double.parseDouble(text.trim());
            if (!Double.isFinite(value)) {
                errors.add(new InvalidRangeException(field, value, "finite values", source));
            }
            return value;
        } catch (NumberFormatException e) {
            errors.add(new RmrException(field + " '" + text + "' is not a number at " + source, e));
            return Double.NaN;
        }
    }

    private static String blankToNull(final String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
