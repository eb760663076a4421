package ou.capstone.rmr.rating;

import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.exceptions.InsufficientDataException;

/**
 * Rock Quality Designation from a direct measurement or from discontinuity frequency.
 *
 * Frequency estimate (Priest and Hudson): RQD = 100 e^(-0.1 lambda) (0.1 lambda + 1),
 * with lambda in discontinuities per metre.
 */
public final class RqdEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RqdEstimator.class);

    private RqdEstimator() {
    }

    /** Uses a measured RQD verbatim, clamped to [0, 100]. */
    public static RqdResult supplied(final double rqdPercent) {
        return new RqdResult(clamp(rqdPercent), false, null);
    }

    public static RqdResult fromFrequency(final double lambdaPerM, final String unitId)
            throws InsufficientDataException {
        if (!Double.isFinite(lambdaPerM) || lambdaPerM < 0.0) {
            throw new InsufficientDataException(unitId, "Discontinuity frequency " + lambdaPerM + " cannot yield RQD");
        }
        final double x = 0.1 * lambdaPerM;
        final double rqd = 100.0 * Math.exp(-x) * (x + 1.0);
        return new RqdResult(clamp(rqd), true, lambdaPerM);
    }

    /** Derives frequency as count / length, then estimates. */
    public static RqdResult fromTraverse(final int count, final double lengthM, final String unitId)
            throws InsufficientDataException {
        if (count <= 0 || !Double.isFinite(lengthM) || lengthM <= 0.0) {
            throw new InsufficientDataException(unitId,
                    "RQD not supplied and traverse length " + lengthM + " m with " + count + " discontinuities gives no frequency");
        }
        return fromFrequency(count / lengthM, unitId);
    }

    /**
     * Prefers a supplied value, falling back to the traverse estimate.
     */
    public static RqdResult resolve(final OptionalDouble supplied, final int count, final double lengthM,
                                    final String unitId) throws InsufficientDataException {
        if (supplied.isPresent()) {
            return supplied(supplied.getAsDouble());
        }
        final RqdResult result = fromTraverse(count, lengthM, unitId);
        logger.debug("Derived RQD {} for {} from lambda={}", result.percent(), unitId, result.frequencyPerM());
        return result;
    }

    private static double clamp(final double rqd) {
        if (Double.isNaN(rqd)) return 0.0;
        return Math.max(0.0, Math.min(100.0, rqd));
    }
}
