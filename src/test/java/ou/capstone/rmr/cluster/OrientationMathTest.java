package ou.capstone.rmr.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import ou.capstone.rmr.model.Orientation;

class OrientationMathTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void circularDistanceTakesTheShortWayRound() {
        assertEquals(2.0, OrientationMath.circularDistance(359.0, 1.0), TOLERANCE);
        assertEquals(0.0, OrientationMath.circularDistance(10.0, 10.0), TOLERANCE);
        assertEquals(180.0, OrientationMath.circularDistance(0.0, 180.0), TOLERANCE);
        assertEquals(20.0, OrientationMath.circularDistance(-10.0, 10.0), TOLERANCE);
        assertEquals(OrientationMath.circularDistance(30.0, 300.0),
                OrientationMath.circularDistance(300.0, 30.0), TOLERANCE);
    }

    @Test
    void circularMeanHandlesTheNorthSeam() {
        final double mean = OrientationMath.circularMeanDirection(List.of(
                new Orientation(350.0, 40.0), new Orientation(10.0, 40.0)));

        assertTrue(OrientationMath.circularDistance(mean, 0.0) < 1e-6, "mean was " + mean);
        assertTrue(mean >= 0.0 && mean < 360.0);
    }

    @Test
    void meanUsesVectorDirectionAndArithmeticDip() {
        final Orientation mean = OrientationMath.mean(List.of(
                new Orientation(40.0, 60.0), new Orientation(50.0, 70.0)));

        assertEquals(45.0, mean.getDipDirection(), 1e-6);
        assertEquals(65.0, mean.getDip(), TOLERANCE);
        assertThrows(IllegalArgumentException.class, () -> OrientationMath.mean(List.of()));
    }

    @Test
    void angleBetweenPlanesUsesNormals() {
        // two gently dipping planes 90 degrees apart in azimuth are only ~7 degrees apart as planes
        assertEquals(7.07, OrientationMath.angleBetweenPlanes(
                new Orientation(0.0, 5.0), new Orientation(90.0, 5.0)), 0.01);
        // a vertical plane is the same plane whichever way it is said to dip
        assertEquals(0.0, OrientationMath.angleBetweenPlanes(
                new Orientation(0.0, 90.0), new Orientation(180.0, 90.0)), 1e-3);
        assertEquals(90.0, OrientationMath.angleBetweenPlanes(
                new Orientation(0.0, 0.0), new Orientation(0.0, 90.0)), 1e-6);
    }

    @Test
    void metricsParseFromCliSpelling() {
        assertEquals(AdmissionMetric.TWO_THRESHOLD, AdmissionMetric.parse("two-threshold"));
        assertEquals(AdmissionMetric.GREAT_CIRCLE, AdmissionMetric.parse(" Great-Circle "));
        assertThrows(IllegalArgumentException.class, () -> AdmissionMetric.parse("fisher"));
        assertThrows(IllegalArgumentException.class, () -> AdmissionMetric.parse(null));
    }
}
