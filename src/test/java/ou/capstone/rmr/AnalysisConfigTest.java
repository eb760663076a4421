package ou.capstone.rmr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import ou.capstone.rmr.cluster.AdmissionMetric;

class AnalysisConfigTest {

    @Test
    void defaults() {
        final AnalysisConfig config = AnalysisConfig.defaults();

        assertEquals("R4", config.getUcsClass());
        assertEquals(-5.0, config.getOrientationPenalty(), 0.0);
        assertEquals(15.0, config.getToleranceDeg(), 0.0);
        assertEquals(3, config.getMinMembers());
        assertEquals(AdmissionMetric.TWO_THRESHOLD, config.getMetric());
        assertEquals(AnalysisConfig.ClusterScope.PROJECT, config.getClusterScope());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().orientationPenalty(2.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().orientationPenalty(-61.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().toleranceDeg(0.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().toleranceDeg(91.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().minMembers(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisConfig.Builder().ucsClass(" ").build());
    }

    @Test
    void clusterScopeParsesCaseInsensitively() {
        assertEquals(AnalysisConfig.ClusterScope.STATION, AnalysisConfig.ClusterScope.parse(" Station"));
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.ClusterScope.parse("site"));
    }
}
