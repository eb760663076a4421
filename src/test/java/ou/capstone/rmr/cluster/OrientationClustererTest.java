package ou.capstone.rmr.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ou.capstone.rmr.model.Orientation;

class OrientationClustererTest {

    private static List<Orientation> orientations(final double[][] values) {
        final List<Orientation> out = new ArrayList<>();
        for (double[] v : values) {
            out.add(new Orientation(v[0], v[1]));
        }
        return out;
    }

    @Test
    void tightSetFormsOneCluster() {
        final List<Orientation> input = orientations(new double[][] {
                {44, 64}, {46, 66}, {45, 65}, {47, 63}, {43, 67}, {48, 65}});

        final ClusterAssignment result = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD)
                .cluster(input);

        assertEquals(1, result.clusters().size());
        final OrientationCluster cluster = result.clusters().get(0);
        assertEquals(List.of(0, 1, 2, 3, 4, 5), cluster.memberIndices());
        assertEquals(45.5, cluster.mean().getDipDirection(), 0.01);
        assertEquals(65.0, cluster.mean().getDip(), 1e-9);
        assertTrue(result.unclustered().isEmpty());
    }

    @Test
    void clustersAcrossTheNorthSeam() {
        final List<Orientation> input = orientations(new double[][] {
                {355, 40}, {5, 42}, {358, 41}, {2, 39}});

        final ClusterAssignment result = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD)
                .cluster(input);

        assertEquals(1, result.clusters().size());
        assertEquals(4, result.clusters().get(0).size());
        assertTrue(OrientationMath.circularDistance(result.clusters().get(0).mean().getDipDirection(), 0.0) < 1e-6);
    }

    @Test
    void smallClustersAreDissolved() {
        final List<Orientation> input = orientations(new double[][] {
                {100, 30}, {104, 32}, {250, 70}, {252, 71}, {248, 69}});

        final ClusterAssignment result = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD)
                .cluster(input);

        assertEquals(1, result.clusters().size());
        assertEquals(List.of(2, 3, 4), result.clusters().get(0).memberIndices());
        assertEquals(List.of(0, 1), result.unclustered());
    }

    @Test
    void membersLeftBehindByTheMovingMeanAreEjected() {
        // each admission is within 10 degrees of the mean at the time, but the
        // mean ends up more than 10 degrees from the seed
        final List<Orientation> input = orientations(new double[][] {
                {0, 50}, {9, 50}, {14, 50}, {17, 50}, {19, 50}, {21, 50}});

        final ClusterAssignment result = new OrientationClusterer(10.0, 3, AdmissionMetric.TWO_THRESHOLD)
                .cluster(input);

        assertEquals(1, result.clusters().size());
        assertEquals(List.of(1, 2, 3, 4, 5), result.clusters().get(0).memberIndices());
        assertEquals(16.0, result.clusters().get(0).mean().getDipDirection(), 0.05);
        assertEquals(List.of(0), result.unclustered());
    }

    @Test
    void everyInputIsAssignedExactlyOnceAndMembersStayWithinTolerance() {
        final Random random = new Random(7);
        final List<Orientation> input = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            input.add(new Orientation(random.nextDouble() * 360.0, random.nextDouble() * 90.0));
        }

        for (AdmissionMetric metric : AdmissionMetric.values()) {
            final ClusterAssignment result = new OrientationClusterer(20.0, 2, metric).cluster(input);

            final List<Integer> seen = new ArrayList<>(result.unclustered());
            for (OrientationCluster c : result.clusters()) {
                assertTrue(c.size() >= 2);
                for (int idx : c.memberIndices()) {
                    assertTrue(metric.admits(c.mean(), input.get(idx), 20.0),
                            metric + ": member " + idx + " outside tolerance of " + c.mean());
                }
                seen.addAll(c.memberIndices());
            }
            Collections.sort(seen);
            final List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < input.size(); i++) {
                expected.add(i);
            }
            assertEquals(expected, seen, metric + " must partition the input");
        }
    }

    @Test
    void sameInputGivesSameClusters() {
        final List<Orientation> input = orientations(new double[][] {
                {10, 20}, {200, 80}, {15, 25}, {205, 78}, {12, 22}, {198, 82}, {90, 45}});
        final OrientationClusterer clusterer = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD);

        assertEquals(clusterer.cluster(input), clusterer.cluster(input));
    }

    @Test
    void wellSeparatedSetsDoNotDependOnInputOrder() {
        final List<Orientation> input = orientations(new double[][] {
                {44, 64}, {46, 66}, {45, 65}, {47, 63},
                {200, 30}, {202, 32}, {198, 28},
                {300, 80}, {302, 82}, {298, 79}});
        final OrientationClusterer clusterer = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD);
        final Set<Set<Orientation>> expected = memberSets(input, clusterer.cluster(input));
        assertEquals(3, expected.size());

        final Random random = new Random(42);
        for (int round = 0; round < 10; round++) {
            final List<Orientation> shuffled = new ArrayList<>(input);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, memberSets(shuffled, clusterer.cluster(shuffled)));
        }
    }

    @Test
    void greatCircleJoinsShallowPlanesTheTwoThresholdRuleSplits() {
        final List<Orientation> input = orientations(new double[][] {{0, 5}, {90, 5}, {45, 6}});

        final ClusterAssignment greatCircle = new OrientationClusterer(15.0, 3, AdmissionMetric.GREAT_CIRCLE)
                .cluster(input);
        final ClusterAssignment twoThreshold = new OrientationClusterer(15.0, 3, AdmissionMetric.TWO_THRESHOLD)
                .cluster(input);

        assertEquals(1, greatCircle.clusters().size());
        assertEquals(3, greatCircle.clusters().get(0).size());
        assertTrue(twoThreshold.clusters().isEmpty());
        assertEquals(List.of(0, 1, 2), twoThreshold.unclustered());
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> new OrientationClusterer(0.0, 3, AdmissionMetric.TWO_THRESHOLD));
        assertThrows(IllegalArgumentException.class,
                () -> new OrientationClusterer(15.0, 0, AdmissionMetric.TWO_THRESHOLD));
        assertTrue(new OrientationClusterer(15.0, 1, null).cluster(List.of()).clusters().isEmpty());
    }

    private static Set<Set<Orientation>> memberSets(final List<Orientation> input, final ClusterAssignment result) {
        final Set<Set<Orientation>> sets = new HashSet<>();
        for (OrientationCluster c : result.clusters()) {
            final Set<Orientation> members = new HashSet<>();
            for (int idx : c.memberIndices()) {
                members.add(input.get(idx));
            }
            sets.add(members);
        }
        return sets;
    }
}
