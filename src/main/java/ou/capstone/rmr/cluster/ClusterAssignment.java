package ou.capstone.rmr.cluster;

import java.util.List;

/**
 * Clusters plus the input positions that belong to none. Every input position
 * appears exactly once across both.
 */
public record ClusterAssignment(List<OrientationCluster> clusters, List<Integer> unclustered) {
    public ClusterAssignment {
        clusters = List.copyOf(clusters);
        unclustered = List.copyOf(unclustered);
    }
}
