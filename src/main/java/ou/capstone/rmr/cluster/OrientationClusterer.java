package ou.capstone.rmr.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.model.Orientation;

/**
 * Greedy, first-fit grouping of orientations into clusters.
 *
 * <ol>
 *   <li>The first pending orientation seeds a cluster.</li>
 *   <li>Pending orientations are swept in input order; each joins the first cluster
 *       (in creation order) whose <em>current</em> mean admits it, and that mean is
 *       recomputed immediately.</li>
 *   <li>Sweeps repeat until one admits nothing; then the next pending orientation
 *       seeds a new cluster. This continues until nothing is pending.</li>
 *   <li>Members that the moving mean has left outside the tolerance are ejected,
 *       farthest first, until every member is within tolerance of the final mean.</li>
 *   <li>Clusters smaller than the minimum membership are dissolved.</li>
 * </ol>
 * Ejected and dissolved members are reported as unclustered. The result depends
 * only on the input order, so identical input always gives identical clusters.
 */
public final class OrientationClusterer {
    private static final Logger logger = LoggerFactory.getLogger(OrientationClusterer.class);

    private final double toleranceDeg;
    private final int minMembers;
    private final AdmissionMetric metric;

    public OrientationClusterer(final double toleranceDeg, final int minMembers, final AdmissionMetric metric) {
        if (!Double.isFinite(toleranceDeg) || toleranceDeg <= 0.0) {
            throw new IllegalArgumentException("Tolerance must be positive");
        }
        if (minMembers < 1) {
            throw new IllegalArgumentException("Minimum membership must be at least 1");
        }
        this.toleranceDeg = toleranceDeg;
        this.minMembers = minMembers;
        this.metric = (metric != null) ? metric : AdmissionMetric.TWO_THRESHOLD;
    }

    public ClusterAssignment cluster(final List<Orientation> orientations) {
        final List<Candidate> candidates = new ArrayList<>();
        final List<Integer> pending = new LinkedList<>();
        for (int i = 0; i < orientations.size(); i++) {
            pending.add(i);
        }

        while (!pending.isEmpty()) {
            final int seed = pending.remove(0);
            candidates.add(new Candidate(seed, orientations.get(seed)));

            boolean admitted;
            do {
                admitted = false;
                final Iterator<Integer> it = pending.iterator();
                while (it.hasNext()) {
                    final int idx = it.next();
                    final Candidate target = firstAdmitting(candidates, orientations.get(idx));
                    if (target != null) {
                        target.admit(idx, orientations.get(idx));
                        it.remove();
                        admitted = true;
                    }
                }
            } while (admitted && !pending.isEmpty());
        }

        final List<OrientationCluster> clusters = new ArrayList<>();
        final List<Integer> unclustered = new ArrayList<>();
        for (Candidate c : candidates) {
            unclustered.addAll(c.ejectOutliers());
            if (c.size() >= minMembers) {
                clusters.add(c.toCluster());
            } else {
                unclustered.addAll(c.indices);
            }
        }
        Collections.sort(unclustered);

        logger.debug("Clustered {} orientations into {} clusters ({} unclustered, tolerance={}, min={}, metric={})",
                orientations.size(), clusters.size(), unclustered.size(), toleranceDeg, minMembers, metric);
        return new ClusterAssignment(clusters, unclustered);
    }

    private Candidate firstAdmitting(final List<Candidate> candidates, final Orientation o) {
        for (Candidate c : candidates) {
            if (metric.admits(c.mean, o, toleranceDeg)) {
                return c;
            }
        }
        return null;
    }

    /** Cluster under construction. */
    private final class Candidate {
        private final List<Integer> indices = new ArrayList<>();
        private final List<Orientation> members = new ArrayList<>();
        private Orientation mean;

        Candidate(final int seed, final Orientation o) {
            admit(seed, o);
        }

        void admit(final int idx, final Orientation o) {
            indices.add(idx);
            members.add(o);
            mean = OrientationMath.mean(members);
        }

        int size() {
            return indices.size();
        }

        /**
         * Removes members beyond tolerance of the mean, one at a time, re-averaging
         * after each removal. Ties on distance eject the later input first.
         */
        List<Integer> ejectOutliers() {
            final List<Integer> ejected = new ArrayList<>();
            while (members.size() > 1) {
                int worst = -1;
                double worstDeviation = toleranceDeg;
                for (int i = 0; i < members.size(); i++) {
                    if (metric.admits(mean, members.get(i), toleranceDeg)) continue;
                    final double deviation = metric.deviation(mean, members.get(i));
                    if (worst < 0 || deviation > worstDeviation
                            || (deviation == worstDeviation && indices.get(i) > indices.get(worst))) {
                        worst = i;
                        worstDeviation = deviation;
                    }
                }
                if (worst < 0) break;
                logger.debug("Ejecting orientation #{} {} from cluster with mean {}",
                        indices.get(worst), members.get(worst), mean);
                ejected.add(indices.remove(worst));
                members.remove(worst);
                mean = OrientationMath.mean(members);
            }
            return ejected;
        }

        OrientationCluster toCluster() {
            final List<Integer> sorted = new ArrayList<>(indices);
            Collections.sort(sorted);
            return new OrientationCluster(sorted, mean);
        }
    }
}
