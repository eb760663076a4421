package ou.capstone.rmr.family;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.cluster.AdmissionMetric;
import ou.capstone.rmr.cluster.ClusterAssignment;
import ou.capstone.rmr.cluster.OrientationCluster;
import ou.capstone.rmr.cluster.OrientationClusterer;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Orientation;

/**
 * Groups discontinuities into families using {@link OrientationClusterer}.
 */
public final class FamilyClusterer {
    private static final Logger logger = LoggerFactory.getLogger(FamilyClusterer.class);

    private final OrientationClusterer clusterer;
    private final double toleranceDeg;
    private final AdmissionMetric metric;

    public FamilyClusterer(final double toleranceDeg, final int minMembers, final AdmissionMetric metric) {
        this.clusterer = new OrientationClusterer(toleranceDeg, minMembers, metric);
        this.toleranceDeg = toleranceDeg;
        this.metric = (metric != null) ? metric : AdmissionMetric.TWO_THRESHOLD;
    }

    public FamilyGrouping group(final List<Discontinuity> discontinuities) {
        return group(discontinuities, "");
    }

    /**
     * @param idPrefix prepended to "F1", "F2"...; empty for project-wide families
     */
    public FamilyGrouping group(final List<Discontinuity> discontinuities, final String idPrefix) {
        final List<Orientation> orientations = new ArrayList<>(discontinuities.size());
        for (Discontinuity d : discontinuities) {
            orientations.add(d.getOrientation());
        }

        final ClusterAssignment assignment = clusterer.cluster(orientations);

        final List<Family> families = new ArrayList<>();
        int n = 0;
        for (OrientationCluster c : assignment.clusters()) {
            final List<Discontinuity> members = new ArrayList<>(c.size());
            for (int idx : c.memberIndices()) {
                members.add(discontinuities.get(idx));
            }
            final Family family = new Family(idPrefix + "F" + (++n), c.mean(), members, toleranceDeg, metric);
            logger.debug("Family {}: {} members, mean {}", family.id(), family.size(), family.meanOrientation());
            families.add(family);
        }

        final List<Discontinuity> unclustered = new ArrayList<>(assignment.unclustered().size());
        for (int idx : assignment.unclustered()) {
            unclustered.add(discontinuities.get(idx));
        }

        logger.info("Formed {} families from {} discontinuities ({} unclustered)",
                families.size(), discontinuities.size(), unclustered.size());
        return new FamilyGrouping(families, unclustered);
    }
}
