package ou.capstone.rmr.family;

import java.util.List;

import ou.capstone.rmr.cluster.AdmissionMetric;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Orientation;

/**
 * A structural set: discontinuities grouped by orientation similarity.
 *
 * @param id "F1", "F2"... in formation order, prefixed by the station when clustered per station
 * @param members in input order; never shared with another family
 * @param toleranceDeg tolerance the family was formed with
 */
public record Family(
        String id,
        Orientation meanOrientation,
        List<Discontinuity> members,
        double toleranceDeg,
        AdmissionMetric metric
) {
    public Family {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
