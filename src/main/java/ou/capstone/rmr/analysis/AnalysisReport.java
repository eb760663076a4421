package ou.capstone.rmr.analysis;

import java.util.List;

import ou.capstone.rmr.family.FamilyStatistics;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.rating.RmrScore;
import ou.capstone.rmr.validation.RejectedRecord;

/**
 * Everything one analysis run produced. Successful units and failed units are
 * listed side by side; one failure never hides the others.
 */
public record AnalysisReport(
        ProjectSummary summary,
        List<RmrScore> stationScores,
        List<FamilyStatistics> families,
        List<Discontinuity> unclustered,
        List<RejectedRecord> rejected,
        List<UnitFailure> failures
) {
    public AnalysisReport {
        stationScores = List.copyOf(stationScores);
        families = List.copyOf(families);
        unclustered = List.copyOf(unclustered);
        rejected = List.copyOf(rejected);
        failures = List.copyOf(failures);
    }
}
