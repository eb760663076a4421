package ou.capstone.rmr.family;

import java.util.List;

import ou.capstone.rmr.rating.RmrScore;

/**
 * Summary of one family, including its own RMR score.
 *
 * @param stationIds stations contributing members, in first-seen order
 * @param maxDeviationDeg largest member distance from the mean under the family's metric
 */
public record FamilyStatistics(
        Family family,
        RmrScore score,
        String dominantTypeCode,
        String dominantTypeName,
        List<String> stationIds,
        double maxDeviationDeg
) {
    public FamilyStatistics {
        stationIds = List.copyOf(stationIds);
    }
}
