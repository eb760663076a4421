package ou.capstone.rmr.analysis;

import ou.capstone.rmr.rating.RockMassClass;

/**
 * Project-wide figures over all scored stations.
 *
 * @param meanRmr mean station total, null when no station could be scored
 * @param dominantClass most frequent station class (ties favour the better class), null when none
 */
public record ProjectSummary(
        int stationCount,
        int validRecords,
        int rejectedRecords,
        Double meanRmr,
        RockMassClass dominantClass,
        int familyCount,
        int unclusteredCount
) {
}
