package ou.capstone.rmr.family;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.EmptyInputException;
import ou.capstone.rmr.exceptions.InsufficientDataException;
import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Station;
import ou.capstone.rmr.rating.DominantCode;
import ou.capstone.rmr.rating.RmrCalculator;
import ou.capstone.rmr.rating.RmrScore;
import ou.capstone.rmr.rating.RqdEstimator;
import ou.capstone.rmr.rating.RqdResult;

/**
 * Scores each family on its own members and gathers its summary statistics.
 *
 * A family's RQD is estimated from the set's own frequency: its member count
 * over the summed traverse length of the stations it draws from. When those
 * stations give no length, the RQD measured at them is used instead, weighted
 * by how many members each station contributes.
 */
public final class FamilyStatisticsAggregator {
    private static final Logger logger = LoggerFactory.getLogger(FamilyStatisticsAggregator.class);

    private final RmrCalculator calculator;

    public FamilyStatisticsAggregator(final RmrCalculator calculator) {
        this.calculator = calculator;
    }

    /**
     * @param stations contributing stations by id
     * @throws RmrException if the family cannot be scored; other families are unaffected
     */
    public FamilyStatistics summarize(final Family family, final Map<String, Station> stations)
            throws RmrException {
        final String unitId = "family " + family.id();
        if (family.members().isEmpty()) {
            throw new EmptyInputException(unitId);
        }

        final Map<String, Integer> membersPerStation = new LinkedHashMap<>();
        for (Discontinuity d : family.members()) {
            membersPerStation.merge(d.getStationId(), 1, Integer::sum);
        }
        double lengthM = 0.0;
        for (String id : membersPerStation.keySet()) {
            final Station station = stations.get(id);
            if (station != null) {
                lengthM += station.getTraverseLengthM();
            }
        }

        final RqdResult rqd = lengthM > 0.0
                ? RqdEstimator.fromTraverse(family.size(), lengthM, unitId)
                : suppliedRqd(membersPerStation, stations, unitId);
        final RmrScore score = calculator.score(family.id(), family.members(), rqd);

        final String typeCode = DominantCode.of(family.members(), Discontinuity::getTypeCode);
        final String typeName = calculator.getDictionary()
                .description(RmrParameter.STRUCTURE_TYPE, typeCode);

        double maxDeviation = 0.0;
        for (Discontinuity d : family.members()) {
            maxDeviation = Math.max(maxDeviation,
                    family.metric().deviation(family.meanOrientation(), d.getOrientation()));
        }

        return new FamilyStatistics(family, score, typeCode, typeName,
                new ArrayList<>(membersPerStation.keySet()), maxDeviation);
    }

    private static RqdResult suppliedRqd(final Map<String, Integer> membersPerStation,
                                         final Map<String, Station> stations, final String unitId)
            throws InsufficientDataException {
        double weighted = 0.0;
        int weight = 0;
        for (Map.Entry<String, Integer> e : membersPerStation.entrySet()) {
            final Station station = stations.get(e.getKey());
            if (station != null && station.getSuppliedRqd().isPresent()) {
                weighted += station.getSuppliedRqd().getAsDouble() * e.getValue();
                weight += e.getValue();
            }
        }
        if (weight == 0) {
            throw new InsufficientDataException(unitId,
                    "No traverse length and no measured RQD at stations " + membersPerStation.keySet());
        }
        logger.debug("Using measured RQD {} for {}", weighted / weight, unitId);
        return RqdEstimator.supplied(weighted / weight);
    }
}
