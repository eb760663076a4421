package ou.capstone.rmr.rating;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.AnalysisConfig;
import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.exceptions.EmptyInputException;
import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Station;

/**
 * Sums the six parameter ratings for a group of discontinuities and classifies the total.
 *
 * Each parameter lives in its own {@link ParameterRater}; this class only wires
 * them together, totals, and classifies.
 */
public class RmrCalculator {
    private static final Logger logger = LoggerFactory.getLogger(RmrCalculator.class);

    private final CodeDictionary dictionary;
    private final AnalysisConfig config;
    private final List<ParameterRater> raters;

    public RmrCalculator(final CodeDictionary dictionary, final AnalysisConfig config) {
        this.dictionary = dictionary;
        this.config = config;

        this.raters = List.of(
                new StrengthRater(),
                new RqdRater(),
                new SpacingRater(),
                new ConditionRater(),
                new GroundwaterRater(),
                new OrientationRater()
        );
    }

    /**
     * Scores a station, using its supplied RQD or deriving it from the traverse.
     */
    public RmrScore scoreStation(final Station station) throws RmrException {
        final String unitId = "station " + station.getId();
        final RqdResult rqd = RqdEstimator.resolve(station.getSuppliedRqd(), station.size(),
                station.getTraverseLengthM(), unitId);
        return score(station.getId(), station.getDiscontinuities(), rqd);
    }

    /**
     * Scores any group of discontinuities with a known RQD.
     *
     * @throws EmptyInputException if members is empty
     * @throws RmrException for unknown codes or a total outside [0, 100]
     */
    public RmrScore score(final String unitId, final List<Discontinuity> members, final RqdResult rqd)
            throws RmrException {
        if (members == null || members.isEmpty()) {
            throw new EmptyInputException(unitId);
        }
        final RatingInput input = new RatingInput(unitId, members, rqd,
                config.getUcsClass(), config.getOrientationPenalty(), dictionary);

        final Map<RatingComponent, PartialRating> ratings = new EnumMap<>(RatingComponent.class);
        double total = 0.0;
        for (ParameterRater rater : raters) {
            final PartialRating r = rater.rate(input);
            ratings.put(r.component(), r);
            total += r.rating();
        }

        final RockMassClass rockMassClass = ClassificationMapper.classify(total, unitId);
        final ConditionRater.WorstCase worst = ConditionRater.worstCase(members, dictionary);
        final double meanSpacing = SpacingRater.meanSpacingMm(members, dictionary);

        logger.debug("Scored {}: total={} ({})", unitId, total, rockMassClass.displayName());
        return new RmrScore(unitId, ratings, total, rockMassClass, rqd, members.size(),
                meanSpacing, worst.representative());
    }

    public CodeDictionary getDictionary() {
        return dictionary;
    }
}
