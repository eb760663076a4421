package ou.capstone.rmr.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.AnalysisConfig;
import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.exceptions.EmptyInputException;
import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.family.FamilyClusterer;
import ou.capstone.rmr.family.FamilyGrouping;
import ou.capstone.rmr.family.FamilyStatistics;
import ou.capstone.rmr.family.FamilyStatisticsAggregator;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.model.Station;
import ou.capstone.rmr.rating.RmrCalculator;
import ou.capstone.rmr.rating.RmrScore;
import ou.capstone.rmr.rating.RockMassClass;
import ou.capstone.rmr.validation.RawRecord;
import ou.capstone.rmr.validation.RecordValidator;
import ou.capstone.rmr.validation.RejectedRecord;
import ou.capstone.rmr.validation.ValidationResult;

/**
 * Runs the whole analysis over a set of raw rows:
 * - row validation (bad rows are set aside, the rest continue)
 * - station assembly and per-station RMR
 * - orientation clustering into families
 * - per-family RMR and statistics
 */
public class RmrAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(RmrAnalysis.class);

    private final AnalysisConfig config;
    private final RecordValidator validator;
    private final RmrCalculator calculator;
    private final FamilyClusterer familyClusterer;
    private final FamilyStatisticsAggregator familyAggregator;

    public RmrAnalysis(final CodeDictionary dictionary, final AnalysisConfig config) {
        this.config = config;
        this.validator = new RecordValidator(dictionary);
        this.calculator = new RmrCalculator(dictionary, config);
        this.familyClusterer = new FamilyClusterer(config.getToleranceDeg(), config.getMinMembers(), config.getMetric());
        this.familyAggregator = new FamilyStatisticsAggregator(calculator);
    }

    public AnalysisReport run(final List<RawRecord> records) {
        logger.info("Analysing {} rows with {}", records.size(), config);

        // Step 1: validate rows and group by station in first-seen order
        final List<RejectedRecord> rejected = new ArrayList<>();
        final List<Discontinuity> valid = new ArrayList<>();
        final Map<String, List<Discontinuity>> byStation = new LinkedHashMap<>();
        final Map<String, Double> suppliedRqd = new LinkedHashMap<>();
        final Set<String> seenStations = new LinkedHashSet<>();
        for (RawRecord raw : records) {
            if (raw.station() != null && !raw.station().isBlank()) {
                seenStations.add(raw.station().trim());
            }
            final ValidationResult result = validator.validate(raw);
            if (!result.isOk()) {
                logger.warn("Rejected row {}: {}", raw.row(), result.message());
                rejected.add(new RejectedRecord(raw.row(), raw.station(), result.errors()));
                continue;
            }
            final Discontinuity d = result.discontinuity().orElseThrow();
            valid.add(d);
            byStation.computeIfAbsent(d.getStationId(), k -> new ArrayList<>()).add(d);
            result.suppliedRqd().ifPresent(rqd -> suppliedRqd.putIfAbsent(d.getStationId(), rqd));
        }

        // Step 2: station scores; a station whose rows were all rejected is still reported
        final List<UnitFailure> failures = new ArrayList<>();
        for (String id : seenStations) {
            if (!byStation.containsKey(id)) {
                logger.warn("Station {} has no valid rows", id);
                failures.add(new UnitFailure(UnitFailure.Kind.STATION, id, new EmptyInputException("station " + id)));
            }
        }
        final List<RmrScore> stationScores = new ArrayList<>();
        final Map<String, Station> stations = new LinkedHashMap<>();
        for (Map.Entry<String, List<Discontinuity>> e : byStation.entrySet()) {
            try {
                final Station station = Station.of(e.getKey(), e.getValue(), suppliedRqd.get(e.getKey()));
                stations.put(station.getId(), station);
                stationScores.add(calculator.scoreStation(station));
            } catch (RmrException ex) {
                logger.warn("Station {} not scored: {}", e.getKey(), ex.getMessage());
                failures.add(new UnitFailure(UnitFailure.Kind.STATION, e.getKey(), ex));
            }
        }
        final int stationCount = seenStations.size();
        logger.info("Scored {} of {} stations", stationScores.size(), stationCount);

        // Step 3: families
        final List<FamilyGrouping> groupings = new ArrayList<>();
        if (config.getClusterScope() == AnalysisConfig.ClusterScope.STATION) {
            for (Map.Entry<String, List<Discontinuity>> e : byStation.entrySet()) {
                groupings.add(familyClusterer.group(e.getValue(), e.getKey() + "/"));
            }
        } else {
            groupings.add(familyClusterer.group(valid));
        }

        // Step 4: family scores
        final List<FamilyStatistics> families = new ArrayList<>();
        final List<Discontinuity> unclustered = new ArrayList<>();
        for (FamilyGrouping grouping : groupings) {
            unclustered.addAll(grouping.unclustered());
            grouping.families().forEach(family -> {
                try {
                    families.add(familyAggregator.summarize(family, stations));
                } catch (RmrException ex) {
                    logger.warn("Family {} not scored: {}", family.id(), ex.getMessage());
                    failures.add(new UnitFailure(UnitFailure.Kind.FAMILY, family.id(), ex));
                }
            });
        }

        final ProjectSummary summary = summarize(stationCount, valid.size(), rejected.size(),
                stationScores, families.size() + countFamilyFailures(failures), unclustered.size());
        logger.info("Analysis complete: {} stations, {} families, {} unclustered, {} rejected rows",
                summary.stationCount(), summary.familyCount(), summary.unclusteredCount(), summary.rejectedRecords());
        return new AnalysisReport(summary, stationScores, families, unclustered, rejected, failures);
    }

    private static int countFamilyFailures(final List<UnitFailure> failures) {
        return (int) failures.stream().filter(f -> f.kind() == UnitFailure.Kind.FAMILY).count();
    }

    static ProjectSummary summarize(final int stationCount, final int validRecords, final int rejectedRecords,
                                    final List<RmrScore> stationScores, final int familyCount,
                                    final int unclusteredCount) {
        Double meanRmr = null;
        RockMassClass dominant = null;
        if (!stationScores.isEmpty()) {
            meanRmr = stationScores.stream().mapToDouble(RmrScore::total).average().orElse(0.0);

            final Map<RockMassClass, Integer> counts = new EnumMap<>(RockMassClass.class);
            for (RmrScore s : stationScores) {
                counts.merge(s.rockMassClass(), 1, Integer::sum);
            }
            int best = 0;
            // EnumMap iterates best class first, so ties keep the better class
            for (Map.Entry<RockMassClass, Integer> e : counts.entrySet()) {
                if (e.getValue() > best) {
                    dominant = e.getKey();
                    best = e.getValue();
                }
            }
        }
        return new ProjectSummary(stationCount, validRecords, rejectedRecords, meanRmr, dominant,
                familyCount, unclusteredCount);
    }
}
