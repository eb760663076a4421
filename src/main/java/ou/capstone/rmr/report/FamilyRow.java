package ou.capstone.rmr.report;

import java.util.List;

import ou.capstone.rmr.family.FamilyStatistics;
import ou.capstone.rmr.rating.RatingComponent;
import ou.capstone.rmr.rating.RmrScore;

/** One family with its orientation statistics and score, flattened. */
public record FamilyRow(
        String family,
        int members,
        double meanDipDirection,
        double meanDip,
        double maxDeviationDeg,
        String dominantType,
        String stations,
        double rqdPercent,
        double strength,
        double rqd,
        double spacing,
        double condition,
        double groundwater,
        double orientation,
        double total,
        String classification
) implements TabularRow {

    public static final List<String> HEADER = List.of(
            "Family", "Members", "Mean_dip_direction", "Mean_dip", "Max_deviation_deg", "Dominant_type",
            "Stations", "RQD_percent", "R_strength", "R_rqd", "R_spacing", "R_condition", "R_groundwater",
            "R_orientation", "RMR_total", "Classification");

    public static FamilyRow of(final FamilyStatistics f) {
        final RmrScore s = f.score();
        return new FamilyRow(
                f.family().id(),
                f.family().size(),
                f.family().meanOrientation().getDipDirection(),
                f.family().meanOrientation().getDip(),
                f.maxDeviationDeg(),
                f.dominantTypeName(),
                String.join(";", f.stationIds()),
                s.rqd().percent(),
                s.rating(RatingComponent.STRENGTH),
                s.rating(RatingComponent.RQD),
                s.rating(RatingComponent.SPACING),
                s.rating(RatingComponent.CONDITION),
                s.rating(RatingComponent.GROUNDWATER),
                s.rating(RatingComponent.ORIENTATION),
                s.total(),
                s.rockMassClass().displayName());
    }

    @Override
    public List<String> values() {
        return List.of(family, String.valueOf(members), Rows.num(meanDipDirection), Rows.num(meanDip),
                Rows.num(maxDeviationDeg), dominantType, stations, Rows.num(rqdPercent), Rows.num(strength),
                Rows.num(rqd), Rows.num(spacing), Rows.num(condition), Rows.num(groundwater),
                Rows.num(orientation), Rows.num(total), classification);
    }
}
