package ou.capstone.rmr.report;

import java.util.List;

import ou.capstone.rmr.rating.RatingComponent;
import ou.capstone.rmr.rating.RmrScore;

/** One scored station, flattened. */
public record StationRow(
        String station,
        int discontinuities,
        double rqdPercent,
        boolean rqdDerived,
        double meanSpacingMm,
        double strength,
        double rqd,
        double spacing,
        double condition,
        double groundwater,
        double orientation,
        double total,
        String classification,
        int worstConditionRow
) implements TabularRow {

    public static final List<String> HEADER = List.of(
            "Station", "Discontinuities", "RQD_percent", "RQD_derived", "Mean_spacing_mm",
            "R_strength", "R_rqd", "R_spacing", "R_condition", "R_groundwater", "R_orientation",
            "RMR_total", "Classification", "Worst_condition_row");

    public static StationRow of(final RmrScore s) {
        return new StationRow(
                s.unitId(),
                s.memberCount(),
                s.rqd().percent(),
                s.rqd().derived(),
                s.meanSpacingMm(),
                s.rating(RatingComponent.STRENGTH),
                s.rating(RatingComponent.RQD),
                s.rating(RatingComponent.SPACING),
                s.rating(RatingComponent.CONDITION),
                s.rating(RatingComponent.GROUNDWATER),
                s.rating(RatingComponent.ORIENTATION),
                s.total(),
                s.rockMassClass().displayName(),
                s.representative().getRow());
    }

    @Override
    public List<String> values() {
        return List.of(station, String.valueOf(discontinuities), Rows.num(rqdPercent), String.valueOf(rqdDerived),
                Rows.num(meanSpacingMm), Rows.num(strength), Rows.num(rqd), Rows.num(spacing),
                Rows.num(condition), Rows.num(groundwater), Rows.num(orientation), Rows.num(total),
                classification, String.valueOf(worstConditionRow));
    }
}
