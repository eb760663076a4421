package ou.capstone.rmr.report;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.rmr.analysis.AnalysisReport;
import ou.capstone.rmr.analysis.ProjectSummary;
import ou.capstone.rmr.analysis.UnitFailure;
import ou.capstone.rmr.family.FamilyStatistics;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.rating.RatingComponent;
import ou.capstone.rmr.rating.RmrScore;
import ou.capstone.rmr.rating.RockMassClass;
import ou.capstone.rmr.validation.RejectedRecord;

/**
 * Console printer for an analysis report.
 *
 * Subclasses style the classification cell via
 * {@link #decorateClassification(RockMassClass, String)} and issue lines via
 * {@link #decorateIssue(String)}.
 *
 * Provides both {@link #print(AnalysisReport)} for CLI stdout and
 * {@link #render(AnalysisReport)} for tests/logging.
 */
public abstract class ReportPrinter {

    protected static final int UNIT_COL_WIDTH   = 10;
    protected static final int COUNT_COL_WIDTH  = 4;
    protected static final int NUMBER_COL_WIDTH = 6;
    protected static final int ORIENT_COL_WIDTH = 12;
    protected static final int TYPE_COL_WIDTH   = 18;
    protected static final int CLASS_COL_WIDTH  = 22;

    private static final RatingComponent[] COMPONENTS = RatingComponent.values();
    private static final String[] COMPONENT_HEADERS = {"Str", "RQD", "Spc", "Cond", "GW", "Ori"};

    public void print(final AnalysisReport report) {
        System.out.println(render(report));
    }

    /**
     * Renders the summary, station table, family table, unclustered list and issues.
     *
     * @return the complete text; a short empty-state message when there is nothing to show
     */
    public String render(final AnalysisReport report) {
        if (report == null
                || (report.stationScores().isEmpty() && report.families().isEmpty()
                && report.rejected().isEmpty() && report.failures().isEmpty())) {
            return "No discontinuities to display.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(renderSummary(report.summary())).append('\n');

        sb.append("Stations\n");
        sb.append(stationHeader()).append('\n');
        sb.append(separator(stationHeader().length())).append('\n');
        for (RmrScore s : report.stationScores()) {
            sb.append(formatStation(s)).append('\n');
        }

        sb.append('\n').append("Families\n");
        if (report.families().isEmpty()) {
            sb.append("No families formed.\n");
        } else {
            sb.append(familyHeader()).append('\n');
            sb.append(separator(familyHeader().length())).append('\n');
            for (FamilyStatistics f : report.families()) {
                sb.append(formatFamily(f)).append('\n');
            }
        }

        if (!report.unclustered().isEmpty()) {
            sb.append('\n').append("Unclustered (").append(report.unclustered().size()).append(")\n");
            for (Discontinuity d : report.unclustered()) {
                sb.append("  ").append(pad(d.source(), 28)).append(d.getOrientation()).append('\n');
            }
        }

        if (!report.rejected().isEmpty() || !report.failures().isEmpty()) {
            sb.append('\n').append("Issues\n");
            for (RejectedRecord r : report.rejected()) {
                sb.append(decorateIssue("  [row " + r.row() + "] " + String.join("; ", r.reasons()))).append('\n');
            }
            for (UnitFailure f : report.failures()) {
                sb.append(decorateIssue("  [" + f.kind().name().toLowerCase(Locale.ROOT) + " " + f.unitId() + "] "
                        + f.message())).append('\n');
            }
        }
        return sb.toString();
    }

    // Hooks for subclasses

    protected abstract String decorateClassification(RockMassClass rockMassClass, String text);

    protected String decorateIssue(final String line) {
        return line;
    }

    // Sections

    private String renderSummary(final ProjectSummary s) {
        final String mean = s.meanRmr() == null ? "-" : String.format(Locale.ROOT, "%.1f", s.meanRmr());
        final String dominant = s.dominantClass() == null ? "-" : s.dominantClass().displayName();
        return String.format(Locale.ROOT,
                "RMR14 summary: %d stations, %d valid rows, %d rejected rows%n"
                        + "Mean station RMR: %s   Dominant class: %s%n"
                        + "Families: %d   Unclustered: %d%n",
                s.stationCount(), s.validRecords(), s.rejectedRecords(), mean, dominant,
                s.familyCount(), s.unclusteredCount());
    }

    private String stationHeader() {
        final StringBuilder h = new StringBuilder();
        h.append(pad("Station", UNIT_COL_WIDTH)).append("  ")
                .append(pad("N", COUNT_COL_WIDTH)).append("  ")
                .append(pad("RQD%", NUMBER_COL_WIDTH)).append("  ");
        for (String c : COMPONENT_HEADERS) {
            h.append(pad(c, NUMBER_COL_WIDTH)).append("  ");
        }
        h.append(pad("Total", NUMBER_COL_WIDTH)).append("  ").append("Class");
        return h.toString();
    }

    private String familyHeader() {
        return pad("Family", UNIT_COL_WIDTH) + "  "
                + pad("N", COUNT_COL_WIDTH) + "  "
                + pad("DipDir/Dip", ORIENT_COL_WIDTH) + "  "
                + pad("MaxDev", NUMBER_COL_WIDTH) + "  "
                + pad("Type", TYPE_COL_WIDTH) + "  "
                + pad("Total", NUMBER_COL_WIDTH) + "  "
                + "Class";
    }

    protected final String formatStation(final RmrScore s) {
        final StringBuilder row = new StringBuilder();
        row.append(pad(clamp(s.unitId(), UNIT_COL_WIDTH), UNIT_COL_WIDTH)).append("  ")
                .append(pad(String.valueOf(s.memberCount()), COUNT_COL_WIDTH)).append("  ")
                .append(pad(num(s.rqd().percent()) + (s.rqd().derived() ? "*" : ""), NUMBER_COL_WIDTH)).append("  ");
        for (RatingComponent c : COMPONENTS) {
            row.append(pad(num(s.rating(c)), NUMBER_COL_WIDTH)).append("  ");
        }
        row.append(pad(num(s.total()), NUMBER_COL_WIDTH)).append("  ")
                .append(decorateClassification(s.rockMassClass(),
                        pad(s.rockMassClass().displayName(), CLASS_COL_WIDTH)).stripTrailing());
        return row.toString();
    }

    protected final String formatFamily(final FamilyStatistics f) {
        final RmrScore s = f.score();
        return pad(clamp(f.family().id(), UNIT_COL_WIDTH), UNIT_COL_WIDTH) + "  "
                + pad(String.valueOf(f.family().size()), COUNT_COL_WIDTH) + "  "
                + pad(f.family().meanOrientation().toString(), ORIENT_COL_WIDTH) + "  "
                + pad(num(f.maxDeviationDeg()), NUMBER_COL_WIDTH) + "  "
                + pad(clamp(f.dominantTypeName(), TYPE_COL_WIDTH), TYPE_COL_WIDTH) + "  "
                + pad(num(s.total()), NUMBER_COL_WIDTH) + "  "
                + decorateClassification(s.rockMassClass(), s.rockMassClass().displayName());
    }

    // Helper methods

    protected static String pad(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        return StringUtils.rightPad(v, width);
    }

    protected static String clamp(final String text, final int maxLength) {
        if (text == null) {
            return "-";
        }
        final String normalized = text.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return StringUtils.abbreviate(normalized, maxLength);
    }

    private static String separator(final int width) {
        return "-".repeat(width);
    }

    private static String num(final double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
