package ou.capstone.rmr.report;

import java.util.ArrayList;
import java.util.List;

import ou.capstone.rmr.analysis.AnalysisReport;
import ou.capstone.rmr.analysis.ProjectSummary;

/**
 * An analysis report flattened into row lists for export.
 */
public record ReportRows(
        ProjectSummary summary,
        List<StationRow> stations,
        List<FamilyRow> families,
        List<UnclusteredRow> unclustered,
        List<IssueRow> issues
) {
    public static ReportRows from(final AnalysisReport report) {
        final List<IssueRow> issues = new ArrayList<>();
        report.rejected().forEach(r -> issues.add(IssueRow.of(r)));
        report.failures().forEach(f -> issues.add(IssueRow.of(f)));
        return new ReportRows(
                report.summary(),
                report.stationScores().stream().map(StationRow::of).toList(),
                report.families().stream().map(FamilyRow::of).toList(),
                report.unclustered().stream().map(UnclusteredRow::of).toList(),
                issues);
    }
}
