package ou.capstone.rmr.report;

import java.util.List;

import ou.capstone.rmr.analysis.UnitFailure;
import ou.capstone.rmr.validation.RejectedRecord;

/**
 * A rejected input row or a unit that could not be scored.
 *
 * @param kind ROW, STATION or FAMILY
 * @param reference row number or unit id
 */
public record IssueRow(String kind, String reference, String station, String error, String message)
        implements TabularRow {

    public static final List<String> HEADER = List.of("Kind", "Reference", "Station", "Error", "Message");

    public static IssueRow of(final RejectedRecord r) {
        final String type = r.errors().isEmpty() ? "" : r.errors().get(0).getClass().getSimpleName();
        return new IssueRow("ROW", String.valueOf(r.row()), r.stationId() == null ? "" : r.stationId(),
                r.errors().size() == 1 ? type : type + " +" + (r.errors().size() - 1),
                String.join("; ", r.reasons()));
    }

    public static IssueRow of(final UnitFailure f) {
        return new IssueRow(f.kind().name(), f.unitId(),
                f.kind() == UnitFailure.Kind.STATION ? f.unitId() : "",
                f.cause().getClass().getSimpleName(), f.message());
    }

    @Override
    public List<String> values() {
        return List.of(kind, reference, station, error, message);
    }
}
