package ou.capstone.rmr.report;

import java.util.List;

import ou.capstone.rmr.model.Discontinuity;

/** A discontinuity that belongs to no family. */
public record UnclusteredRow(int row, String station, String type, double dipDirection, double dip)
        implements TabularRow {

    public static final List<String> HEADER = List.of("Row", "Station", "Type", "Dip_direction", "Dip");

    public static UnclusteredRow of(final Discontinuity d) {
        return new UnclusteredRow(d.getRow(), d.getStationId(), d.getTypeCode(),
                d.getOrientation().getDipDirection(), d.getOrientation().getDip());
    }

    @Override
    public List<String> values() {
        return List.of(String.valueOf(row), station, type, Rows.num(dipDirection), Rows.num(dip));
    }
}
