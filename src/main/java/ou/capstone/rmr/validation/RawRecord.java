package ou.capstone.rmr.validation;

/**
 * One input row as text, before any parsing. Any field may be null or blank.
 *
 * @param row 1-based line number in the source (the header is line 1)
 * @param rqdPercent optional directly measured RQD for the row's station
 */
public record RawRecord(
        int row,
        String station,
        String distanceM,
        String type,
        String dipDirection,
        String dip,
        String spacing,
        String persistence,
        String aperture,
        String roughness,
        String infill,
        String weathering,
        String groundwater,
        String rqdPercent
) {
}
