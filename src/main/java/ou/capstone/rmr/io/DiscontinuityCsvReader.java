package ou.capstone.rmr.io;

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.validation.RawRecord;

/**
 * Reads the field discontinuity table (one row per discontinuity).
 *
 * Required columns (case-insensitive): Station, Distance_m, Type, Dip_Direction_degrees,
 * Dip_degrees, Spacing_mm, Persistence_m, Aperture_mm, Roughness, Infilling_Type,
 * Weathering, Groundwater. Optional: RQD_percent.
 * The categorical columns hold codes, not measurements, despite their unit suffixes.
 */
public class DiscontinuityCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(DiscontinuityCsvReader.class);

    public static final String COL_STATION = "Station";
    public static final String COL_DISTANCE = "Distance_m";
    public static final String COL_TYPE = "Type";
    public static final String COL_DIP_DIRECTION = "Dip_Direction_degrees";
    public static final String COL_DIP = "Dip_degrees";
    public static final String COL_SPACING = "Spacing_mm";
    public static final String COL_PERSISTENCE = "Persistence_m";
    public static final String COL_APERTURE = "Aperture_mm";
    public static final String COL_ROUGHNESS = "Roughness";
    public static final String COL_INFILL = "Infilling_Type";
    public static final String COL_WEATHERING = "Weathering";
    public static final String COL_GROUNDWATER = "Groundwater";
    public static final String COL_RQD = "RQD_percent";

    static final List<String> REQUIRED_COLUMNS = List.of(
            COL_STATION, COL_DISTANCE, COL_TYPE, COL_DIP_DIRECTION, COL_DIP, COL_SPACING,
            COL_PERSISTENCE, COL_APERTURE, COL_ROUGHNESS, COL_INFILL, COL_WEATHERING, COL_GROUNDWATER);

    public RecordLoadResult read(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * @throws IllegalArgumentException if the input is empty or lacks a required column
     */
    public RecordLoadResult read(final Reader in, final String sourceName) throws IOException {
        final LineNumberReader reader = new LineNumberReader(in);

        final String headerLine = CsvLines.readHeader(reader);
        if (headerLine == null) {
            throw new IllegalArgumentException("Empty discontinuity table: " + sourceName);
        }
        final Map<String, Integer> idx = CsvLines.indexHeader(CsvLines.parseLine(headerLine));
        final List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!idx.containsKey(column.toLowerCase(Locale.ROOT))) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(sourceName + " is missing columns " + missing
                    + " (required: " + REQUIRED_COLUMNS + ")");
        }

        // Rows are physical line numbers, blank lines included
        final List<RawRecord> records = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            final int row = reader.getLineNumber();
            if (line.isBlank()) continue;
            final List<String> cols = CsvLines.parseLine(line);
            records.add(new RawRecord(
                    row,
                    CsvLines.get(cols, idx, COL_STATION),
                    CsvLines.get(cols, idx, COL_DISTANCE),
                    CsvLines.get(cols, idx, COL_TYPE),
                    CsvLines.get(cols, idx, COL_DIP_DIRECTION),
                    CsvLines.get(cols, idx, COL_DIP),
                    CsvLines.get(cols, idx, COL_SPACING),
                    CsvLines.get(cols, idx, COL_PERSISTENCE),
                    CsvLines.get(cols, idx, COL_APERTURE),
                    CsvLines.get(cols, idx, COL_ROUGHNESS),
                    CsvLines.get(cols, idx, COL_INFILL),
                    CsvLines.get(cols, idx, COL_WEATHERING),
                    CsvLines.get(cols, idx, COL_GROUNDWATER),
                    CsvLines.get(cols, idx, COL_RQD)));
        }

        logger.info("Read {} rows from {}", records.size(), sourceName);
        return new RecordLoadResult(sourceName, records);
    }
}
