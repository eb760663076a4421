package ou.capstone.rmr.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.io.CsvLines;

/**
 * Writes report rows as CSV: one file per row kind, or a single table to any writer.
 */
public class CsvReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final String STATIONS_FILE = "stations.csv";
    public static final String FAMILIES_FILE = "families.csv";
    public static final String UNCLUSTERED_FILE = "unclustered.csv";
    public static final String ISSUES_FILE = "issues.csv";

    /**
     * Writes stations.csv, families.csv, unclustered.csv and issues.csv into a directory,
     * creating it if needed.
     */
    public void writeAll(final Path directory, final ReportRows rows) throws IOException {
        Files.createDirectories(directory);
        writeFile(directory.resolve(STATIONS_FILE), StationRow.HEADER, rows.stations());
        writeFile(directory.resolve(FAMILIES_FILE), FamilyRow.HEADER, rows.families());
        writeFile(directory.resolve(UNCLUSTERED_FILE), UnclusteredRow.HEADER, rows.unclustered());
        writeFile(directory.resolve(ISSUES_FILE), IssueRow.HEADER, rows.issues());
        logger.info("Wrote CSV report to {}", directory);
    }

    public void writeTable(final Writer out, final List<String> header,
                           final List<? extends TabularRow> rows) throws IOException {
        out.write(line(header));
        for (TabularRow row : rows) {
            out.write(line(row.values()));
        }
        out.flush();
    }

    private void writeFile(final Path file, final List<String> header,
                           final List<? extends TabularRow> rows) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeTable(out, header, rows);
        }
    }

    private static String line(final List<String> cells) {
        return cells.stream().map(CsvLines::escape).collect(Collectors.joining(",")) + "\n";
    }
}
