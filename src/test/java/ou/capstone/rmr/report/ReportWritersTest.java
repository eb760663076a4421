package ou.capstone.rmr.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.rmr.AnalysisConfig;
import ou.capstone.rmr.TestData;
import ou.capstone.rmr.analysis.RmrAnalysis;
import ou.capstone.rmr.codes.CodeDictionary;

class ReportWritersTest {

    @TempDir
    Path tempDir;

    private ReportRows rows;

    @BeforeEach
    void setUp() throws Exception {
        rows = ReportRows.from(new RmrAnalysis(CodeDictionary.defaults(), AnalysisConfig.defaults())
                .run(TestData.surveyRecords()));
    }

    @Test
    void flattensEveryUnit() {
        assertEquals(2, rows.stations().size());
        assertEquals(2, rows.families().size());
        assertEquals(1, rows.unclustered().size());
        assertEquals(1, rows.issues().size());

        final StationRow e1 = rows.stations().get(0);
        assertEquals(StationRow.HEADER.size(), e1.values().size());
        assertEquals("E-1", e1.values().get(0));
        assertEquals("64.0", e1.values().get(11));
        assertEquals("2", e1.values().get(13));
        assertEquals(FamilyRow.HEADER.size(), rows.families().get(0).values().size());
        assertEquals("E-1", rows.families().get(0).stations());
    }

    @Test
    void csvWriterProducesOneFilePerRowKind() throws Exception {
        final Path out = tempDir.resolve("report");
        new CsvReportWriter().writeAll(out, rows);

        final List<String> stations = Files.readAllLines(out.resolve(CsvReportWriter.STATIONS_FILE));
        assertEquals(3, stations.size());
        assertTrue(stations.get(0).startsWith("Station,Discontinuities,RQD_percent"), stations.get(0));
        assertTrue(stations.get(1).startsWith("E-1,6,78.2,false,400.0,7.0,17.0,10.0,25.0,10.0,-5.0,64.0"),
                stations.get(1));

        final List<String> families = Files.readAllLines(out.resolve(CsvReportWriter.FAMILIES_FILE));
        assertEquals(3, families.size());
        assertTrue(families.get(1).startsWith("F1,6,45.5,65.0"), families.get(1));

        final List<String> unclustered = Files.readAllLines(out.resolve(CsvReportWriter.UNCLUSTERED_FILE));
        assertEquals(List.of("Row,Station,Type,Dip_direction,Dip", "12,E-2,F,120.0,80.0"), unclustered);

        final List<String> issues = Files.readAllLines(out.resolve(CsvReportWriter.ISSUES_FILE));
        assertEquals(2, issues.size());
        // the message contains "[0, 90]" and is therefore quoted
        assertTrue(issues.get(1).startsWith("ROW,13,E-2,InvalidRangeException +1,\"dip=95.000"), issues.get(1));
    }

    @Test
    void csvTableToWriter() throws Exception {
        final StringWriter out = new StringWriter();
        new CsvReportWriter().writeTable(out, UnclusteredRow.HEADER, rows.unclustered());

        assertEquals("Row,Station,Type,Dip_direction,Dip\n12,E-2,F,120.0,80.0\n", out.toString());
    }

    @Test
    void jsonWriterEmitsOneDocument() throws Exception {
        final JsonReportWriter writer = new JsonReportWriter();
        final JsonNode root = new ObjectMapper().readTree(writer.render(rows));

        assertEquals(2, root.get("summary").get("stationCount").asInt());
        assertEquals("II", root.get("summary").get("dominantClass").asText());
        assertEquals(62.0, root.get("summary").get("meanRmr").asDouble(), 1e-9);
        assertEquals("E-1", root.get("stations").get(0).get("station").asText());
        assertEquals(64.0, root.get("stations").get(0).get("total").asDouble(), 1e-9);
        assertEquals("F1", root.get("families").get(0).get("family").asText());
        assertEquals(12, root.get("unclustered").get(0).get("row").asInt());
        assertEquals("ROW", root.get("issues").get(0).get("kind").asText());

        final Path file = writer.write(tempDir, rows);
        assertEquals(JsonReportWriter.REPORT_FILE, file.getFileName().toString());
        assertTrue(Files.size(file) > 0);
    }
}
