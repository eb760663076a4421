package ou.capstone.rmr.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import ou.capstone.rmr.TestData;
import ou.capstone.rmr.validation.RawRecord;

class DiscontinuityCsvReaderTest {

    private static final String HEADER = "Station,Distance_m,Type,Dip_Direction_degrees,Dip_degrees,Spacing_mm,"
            + "Persistence_m,Aperture_mm,Roughness,Infilling_Type,Weathering,Groundwater\n";

    private final DiscontinuityCsvReader reader = new DiscontinuityCsvReader();

    @Test
    void readsSurveyFixture() throws Exception {
        final List<RawRecord> records = TestData.surveyRecords();

        assertEquals(12, records.size());
        final RawRecord first = records.get(0);
        assertEquals(2, first.row());
        assertEquals("E-1", first.station());
        assertEquals("44", first.dipDirection());
        assertEquals("78.2", first.rqdPercent());
        assertEquals("", records.get(1).rqdPercent());
        assertEquals(13, records.get(11).row());
    }

    @Test
    void headerIsCaseInsensitiveAndBomIsStripped() throws Exception {
        final String csv = "\uFEFF" + HEADER.toUpperCase(Locale.ROOT) + "E-1,0.5,J,44,64,4,2,2,2,1,2,2\n";

        final RecordLoadResult result = reader.read(new StringReader(csv), "bom.csv");

        assertEquals(1, result.records().size());
        assertEquals("E-1", result.records().get(0).station());
        assertNull(result.records().get(0).rqdPercent());
    }

    @Test
    void blankLinesBeforeHeaderCountTowardRowNumbers() throws Exception {
        final String csv = "\n\n" + HEADER + "E-1,0.5,J,44,64,4,2,2,2,1,2,2\n";

        final List<RawRecord> records = reader.read(new StringReader(csv), "leading-blank.csv").records();

        assertEquals(1, records.size());
        assertEquals(4, records.get(0).row());
    }

    @Test
    void quotedFieldsAndBlankLines() throws Exception {
        final String csv = HEADER
                + "\"E-1, north wall\",0.5,J,44,64,4,2,2,2,1,2,2\n"
                + "\n"
                + "E-1,1.5,\"J\",46,66,4,2,2,2,1,2,2\n";

        final List<RawRecord> records = reader.read(new StringReader(csv), "quoted.csv").records();

        assertEquals(2, records.size());
        assertEquals("E-1, north wall", records.get(0).station());
        // the blank line still counts toward the row number
        assertEquals(4, records.get(1).row());
        assertEquals("J", records.get(1).type());
    }

    @Test
    void missingColumnsAreListed() {
        final String csv = "Station,Distance_m,Type\nE-1,0.5,J\n";

        final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> reader.read(new StringReader(csv), "short.csv"));
        assertTrue(ex.getMessage().contains("Dip_degrees"), ex.getMessage());
        assertTrue(ex.getMessage().contains("Groundwater"), ex.getMessage());
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(new StringReader("\n\n"), "empty.csv"));
    }

    @Test
    void shortRowsYieldNullCells() throws Exception {
        final List<RawRecord> records = reader.read(new StringReader(HEADER + "E-1,0.5,J\n"), "short-row.csv")
                .records();
        assertEquals(1, records.size());
        assertNull(records.get(0).dip());
        assertNull(records.get(0).groundwater());
    }

    @Test
    void escapeQuotesOnlyWhenNeeded() {
        assertEquals("plain", CsvLines.escape("plain"));
        assertEquals("\"a,b\"", CsvLines.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvLines.escape("say \"hi\""));
        assertEquals("", CsvLines.escape(null));
    }
}
