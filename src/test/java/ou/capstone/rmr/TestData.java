package ou.capstone.rmr;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.io.DiscontinuityCsvReader;
import ou.capstone.rmr.model.Discontinuity;
import ou.capstone.rmr.validation.RawRecord;

/**
 * Shared builders and classpath fixtures for tests.
 */
public final class TestData {

    public static final String SURVEY = "/fixtures/survey.csv";
    public static final String WORKED_EXAMPLE_CODES = "/fixtures/worked-example-codes.csv";
    public static final String WORKED_EXAMPLE_STATION = "/fixtures/worked-example-station.csv";

    private TestData() {
    }

    /** A joint with standard codes (spacing 4, condition codes 2, infill 1, groundwater 2). */
    public static Discontinuity.Builder joint(final String station, final double dipDirection, final double dip) {
        return new Discontinuity.Builder()
                .stationId(station)
                .distanceM(1.0)
                .typeCode("J")
                .orientation(dipDirection, dip)
                .spacingCode("4")
                .persistenceCode("2")
                .apertureCode("2")
                .roughnessCode("2")
                .infillCode("1")
                .weatheringCode("2")
                .groundwaterCode("2");
    }

    /** A raw row with valid standard codes and no RQD. */
    public static RawRecord rawRow(final int row, final String station, final String dipDirection, final String dip) {
        return new RawRecord(row, station, "1.0", "J", dipDirection, dip,
                "4", "2", "2", "2", "1", "2", "2", "");
    }

    public static CodeDictionary workedExampleCodes() {
        return CodeDictionary.fromResource(WORKED_EXAMPLE_CODES);
    }

    public static List<RawRecord> surveyRecords() throws IOException {
        return records(SURVEY);
    }

    public static List<RawRecord> records(final String resource) throws IOException {
        try (Reader reader = open(resource)) {
            return new DiscontinuityCsvReader().read(reader, resource).records();
        }
    }

    public static Reader open(final String resource) {
        final InputStream is = TestData.class.getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalStateException("Missing test resource " + resource);
        }
        return new InputStreamReader(is, StandardCharsets.UTF_8);
    }

    public static Path path(final String resource) {
        final URL url = TestData.class.getResource(resource);
        if (url == null) {
            throw new IllegalStateException("Missing test resource " + resource);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
