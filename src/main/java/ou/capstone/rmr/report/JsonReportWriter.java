package ou.capstone.rmr.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes report rows as a single JSON document.
 */
public class JsonReportWriter {

    public static final String REPORT_FILE = "rmr-report.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String render(final ReportRows rows) throws JsonProcessingException {
        return mapper.writeValueAsString(rows);
    }

    /** Writes rmr-report.json into a directory, creating it if needed. */
    public Path write(final Path directory, final ReportRows rows) throws IOException {
        Files.createDirectories(directory);
        final Path file = directory.resolve(REPORT_FILE);
        mapper.writeValue(file.toFile(), rows);
        return file;
    }
}
