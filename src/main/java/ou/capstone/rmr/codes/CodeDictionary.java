package ou.capstone.rmr.codes;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.io.CsvLines;

/**
 * Read-only mapping from field-recorded codes to numeric values, per parameter.
 *
 * Table format (CSV with header): {@code parameter,code,value,description}.
 * The bundled table lives at src/main/resources/data/rmr14-codes.csv and is
 * reached through the classpath as "/data/rmr14-codes.csv".
 *
 * Instances are immutable once loaded and are passed explicitly to whatever
 * needs them; there is no shared global dictionary.
 */
public final class CodeDictionary {
    private static final Logger logger = LoggerFactory.getLogger(CodeDictionary.class);

    public static final String DEFAULT_RESOURCE = "/data/rmr14-codes.csv";

    private static final String COL_PARAMETER = "parameter";
    private static final String COL_CODE = "code";
    private static final String COL_VALUE = "value";
    private static final String COL_DESCRIPTION = "description";

    private record Entry(double value, String description) {
    }

    private final Map<RmrParameter, Map<String, Entry>> entries;
    private final String sourceName;

    private CodeDictionary(final Map<RmrParameter, Map<String, Entry>> entries, final String sourceName) {
        final Map<RmrParameter, Map<String, Entry>> copy = new EnumMap<>(RmrParameter.class);
        entries.forEach((p, m) -> copy.put(p, Collections.unmodifiableMap(new LinkedHashMap<>(m))));
        this.entries = Collections.unmodifiableMap(copy);
        this.sourceName = sourceName;
    }

    /** Loads the bundled standard tables. */
    public static CodeDictionary defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static CodeDictionary fromResource(final String resourcePath) {
        final InputStream is = CodeDictionary.class.getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("Code dictionary not found on classpath: " + resourcePath);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return fromReader(reader, resourcePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load code dictionary: " + resourcePath, e);
        }
    }

    public static CodeDictionary fromFile(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromReader(reader, path.toString());
        }
    }

    /**
     * Parses a dictionary table. Duplicate (parameter, code) pairs, unknown
     * parameters and malformed values are load errors naming the line.
     */
    public static CodeDictionary fromReader(final Reader in, final String sourceName) throws IOException {
        final LineNumberReader reader = new LineNumberReader(in);
        final String headerLine = CsvLines.readHeader(reader);
        if (headerLine == null) {
            throw new IllegalStateException("Empty code dictionary: " + sourceName);
        }
        final Map<String, Integer> idx = CsvLines.indexHeader(CsvLines.parseLine(headerLine));
        for (String required : List.of(COL_PARAMETER, COL_CODE, COL_VALUE)) {
            if (!idx.containsKey(required)) {
                throw new IllegalStateException("Code dictionary " + sourceName + " lacks column '" + required + "'");
            }
        }

        final Map<RmrParameter, Map<String, Entry>> table = new EnumMap<>(RmrParameter.class);
        String line;
        while ((line = reader.readLine()) != null) {
            final int lineNo = reader.getLineNumber();
            if (line.isBlank() || line.startsWith("#")) continue;
            final List<String> cols = CsvLines.parseLine(line);

            final String paramText = CsvLines.get(cols, idx, COL_PARAMETER);
            final String code = normalizeCode(CsvLines.get(cols, idx, COL_CODE));
            final String valueText = CsvLines.get(cols, idx, COL_VALUE);
            final String description = CsvLines.get(cols, idx, COL_DESCRIPTION);

            final RmrParameter parameter;
            try {
                parameter = RmrParameter.valueOf(paramText == null ? "" : paramText.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(sourceName + ":" + lineNo + ": unknown parameter '" + paramText + "'", e);
            }
            if (code == null) {
                throw new IllegalStateException(sourceName + ":" + lineNo + ": missing code");
            }
            final double value;
            try {
                value = Double.parseDouble(valueText == null ? "" : valueText);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(sourceName + ":" + lineNo + ": value '" + valueText + "' is not a number", e);
            }

            final Map<String, Entry> forParam = table.computeIfAbsent(parameter, p -> new LinkedHashMap<>());
            if (forParam.putIfAbsent(code, new Entry(value, description == null ? "" : description)) != null) {
                throw new IllegalStateException(sourceName + ":" + lineNo + ": duplicate " + parameter + " code '" + code + "'");
            }
        }

        final CodeDictionary dictionary = new CodeDictionary(table, sourceName);
        logger.info("Loaded code dictionary {} ({} codes)", sourceName, dictionary.size());
        return dictionary;
    }

    /**
     * Returns the numeric value recorded for a code.
     *
     * @throws UnknownCodeException when the parameter has no such code; never defaults
     */
    public double ratingFor(final RmrParameter parameter, final String code) throws UnknownCodeException {
        return ratingFor(parameter, code, null);
    }

    /**
     * Same as {@link #ratingFor(RmrParameter, String)}, with a source description
     * (row, station) carried into the exception.
     */
    public double ratingFor(final RmrParameter parameter, final String code, final String source)
            throws UnknownCodeException {
        return lookup(parameter, code, source).value();
    }

    public String description(final RmrParameter parameter, final String code) throws UnknownCodeException {
        return lookup(parameter, code, null).description();
    }

    public boolean contains(final RmrParameter parameter, final String code) {
        final String key = normalizeCode(code);
        return key != null && entries.getOrDefault(parameter, Map.of()).containsKey(key);
    }

    public Optional<String> findDescription(final RmrParameter parameter, final String code) {
        final String key = normalizeCode(code);
        if (key == null) return Optional.empty();
        return Optional.ofNullable(entries.getOrDefault(parameter, Map.of()).get(key)).map(Entry::description);
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }

    public String getSourceName() {
        return sourceName;
    }

    private Entry lookup(final RmrParameter parameter, final String code, final String source)
            throws UnknownCodeException {
        final String key = normalizeCode(code);
        final Entry entry = (key == null) ? null : entries.getOrDefault(parameter, Map.of()).get(key);
        if (entry == null) {
            throw new UnknownCodeException(parameter, code, source);
        }
        return entry;
    }

    /**
     * Trims and upper-cases a code; "3.0" and "3" are the same code since
     * spreadsheets export integer codes as decimals.
     */
    public static String normalizeCode(final String code) {
        if (code == null || code.isBlank()) return null;
        String key = code.trim().toUpperCase(Locale.ROOT);
        if (key.matches("-?\\d+\\.0+")) {
            key = key.substring(0, key.indexOf('.'));
        }
        return key;
    }
}
