package ou.capstone.rmr.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal CSV helpers shared by the dictionary and discontinuity readers.
 */
public final class CsvLines {

    private CsvLines() {
    }

    /**
     * Reads the first non-blank line, stripping a UTF-8 BOM.
     *
     * @return the header line, or null when the input is empty
     */
    public static String readHeader(final BufferedReader reader) throws IOException {
        String headerLine;
        do {
            headerLine = reader.readLine();
        } while (headerLine != null && headerLine.isBlank());
        if (headerLine == null) return null;

        if (headerLine.charAt(0) == '\uFEFF') headerLine = headerLine.substring(1);
        return headerLine;
    }

    /**
     * Maps lower-cased, trimmed column names to their index.
     */
    public static Map<String, Integer> indexHeader(final List<String> header) {
        final Map<String, Integer> m = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            final String h = header.get(i);
            if (h != null) {
                final String key = h.trim().toLowerCase(Locale.ROOT);
                if (!key.isBlank()) m.put(key, i);
            }
        }
        return m;
    }

    /**
     * Returns the trimmed cell for a column, or null when the column or cell is missing.
     */
    public static String get(final List<String> cols, final Map<String, Integer> idx, final String column) {
        final Integer i = idx.get(column.toLowerCase(Locale.ROOT));
        if (i == null) return null;
        return (i < cols.size()) ? cols.get(i).trim() : null;
    }

    /**
     * Splits one CSV line (handles quotes, commas, and escaped quotes).
     */
    public static List<String> parseLine(final String line) {
        final List<String> out = new ArrayList<>();
        final StringBuilder sb = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        sb.append('"');
                        i++;
                    } else inQuotes = false;
                } else {
                    sb.append(c);
                }
            } else {
                if (c == ',') {
                    out.add(sb.toString());
                    sb.setLength(0);
                } else if (c == '"') {
                    inQuotes = true;
                } else {
                    sb.append(c);
                }
            }
        }
        out.add(sb.toString());
        return out;
    }

    /**
     * Quotes a value for output when it contains a comma, quote or line break.
     */
    public static String escape(final String value) {
        if (value == null) return "";
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
