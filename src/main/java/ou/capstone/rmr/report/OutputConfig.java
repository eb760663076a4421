package ou.capstone.rmr.report;

import java.nio.file.Path;
import java.util.Locale;

/**
 * How the report is emitted.
 */
public record OutputConfig(
    /**
     * TABLE prints to the console; CSV and JSON print to stdout unless an output directory is set.
     */
    Format format,

    /**
     * Whether the console table uses ANSI colours.
     */
    boolean color,

    /**
     * Directory for CSV/JSON files; null means stdout.
     */
    Path outputDir
) {
    public enum Format {
        TABLE,
        CSV,
        JSON;

        public static Format parse(final String text) {
            try {
                return valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown output format '" + text + "' (expected table, csv or json)", e);
            }
        }
    }
}
