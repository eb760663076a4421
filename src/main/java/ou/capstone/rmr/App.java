package ou.capstone.rmr;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.rmr.AnalysisConfig.ClusterScope;
import ou.capstone.rmr.analysis.AnalysisReport;
import ou.capstone.rmr.analysis.RmrAnalysis;
import ou.capstone.rmr.cluster.AdmissionMetric;
import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.io.DiscontinuityCsvReader;
import ou.capstone.rmr.io.RecordLoadResult;
import ou.capstone.rmr.report.ColorReportPrinter;
import ou.capstone.rmr.report.CsvReportWriter;
import ou.capstone.rmr.report.FamilyRow;
import ou.capstone.rmr.report.IssueRow;
import ou.capstone.rmr.report.JsonReportWriter;
import ou.capstone.rmr.report.OutputConfig;
import ou.capstone.rmr.report.PlainReportPrinter;
import ou.capstone.rmr.report.ReportPrinter;
import ou.capstone.rmr.report.ReportRows;
import ou.capstone.rmr.report.StationRow;
import ou.capstone.rmr.report.UnclusteredRow;

/**
 * Command-line driver for the RMR14 analysis.
 *
 * Orchestrates the flow between components:
 * - option parsing into analysis and output configuration
 * - code dictionary and discontinuity CSV loading
 * - station scoring and family clustering via RmrAnalysis
 * - table, CSV or JSON output
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // --input is checked by hand after the help case so that `--help`
        // alone does not fail as a missing required option.
        final Option inputOption = Option.builder("i")
                .longOpt("input").hasArg()
                .desc("Discontinuity survey CSV file").get();
        final Option codesOption = Option.builder("c")
                .longOpt("codes").hasArg()
                .desc("Code dictionary CSV (default: bundled RMR14 table)").get();
        final Option ucsOption = Option.builder("u")
                .longOpt("ucs").hasArg()
                .desc("UCS strength class (default: " + AnalysisConfig.DEFAULT_UCS_CLASS + ")").get();
        final Option penaltyOption = Option.builder("p")
                .longOpt("orientation-penalty").hasArg()
                .desc("Orientation adjustment, -60 to 0 (default: "
                        + AnalysisConfig.DEFAULT_ORIENTATION_PENALTY + ")").get();
        final Option toleranceOption = Option.builder("t")
                .longOpt("tolerance").hasArg()
                .desc("Family clustering tolerance in degrees (default: "
                        + AnalysisConfig.DEFAULT_TOLERANCE_DEG + ")").get();
        final Option minMembersOption = Option.builder("m")
                .longOpt("min-members").hasArg()
                .desc("Minimum discontinuities per family (default: "
                        + AnalysisConfig.DEFAULT_MIN_MEMBERS + ")").get();
        final Option metricOption = Option.builder()
                .longOpt("metric").hasArg()
                .desc("Admission metric: 'two-threshold' or 'great-circle' (default: two-threshold)").get();
        final Option scopeOption = Option.builder()
                .longOpt("cluster-scope").hasArg()
                .desc("Cluster 'project'-wide or per 'station' (default: project)").get();
        final Option formatOption = Option.builder("f")
                .longOpt("format").hasArg()
                .desc("Output format: 'table', 'csv' or 'json' (default: table)").get();
        final Option outputDirOption = Option.builder("o")
                .longOpt("output-dir").hasArg()
                .desc("Write csv/json output files to this directory instead of stdout").get();
        final Option noColorOption = Option.builder()
                .longOpt("no-color")
                .desc("Disable ANSI colors in table output").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( inputOption );
        options.addOption( codesOption );
        options.addOption( ucsOption );
        options.addOption( penaltyOption );
        options.addOption( toleranceOption );
        options.addOption( minMembersOption );
        options.addOption( metricOption );
        options.addOption( scopeOption );
        options.addOption( formatOption );
        options.addOption( outputDirOption );
        options.addOption( noColorOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("rmr14",
                    "RMR14 Rock Mass Rating Options", options,
                    "Rows that fail validation are listed under Issues and do not stop the run.",
                    true);
            exitHandler.exit(0);
            return;
        }

        if (!line.hasOption(inputOption)) {
            throw new ParseException("Invalid options: input CSV file is required");
        }

        logger.info("RMR14 analysis starting");

        try {
            // Step 1: configuration
            final AnalysisConfig config = buildAnalysisConfig(line, ucsOption, penaltyOption,
                    toleranceOption, minMembersOption, metricOption, scopeOption);
            final OutputConfig output = new OutputConfig(
                    line.hasOption(formatOption)
                            ? OutputConfig.Format.parse(line.getOptionValue(formatOption))
                            : OutputConfig.Format.TABLE,
                    !line.hasOption(noColorOption),
                    line.hasOption(outputDirOption) ? Paths.get(line.getOptionValue(outputDirOption)) : null);

            // Step 2: code dictionary
            final CodeDictionary dictionary = line.hasOption(codesOption)
                    ? CodeDictionary.fromFile(Paths.get(line.getOptionValue(codesOption)))
                    : CodeDictionary.defaults();
            if (!dictionary.contains(RmrParameter.STRENGTH, config.getUcsClass())) {
                throw new IllegalArgumentException("UCS class '" + config.getUcsClass()
                        + "' is not defined in " + dictionary.getSourceName());
            }

            // Step 3: survey records
            final RecordLoadResult loaded = new DiscontinuityCsvReader()
                    .read(Paths.get(line.getOptionValue(inputOption)));
            logger.info("Loaded {} rows from {}", loaded.records().size(), loaded.sourceName());

            // Step 4: analysis
            final AnalysisReport report = new RmrAnalysis(dictionary, config).run(loaded.records());

            // Step 5: output
            emit(report, output);

            logger.info("RMR14 analysis completed successfully");
        } catch (final IOException e) {
            logger.error("I/O error: {}", e.getMessage());
            System.err.println("\nCould not read or write file: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalStateException e) {
            logger.error("Code dictionary error: {}", e.getMessage());
            System.err.println("\nCode dictionary error: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final Exception e) {
            logger.error("Unexpected error during execution", e);
            System.err.println("\nUnexpected Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    private static AnalysisConfig buildAnalysisConfig(final CommandLine line,
                                                      final Option ucsOption,
                                                      final Option penaltyOption,
                                                      final Option toleranceOption,
                                                      final Option minMembersOption,
                                                      final Option metricOption,
                                                      final Option scopeOption) {
        final AnalysisConfig.Builder builder = new AnalysisConfig.Builder();
        if (line.hasOption(ucsOption)) {
            builder.ucsClass(line.getOptionValue(ucsOption));
        }
        if (line.hasOption(penaltyOption)) {
            builder.orientationPenalty(parseNumber(line.getOptionValue(penaltyOption), "orientation-penalty"));
        }
        if (line.hasOption(toleranceOption)) {
            builder.toleranceDeg(parseNumber(line.getOptionValue(toleranceOption), "tolerance"));
        }
        if (line.hasOption(minMembersOption)) {
            final String raw = line.getOptionValue(minMembersOption);
            try {
                builder.minMembers(Integer.parseInt(raw.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("min-members must be a whole number, got '" + raw + "'", e);
            }
        }
        if (line.hasOption(metricOption)) {
            builder.metric(AdmissionMetric.parse(line.getOptionValue(metricOption)));
        }
        if (line.hasOption(scopeOption)) {
            builder.clusterScope(ClusterScope.parse(line.getOptionValue(scopeOption)));
        }
        return builder.build();
    }

    private static double parseNumber(final String raw, final String optionName) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(optionName + " must be a number, got '" + raw + "'", e);
        }
    }

    /**
     * Emits the report in the requested format. CSV and JSON go to files when an
     * output directory is configured, otherwise to stdout.
     */
    private static void emit(final AnalysisReport report, final OutputConfig output) throws IOException {
        switch (output.format()) {
            case TABLE -> {
                final ReportPrinter printer = output.color()
                        ? new ColorReportPrinter()
                        : new PlainReportPrinter();
                System.out.println("\n" + "=".repeat(80));
                printer.print(report);
                System.out.println("=".repeat(80) + "\n");
            }
            case CSV -> {
                final ReportRows rows = ReportRows.from(report);
                final CsvReportWriter writer = new CsvReportWriter();
                if (output.outputDir() != null) {
                    writer.writeAll(output.outputDir(), rows);
                    System.out.println("CSV report written to " + output.outputDir().toAbsolutePath());
                } else {
                    final StringWriter out = new StringWriter();
                    writer.writeTable(out, StationRow.HEADER, rows.stations());
                    out.write("\n");
                    writer.writeTable(out, FamilyRow.HEADER, rows.families());
                    out.write("\n");
                    writer.writeTable(out, UnclusteredRow.HEADER, rows.unclustered());
                    out.write("\n");
                    writer.writeTable(out, IssueRow.HEADER, rows.issues());
                    System.out.print(out);
                }
            }
            case JSON -> {
                final ReportRows rows = ReportRows.from(report);
                final JsonReportWriter writer = new JsonReportWriter();
                if (output.outputDir() != null) {
                    final Path file = writer.write(output.outputDir(), rows);
                    System.out.println("JSON report written to " + file.toAbsolutePath());
                } else {
                    System.out.println(writer.render(rows));
                }
            }
        }
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
