package ou.capstone.rmr.report;

import ou.capstone.rmr.rating.RockMassClass;

/**
 * Printer that colours the class column: I-II green, III yellow, IV-V red.
 */
public final class ColorReportPrinter extends ReportPrinter {

    private final AnsiOutputHelper ansi = new AnsiOutputHelper(true);

    @Override
    protected String decorateClassification(final RockMassClass rockMassClass, final String text) {
        return switch (rockMassClass) {
            case I, II -> ansi.colorGreen(text);
            case III   -> ansi.colorYellow(text);
            case IV, V -> ansi.colorRed(text);
        };
    }

    @Override
    protected String decorateIssue(final String line) {
        return ansi.dim(line);
    }
}
