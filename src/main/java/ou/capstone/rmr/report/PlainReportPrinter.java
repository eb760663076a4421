package ou.capstone.rmr.report;

import ou.capstone.rmr.rating.RockMassClass;

/** Printer with ANSI colors disabled (plain text). */
public final class PlainReportPrinter extends ReportPrinter {

    @Override
    protected String decorateClassification(final RockMassClass rockMassClass, final String text) {
        // No coloring
        return text;
    }
}
