package ou.capstone.rmr.report;

import java.util.Locale;

final class Rows {

    private Rows() {
    }

    static String num(final double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String num(final Double value) {
        return value == null ? "" : num(value.doubleValue());
    }
}
