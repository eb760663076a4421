package ou.capstone.rmr.report;

public final class AnsiOutputHelper {

    private final boolean enabled;

    public AnsiOutputHelper(final boolean enabled) {
        this.enabled = enabled;
    }

    public String colorRed(final String text)    { return apply(text, "\u001B[31m"); }
    public String colorGreen(final String text)  { return apply(text, "\u001B[32m"); }
    public String colorYellow(final String text) { return apply(text, "\u001B[33m"); }
    public String dim(final String text)         { return apply(text, "\u001B[2m");  }

    private String apply(final String text, final String code) {
        if (!enabled || text == null) return text;
        return code + text + "\u001B[0m";
    }
}
