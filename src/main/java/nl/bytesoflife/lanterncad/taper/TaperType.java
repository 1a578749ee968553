package nl.bytesoflife.lanterncad.taper;

/**
 * Taper keyword written next to a segment's tapered property ({@code width_taper},
 * {@code position_taper}, ...). User tapers are numbered.
 */
public record TaperType(String tag) {

    public static final TaperType LINEAR = new TaperType("TAPER_LINEAR");
    public static final TaperType EXPONENTIAL = new TaperType("TAPER_EXPONENTIAL");

    public static TaperType user(int number) {
        if (number < 1) {
            throw new TaperValidationException("User taper numbers start at 1, got " + number);
        }
        return new TaperType("TAPER_USER_" + number);
    }

    public boolean isUser() {
        return tag.startsWith("TAPER_USER_");
    }

    @Override
    public String toString() {
        return tag;
    }
}
