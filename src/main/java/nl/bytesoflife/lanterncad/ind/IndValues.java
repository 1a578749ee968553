package nl.bytesoflife.lanterncad.ind;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Text form of property values. Whole numbers are written without a fraction, other numbers
 * in plain decimal notation with trailing zeros removed.
 */
public final class IndValues {

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,9}");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private IndValues() {}

    public static String formatNumber(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return number.toString();
        }
        double d = number.doubleValue();
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** Parses a written value back into an Integer, a Double or, failing both, the raw text. */
    public static Object parse(String text) {
        if (INTEGER.matcher(text).matches()) {
            return Integer.valueOf(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        return text;
    }
}
