package nl.bytesoflife.lanterncad.mode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A linearly polarized mode label such as {@code LP01}, {@code LP11} or {@code LP11b}:
 * azimuthal number {@code l}, radial number {@code p} and, for the two-fold degenerate
 * {@code l > 0} modes, an optional orientation {@code a} (even) or {@code b} (odd).
 */
public record LpMode(int l, int p, String orientation) {

    private static final Pattern LABEL = Pattern.compile("LP(\\d)(\\d)([ab]?)");

    public LpMode {
        if (orientation == null) orientation = "";
    }

    public static LpMode parse(String label) {
        if (label == null) {
            throw new ModeConfigurationException("Mode label must not be null");
        }
        Matcher m = LABEL.matcher(label.trim());
        if (!m.matches()) {
            throw new ModeConfigurationException("Not an LP mode label: '" + label + "'");
        }
        int l = Integer.parseInt(m.group(1));
        int p = Integer.parseInt(m.group(2));
        if (p < 1) {
            throw new ModeConfigurationException("Radial mode number starts at 1: '" + label + "'");
        }
        String orientation = m.group(3);
        if (l == 0 && !orientation.isEmpty()) {
            throw new ModeConfigurationException("LP0p modes have no orientation: '" + label + "'");
        }
        return new LpMode(l, p, orientation);
    }

    public boolean isDegenerate() {
        return l > 0;
    }

    public boolean hasOrientation() {
        return !orientation.isEmpty();
    }

    /** Label without orientation, e.g. {@code LP11} for {@code LP11b}. */
    public String baseLabel() {
        return "LP" + l + p;
    }

    public String label() {
        return baseLabel() + orientation;
    }

    /** Labels of the physical modes behind this mode: {@code a} and {@code b} when degenerate. */
    public List<String> expand() {
        if (hasOrientation() || !isDegenerate()) {
            return List.of(label());
        }
        return List.of(baseLabel() + "a", baseLabel() + "b");
    }

    @Override
    public String toString() {
        return label();
    }
}
