package nl.bytesoflife.lanterncad.taper;

import java.util.Arrays;

/**
 * Built-in taper profiles.
 */
public final class TaperProfiles {

    private TaperProfiles() {}

    public static final TaperProfile LINEAR = (z, zs, ze, vs, ve) -> vs + (ve - vs) * fraction(z, zs, ze);

    /**
     * Geometric interpolation, constant relative change per unit length. Falls back to linear
     * interpolation when the end values do not share a sign.
     */
    public static final TaperProfile EXPONENTIAL = (z, zs, ze, vs, ve) -> {
        double t = fraction(z, zs, ze);
        if (vs == 0 || ve == 0 || Math.signum(vs) != Math.signum(ve)) {
            return vs + (ve - vs) * t;
        }
        if (t <= 0) return vs;
        if (t >= 1) return ve;
        return vs * Math.pow(ve / vs, t);
    };

    /**
     * Adiabatic profile built from three weighted sigmoids (centres at 0.33, 0.5 and 0.67 of
     * the length), rescaled so the ends meet the start and end values exactly.
     */
    public static final TaperProfile SIGMOID = (z, zs, ze, vs, ve) -> {
        double t = fraction(z, zs, ze);
        double s0 = sigmoidRatio(0);
        double s1 = sigmoidRatio(1);
        double normalized = (sigmoidRatio(t) - s0) / (s1 - s0);
        return vs + (ve - vs) * normalized;
    };

    /** Unnormalized weighted sigmoid ratio at the relative position {@code t}. */
    static double sigmoidRatio(double t) {
        return 0.1 * sigmoid(t, 0.33, 1.0 / 6)
                + 0.8 * sigmoid(t, 0.5, 1.0 / 10)
                + 0.1 * sigmoid(t, 0.67, 1.0 / 6);
    }

    private static double sigmoid(double t, double centre, double width) {
        return 1 / (1 + Math.exp(-(t - centre) / width));
    }

    /**
     * Piecewise-linear profile through a table of (relative position, ratio) points. Ratios
     * give the fraction of the way from the start value to the end value, so a valid table
     * runs from ratio 0 at position 0 to ratio 1 at position 1.
     */
    public static TaperProfile tabulated(double[] positions, double[] ratios) {
        if (positions.length != ratios.length || positions.length < 2) {
            throw new TaperValidationException("Tabulated taper needs at least two (position, ratio) pairs, got "
                    + positions.length + " positions and " + ratios.length + " ratios");
        }
        for (int i = 1; i < positions.length; i++) {
            if (!(positions[i] > positions[i - 1])) {
                throw new TaperValidationException("Tabulated taper positions must increase strictly: "
                        + Arrays.toString(positions));
            }
        }
        double[] ts = positions.clone();
        double[] rs = ratios.clone();
        return (z, zs, ze, vs, ve) -> vs + (ve - vs) * interpolate(ts, rs, fraction(z, zs, ze));
    }

    private static double interpolate(double[] ts, double[] rs, double t) {
        if (t <= ts[0]) return rs[0];
        int last = ts.length - 1;
        if (t >= ts[last]) return rs[last];
        int hi = 1;
        while (ts[hi] < t) hi++;
        int lo = hi - 1;
        double w = (t - ts[lo]) / (ts[hi] - ts[lo]);
        return rs[lo] + (rs[hi] - rs[lo]) * w;
    }

    /** Relative position of {@code z} in [zs, ze], clamped to [0, 1]. */
    public static double fraction(double z, double zs, double ze) {
        double t = (z - zs) / (ze - zs);
        return Math.max(0, Math.min(1, t));
    }
}
