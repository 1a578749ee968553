package nl.bytesoflife.lanterncad.taper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A named taper: radius and refractive index as functions of the axial position over
 * {@code [zStart, zEnd]}. Radius and index carry their own profiles so cores and cladding can
 * taper at different rates within one structure. Positions outside the domain clamp to the
 * nearest bound.
 */
public class TaperSpec {

    /** Relative tolerance for profile endpoint checks. */
    public static final double TOLERANCE = 1e-9;

    private static final int MONOTONIC_SAMPLES = 64;

    private final String name;
    private final double zStart;
    private final double zEnd;
    private final double radiusStart;
    private final double radiusEnd;
    private final TaperProfile radiusProfile;
    private final double indexStart;
    private final double indexEnd;
    private final TaperProfile indexProfile;
    private final TaperType type;

    public TaperSpec(String name, double zStart, double zEnd,
                     double radiusStart, double radiusEnd, TaperProfile radiusProfile,
                     double indexStart, double indexEnd, TaperProfile indexProfile,
                     TaperType type) {
        if (name == null || name.isBlank()) {
            throw new TaperValidationException("Taper name must not be empty");
        }
        if (!Double.isFinite(zStart) || !Double.isFinite(zEnd) || !(zStart < zEnd)) {
            throw new TaperValidationException(String.format(Locale.US,
                    "Taper '%s' needs start position < end position, got [%s, %s]", name, zStart, zEnd));
        }
        if (radiusProfile == null || indexProfile == null || type == null) {
            throw new TaperValidationException("Taper '" + name + "' needs radius and index profiles and a type");
        }
        this.name = name;
        this.zStart = zStart;
        this.zEnd = zEnd;
        this.radiusStart = radiusStart;
        this.radiusEnd = radiusEnd;
        this.radiusProfile = radiusProfile;
        this.indexStart = indexStart;
        this.indexEnd = indexEnd;
        this.indexProfile = indexProfile;
        this.type = type;
        validate();
    }

    /** Linear radius taper at a constant index. */
    public static TaperSpec linear(String name, double zStart, double zEnd,
                                   double radiusStart, double radiusEnd, double index) {
        return new TaperSpec(name, zStart, zEnd, radiusStart, radiusEnd, TaperProfiles.LINEAR,
                index, index, TaperProfiles.LINEAR, TaperType.LINEAR);
    }

    /**
     * Taper over {@code [0, length]} that shrinks a diameter by {@code factor} with the given
     * profile, keeping the index constant.
     */
    public static TaperSpec byFactor(String name, double length, double startDiameter, double factor,
                                     double index, TaperProfile profile, TaperType type) {
        if (!(factor > 0)) {
            throw new TaperValidationException("Taper factor of '" + name + "' must be positive, got " + factor);
        }
        return new TaperSpec(name, 0, length, startDiameter / 2, startDiameter / 2 / factor, profile,
                index, index, TaperProfiles.LINEAR, type);
    }

    /**
     * Checks that both profiles meet their declared end values and stay finite and monotonic
     * over the domain.
     */
    public void validate() {
        checkProfile("radius", radiusProfile, radiusStart, radiusEnd);
        checkProfile("index", indexProfile, indexStart, indexEnd);
    }

    private void checkProfile(String what, TaperProfile profile, double start, double end) {
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw new TaperValidationException(String.format(Locale.US,
                    "Taper '%s' has a non-finite %s bound: %s -> %s", name, what, start, end));
        }
        double atStart = profile.evaluate(zStart, zStart, zEnd, start, end);
        double atEnd = profile.evaluate(zEnd, zStart, zEnd, start, end);
        if (!close(atStart, start) || !close(atEnd, end)) {
            throw new TaperValidationException(String.format(Locale.US,
                    "Taper '%s' %s profile gives %s at z=%s and %s at z=%s, expected %s and %s",
                    name, what, atStart, zStart, atEnd, zEnd, start, end));
        }

        double direction = Math.signum(end - start);
        double previous = atStart;
        double slack = tolerance(start, end);
        for (int i = 1; i <= MONOTONIC_SAMPLES; i++) {
            double z = zStart + (zEnd - zStart) * i / MONOTONIC_SAMPLES;
            double value = profile.evaluate(z, zStart, zEnd, start, end);
            if (!Double.isFinite(value)) {
                throw new TaperValidationException(String.format(Locale.US,
                        "Taper '%s' %s profile is not finite at z=%s", name, what, z));
            }
            boolean reverses = direction == 0
                    ? Math.abs(value - start) > slack
                    : (value - previous) * direction < -slack;
            if (reverses) {
                throw new TaperValidationException(String.format(Locale.US,
                        "Taper '%s' %s profile is not monotonic near z=%s", name, what, z));
            }
            previous = value;
        }
    }

    private static boolean close(double actual, double expected) {
        return Math.abs(actual - expected) <= tolerance(actual, expected);
    }

    private static double tolerance(double a, double b) {
        return TOLERANCE * Math.max(1, Math.max(Math.abs(a), Math.abs(b)));
    }

    public TaperPoint evaluate(double z) {
        return new TaperPoint(z, radiusAt(z), indexAt(z));
    }

    public double radiusAt(double z) {
        return radiusProfile.evaluate(clamp(z), zStart, zEnd, radiusStart, radiusEnd);
    }

    public double diameterAt(double z) {
        return 2 * radiusAt(z);
    }

    public double indexAt(double z) {
        return indexProfile.evaluate(clamp(z), zStart, zEnd, indexStart, indexEnd);
    }

    private double clamp(double z) {
        return Math.max(zStart, Math.min(zEnd, z));
    }

    /** Start radius over end radius. */
    public double getTaperFactor() {
        return radiusEnd == 0 ? Double.POSITIVE_INFINITY : radiusStart / radiusEnd;
    }

    /** Evenly spaced samples over the whole domain, both ends included. */
    public List<TaperPoint> sample(int points) {
        if (points < 2) {
            throw new TaperValidationException("Sampling a taper needs at least 2 points, got " + points);
        }
        List<TaperPoint> samples = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            double z = i == points - 1 ? zEnd : zStart + (zEnd - zStart) * i / (points - 1);
            samples.add(evaluate(z));
        }
        return Collections.unmodifiableList(samples);
    }

    public String getName() { return name; }
    public double getZStart() { return zStart; }
    public double getZEnd() { return zEnd; }
    public double getLength() { return zEnd - zStart; }
    public double getRadiusStart() { return radiusStart; }
    public double getRadiusEnd() { return radiusEnd; }
    public double getIndexStart() { return indexStart; }
    public double getIndexEnd() { return indexEnd; }
    public TaperProfile getRadiusProfile() { return radiusProfile; }
    public TaperProfile getIndexProfile() { return indexProfile; }
    public TaperType getType() { return type; }

    @Override
    public String toString() {
        return String.format(Locale.US, "TaperSpec{%s, z=[%s, %s], r=%s->%s, n=%s->%s, %s}",
                name, zStart, zEnd, radiusStart, radiusEnd, indexStart, indexEnd, type);
    }
}
