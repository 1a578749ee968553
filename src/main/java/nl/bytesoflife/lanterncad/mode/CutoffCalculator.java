package nl.bytesoflife.lanterncad.mode;

/**
 * Step-index fibre cutoff formulas at a fixed operating wavelength:
 * {@code NA = sqrt(n_core^2 - n_clad^2)}, {@code V = pi d NA / lambda} and
 * {@code lambda_c = pi d NA / u_c}, where {@code u_c} is the mode's normalized cutoff.
 */
public class CutoffCalculator {

    public static final double DEFAULT_WAVELENGTH = 1.55;

    private final double wavelength;

    public CutoffCalculator() {
        this(DEFAULT_WAVELENGTH);
    }

    public CutoffCalculator(double wavelength) {
        if (!(wavelength > 0) || Double.isInfinite(wavelength)) {
            throw new ModeConfigurationException("Wavelength must be positive, got " + wavelength);
        }
        this.wavelength = wavelength;
    }

    public double getWavelength() {
        return wavelength;
    }

    public static double numericalAperture(double coreIndex, double claddingIndex) {
        double d = coreIndex * coreIndex - claddingIndex * claddingIndex;
        if (d <= 0) {
            throw new ModeConfigurationException("Core index " + coreIndex
                    + " must exceed cladding index " + claddingIndex + " to guide light");
        }
        return Math.sqrt(d);
    }

    public double vNumber(double coreDiameter, double numericalAperture) {
        return Math.PI * coreDiameter * numericalAperture / wavelength;
    }

    public ModeCutoff compute(double normalizedCutoff, double coreDiameter, double coreIndex, double claddingIndex) {
        if (!(coreDiameter > 0)) {
            throw new ModeConfigurationException("Core diameter must be positive, got " + coreDiameter);
        }
        double na = numericalAperture(coreIndex, claddingIndex);
        double v = vNumber(coreDiameter, na);
        double cutoffWavelength = normalizedCutoff == 0
                ? Double.POSITIVE_INFINITY
                : Math.PI * coreDiameter * na / normalizedCutoff;
        return new ModeCutoff(normalizedCutoff, na, v, cutoffWavelength, v > normalizedCutoff);
    }
}
