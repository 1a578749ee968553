package nl.bytesoflife.lanterncad.mode;

/**
 * Cutoff parameters of one mode in one core.
 *
 * @param normalizedCutoff  cutoff V-number of the mode (0 for LP01)
 * @param numericalAperture NA of the core
 * @param vNumber           normalized frequency of the core at the operating wavelength
 * @param cutoffWavelength  wavelength above which the mode is no longer guided, infinite for LP01
 * @param guided            whether the core guides the mode at the operating wavelength
 */
public record ModeCutoff(double normalizedCutoff, double numericalAperture, double vNumber,
                         double cutoffWavelength, boolean guided) {
}
