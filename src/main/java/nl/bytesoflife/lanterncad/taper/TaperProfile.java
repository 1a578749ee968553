package nl.bytesoflife.lanterncad.taper;

/**
 * Shape of a taper between two axial positions. Implementations must be pure and return
 * {@code startValue} at {@code zStart} and {@code endValue} at {@code zEnd}.
 */
@FunctionalInterface
public interface TaperProfile {

    double evaluate(double z, double zStart, double zEnd, double startValue, double endValue);
}
