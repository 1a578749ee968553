package nl.bytesoflife.lanterncad.lantern;

/**
 * Dimensions (um) and refractive indices of one fibre in the bundle.
 */
public record FiberProperties(double coreDiameter, double claddingDiameter,
                              double coreIndex, double claddingIndex, double backgroundIndex) {

    /** Standard single-mode fibre at 1550 nm in a low-index capillary. */
    public static final FiberProperties DEFAULT = new FiberProperties(10.4, 125, 1.45213, 1.44692, 1.4345);

    public FiberProperties withCoreDiameter(double d) {
        return new FiberProperties(d, claddingDiameter, coreIndex, claddingIndex, backgroundIndex);
    }

    public FiberProperties withCladdingDiameter(double d) {
        return new FiberProperties(coreDiameter, d, coreIndex, claddingIndex, backgroundIndex);
    }

    public FiberProperties withCoreIndex(double n) {
        return new FiberProperties(coreDiameter, claddingDiameter, n, claddingIndex, backgroundIndex);
    }

    public FiberProperties withCladdingIndex(double n) {
        return new FiberProperties(coreDiameter, claddingDiameter, coreIndex, n, backgroundIndex);
    }

    public FiberProperties withBackgroundIndex(double n) {
        return new FiberProperties(coreDiameter, claddingDiameter, coreIndex, claddingIndex, n);
    }

    public double coreDelta() {
        return coreIndex - backgroundIndex;
    }

    public double claddingDelta() {
        return claddingIndex - backgroundIndex;
    }
}
