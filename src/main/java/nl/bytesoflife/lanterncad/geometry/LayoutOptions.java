package nl.bytesoflife.lanterncad.geometry;

/**
 * Optional knobs of {@link LayoutEngine#computeLayout}. Instances are immutable; the
 * {@code with*} methods return modified copies.
 */
public final class LayoutOptions {

    public static final double DEFAULT_CORE_DIAMETER = 10.4;
    public static final double DEFAULT_CORE_INDEX = 1.45213;

    private static final LayoutOptions DEFAULTS =
            new LayoutOptions(0, 0, false, false, DEFAULT_CORE_DIAMETER, DEFAULT_CORE_INDEX);

    private final double angularOffsetDegrees;
    private final double edgeMargin;
    private final boolean centerCore;
    private final boolean partialShells;
    private final double coreDiameter;
    private final double coreIndex;

    private LayoutOptions(double angularOffsetDegrees, double edgeMargin, boolean centerCore,
                          boolean partialShells, double coreDiameter, double coreIndex) {
        this.angularOffsetDegrees = angularOffsetDegrees;
        this.edgeMargin = edgeMargin;
        this.centerCore = centerCore;
        this.partialShells = partialShells;
        this.coreDiameter = coreDiameter;
        this.coreIndex = coreIndex;
    }

    public static LayoutOptions defaults() {
        return DEFAULTS;
    }

    public LayoutOptions withAngularOffset(double degrees) {
        return new LayoutOptions(degrees, edgeMargin, centerCore, partialShells, coreDiameter, coreIndex);
    }

    /** Gap left between the edges of neighbouring claddings. Negative values squeeze them. */
    public LayoutOptions withEdgeMargin(double margin) {
        return new LayoutOptions(angularOffsetDegrees, margin, centerCore, partialShells, coreDiameter, coreIndex);
    }

    /** Circular layouts only: reserve one of the cores for the lantern axis. */
    public LayoutOptions withCenterCore(boolean enabled) {
        return new LayoutOptions(angularOffsetDegrees, edgeMargin, enabled, partialShells, coreDiameter, coreIndex);
    }

    /** Hexagonal layouts only: allow a core count that does not fill the last shell. */
    public LayoutOptions withPartialShells(boolean enabled) {
        return new LayoutOptions(angularOffsetDegrees, edgeMargin, centerCore, enabled, coreDiameter, coreIndex);
    }

    public LayoutOptions withCore(double diameter, double index) {
        return new LayoutOptions(angularOffsetDegrees, edgeMargin, centerCore, partialShells, diameter, index);
    }

    public double getAngularOffsetDegrees() { return angularOffsetDegrees; }
    public double getEdgeMargin() { return edgeMargin; }
    public boolean isCenterCore() { return centerCore; }
    public boolean isPartialShells() { return partialShells; }
    public double getCoreDiameter() { return coreDiameter; }
    public double getCoreIndex() { return coreIndex; }
}
