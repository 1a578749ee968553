package nl.bytesoflife.lanterncad.taper;

/**
 * Radius and index of a tapered structure at one axial position.
 */
public record TaperPoint(double z, double radius, double index) {

    public double diameter() {
        return 2 * radius;
    }
}
