package nl.bytesoflife.lanterncad.geometry;

import nl.bytesoflife.lanterncad.taper.TaperSpec;
import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;

/**
 * A single waveguide core placed by the {@link LayoutEngine}.
 * <p>
 * Identity, role and position are fixed at construction. The mode label is assigned once
 * mode assignment runs; diameter and index turn into functions of the axial position once a
 * taper is applied.
 */
public class Core {

    private final int id;
    private final CoreRole role;
    private final int shell;
    private final int angularIndex;
    private final double x;
    private final double y;
    private final double diameter;
    private final double index;
    private String modeLabel;
    private TaperSpec taper;

    public Core(int id, CoreRole role, int shell, int angularIndex, double x, double y,
                double diameter, double index) {
        this.id = id;
        this.role = role;
        this.shell = shell;
        this.angularIndex = angularIndex;
        this.x = x;
        this.y = y;
        this.diameter = diameter;
        this.index = index;
    }

    public int getId() { return id; }
    public CoreRole getRole() { return role; }
    public int getShell() { return shell; }
    public int getAngularIndex() { return angularIndex; }
    public double getX() { return x; }
    public double getY() { return y; }
    public String getModeLabel() { return modeLabel; }
    public TaperSpec getTaper() { return taper; }

    public boolean isCenter() {
        return role == CoreRole.CENTER;
    }

    /** Distance from the lantern axis. */
    public double getRadialPosition() {
        return Math.hypot(x, y);
    }

    /** Polar angle in degrees, normalized to [0, 360). */
    public double getAngleDegrees() {
        if (isCenter()) return 0;
        double deg = Math.toDegrees(Math.atan2(y, x));
        return deg < 0 ? deg + 360 : deg;
    }

    public Coordinate toCoordinate() {
        return new Coordinate(x, y);
    }

    /**
     * Label used to key this core in core maps: the assigned mode, or the generation index
     * while no mode has been assigned.
     */
    public String getLabel() {
        return modeLabel != null ? modeLabel : Integer.toString(id);
    }

    public double getDiameter() {
        return getDiameterAt(0);
    }

    public double getIndex() {
        return getIndexAt(0);
    }

    public double getDiameterAt(double z) {
        return taper != null ? 2 * taper.radiusAt(z) : diameter;
    }

    public double getIndexAt(double z) {
        return taper != null ? taper.indexAt(z) : index;
    }

    public void assignMode(String label) {
        this.modeLabel = label;
    }

    public void applyTaper(TaperSpec taper) {
        this.taper = taper;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Core{id=%d, %s, label=%s, at (%.4f, %.4f)}",
                id, role, getLabel(), x, y);
    }
}
