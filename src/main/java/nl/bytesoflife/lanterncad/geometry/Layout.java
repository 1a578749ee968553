package nl.bytesoflife.lanterncad.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Result of packing cores inside a capillary: the cores in generation order, the packing
 * radius R (distance from the axis to the outermost core centres) and the capillary radius.
 */
public class Layout {

    private static final int CIRCLE_SEGMENTS = 32;

    private final Arrangement arrangement;
    private final double claddingDiameter;
    private final double packingRadius;
    private final double capillaryRadius;
    private final List<Core> cores;
    private final GeometryFactory factory = new GeometryFactory();

    public Layout(Arrangement arrangement, double claddingDiameter, double packingRadius, List<Core> cores) {
        this.arrangement = arrangement;
        this.claddingDiameter = claddingDiameter;
        this.packingRadius = packingRadius;
        this.capillaryRadius = packingRadius + claddingDiameter / 2;
        this.cores = List.copyOf(cores);
    }

    public Arrangement getArrangement() { return arrangement; }
    public double getCladdingDiameter() { return claddingDiameter; }
    public double getPackingRadius() { return packingRadius; }
    public double getCapillaryRadius() { return capillaryRadius; }

    public double getCapillaryDiameter() {
        return 2 * capillaryRadius;
    }

    public List<Core> getCores() {
        return cores;
    }

    public int getCoreCount() {
        return cores.size();
    }

    public Core getCenterCore() {
        for (Core core : cores) {
            if (core.isCenter()) return core;
        }
        return null;
    }

    public List<Core> getRingCores() {
        List<Core> ring = new ArrayList<>();
        for (Core core : cores) {
            if (!core.isCenter()) ring.add(core);
        }
        return Collections.unmodifiableList(ring);
    }

    public Core getCore(int id) {
        for (Core core : cores) {
            if (core.getId() == id) return core;
        }
        throw new LayoutException("No core with id " + id);
    }

    public Core findByLabel(String label) {
        for (Core core : cores) {
            if (core.getLabel().equals(label)) return core;
        }
        return null;
    }

    public List<Coordinate> coordinates() {
        List<Coordinate> coords = new ArrayList<>(cores.size());
        for (Core core : cores) {
            coords.add(core.toCoordinate());
        }
        return coords;
    }

    /** Cladding discs, one polygon per core, in generation order. */
    public Geometry toGeometry() {
        Polygon[] discs = new Polygon[cores.size()];
        for (int i = 0; i < cores.size(); i++) {
            discs[i] = disc(cores.get(i).toCoordinate(), claddingDiameter / 2);
        }
        return factory.createMultiPolygon(discs);
    }

    public Polygon capillaryGeometry() {
        return disc(new Coordinate(0, 0), capillaryRadius);
    }

    /**
     * Whether a capillary bore of the given diameter holds every cladding disc. The bore polygon
     * is circumscribed around its circle while the cladding polygons are inscribed in theirs.
     */
    public boolean encloses(double capillaryDiameter) {
        double circumscribed = capillaryDiameter / 2 / Math.cos(Math.PI / (4 * CIRCLE_SEGMENTS));
        Polygon bore = disc(new Coordinate(0, 0), circumscribed * (1 + 1e-9));
        return bore.covers(toGeometry());
    }

    private Polygon disc(Coordinate centre, double radius) {
        return (Polygon) factory.createPoint(centre).buffer(radius, CIRCLE_SEGMENTS);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Layout{%s, cores=%d, R=%.4f, capillaryRadius=%.4f}",
                arrangement, cores.size(), packingRadius, capillaryRadius);
    }
}
