package nl.bytesoflife.lanterncad.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Computes core centre positions for circular and hexagonal lantern layouts.
 * <p>
 * Circular: {@code n} claddings on one ring whose radius makes neighbouring edges touch
 * (plus the configured margin), {@code R = pitch / (2 sin(pi / n))}. With a centre core the
 * ring holds {@code n - 1} claddings and never comes closer than one pitch to the axis.
 * <p>
 * Hexagonal: a centre core surrounded by shells of 6, 12, 18, ... cores on the hexagonal
 * lattice, shell {@code k} having its corners at {@code k * pitch}.
 * <p>
 * Layered: concentric rings given as {@link RingLayer}s, each one pitch outside the previous
 * ring or wider when its own cores need the room.
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private static final double OVERLAP_TOLERANCE = 1e-9;

    public Layout computeLayout(double claddingDiameter, int coreCount, Arrangement arrangement) {
        return computeLayout(claddingDiameter, coreCount, arrangement, LayoutOptions.defaults());
    }

    public Layout computeLayout(double claddingDiameter, int coreCount, Arrangement arrangement,
                                LayoutOptions options) {
        if (coreCount <= 0) {
            throw new LayoutException("Core count must be at least 1, got " + coreCount);
        }
        if (!Double.isFinite(claddingDiameter) || claddingDiameter <= 0) {
            throw new LayoutException("Cladding diameter must be positive, got " + claddingDiameter);
        }
        double pitch = claddingDiameter + options.getEdgeMargin();
        if (pitch <= 0) {
            throw new LayoutException("Edge margin " + options.getEdgeMargin()
                    + " leaves no room between core centres");
        }

        Layout layout = switch (arrangement) {
            case CIRCULAR -> circular(claddingDiameter, pitch, coreCount, options);
            case HEXAGONAL -> hexagonal(claddingDiameter, pitch, coreCount, options);
        };
        verifyNoOverlap(layout);

        log.debug("Computed {} layout: {} cores, R={}, capillary radius={}",
                arrangement, coreCount, layout.getPackingRadius(), layout.getCapillaryRadius());
        return layout;
    }

    /**
     * Lays out concentric rings from the innermost layer outwards. A layer sits at the larger
     * of {@code previousRadius + pitch} and the radius its own cores need edge to edge, times
     * the layer scale. Empty layers are skipped.
     */
    public Layout computeLayeredLayout(double claddingDiameter, List<RingLayer> layers, LayoutOptions options) {
        int coreCount = RingLayer.totalCount(layers);
        if (coreCount <= 0) {
            throw new LayoutException("Layers " + layers + " hold no cores");
        }
        if (!Double.isFinite(claddingDiameter) || claddingDiameter <= 0) {
            throw new LayoutException("Cladding diameter must be positive, got " + claddingDiameter);
        }
        double pitch = claddingDiameter + options.getEdgeMargin();
        if (pitch <= 0) {
            throw new LayoutException("Edge margin " + options.getEdgeMargin()
                    + " leaves no room between core centres");
        }

        List<Core> cores = new ArrayList<>();
        double radius = 0;
        int ring = 0;
        for (RingLayer layer : layers) {
            if (layer.count() == 0) continue;
            if (cores.isEmpty() && layer.count() == 1) {
                cores.add(centerCore(options));
                continue;
            }
            double minimum = ringRadius(pitch, layer.count());
            if (!cores.isEmpty()) {
                minimum = Math.max(minimum, radius + pitch);
            }
            radius = minimum * layer.scale();
            placeOnRing(cores, layer.count(), radius, ++ring, options);
        }

        Layout layout = new Layout(Arrangement.CIRCULAR, claddingDiameter, radius, cores);
        verifyNoOverlap(layout);

        log.debug("Computed layered layout {}: {} cores, R={}", layers, coreCount, radius);
        return layout;
    }

    /**
     * Radius of the ring on which {@code count} circles of centre spacing {@code pitch} sit
     * edge to edge. A single circle sits on the axis.
     */
    public static double ringRadius(double pitch, int count) {
        if (count <= 1) return 0;
        return pitch / (2 * Math.sin(Math.PI / count));
    }

    private Layout circular(double claddingDiameter, double pitch, int coreCount, LayoutOptions options) {
        List<Core> cores = new ArrayList<>();
        if (coreCount == 1) {
            cores.add(centerCore(options));
            return new Layout(Arrangement.CIRCULAR, claddingDiameter, 0, cores);
        }

        int ringCount = coreCount;
        double radius;
        if (options.isCenterCore()) {
            cores.add(centerCore(options));
            ringCount = coreCount - 1;
            radius = Math.max(ringRadius(pitch, ringCount), pitch);
        } else {
            radius = ringRadius(pitch, ringCount);
        }

        placeOnRing(cores, ringCount, radius, 1, options);
        return new Layout(Arrangement.CIRCULAR, claddingDiameter, radius, cores);
    }

    private Layout hexagonal(double claddingDiameter, double pitch, int coreCount, LayoutOptions options) {
        int shells = 0;
        int placed = 1;
        while (placed + 6 * (shells + 1) <= coreCount) {
            shells++;
            placed += 6 * shells;
        }
        int remainder = coreCount - placed;
        if (remainder > 0 && !options.isPartialShells()) {
            throw new LayoutException("Hexagonal layouts hold 1, 7, 19, 37, ... cores on whole shells; "
                    + coreCount + " cores would leave " + remainder
                    + " on a partial shell (enable partial shells to allow this)");
        }

        List<Core> cores = new ArrayList<>();
        cores.add(centerCore(options));

        double offset = options.getAngularOffsetDegrees();
        for (int shell = 1; shell <= shells; shell++) {
            double shellRadius = shell * pitch;
            for (int side = 0; side < 6; side++) {
                double a0 = Math.toRadians(offset + 60.0 * side);
                double a1 = Math.toRadians(offset + 60.0 * (side + 1));
                double cx = shellRadius * Math.cos(a0);
                double cy = shellRadius * Math.sin(a0);
                double nx = shellRadius * Math.cos(a1);
                double ny = shellRadius * Math.sin(a1);
                for (int step = 0; step < shell; step++) {
                    double t = (double) step / shell;
                    cores.add(new Core(cores.size(), CoreRole.RING, shell, side * shell + step,
                            cx + t * (nx - cx), cy + t * (ny - cy),
                            options.getCoreDiameter(), options.getCoreIndex()));
                }
            }
        }

        int outerShell = shells;
        if (remainder > 0) {
            outerShell = shells + 1;
            placeOnRing(cores, remainder, outerShell * pitch, outerShell, options);
        }
        return new Layout(Arrangement.HEXAGONAL, claddingDiameter, outerShell * pitch, cores);
    }

    private void placeOnRing(List<Core> cores, int count, double radius, int shell, LayoutOptions options) {
        double step = 360.0 / count;
        for (int i = 0; i < count; i++) {
            double angle = Math.toRadians(options.getAngularOffsetDegrees() + i * step);
            cores.add(new Core(cores.size(), CoreRole.RING, shell, i,
                    radius * Math.cos(angle), radius * Math.sin(angle),
                    options.getCoreDiameter(), options.getCoreIndex()));
        }
    }

    private Core centerCore(LayoutOptions options) {
        return new Core(0, CoreRole.CENTER, 0, 0, 0, 0, options.getCoreDiameter(), options.getCoreIndex());
    }

    private void verifyNoOverlap(Layout layout) {
        double minDistance = layout.getCladdingDiameter() * (1 - OVERLAP_TOLERANCE);
        List<CoreSpatialIndex.CorePair> pairs =
                CoreSpatialIndex.findPairsCloserThan(layout.getCores(), minDistance);
        if (pairs.isEmpty()) return;

        CoreSpatialIndex.CorePair first = pairs.stream()
                .min(Comparator.comparingInt((CoreSpatialIndex.CorePair p) -> p.first().getId())
                        .thenComparingInt(p -> p.second().getId()))
                .orElseThrow();
        throw new LayoutException(String.format(Locale.US,
                "Claddings of cores %d and %d overlap: centres %.4f apart, cladding diameter %.4f (%d overlapping pairs)",
                first.first().getId(), first.second().getId(), first.distance(),
                layout.getCladdingDiameter(), pairs.size()));
    }
}
