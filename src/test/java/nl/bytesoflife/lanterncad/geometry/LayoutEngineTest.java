package nl.bytesoflife.lanterncad.geometry;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutEngineTest {

    private final LayoutEngine engine = new LayoutEngine();

    @Test
    void fiveCoreCircularRingTouchesEdgeToEdge() {
        Layout layout = engine.computeLayout(125, 5, Arrangement.CIRCULAR);

        assertEquals(5, layout.getCoreCount());
        assertEquals(106.33, layout.getPackingRadius(), 0.01);
        assertEquals(2 * 106.33 + 125, layout.getCapillaryDiameter(), 0.02);

        List<Core> cores = layout.getCores();
        for (int i = 0; i < cores.size(); i++) {
            Core core = cores.get(i);
            assertEquals(i, core.getId());
            assertEquals(CoreRole.RING, core.getRole());
            assertEquals(layout.getPackingRadius(), core.getRadialPosition(), 1e-9);
            assertEquals(72.0 * i, core.getAngleDegrees(), 1e-9);
        }

        double neighbour = Math.hypot(cores.get(0).getX() - cores.get(1).getX(),
                cores.get(0).getY() - cores.get(1).getY());
        assertEquals(125, neighbour, 1e-9);
    }

    @Test
    void singleCoreSitsOnAxis() {
        Layout layout = engine.computeLayout(125, 1, Arrangement.CIRCULAR);

        assertEquals(1, layout.getCoreCount());
        assertEquals(0, layout.getPackingRadius());
        assertEquals(0, layout.getCores().get(0).getX());
        assertEquals(0, layout.getCores().get(0).getY());
        assertEquals(125, layout.getCapillaryDiameter(), 1e-9);
    }

    @Test
    void rejectsNonPositiveCoreCount() {
        assertThrows(LayoutException.class, () -> engine.computeLayout(125, 0, Arrangement.CIRCULAR));
        assertThrows(LayoutException.class, () -> engine.computeLayout(125, -3, Arrangement.HEXAGONAL));
    }

    @Test
    void rejectsNonPositiveDiameter() {
        assertThrows(LayoutException.class, () -> engine.computeLayout(0, 5, Arrangement.CIRCULAR));
        assertThrows(LayoutException.class, () -> engine.computeLayout(Double.NaN, 5, Arrangement.CIRCULAR));
    }

    @Test
    void ringRadiusGrowsWithCoreCount() {
        double previous = 0;
        for (int n = 2; n <= 20; n++) {
            double radius = engine.computeLayout(125, n, Arrangement.CIRCULAR).getPackingRadius();
            assertTrue(radius > previous, "R should grow at n=" + n);
            previous = radius;
        }
    }

    @Test
    void ringRadiusGrowsWithCladdingDiameter() {
        for (Arrangement arrangement : Arrangement.values()) {
            double previous = 0;
            for (double diameter = 50; diameter <= 250; diameter += 12.5) {
                double radius = engine.computeLayout(diameter, 7, arrangement).getPackingRadius();
                assertTrue(radius > previous, arrangement + " R should grow at d=" + diameter);
                previous = radius;
            }
        }
    }

    @Test
    void centerCoreKeepsRingAtLeastOnePitchAway() {
        Layout layout = engine.computeLayout(125, 4, Arrangement.CIRCULAR,
                LayoutOptions.defaults().withCenterCore(true));

        assertEquals(4, layout.getCoreCount());
        assertNotNull(layout.getCenterCore());
        assertEquals(0, layout.getCenterCore().getId());
        assertEquals(3, layout.getRingCores().size());
        // three claddings alone would sit at 72.17, closer than one pitch
        assertEquals(125, layout.getPackingRadius(), 1e-9);
    }

    @Test
    void centerCoreWithSixRingCores() {
        Layout layout = engine.computeLayout(125, 7, Arrangement.CIRCULAR,
                LayoutOptions.defaults().withCenterCore(true));

        assertEquals(125, layout.getPackingRadius(), 1e-9);
        for (Core core : layout.getRingCores()) {
            assertEquals(125, core.getRadialPosition(), 1e-9);
        }
    }

    @Test
    void angularOffsetRotatesRing() {
        Layout layout = engine.computeLayout(125, 3, Arrangement.CIRCULAR,
                LayoutOptions.defaults().withAngularOffset(90));

        assertEquals(90, layout.getCores().get(0).getAngleDegrees(), 1e-9);
        assertEquals(210, layout.getCores().get(1).getAngleDegrees(), 1e-9);
        assertEquals(330, layout.getCores().get(2).getAngleDegrees(), 1e-9);
    }

    @Test
    void edgeMarginWidensRing() {
        Layout tight = engine.computeLayout(125, 6, Arrangement.CIRCULAR);
        Layout spaced = engine.computeLayout(125, 6, Arrangement.CIRCULAR,
                LayoutOptions.defaults().withEdgeMargin(5));

        assertEquals(125, tight.getPackingRadius(), 1e-9);
        assertEquals(130, spaced.getPackingRadius(), 1e-9);
    }

    @Test
    void negativeMarginOverlapsCladdings() {
        LayoutException e = assertThrows(LayoutException.class, () ->
                engine.computeLayout(125, 6, Arrangement.CIRCULAR, LayoutOptions.defaults().withEdgeMargin(-10)));
        assertTrue(e.getMessage().contains("cores 0 and 1"), e.getMessage());
    }

    @Test
    void hexagonalSevenCores() {
        Layout layout = engine.computeLayout(125, 7, Arrangement.HEXAGONAL);

        assertEquals(7, layout.getCoreCount());
        assertTrue(layout.getCores().get(0).isCenter());
        assertEquals(125, layout.getPackingRadius(), 1e-9);
        for (Core core : layout.getRingCores()) {
            assertEquals(1, core.getShell());
            assertEquals(125, core.getRadialPosition(), 1e-9);
        }
    }

    @Test
    void hexagonalNineteenCoresFillTwoShells() {
        Layout layout = engine.computeLayout(125, 19, Arrangement.HEXAGONAL);

        assertEquals(19, layout.getCoreCount());
        assertEquals(250, layout.getPackingRadius(), 1e-9);
        long secondShell = layout.getCores().stream().filter(c -> c.getShell() == 2).count();
        assertEquals(12, secondShell);

        // side midpoints of shell 2 sit on the flat of the hexagon
        Core midpoint = layout.getCores().stream()
                .filter(c -> c.getShell() == 2 && c.getAngularIndex() == 1)
                .findFirst().orElseThrow();
        assertEquals(250 * Math.cos(Math.toRadians(30)), midpoint.getRadialPosition(), 1e-9);
    }

    @Test
    void hexagonalRejectsPartialShellByDefault() {
        assertThrows(LayoutException.class, () -> engine.computeLayout(125, 10, Arrangement.HEXAGONAL));
    }

    @Test
    void hexagonalPartialShellSpreadsRemainder() {
        Layout layout = engine.computeLayout(125, 10, Arrangement.HEXAGONAL,
                LayoutOptions.defaults().withPartialShells(true));

        assertEquals(10, layout.getCoreCount());
        assertEquals(250, layout.getPackingRadius(), 1e-9);
        List<Core> outer = layout.getCores().stream().filter(c -> c.getShell() == 2).toList();
        assertEquals(3, outer.size());
        assertEquals(0, outer.get(0).getAngleDegrees(), 1e-9);
        assertEquals(120, outer.get(1).getAngleDegrees(), 1e-9);
    }

    @Test
    void capillaryEnclosesLayout() {
        Layout layout = engine.computeLayout(125, 6, Arrangement.CIRCULAR);

        assertTrue(layout.encloses(layout.getCapillaryDiameter()));
        assertFalse(layout.encloses(layout.getCapillaryDiameter() - 20));
    }

    @Test
    void coresFollowLayoutOptionsFiber() {
        Layout layout = engine.computeLayout(125, 3, Arrangement.CIRCULAR,
                LayoutOptions.defaults().withCore(8.2, 1.456));

        for (Core core : layout.getCores()) {
            assertEquals(8.2, core.getDiameter());
            assertEquals(1.456, core.getIndex());
            assertEquals(Integer.toString(core.getId()), core.getLabel());
        }
    }

    @Test
    void ringRadiusOfSingleCircleIsZero() {
        assertEquals(0, LayoutEngine.ringRadius(125, 1));
        assertEquals(62.5, LayoutEngine.ringRadius(125, 2), 1e-9);
    }

    @Test
    void geometryExportsFollowGenerationOrder() {
        Layout layout = engine.computeLayout(125, 4, Arrangement.CIRCULAR);

        List<Coordinate> coords = layout.coordinates();
        assertEquals(4, coords.size());
        assertEquals(layout.getCores().get(2).getX(), coords.get(2).x, 1e-12);

        Geometry discs = layout.toGeometry();
        assertEquals(4, discs.getNumGeometries());
        assertTrue(layout.capillaryGeometry().contains(discs.getCentroid()));
        assertEquals(layout.getCapillaryDiameter(), layout.capillaryGeometry().getEnvelopeInternal().getWidth(), 1e-6);
        assertEquals(Math.PI * 62.5 * 62.5, discs.getGeometryN(0).getArea(), 0.01 * Math.PI * 62.5 * 62.5);
    }

    @Test
    void layeredRingsStackOnePitchApart() {
        Layout layout = engine.computeLayeredLayout(125,
                List.of(RingLayer.of(1), RingLayer.of(6), RingLayer.of(12)), LayoutOptions.defaults());

        assertEquals(19, layout.getCoreCount());
        assertEquals(Arrangement.CIRCULAR, layout.getArrangement());
        assertTrue(layout.getCores().get(0).isCenter());
        for (Core core : layout.getRingCores()) {
            double expected = core.getShell() == 1 ? 125 : 250;
            assertEquals(expected, core.getRadialPosition(), 1e-9);
        }
        assertEquals(250, layout.getPackingRadius(), 1e-9);
        assertEquals(625, layout.getCapillaryDiameter(), 1e-9);
        assertEquals(12, layout.getCores().stream().filter(c -> c.getShell() == 2).count());
    }

    @Test
    void layeredRingWidensWhenItsCoresNeedRoom() {
        Layout layout = engine.computeLayeredLayout(125,
                List.of(RingLayer.of(1), RingLayer.of(12)), LayoutOptions.defaults());

        // twelve claddings need more than one pitch from the axis
        assertEquals(LayoutEngine.ringRadius(125, 12), layout.getPackingRadius(), 1e-9);
    }

    @Test
    void layeredRingsWithoutCenterCore() {
        Layout layout = engine.computeLayeredLayout(125,
                List.of(RingLayer.of(5), RingLayer.of(0), RingLayer.of(10)), LayoutOptions.defaults());

        assertEquals(15, layout.getCoreCount());
        assertNull(layout.getCenterCore());
        assertEquals(LayoutEngine.ringRadius(125, 5) + 125, layout.getPackingRadius(), 1e-9);
    }

    @Test
    void layerScaleMovesRingOutwards() {
        Layout layout = engine.computeLayeredLayout(125,
                List.of(RingLayer.of(1), new RingLayer(6, 1.2)), LayoutOptions.defaults());

        assertEquals(150, layout.getPackingRadius(), 1e-9);
    }

    @Test
    void shrunkLayerOverlaps() {
        LayoutException e = assertThrows(LayoutException.class, () -> engine.computeLayeredLayout(125,
                List.of(RingLayer.of(1), new RingLayer(6, 0.9)), LayoutOptions.defaults()));
        assertTrue(e.getMessage().contains("overlap"), e.getMessage());
    }

    @Test
    void layersMustHoldCores() {
        assertThrows(LayoutException.class, () -> engine.computeLayeredLayout(125,
                List.of(RingLayer.of(0)), LayoutOptions.defaults()));
        assertThrows(LayoutException.class, () -> new RingLayer(-1, 1));
        assertThrows(LayoutException.class, () -> new RingLayer(6, 0));
    }

    @Test
    void arrangementNames() {
        assertEquals(Arrangement.HEXAGONAL, Arrangement.fromName("hex"));
        assertEquals(Arrangement.CIRCULAR, Arrangement.fromName("Circular"));
        assertThrows(LayoutException.class, () -> Arrangement.fromName("square"));
    }
}
