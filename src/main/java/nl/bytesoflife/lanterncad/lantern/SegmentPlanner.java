package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.circuit.CircuitModel;
import nl.bytesoflife.lanterncad.circuit.LaunchFieldSpec;
import nl.bytesoflife.lanterncad.circuit.LaunchType;
import nl.bytesoflife.lanterncad.circuit.MonitorType;
import nl.bytesoflife.lanterncad.circuit.PathwayId;
import nl.bytesoflife.lanterncad.circuit.SegmentId;
import nl.bytesoflife.lanterncad.circuit.SegmentSpec;
import nl.bytesoflife.lanterncad.geometry.Core;
import nl.bytesoflife.lanterncad.taper.TaperModel;
import nl.bytesoflife.lanterncad.taper.TaperProfile;
import nl.bytesoflife.lanterncad.taper.TaperSpec;
import nl.bytesoflife.lanterncad.taper.TaperType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns tapered fibres into circuit segments. Every core segment gets a pathway and a
 * monitor of its own, cladding segments get neither, and the capillary gets a pathway with a
 * partial-power monitor. Each {@link FiberLayer} tapers on its own factor and profile. End
 * positions of both core and cladding segments shrink towards the axis with the cladding
 * taper, so a core stays centred in its cladding.
 */
class SegmentPlanner {

    private static final String[] TAPER_KEYS = {"width_taper", "height_taper", "position_y_taper", "position_taper"};

    private final CircuitModel circuit;
    private final TaperModel tapers;
    private final double taperLength;
    private final Map<FiberLayer, LayerPlan> plans;

    SegmentPlanner(CircuitModel circuit, TaperModel tapers, double taperLength, Map<FiberLayer, LayerPlan> plans) {
        this.circuit = circuit;
        this.tapers = tapers;
        this.taperLength = taperLength;
        this.plans = plans;
        for (FiberLayer layer : FiberLayer.values()) {
            if (!plans.containsKey(layer)) {
                throw new IllegalArgumentException("No taper plan for layer " + layer);
            }
        }
    }

    record Fiber(String label, Core core, FiberProperties properties) {}

    /** How one layer tapers. */
    record LayerPlan(double factor, TaperProfile profile, TaperType type) {}

    /** Adds one core segment per fibre and returns each core's pathway by label. */
    Map<String, PathwayId> addCoreSegments(List<Fiber> fibers, MonitorType monitorType) {
        Map<String, PathwayId> pathways = new LinkedHashMap<>();
        for (Fiber fiber : fibers) {
            FiberProperties p = fiber.properties();
            TaperSpec core = register(FiberLayer.CORE, "core-" + fiber.label(), p.coreDiameter(), p.coreIndex());
            fiber.core().applyTaper(core);

            SegmentId segment = circuit.addSegment(fiberSegment(fiber, FiberLayer.CORE, core, p.backgroundIndex()));
            PathwayId pathway = circuit.addPathway(segment);
            circuit.addMonitor(pathway, monitorType);
            pathways.put(fiber.label(), pathway);
        }
        return pathways;
    }

    void addCladdingSegments(List<Fiber> fibers) {
        for (Fiber fiber : fibers) {
            FiberProperties p = fiber.properties();
            TaperSpec cladding = register(FiberLayer.CLADDING, "cladding-" + fiber.label(),
                    p.claddingDiameter(), p.claddingIndex());
            circuit.addSegment(fiberSegment(fiber, FiberLayer.CLADDING, cladding, p.backgroundIndex()));
        }
    }

    PathwayId addCapillarySegment(double capillaryDiameter, double backgroundIndex) {
        TaperSpec capillary = register(FiberLayer.CAPILLARY, "capillary", capillaryDiameter, backgroundIndex);
        double end = capillary.diameterAt(taperLength);
        SegmentSpec spec = new SegmentSpec()
                .compName("CAPILLARY")
                .begin(0, 0, 0, capillaryDiameter, capillaryDiameter, 0)
                .end(0, 0, taperLength, end, end, 0)
                .taper(capillary.getName());
        tag(spec, plans.get(FiberLayer.CAPILLARY).type());

        SegmentId segment = circuit.addSegment(spec);
        PathwayId pathway = circuit.addPathway(segment);
        circuit.addMonitor(pathway, MonitorType.PARTIAL_POWER);
        return pathway;
    }

    /** Launch field centred on a core, as wide as the core. */
    LaunchFieldSpec launchFrom(Core core, PathwayId pathway, LaunchType type) {
        double d = core.getDiameter();
        return new LaunchFieldSpec(pathway)
                .type(type)
                .tilt(0)
                .size(d, d)
                .position(core.getX(), core.getY());
    }

    private TaperSpec register(FiberLayer layer, String name, double diameter, double index) {
        LayerPlan plan = plans.get(layer);
        TaperSpec spec = TaperSpec.byFactor(name, taperLength, diameter, plan.factor(), index, plan.profile(),
                plan.type());
        tapers.register(spec);
        return spec;
    }

    private SegmentSpec fiberSegment(Fiber fiber, FiberLayer layer, TaperSpec taper, double backgroundIndex) {
        Core core = fiber.core();
        LayerPlan plan = plans.get(layer);
        double scale = 1 / plans.get(FiberLayer.CLADDING).factor();
        double beginDiameter = taper.diameterAt(0);
        double endDiameter = taper.diameterAt(taperLength);
        double beginDelta = taper.indexAt(0) - backgroundIndex;
        double endDelta = taper.indexAt(taperLength) - backgroundIndex;

        SegmentSpec spec = new SegmentSpec()
                .compName(fiber.label() + "_" + layer.name())
                .begin(core.getX(), core.getY(), 0, beginDiameter, beginDiameter, beginDelta)
                .end(core.getX() * scale, core.getY() * scale, taperLength, endDiameter, endDiameter, endDelta)
                .taper(taper.getName());
        if (plan.factor() != 1) {
            tag(spec, plan.type());
        }
        return spec;
    }

    private void tag(SegmentSpec spec, TaperType type) {
        for (String key : TAPER_KEYS) {
            spec.set(key, type.tag());
        }
    }
}
