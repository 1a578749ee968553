package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.LanternCadException;
import nl.bytesoflife.lanterncad.circuit.CircuitModel;
import nl.bytesoflife.lanterncad.circuit.CircuitView;
import nl.bytesoflife.lanterncad.circuit.LaunchFieldId;
import nl.bytesoflife.lanterncad.circuit.LaunchFieldSpec;
import nl.bytesoflife.lanterncad.circuit.LaunchType;
import nl.bytesoflife.lanterncad.circuit.PathwayId;
import nl.bytesoflife.lanterncad.geometry.Arrangement;
import nl.bytesoflife.lanterncad.geometry.Core;
import nl.bytesoflife.lanterncad.geometry.Layout;
import nl.bytesoflife.lanterncad.geometry.LayoutEngine;
import nl.bytesoflife.lanterncad.geometry.LayoutException;
import nl.bytesoflife.lanterncad.geometry.LayoutOptions;
import nl.bytesoflife.lanterncad.geometry.RingLayer;
import nl.bytesoflife.lanterncad.ind.DesignWriter;
import nl.bytesoflife.lanterncad.ind.DesignWriters;
import nl.bytesoflife.lanterncad.mode.ModeAssignmentStrategy;
import nl.bytesoflife.lanterncad.mode.ModeConfigurationException;
import nl.bytesoflife.lanterncad.mode.ModeMap;
import nl.bytesoflife.lanterncad.taper.TaperModel;
import nl.bytesoflife.lanterncad.taper.TaperProfile;
import nl.bytesoflife.lanterncad.taper.TaperProfiles;
import nl.bytesoflife.lanterncad.taper.TaperType;
import nl.bytesoflife.lanterncad.taper.TaperValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Builds one lantern design: layout, mode labels, tapers and the populated circuit, then the
 * design file.
 * <p>
 * A builder moves through {@link LanternState} in one direction only:
 * {@link #createLantern} lays out and tapers the lantern, {@link #addLaunchField} or
 * {@link #launchFromCore} completes the circuit and {@link #write} freezes and writes it.
 * Calls out of that order throw {@link LifecycleException}. Plain photonic and
 * mode-selective lanterns differ only in their {@link ModeAssignmentStrategy}.
 */
public class LanternBuilder {

    private static final Logger log = LoggerFactory.getLogger(LanternBuilder.class);

    public static final String PHOTONIC_PREFIX = "photonic_lantern";
    public static final String MODE_SELECTIVE_PREFIX = "mspl";

    private final ModeAssignmentStrategy modeStrategy;
    private final String filePrefix;
    private final LayoutEngine layoutEngine = new LayoutEngine();
    private String writerTag = DesignWriters.IND;

    private LanternState state = LanternState.UNINITIALIZED;
    private LanternParameters params;
    private Layout layout;
    private ModeMap modeMap;
    private TaperModel taperModel;
    private CircuitModel circuit;
    private Map<String, PathwayId> corePathways;
    private PathwayId capillaryPathway;
    private double capillaryDiameter;
    private SegmentPlanner planner;

    public LanternBuilder(ModeAssignmentStrategy modeStrategy, String filePrefix) {
        this.modeStrategy = modeStrategy;
        this.filePrefix = filePrefix;
    }

    public static LanternBuilder photonic() {
        return new LanternBuilder(ModeAssignmentStrategy.identity(), PHOTONIC_PREFIX);
    }

    public static LanternBuilder modeSelective() {
        return new LanternBuilder(ModeAssignmentStrategy.ranked(), MODE_SELECTIVE_PREFIX);
    }

    /** Selects the design format used by {@link #write}. */
    public LanternBuilder writer(String tag) {
        DesignWriters.get(tag);
        this.writerTag = tag;
        return this;
    }

    /**
     * Lays out the cores, assigns modes, applies the tapers and fills the circuit with core,
     * cladding and capillary segments. Nothing is kept if any step fails.
     */
    public LanternSummary createLantern(LanternParameters params) {
        requireState("createLantern", LanternState.UNINITIALIZED);
        for (FiberLayer layer : FiberLayer.values()) {
            double factor = params.taperFactorFor(layer);
            if (!(factor > 0) || Double.isInfinite(factor)) {
                throw new TaperValidationException("Taper factor of the " + layer.name().toLowerCase()
                        + " layer must be positive, got " + factor);
            }
        }

        FiberProperties fiber = params.getFiber();
        LayoutOptions options = params.getLayoutOptions().withCore(fiber.coreDiameter(), fiber.coreIndex());
        List<RingLayer> layers = params.getLayers();
        int coreCount = params.getCoreCount();
        if (!layers.isEmpty()) {
            if (params.getArrangement() != Arrangement.CIRCULAR) {
                throw new LayoutException("Ring layers need a circular arrangement, got " + params.getArrangement());
            }
            int layered = RingLayer.totalCount(layers);
            if (coreCount != 0 && coreCount != layered) {
                throw new LayoutException("Requested " + coreCount + " cores, but the layers " + layers
                        + " hold " + layered);
            }
            coreCount = layered;
        }
        OptionalInt required = modeStrategy.requiredCoreCount(params.getModeRequest());
        if (required.isPresent()) {
            if (coreCount != 0 && coreCount != required.getAsInt()) {
                throw new ModeConfigurationException("Requested " + coreCount + " cores, but the modes up to "
                        + params.getModeRequest().highestMode() + " need " + required.getAsInt());
            }
            coreCount = required.getAsInt();
            options = params.getArrangement() == Arrangement.CIRCULAR
                    ? options.withCenterCore(true)
                    : options.withPartialShells(true);
        }

        Layout newLayout = layers.isEmpty()
                ? layoutEngine.computeLayout(fiber.claddingDiameter(), coreCount, params.getArrangement(), options)
                : layoutEngine.computeLayeredLayout(fiber.claddingDiameter(), layers, options);
        state = LanternState.LAYOUT_COMPUTED;
        try {
            return populate(params, newLayout);
        } catch (RuntimeException e) {
            state = LanternState.UNINITIALIZED;
            throw e;
        }
    }

    private LanternSummary populate(LanternParameters params, Layout newLayout) {
        ModeMap newModeMap = modeStrategy.assign(params.getModeRequest(), newLayout);

        for (String label : params.getOverrides().keySet()) {
            if (newLayout.findByLabel(label) == null) {
                throw new LanternCadException("Fibre override for unknown core '" + label + "'");
            }
        }

        double capillary = params.getCapillaryDiameter() != null
                ? params.getCapillaryDiameter()
                : newLayout.getCapillaryDiameter();
        if (!newLayout.encloses(capillary)) {
            throw new LayoutException("Capillary diameter " + capillary + " does not hold the "
                    + newLayout.getCoreCount() + " claddings (needs " + newLayout.getCapillaryDiameter() + ")");
        }

        FiberProperties fiber = params.getFiber();
        CircuitModel newCircuit = new CircuitModel();
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("structure", "STRUCT_FIBER");
        defaults.put("cad_aspectratio_x", 50);
        defaults.put("cad_aspectratio_y", 50);
        defaults.put("background_index", fiber.backgroundIndex());
        defaults.put("free_space_wavelength", params.getWavelength());
        defaults.put("grid_size", 1);
        defaults.put("grid_size_y", 1);
        defaults.put("fem_nev", 1);
        defaults.put("sim_tool", "ST_BEAMPROP");
        defaults.put("slice_display_mode", "DISPLAY_CONTOURMAPXZ");
        newCircuit.updateGlobalParams(defaults);

        TaperModel newTapers = new TaperModel();
        Map<FiberLayer, SegmentPlanner.LayerPlan> plans = new EnumMap<>(FiberLayer.class);
        for (FiberLayer layer : FiberLayer.values()) {
            TaperProfile profile = params.taperProfileFor(layer);
            plans.put(layer, new SegmentPlanner.LayerPlan(params.taperFactorFor(layer), profile,
                    taperType(profile, newTapers)));
        }
        SegmentPlanner newPlanner = new SegmentPlanner(newCircuit, newTapers, params.getTaperLength(), plans);

        List<SegmentPlanner.Fiber> fibers = new ArrayList<>();
        for (Core core : newLayout.getCores()) {
            fibers.add(new SegmentPlanner.Fiber(core.getLabel(), core, params.fiberFor(core.getLabel())));
        }
        Map<String, PathwayId> pathways = newPlanner.addCoreSegments(fibers, params.getMonitorType());
        newPlanner.addCladdingSegments(fibers);
        PathwayId capillaryPath = newPlanner.addCapillarySegment(capillary, fiber.backgroundIndex());

        Map<String, Object> sim = new LinkedHashMap<>();
        sim.put("grid_size", 1);
        sim.put("grid_size_y", 1);
        sim.put("fem_nev", params.getFemNev());
        sim.put("slice_display_mode", "DISPLAY_CONTOURMAPXY");
        sim.putAll(params.getSimParams());
        newCircuit.updateGlobalParams(sim);

        this.params = params;
        this.layout = newLayout;
        this.modeMap = newModeMap;
        this.taperModel = newTapers;
        this.circuit = newCircuit;
        this.planner = newPlanner;
        this.corePathways = pathways;
        this.capillaryPathway = capillaryPath;
        this.capillaryDiameter = capillary;
        this.state = LanternState.TAPERS_APPLIED;

        log.info("Created {} lantern: {} cores, capillary diameter {}", filePrefix,
                newLayout.getCoreCount(), capillary);
        return new LanternSummary(newLayout, newModeMap, coreInfo(), capillary);
    }

    private static TaperType taperType(TaperProfile profile, TaperModel tapers) {
        if (profile == TaperProfiles.LINEAR) return TaperType.LINEAR;
        if (profile == TaperProfiles.EXPONENTIAL) return TaperType.EXPONENTIAL;
        return tapers.userTypeFor(profile);
    }

    public LaunchFieldId addLaunchField(LaunchFieldSpec spec) {
        requireState("addLaunchField", LanternState.TAPERS_APPLIED, LanternState.CIRCUIT_POPULATED);
        LaunchFieldId id = circuit.addLaunchField(spec);
        state = LanternState.CIRCUIT_POPULATED;
        return id;
    }

    /**
     * Launches into the core with the given label: centred on it, as wide as the core, on the
     * core's own pathway. An orientation-less label of a degenerate mode selects its
     * {@code a} core.
     */
    public LaunchFieldId launchFromCore(String label, LaunchType type) {
        requireState("launchFromCore", LanternState.TAPERS_APPLIED, LanternState.CIRCUIT_POPULATED);
        Core core = findCore(label);
        return addLaunchField(planner.launchFrom(core, corePathways.get(core.getLabel()), type));
    }

    /** Launches into the requested launch mode, or the first core of a plain lantern. */
    public LaunchFieldId launchDefault(LaunchType type) {
        requireState("launchDefault", LanternState.TAPERS_APPLIED, LanternState.CIRCUIT_POPULATED);
        String label = modeMap.isEmpty() ? layout.getCores().get(0).getLabel() : modeMap.getLaunchMode();
        return launchFromCore(label, type);
    }

    /**
     * Writes the design under {@code dataDir} with the default name
     * {@code <prefix>_<n>_cores/<prefix>_<n>_cores_<opt>.<ext>}.
     */
    public DesignHandle write(Path dataDir) throws IOException {
        requireWritable();
        DesignWriter writer = DesignWriters.get(writerTag);
        int n = layout.getCoreCount();
        String fileName = designFileName(filePrefix, n, params.getOptName(), writer.extension());
        return writeTo(dataDir.resolve(designDirectoryName(filePrefix, n)).resolve(fileName));
    }

    /**
     * Freezes the circuit and writes it to {@code file}. Writing again without changes gives
     * identical output.
     */
    public DesignHandle writeTo(Path file) throws IOException {
        requireWritable();
        CircuitView view = circuit.freeze();
        DesignWriter writer = DesignWriters.get(writerTag);
        writer.write(view, file);
        state = LanternState.WRITTEN;
        return new DesignHandle(file, file.getFileName().toString(), coreInfo());
    }

    private void requireWritable() {
        requireState("write", LanternState.TAPERS_APPLIED, LanternState.CIRCUIT_POPULATED, LanternState.WRITTEN);
        if (circuit.getSegments().isEmpty()) {
            throw new IncompleteDesignException("Design has no segments");
        }
        if (circuit.getLaunchFields().isEmpty()) {
            throw new IncompleteDesignException("Design has no launch field; add one before writing");
        }
    }

    public static String designDirectoryName(String prefix, int coreCount) {
        return prefix + "_" + coreCount + "_cores";
    }

    public static String designFileName(String prefix, int coreCount, String optName, String extension) {
        return designDirectoryName(prefix, coreCount) + "_" + optName + "." + extension;
    }

    private Core findCore(String label) {
        Core core = layout.findByLabel(label);
        if (core == null) {
            core = layout.findByLabel(label + "a");
        }
        if (core == null) {
            throw new LanternCadException("No core labelled '" + label + "'");
        }
        return core;
    }

    private Map<String, CoreInfo> coreInfo() {
        Map<String, CoreInfo> cores = new LinkedHashMap<>();
        for (Core core : layout.getCores()) {
            FiberProperties p = params.fiberFor(core.getLabel());
            cores.put(core.getLabel(), new CoreInfo(core.getLabel(), core.getRole(), core.getX(), core.getY(),
                    core.getDiameter(), p.claddingDiameter(), core.getModeLabel()));
        }
        return cores;
    }

    private void requireState(String operation, LanternState... allowed) {
        for (LanternState s : allowed) {
            if (state == s) return;
        }
        throw new LifecycleException(operation + " is not allowed in state " + state);
    }

    public LanternState getState() { return state; }
    public String getFilePrefix() { return filePrefix; }
    public Layout getLayout() { return layout; }
    public ModeMap getModeMap() { return modeMap; }
    public TaperModel getTaperModel() { return taperModel; }
    public double getCapillaryDiameter() { return capillaryDiameter; }
    public PathwayId getCapillaryPathway() { return capillaryPathway; }

    /** Read-only view of the circuit, null before {@link #createLantern}. */
    public CircuitView getCircuit() {
        return circuit == null ? null : circuit.view();
    }

    public PathwayId getCorePathway(String label) {
        requireState("getCorePathway", LanternState.TAPERS_APPLIED, LanternState.CIRCUIT_POPULATED, LanternState.WRITTEN);
        return corePathways.get(findCore(label).getLabel());
    }
}
