package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.circuit.MonitorType;
import nl.bytesoflife.lanterncad.geometry.Arrangement;
import nl.bytesoflife.lanterncad.geometry.LayoutOptions;
import nl.bytesoflife.lanterncad.geometry.RingLayer;
import nl.bytesoflife.lanterncad.mode.ModeRequest;
import nl.bytesoflife.lanterncad.taper.TaperProfile;
import nl.bytesoflife.lanterncad.taper.TaperProfiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything {@link LanternBuilder#createLantern} needs to lay out, taper and populate a
 * lantern. Build instances with {@link #builder()}.
 */
public class LanternParameters {

    public static final double DEFAULT_TAPER_LENGTH = 80000;
    public static final double DEFAULT_WAVELENGTH = 1.55;

    private final int coreCount;
    private final Arrangement arrangement;
    private final LayoutOptions layoutOptions;
    private final List<RingLayer> layers;
    private final ModeRequest modeRequest;
    private final FiberProperties fiber;
    private final Map<String, FiberOverride> overrides;
    private final double taperFactor;
    private final double taperLength;
    private final TaperProfile taperProfile;
    private final Map<FiberLayer, LayerTaper> layerTapers;
    private final Double capillaryDiameter;
    private final MonitorType monitorType;
    private final double wavelength;
    private final int femNev;
    private final Map<String, Object> simParams;
    private final String optName;

    private LanternParameters(Builder b) {
        this.coreCount = b.coreCount;
        this.arrangement = b.arrangement;
        this.layoutOptions = b.layoutOptions;
        this.layers = List.copyOf(b.layers);
        this.modeRequest = b.modeRequest;
        this.fiber = b.fiber;
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.overrides));
        this.taperFactor = b.taperFactor;
        this.taperLength = b.taperLength;
        this.taperProfile = b.taperProfile;
        this.layerTapers = Collections.unmodifiableMap(new EnumMap<>(b.layerTapers));
        this.capillaryDiameter = b.capillaryDiameter;
        this.monitorType = b.monitorType;
        this.wavelength = b.wavelength;
        this.femNev = b.femNev;
        this.simParams = Collections.unmodifiableMap(new LinkedHashMap<>(b.simParams));
        this.optName = b.optName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getCoreCount() { return coreCount; }
    public Arrangement getArrangement() { return arrangement; }
    public LayoutOptions getLayoutOptions() { return layoutOptions; }
    public List<RingLayer> getLayers() { return layers; }
    public ModeRequest getModeRequest() { return modeRequest; }
    public FiberProperties getFiber() { return fiber; }
    public Map<String, FiberOverride> getOverrides() { return overrides; }
    public double getTaperFactor() { return taperFactor; }
    public double getTaperLength() { return taperLength; }
    public TaperProfile getTaperProfile() { return taperProfile; }
    public Map<FiberLayer, LayerTaper> getLayerTapers() { return layerTapers; }
    public Double getCapillaryDiameter() { return capillaryDiameter; }
    public MonitorType getMonitorType() { return monitorType; }
    public double getWavelength() { return wavelength; }
    public int getFemNev() { return femNev; }
    public Map<String, Object> getSimParams() { return simParams; }
    public String getOptName() { return optName; }

    /** Taper factor of one layer, the shared factor unless the layer sets its own. */
    public double taperFactorFor(FiberLayer layer) {
        LayerTaper taper = layerTapers.get(layer);
        return taper == null || taper.factor() == null ? taperFactor : taper.factor();
    }

    public TaperProfile taperProfileFor(FiberLayer layer) {
        LayerTaper taper = layerTapers.get(layer);
        return taper == null || taper.profile() == null ? taperProfile : taper.profile();
    }

    /** Fibre properties of the core with the given label, overrides applied. */
    public FiberProperties fiberFor(String label) {
        FiberOverride override = overrides.get(label);
        return override == null ? fiber : override.applyTo(fiber);
    }

    /**
     * Per-core replacements for the bundle-wide fibre properties. Unset fields are null.
     */
    public record FiberOverride(Double coreDiameter, Double claddingDiameter, Double coreIndex,
                                Double claddingIndex, Double backgroundIndex) {

        static final FiberOverride NONE = new FiberOverride(null, null, null, null, null);

        FiberProperties applyTo(FiberProperties base) {
            FiberProperties p = base;
            if (coreDiameter != null) p = p.withCoreDiameter(coreDiameter);
            if (claddingDiameter != null) p = p.withCladdingDiameter(claddingDiameter);
            if (coreIndex != null) p = p.withCoreIndex(coreIndex);
            if (claddingIndex != null) p = p.withCladdingIndex(claddingIndex);
            if (backgroundIndex != null) p = p.withBackgroundIndex(backgroundIndex);
            return p;
        }
    }

    /** Per-layer replacement of the shared taper. Unset fields are null. */
    public record LayerTaper(Double factor, TaperProfile profile) {}

    public static class Builder {
        private int coreCount = 0;
        private Arrangement arrangement = Arrangement.CIRCULAR;
        private LayoutOptions layoutOptions = LayoutOptions.defaults();
        private final List<RingLayer> layers = new ArrayList<>();
        private ModeRequest modeRequest;
        private FiberProperties fiber = FiberProperties.DEFAULT;
        private final Map<String, FiberOverride> overrides = new LinkedHashMap<>();
        private double taperFactor = 1;
        private double taperLength = DEFAULT_TAPER_LENGTH;
        private TaperProfile taperProfile = TaperProfiles.LINEAR;
        private final Map<FiberLayer, LayerTaper> layerTapers = new EnumMap<>(FiberLayer.class);
        private Double capillaryDiameter;
        private MonitorType monitorType = MonitorType.FIBER_POWER;
        private double wavelength = DEFAULT_WAVELENGTH;
        private int femNev = 1;
        private final Map<String, Object> simParams = new LinkedHashMap<>();
        private String optName = "0";

        public Builder coreCount(int coreCount) {
            this.coreCount = coreCount;
            return this;
        }

        public Builder arrangement(Arrangement arrangement) {
            this.arrangement = arrangement;
            return this;
        }

        public Builder layoutOptions(LayoutOptions layoutOptions) {
            this.layoutOptions = layoutOptions;
            return this;
        }

        /**
         * Concentric ring layers, innermost first, replacing the core count of a circular
         * layout.
         */
        public Builder layers(List<RingLayer> layers) {
            this.layers.clear();
            this.layers.addAll(layers);
            return this;
        }

        public Builder layers(RingLayer... layers) {
            return layers(List.of(layers));
        }

        /** Modes of a mode-selective lantern; the core count then follows from the modes. */
        public Builder modes(String highestMode, String launchMode) {
            this.modeRequest = new ModeRequest(highestMode, launchMode);
            return this;
        }

        public Builder fiber(FiberProperties fiber) {
            this.fiber = fiber;
            return this;
        }

        public Builder coreDiameter(String label, double d) {
            return override(label, new FiberOverride(d, null, null, null, null));
        }

        public Builder claddingDiameter(String label, double d) {
            return override(label, new FiberOverride(null, d, null, null, null));
        }

        public Builder coreIndex(String label, double n) {
            return override(label, new FiberOverride(null, null, n, null, null));
        }

        public Builder claddingIndex(String label, double n) {
            return override(label, new FiberOverride(null, null, null, n, null));
        }

        public Builder backgroundIndex(String label, double n) {
            return override(label, new FiberOverride(null, null, null, null, n));
        }

        private Builder override(String label, FiberOverride change) {
            FiberOverride current = overrides.getOrDefault(label, FiberOverride.NONE);
            overrides.put(label, new FiberOverride(
                    change.coreDiameter() != null ? change.coreDiameter() : current.coreDiameter(),
                    change.claddingDiameter() != null ? change.claddingDiameter() : current.claddingDiameter(),
                    change.coreIndex() != null ? change.coreIndex() : current.coreIndex(),
                    change.claddingIndex() != null ? change.claddingIndex() : current.claddingIndex(),
                    change.backgroundIndex() != null ? change.backgroundIndex() : current.backgroundIndex()));
            return this;
        }

        /** Start diameter over end diameter; 1 leaves the structure untapered. */
        public Builder taperFactor(double taperFactor) {
            this.taperFactor = taperFactor;
            return this;
        }

        public Builder taperLength(double taperLength) {
            this.taperLength = taperLength;
            return this;
        }

        public Builder taperProfile(TaperProfile taperProfile) {
            this.taperProfile = taperProfile;
            return this;
        }

        /** Tapers one layer with its own factor and profile instead of the shared ones. */
        public Builder layerTaper(FiberLayer layer, double factor, TaperProfile profile) {
            layerTapers.put(layer, new LayerTaper(factor, profile));
            return this;
        }

        public Builder layerTaperProfile(FiberLayer layer, TaperProfile profile) {
            LayerTaper current = layerTapers.get(layer);
            layerTapers.put(layer, new LayerTaper(current == null ? null : current.factor(), profile));
            return this;
        }

        /** Capillary bore at the start of the taper; defaults to the packing's enclosing diameter. */
        public Builder capillaryDiameter(double capillaryDiameter) {
            this.capillaryDiameter = capillaryDiameter;
            return this;
        }

        public Builder monitorType(MonitorType monitorType) {
            this.monitorType = monitorType;
            return this;
        }

        public Builder wavelength(double wavelength) {
            this.wavelength = wavelength;
            return this;
        }

        public Builder femNev(int femNev) {
            this.femNev = femNev;
            return this;
        }

        public Builder simParam(String key, Object value) {
            simParams.put(key, value);
            return this;
        }

        public Builder simParams(Map<String, ?> params) {
            simParams.putAll(params);
            return this;
        }

        public Builder optName(String optName) {
            this.optName = optName;
            return this;
        }

        public LanternParameters build() {
            return new LanternParameters(this);
        }
    }
}
