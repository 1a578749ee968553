package nl.bytesoflife.lanterncad.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory circuit: global parameters plus segments, pathways, monitors and launch fields,
 * each kept in insertion order.
 * <p>
 * References are checked when an entry is added and a rejected entry leaves the circuit
 * unchanged. After {@link #freeze()} every mutating call throws
 * {@link CircuitStateException}.
 */
public class CircuitModel implements CircuitView {

    private final Map<String, Object> globals = new LinkedHashMap<>();
    private final List<Segment> segments = new ArrayList<>();
    private final List<Pathway> pathways = new ArrayList<>();
    private final List<Monitor> monitors = new ArrayList<>();
    private final List<LaunchField> launchFields = new ArrayList<>();
    private final Set<EntryId> known = new HashSet<>();
    private boolean frozen = false;
    private final CircuitView view = new ReadOnlyView();

    public CircuitModel() {
        globals.put("alpha", 0);
        globals.put("background_index", 1);
        globals.put("cad_aspectratio", 1);
        globals.put("delta", 0.1);
        globals.put("dimension", 3);
        globals.put("eim", 0);
        globals.put("free_space_wavelength", 1.55);
        globals.put("height", 1);
        globals.put("k0", "(2 * pi) / free_space_wavelength");
        globals.put("lambda", "free_space_wavelength");
        globals.put("launch_tilt", 1);
        globals.put("sim_tool", "ST_BEAMPROP");
        globals.put("structure", "STRUCT_CHANNEL");
        globals.put("width", 1);
    }

    public CircuitModel(Map<String, ?> params) {
        this();
        updateGlobalParams(params);
    }

    /**
     * Sets global parameters. Existing keys keep their position, new keys are appended.
     */
    public CircuitModel updateGlobalParams(Map<String, ?> params) {
        checkMutable();
        Map<String, Object> checked = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            checked.put(checkKey(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }
        globals.putAll(checked);
        return this;
    }

    public CircuitModel setGlobalParam(String key, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key, value);
        return updateGlobalParams(single);
    }

    public SegmentId addSegment(SegmentSpec spec) {
        checkMutable();
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("structure", "STRUCT_FIBER");
        props.put("comp_name", "CORE");
        for (String end : new String[]{"begin", "end"}) {
            props.put(end + ".x", 0);
            props.put(end + ".y", 0);
            props.put(end + ".z", 0);
            props.put(end + ".height", 0);
            props.put(end + ".width", 0);
            props.put(end + ".delta", 0);
        }
        for (Map.Entry<String, Object> entry : spec.getProperties().entrySet()) {
            props.put(checkKey(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }

        SegmentId id = new SegmentId(segments.size() + 1);
        segments.add(new Segment(id, props, spec.getTaperName()));
        known.add(id);
        return id;
    }

    public PathwayId addPathway(SegmentId... segmentIds) {
        return addPathway(List.of(segmentIds));
    }

    public PathwayId addPathway(List<SegmentId> segmentIds) {
        checkMutable();
        if (segmentIds.isEmpty()) {
            throw new CircuitValidationException("A pathway needs at least one segment");
        }
        for (SegmentId segmentId : segmentIds) {
            checkReference(segmentId, "Pathway");
        }

        PathwayId id = new PathwayId(pathways.size() + 1);
        pathways.add(new Pathway(id, segmentIds));
        known.add(id);
        return id;
    }

    public MonitorId addMonitor(PathwayId pathway, MonitorType type) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("monitor_type", type);
        return addMonitor(pathway, props);
    }

    /**
     * Adds a monitor on {@code pathway}. Defaults to {@code MONITOR_WG_POWER} over both field
     * components; {@code properties} replace or extend the defaults.
     */
    public MonitorId addMonitor(PathwayId pathway, Map<String, ?> properties) {
        checkMutable();
        checkReference(pathway, "Monitor");

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("pathway", pathway);
        props.put("monitor_type", MonitorType.WG_POWER.keyword());
        props.put("monitor_component", "COMPONENT_BOTH");
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            if (entry.getKey().equals("pathway")) continue;
            props.put(checkKey(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }

        MonitorId id = new MonitorId(monitors.size() + 1);
        monitors.add(new Monitor(id, pathway, props));
        known.add(id);
        return id;
    }

    /**
     * Adds a launch field and mirrors its properties into the global parameters, where the
     * simulator reads the active launch settings.
     */
    public LaunchFieldId addLaunchField(LaunchFieldSpec spec) {
        checkMutable();
        PathwayId pathway = spec.getPathway();
        checkReference(pathway, "Launch field");

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("launch_pathway", pathway);
        props.put("launch_type", LaunchType.GAUSSIAN.keyword());
        props.put("launch_random_set", 69);
        props.put("launch_align_file", 1);
        props.put("launch_width", 0);
        props.put("launch_height", 0);
        props.put("launch_position", 0);
        props.put("launch_position_y", 0);
        props.put("launch_polarizer", 2);
        props.put("launch_polarizer_angle", 45);
        for (Map.Entry<String, Object> entry : spec.getProperties().entrySet()) {
            if (entry.getKey().equals("launch_pathway")) continue;
            props.put(checkKey(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }
        checkNonNegative(props, "launch_power");
        checkNonNegative(props, "launch_width");
        checkNonNegative(props, "launch_height");

        LaunchFieldId id = new LaunchFieldId(launchFields.size() + 1);
        launchFields.add(new LaunchField(id, pathway, props));
        known.add(id);
        globals.putAll(props);
        return id;
    }

    /**
     * Makes the circuit read-only. Calling it again returns the same view.
     */
    public CircuitView freeze() {
        frozen = true;
        return view;
    }

    /** Live read-only view; it cannot be cast back to the model. */
    public CircuitView view() {
        return view;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    public boolean contains(EntryId id) {
        return known.contains(id);
    }

    public Segment getSegment(SegmentId id) {
        for (Segment segment : segments) {
            if (segment.getId() == id) return segment;
        }
        throw new CircuitReferenceException("Segment " + id + " is not part of this circuit");
    }

    public Pathway getPathway(PathwayId id) {
        for (Pathway pathway : pathways) {
            if (pathway.getId() == id) return pathway;
        }
        throw new CircuitReferenceException("Pathway " + id + " is not part of this circuit");
    }

    @Override
    public Map<String, Object> getGlobalParameters() {
        return Collections.unmodifiableMap(globals);
    }

    @Override
    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    @Override
    public List<Pathway> getPathways() {
        return Collections.unmodifiableList(pathways);
    }

    @Override
    public List<Monitor> getMonitors() {
        return Collections.unmodifiableList(monitors);
    }

    @Override
    public List<LaunchField> getLaunchFields() {
        return Collections.unmodifiableList(launchFields);
    }

    /** Value of a position measured from the beginning of {@code segment}. */
    public static RelativePosition relativeDistance(String variable, SegmentId segment) {
        return new RelativePosition(variable, segment);
    }

    private void checkMutable() {
        if (frozen) {
            throw new CircuitStateException("Circuit is frozen and can no longer be modified");
        }
    }

    private void checkReference(EntryId id, String what) {
        if (id == null || !known.contains(id)) {
            throw new CircuitReferenceException(what + " refers to " + id + ", which is not part of this circuit");
        }
    }

    private static String checkKey(String key) {
        if (key == null || key.isBlank() || !key.strip().equals(key) || key.contains("=") || key.contains("\n")) {
            throw new CircuitValidationException("Invalid property name: '" + key + "'");
        }
        return key;
    }

    /**
     * Normalizes a property value: keywords become strings, ids and relative positions must
     * resolve in this circuit, numbers must be finite.
     */
    private Object checkValue(String key, Object value) {
        if (value instanceof IndKeyword keyword) {
            return keyword.keyword();
        }
        if (value instanceof String s) {
            if (s.contains("\n")) {
                throw new CircuitValidationException("Property " + key + " spans several lines");
            }
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            if (!Double.isFinite(((Number) value).doubleValue())) {
                throw new CircuitValidationException("Property " + key + " must be finite, got " + value);
            }
            return value;
        }
        if (value instanceof Integer || value instanceof Long) {
            return value;
        }
        if (value instanceof EntryId id) {
            checkReference(id, "Property " + key);
            return id;
        }
        if (value instanceof RelativePosition relative) {
            checkReference(relative.segment(), "Property " + key);
            return relative;
        }
        throw new CircuitValidationException("Property " + key + " has an unsupported value: " + value);
    }

    private static void checkNonNegative(Map<String, Object> props, String key) {
        if (props.get(key) instanceof Number n && n.doubleValue() < 0) {
            throw new CircuitValidationException(key + " must not be negative, got " + n);
        }
    }

    private final class ReadOnlyView implements CircuitView {

        @Override
        public Map<String, Object> getGlobalParameters() {
            return CircuitModel.this.getGlobalParameters();
        }

        @Override
        public List<Segment> getSegments() {
            return CircuitModel.this.getSegments();
        }

        @Override
        public List<Pathway> getPathways() {
            return CircuitModel.this.getPathways();
        }

        @Override
        public List<Monitor> getMonitors() {
            return CircuitModel.this.getMonitors();
        }

        @Override
        public List<LaunchField> getLaunchFields() {
            return CircuitModel.this.getLaunchFields();
        }

        @Override
        public boolean isFrozen() {
            return frozen;
        }
    }
}
