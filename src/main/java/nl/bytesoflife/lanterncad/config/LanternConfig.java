package nl.bytesoflife.lanterncad.config;

import nl.bytesoflife.lanterncad.circuit.LaunchType;
import nl.bytesoflife.lanterncad.geometry.Arrangement;
import nl.bytesoflife.lanterncad.geometry.LayoutOptions;
import nl.bytesoflife.lanterncad.lantern.FiberLayer;
import nl.bytesoflife.lanterncad.lantern.FiberProperties;
import nl.bytesoflife.lanterncad.lantern.LanternParameters;
import nl.bytesoflife.lanterncad.taper.TaperProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * A photonic lantern configuration: groups of named parameters ({@code pl_params},
 * {@code core_segment}, {@code launch_field_config}, ...) whose values are numbers, keyword
 * literals or arithmetic expressions over other parameters.
 * <p>
 * Expressions are looked up in their own group first and in {@code pl_params} after that.
 * Upper-case keywords such as {@code TAPER_LINEAR} and relative positions such as
 * {@code Taper_Length rel begin segment 1} are kept as text.
 */
public class LanternConfig {

    private static final Logger log = LoggerFactory.getLogger(LanternConfig.class);

    public static final String PL_PARAMS = "pl_params";
    public static final String CENTER_CORE_SEGMENT = "center_core_segment";
    public static final String CORE_SEGMENT = "core_segment";
    public static final String CLADDING_SEGMENT = "cladding_segment";
    public static final String CAPILLARY_SEGMENT = "capillary_segment";
    public static final String LAUNCH_FIELD_CONFIG = "launch_field_config";

    private static final Pattern KEYWORD = Pattern.compile("_?[A-Z][A-Z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,18}");

    private final Map<String, Object> root;

    private LanternConfig(Map<String, Object> root) {
        this.root = root;
    }

    public static LanternConfig parse(String json) {
        return new LanternConfig(new JsonParser().parseObject(json));
    }

    public static LanternConfig load(Path file) throws IOException {
        return new LanternConfig(new JsonParser().parseObject(Files.readString(file, StandardCharsets.UTF_8),
                file.toString()));
    }

    public static LanternConfig fromMap(Map<String, ?> root) {
        return new LanternConfig(deepCopy(root));
    }

    public LanternConfig copy() {
        return new LanternConfig(deepCopy(root));
    }

    public void save(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
        log.info("Configuration saved to {}", file);
    }

    public String toJson() {
        return new JsonWriter().write(root);
    }

    /**
     * Sets the parameter at a dotted path such as {@code pl_params.Num_Cores_Ring}, creating
     * missing sections. A text value replacing a number is converted to a number when it
     * parses as one and kept as text (a formula) otherwise.
     */
    @SuppressWarnings("unchecked")
    public LanternConfig override(String path, Object value) {
        if (path == null || path.isBlank()) {
            throw new ConfigException("Empty parameter path");
        }
        String[] parts = path.split("\\.");
        Map<String, Object> target = root;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = target.get(parts[i]);
            if (next == null) {
                log.warn("Creating new section '{}' in configuration", parts[i]);
                next = new LinkedHashMap<String, Object>();
                target.put(parts[i], next);
            } else if (!(next instanceof Map)) {
                throw new ConfigException("Cannot descend into '" + parts[i] + "' of " + path + ": not a section");
            }
            target = (Map<String, Object>) next;
        }

        String name = parts[parts.length - 1];
        if (target.containsKey(name)) {
            Object old = target.get(name);
            Object coerced = coerce(old, value);
            log.info("Changed {}: {} -> {}", path, old, coerced);
            target.put(name, coerced);
        } else {
            log.info("Added new parameter {}: {}", path, value);
            target.put(name, value);
        }
        return this;
    }

    private static Object coerce(Object old, Object value) {
        if (!(old instanceof Number) || !(value instanceof String s)) {
            return value;
        }
        String text = s.trim();
        if (old instanceof Integer || old instanceof Long) {
            if (INTEGER.matcher(text).matches()) {
                long parsed = Long.parseLong(text);
                return parsed == (int) parsed ? Integer.valueOf((int) parsed) : Long.valueOf(parsed);
            }
            return s;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            // a formula
            return s;
        }
    }

    /** Raw value at a dotted path, or null. */
    @SuppressWarnings("unchecked")
    public Object get(String path) {
        Object current = root;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) return null;
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    public boolean hasSection(String group) {
        return root.get(group) instanceof Map;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String group) {
        Object section = root.get(group);
        if (!(section instanceof Map)) {
            throw new ConfigException("Configuration has no section '" + group + "'");
        }
        return Collections.unmodifiableMap((Map<String, Object>) section);
    }

    /**
     * Values of a group with every expression evaluated. Keywords, relative positions and
     * non-numeric values are returned as they are.
     */
    public Map<String, Object> resolveSection(String group) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section(group).entrySet()) {
            resolved.put(entry.getKey(), resolveValue(group, entry.getKey(), new HashSet<>()));
        }
        return resolved;
    }

    /** Numeric value of {@code group.name}, evaluating expressions as needed. */
    public double number(String group, String name) {
        Object value = resolveValue(group, name, new HashSet<>());
        if (value instanceof Number n) return n.doubleValue();
        throw new ConfigException(group + "." + name + " is not numeric: " + value);
    }

    private double numberOr(String group, String name, double fallback) {
        if (!hasSection(group) || !section(group).containsKey(name)) return fallback;
        return number(group, name);
    }

    private Object resolveValue(String group, String name, Set<String> resolving) {
        Map<String, Object> section = section(group);
        if (!section.containsKey(name)) {
            throw new ConfigException("Unknown parameter '" + group + "." + name + "'");
        }
        Object value = section.get(name);
        if (!(value instanceof String expression) || isLiteral(expression)) {
            return value;
        }

        String key = group + "." + name;
        if (!resolving.add(key)) {
            throw new ConfigException("Circular reference while evaluating " + key);
        }
        double result = new ExpressionEvaluator().evaluate(expression, variable -> lookup(group, variable, resolving));
        resolving.remove(key);
        return result;
    }

    private Double lookup(String group, String variable, Set<String> resolving) {
        String owner = null;
        if (section(group).containsKey(variable)) {
            owner = group;
        } else if (hasSection(PL_PARAMS) && section(PL_PARAMS).containsKey(variable)) {
            owner = PL_PARAMS;
        }
        if (owner == null) return null;

        Object value = resolveValue(owner, variable, resolving);
        if (value instanceof Number n) return n.doubleValue();
        throw new ConfigException("Parameter '" + variable + "' is not numeric: " + value);
    }

    private static boolean isLiteral(String value) {
        String s = value.trim();
        return s.isEmpty() || KEYWORD.matcher(s).matches() || s.contains(" rel ");
    }

    /** Every parameter as {@code group.name = value}, sorted by path. */
    public Map<String, Object> flatten() {
        Map<String, Object> flat = new TreeMap<>();
        flatten("", root, flat);
        return flat;
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Map<String, Object> out) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map) {
                flatten(path, (Map<String, Object>) entry.getValue(), out);
            } else {
                out.put(path, entry.getValue());
            }
        }
    }

    /**
     * Photonic lantern parameters: one centre core plus {@code Num_Cores_Ring} ring cores of
     * SMF-28 in a capillary of {@code Index_Capillary}, tapered by {@code Taper_Slope} over
     * {@code Taper_Length}. The centre fibre uses the {@code Index_SM1500G80_*} indices when
     * they are present.
     */
    public LanternParameters toParameters() {
        int ring = (int) Math.round(number(PL_PARAMS, "Num_Cores_Ring"));
        if (ring < 1) {
            throw new ConfigException("Num_Cores_Ring must be at least 1, got " + ring);
        }
        FiberProperties d = FiberProperties.DEFAULT;
        FiberProperties fiber = new FiberProperties(
                numberOr(PL_PARAMS, "Diameter_SM_Core", d.coreDiameter()),
                numberOr(PL_PARAMS, "Diameter_SM_Clad", d.claddingDiameter()),
                numberOr(PL_PARAMS, "Index_SMF28_Core_1550", d.coreIndex()),
                numberOr(PL_PARAMS, "Index_SMF28_Clad_1550", d.claddingIndex()),
                numberOr(PL_PARAMS, "Index_Capillary", d.backgroundIndex()));

        LanternParameters.Builder builder = LanternParameters.builder()
                .coreCount(ring + 1)
                .arrangement(Arrangement.CIRCULAR)
                .layoutOptions(LayoutOptions.defaults()
                        .withCenterCore(true)
                        .withAngularOffset(numberOr(PL_PARAMS, "Rotate_View", 0)))
                .fiber(fiber)
                .taperLength(numberOr(PL_PARAMS, "Taper_Length", LanternParameters.DEFAULT_TAPER_LENGTH))
                .taperFactor(numberOr(PL_PARAMS, "Taper_Slope", 1));

        if (section(PL_PARAMS).containsKey("Index_SM1500G80_Core_1550")) {
            builder.coreIndex("0", number(PL_PARAMS, "Index_SM1500G80_Core_1550"));
        }
        if (section(PL_PARAMS).containsKey("Index_SM1500G80_Clad_1550")) {
            builder.claddingIndex("0", number(PL_PARAMS, "Index_SM1500G80_Clad_1550"));
        }
        layerProfile(builder, CORE_SEGMENT, FiberLayer.CORE);
        layerProfile(builder, CLADDING_SEGMENT, FiberLayer.CLADDING);
        layerProfile(builder, CAPILLARY_SEGMENT, FiberLayer.CAPILLARY);
        return builder.build();
    }

    private void layerProfile(LanternParameters.Builder builder, String group, FiberLayer layer) {
        if (!hasSection(group)) return;
        Object tag = section(group).get("width_taper");
        if ("TAPER_EXPONENTIAL".equals(tag)) {
            builder.layerTaperProfile(layer, TaperProfiles.EXPONENTIAL);
        } else if ("TAPER_LINEAR".equals(tag)) {
            builder.layerTaperProfile(layer, TaperProfiles.LINEAR);
        } else if (tag != null) {
            throw new ConfigException(group + ".width_taper: unsupported taper '" + tag + "'");
        }
    }

    /** Launch type named by {@code launch_field_config.launch_type}, Gaussian by default. */
    public LaunchType launchType() {
        Object keyword = hasSection(LAUNCH_FIELD_CONFIG) ? section(LAUNCH_FIELD_CONFIG).get("launch_type") : null;
        if (keyword == null) return LaunchType.GAUSSIAN;
        for (LaunchType type : LaunchType.values()) {
            if (type.keyword().equals(keyword)) return type;
        }
        throw new ConfigException("Unknown launch type '" + keyword + "'");
    }

    /** Label of the core to launch into, from {@code launch_field_config.launch_core}. */
    public String launchCore() {
        Object core = hasSection(LAUNCH_FIELD_CONFIG) ? section(LAUNCH_FIELD_CONFIG).get("launch_core") : null;
        if (core == null) return "0";
        return core instanceof Number n ? Integer.toString(n.intValue()) : core.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map) {
                value = deepCopy((Map<String, ?>) value);
            } else if (value instanceof List<?> list) {
                value = new ArrayList<>(list);
            }
            copy.put(entry.getKey(), value);
        }
        return copy;
    }
}
