package nl.bytesoflife.lanterncad.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A waveguide element: begin and end extents, index contrast and any extra keyword
 * properties, in the order they are written.
 */
public class Segment {

    private final SegmentId id;
    private final Map<String, Object> properties;
    private final String taperName;

    Segment(SegmentId id, Map<String, Object> properties, String taperName) {
        this.id = id;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.taperName = taperName;
    }

    public SegmentId getId() { return id; }
    public Map<String, Object> getProperties() { return properties; }

    /** Name of the taper this segment was derived from, or null for an untapered segment. */
    public String getTaperName() { return taperName; }

    public Object get(String key) {
        return properties.get(key);
    }

    public String getCompName() {
        return String.valueOf(properties.get("comp_name"));
    }

    /** Numeric property value; throws if the property is missing or not a number. */
    public double getNumber(String key) {
        if (properties.get(key) instanceof Number n) {
            return n.doubleValue();
        }
        throw new CircuitValidationException("Segment property " + key + " is not numeric: " + properties.get(key));
    }
}
