package nl.bytesoflife.lanterncad.circuit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Properties of a segment to add. Values set here replace the segment defaults in place and
 * new keys are appended, so the written order is the default order followed by extras in
 * the order they were set.
 */
public class SegmentSpec {

    private final Map<String, Object> properties = new LinkedHashMap<>();
    private String taperName;

    public SegmentSpec compName(String name) {
        return set("comp_name", name);
    }

    public SegmentSpec begin(Object x, Object y, Object z, Object height, Object width, Object delta) {
        return extent("begin", x, y, z, height, width, delta);
    }

    public SegmentSpec end(Object x, Object y, Object z, Object height, Object width, Object delta) {
        return extent("end", x, y, z, height, width, delta);
    }

    private SegmentSpec extent(String which, Object x, Object y, Object z, Object height, Object width, Object delta) {
        set(which + ".x", x);
        set(which + ".y", y);
        set(which + ".z", z);
        set(which + ".height", height);
        set(which + ".width", width);
        return set(which + ".delta", delta);
    }

    public SegmentSpec set(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    public SegmentSpec setAll(Map<String, ?> values) {
        properties.putAll(values);
        return this;
    }

    /** Associates the segment with a named taper. */
    public SegmentSpec taper(String name) {
        this.taperName = name;
        return this;
    }

    Map<String, Object> getProperties() {
        return properties;
    }

    String getTaperName() {
        return taperName;
    }
}
