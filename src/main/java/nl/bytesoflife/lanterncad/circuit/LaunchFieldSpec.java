package nl.bytesoflife.lanterncad.circuit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Launch field to add to a pathway.
 */
public class LaunchFieldSpec {

    private final PathwayId pathway;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public LaunchFieldSpec(PathwayId pathway) {
        this.pathway = pathway;
    }

    public LaunchFieldSpec type(LaunchType type) {
        return set("launch_type", type);
    }

    public LaunchFieldSpec tilt(double tilt) {
        return set("launch_tilt", tilt);
    }

    /** Launched power; must not be negative. */
    public LaunchFieldSpec power(double power) {
        return set("launch_power", power);
    }

    public LaunchFieldSpec position(double x, double y) {
        set("launch_position", x);
        return set("launch_position_y", y);
    }

    public LaunchFieldSpec size(double width, double height) {
        set("launch_width", width);
        return set("launch_height", height);
    }

    public LaunchFieldSpec set(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    public LaunchFieldSpec setAll(Map<String, ?> values) {
        properties.putAll(values);
        return this;
    }

    PathwayId getPathway() {
        return pathway;
    }

    Map<String, Object> getProperties() {
        return properties;
    }
}
