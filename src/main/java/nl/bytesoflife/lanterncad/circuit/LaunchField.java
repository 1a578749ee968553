package nl.bytesoflife.lanterncad.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input field injected into a pathway at the start of a simulation.
 */
public class LaunchField {

    private final LaunchFieldId id;
    private final PathwayId pathway;
    private final Map<String, Object> properties;

    LaunchField(LaunchFieldId id, PathwayId pathway, Map<String, Object> properties) {
        this.id = id;
        this.pathway = pathway;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public LaunchFieldId getId() { return id; }
    public PathwayId getPathway() { return pathway; }
    public Map<String, Object> getProperties() { return properties; }

    public String getLaunchType() {
        return String.valueOf(properties.get("launch_type"));
    }
}
