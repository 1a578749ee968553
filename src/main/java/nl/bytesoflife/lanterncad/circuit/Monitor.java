package nl.bytesoflife.lanterncad.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Samples a quantity along a pathway. The {@code pathway} property holds the target
 * {@link PathwayId}.
 */
public class Monitor {

    private final MonitorId id;
    private final PathwayId pathway;
    private final Map<String, Object> properties;

    Monitor(MonitorId id, PathwayId pathway, Map<String, Object> properties) {
        this.id = id;
        this.pathway = pathway;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public MonitorId getId() { return id; }
    public PathwayId getPathway() { return pathway; }
    public Map<String, Object> getProperties() { return properties; }
}
