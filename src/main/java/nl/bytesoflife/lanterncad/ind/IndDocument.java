package nl.bytesoflife.lanterncad.ind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed contents of a design file. Values are kept as written; {@link IndValues#parse}
 * turns numeric ones back into numbers.
 */
public class IndDocument {

    private final Map<String, String> globals;
    private final List<Block> segments;
    private final List<PathwayBlock> pathways;
    private final List<Block> monitors;
    private final List<Block> launchFields;

    public IndDocument(Map<String, String> globals, List<Block> segments, List<PathwayBlock> pathways,
                       List<Block> monitors, List<Block> launchFields) {
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals));
        this.segments = List.copyOf(segments);
        this.pathways = List.copyOf(pathways);
        this.monitors = List.copyOf(monitors);
        this.launchFields = List.copyOf(launchFields);
    }

    public Map<String, String> getGlobalParameters() { return globals; }
    public List<Block> getSegments() { return segments; }
    public List<PathwayBlock> getPathways() { return pathways; }
    public List<Block> getMonitors() { return monitors; }
    public List<Block> getLaunchFields() { return launchFields; }

    /** Segment by its 1-based index. */
    public Block getSegment(int index) {
        return segments.get(index - 1);
    }

    public PathwayBlock getPathway(int index) {
        return pathways.get(index - 1);
    }

    public String getGlobal(String key) {
        return globals.get(key);
    }

    /** A numbered block of {@code key = value} properties. */
    public record Block(int index, Map<String, String> properties) {

        public Block {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }

        public String get(String key) {
            return properties.get(key);
        }

        /** Numeric value of a property; throws if it is missing or not a number. */
        public double getNumber(String key) {
            Object value = properties.get(key) == null ? null : IndValues.parse(properties.get(key));
            if (value instanceof Number n) return n.doubleValue();
            throw new IllegalArgumentException("Property " + key + " of block " + index + " is not numeric: "
                    + properties.get(key));
        }
    }

    /** A numbered pathway listing segment indices in order. */
    public record PathwayBlock(int index, List<Integer> segments) {

        public PathwayBlock {
            segments = List.copyOf(segments);
        }
    }
}
