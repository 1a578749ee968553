package nl.bytesoflife.lanterncad.mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Supported modes of one lantern, in ranking order, each mapped to its core and cutoff
 * parameters. Plain photonic lanterns carry an empty map.
 */
public final class ModeMap {

    private static final ModeMap EMPTY = new ModeMap(null, null, List.of());

    private final String highestMode;
    private final String launchMode;
    private final Map<String, ModeAssignment> assignments;

    public ModeMap(String highestMode, String launchMode, List<ModeAssignment> assignments) {
        this.highestMode = highestMode;
        this.launchMode = launchMode;
        Map<String, ModeAssignment> map = new LinkedHashMap<>();
        for (ModeAssignment assignment : assignments) {
            if (map.put(assignment.label(), assignment) != null) {
                throw new ModeConfigurationException("Mode " + assignment.label() + " assigned twice");
            }
        }
        this.assignments = Collections.unmodifiableMap(map);
    }

    public static ModeMap empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public String getHighestMode() { return highestMode; }
    public String getLaunchMode() { return launchMode; }

    public List<String> getSupportedModes() {
        return List.copyOf(assignments.keySet());
    }

    public List<ModeAssignment> getAssignments() {
        return Collections.unmodifiableList(new ArrayList<>(assignments.values()));
    }

    public boolean contains(String label) {
        return assignments.containsKey(label);
    }

    public ModeAssignment get(String label) {
        ModeAssignment assignment = assignments.get(label);
        if (assignment == null) {
            throw new ModeConfigurationException("Mode " + label + " is not supported by this lantern; supported: "
                    + assignments.keySet());
        }
        return assignment;
    }

    public int coreFor(String label) {
        return get(label).coreId();
    }

    public int size() {
        return assignments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModeMap other)) return false;
        return Objects.equals(highestMode, other.highestMode)
                && Objects.equals(launchMode, other.launchMode)
                && getAssignments().equals(other.getAssignments());
    }

    @Override
    public int hashCode() {
        return Objects.hash(highestMode, launchMode, getAssignments());
    }

    @Override
    public String toString() {
        return "ModeMap{highest=" + highestMode + ", launch=" + launchMode + ", modes=" + assignments.keySet() + "}";
    }
}
