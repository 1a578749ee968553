package nl.bytesoflife.lanterncad.circuit;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of a circuit, handed to writers once the circuit is frozen.
 */
public interface CircuitView {

    Map<String, Object> getGlobalParameters();

    List<Segment> getSegments();

    List<Pathway> getPathways();

    List<Monitor> getMonitors();

    List<LaunchField> getLaunchFields();

    boolean isFrozen();
}
