package nl.bytesoflife.lanterncad.circuit;

import java.util.List;

public class Pathway {

    private final PathwayId id;
    private final List<SegmentId> segments;

    Pathway(PathwayId id, List<SegmentId> segments) {
        this.id = id;
        this.segments = List.copyOf(segments);
    }

    public PathwayId getId() { return id; }
    public List<SegmentId> getSegments() { return segments; }
}
