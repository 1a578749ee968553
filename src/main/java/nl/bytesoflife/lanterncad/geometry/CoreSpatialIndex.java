package nl.bytesoflife.lanterncad.geometry;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * STR-tree over core centres, used to find claddings that overlap their neighbours without
 * comparing every pair.
 */
public class CoreSpatialIndex {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    public void insert(Core core) {
        tree.insert(new Envelope(core.toCoordinate()), core);
    }

    public void insertAll(List<Core> cores) {
        for (Core core : cores) {
            insert(core);
        }
    }

    @SuppressWarnings("unchecked")
    public List<Core> queryNeighbors(Core core, double searchDistance) {
        ensureBuilt();
        Envelope searchEnvelope = new Envelope(core.toCoordinate());
        searchEnvelope.expandBy(searchDistance);
        return (List<Core>) tree.query(searchEnvelope);
    }

    /**
     * Pairs of cores whose centres are closer than {@code minDistance}. Each pair is reported
     * once, lower id first.
     */
    public static List<CorePair> findPairsCloserThan(List<Core> cores, double minDistance) {
        CoreSpatialIndex index = new CoreSpatialIndex();
        index.insertAll(cores);

        List<CorePair> pairs = new ArrayList<>();
        for (Core core : cores) {
            for (Core neighbor : index.queryNeighbors(core, minDistance)) {
                if (neighbor.getId() <= core.getId()) continue;

                double distance = core.toCoordinate().distance(neighbor.toCoordinate());
                if (distance < minDistance) {
                    pairs.add(new CorePair(core, neighbor, distance));
                }
            }
        }
        return pairs;
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    public record CorePair(Core first, Core second, double distance) {}
}
