package nl.bytesoflife.lanterncad.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoreSpatialIndexTest {

    private static Core core(int id, double x, double y) {
        return new Core(id, CoreRole.RING, 1, id, x, y, 10, 1.45);
    }

    @Test
    void findsOnlyPairsBelowDistance() {
        List<Core> cores = List.of(core(0, 0, 0), core(1, 50, 0), core(2, 300, 0));

        List<CoreSpatialIndex.CorePair> pairs = CoreSpatialIndex.findPairsCloserThan(cores, 100);

        assertEquals(1, pairs.size());
        CoreSpatialIndex.CorePair pair = pairs.get(0);
        assertEquals(50, pair.distance(), 1e-9);
        assertEquals(0, Math.min(pair.first().getId(), pair.second().getId()));
        assertEquals(1, Math.max(pair.first().getId(), pair.second().getId()));
    }

    @Test
    void touchingCoresAreNotReported() {
        List<Core> cores = List.of(core(0, 0, 0), core(1, 125, 0));

        assertTrue(CoreSpatialIndex.findPairsCloserThan(cores, 125 * (1 - 1e-9)).isEmpty());
    }
}
