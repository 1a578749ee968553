package nl.bytesoflife.lanterncad.mode;

import nl.bytesoflife.lanterncad.geometry.Layout;

import java.util.OptionalInt;

/**
 * How a lantern builder labels its cores. Plain photonic lanterns keep the layout's own
 * numbering; mode-selective lanterns dedicate each core to one LP mode.
 */
public interface ModeAssignmentStrategy {

    /** Core count imposed by the requested modes, or empty when the caller's count stands. */
    OptionalInt requiredCoreCount(ModeRequest request);

    ModeMap assign(ModeRequest request, Layout layout);

    static ModeAssignmentStrategy identity() {
        return IdentityModeStrategy.INSTANCE;
    }

    static ModeAssignmentStrategy ranked() {
        return new RankedModeStrategy(new ModeAssignmentEngine());
    }
}
