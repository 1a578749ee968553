package nl.bytesoflife.lanterncad.mode;

import nl.bytesoflife.lanterncad.geometry.Layout;

import java.util.OptionalInt;

/**
 * Leaves cores unlabelled. Cores are then known by their generation index.
 */
final class IdentityModeStrategy implements ModeAssignmentStrategy {

    static final IdentityModeStrategy INSTANCE = new IdentityModeStrategy();

    private IdentityModeStrategy() {}

    @Override
    public OptionalInt requiredCoreCount(ModeRequest request) {
        return OptionalInt.empty();
    }

    @Override
    public ModeMap assign(ModeRequest request, Layout layout) {
        return ModeMap.empty();
    }
}
