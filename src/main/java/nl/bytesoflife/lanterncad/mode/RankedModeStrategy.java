package nl.bytesoflife.lanterncad.mode;

import nl.bytesoflife.lanterncad.geometry.Layout;

import java.util.OptionalInt;

/**
 * One core per supported mode, assigned by the {@link ModeAssignmentEngine}.
 */
public class RankedModeStrategy implements ModeAssignmentStrategy {

    private final ModeAssignmentEngine engine;

    public RankedModeStrategy(ModeAssignmentEngine engine) {
        this.engine = engine;
    }

    @Override
    public OptionalInt requiredCoreCount(ModeRequest request) {
        return OptionalInt.of(engine.requiredCoreCount(requireRequest(request).highestMode()));
    }

    @Override
    public ModeMap assign(ModeRequest request, Layout layout) {
        ModeRequest r = requireRequest(request);
        String launch = r.launchMode() != null ? r.launchMode() : ModeRequest.DEFAULT_LAUNCH_MODE;
        return engine.assignModes(r.highestMode(), launch, layout);
    }

    private static ModeRequest requireRequest(ModeRequest request) {
        if (request == null || request.highestMode() == null) {
            throw new ModeConfigurationException("Mode-selective lanterns need a highest mode");
        }
        return request;
    }
}
