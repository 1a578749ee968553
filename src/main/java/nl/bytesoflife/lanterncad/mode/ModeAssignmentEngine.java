package nl.bytesoflife.lanterncad.mode;

import nl.bytesoflife.lanterncad.geometry.Core;
import nl.bytesoflife.lanterncad.geometry.Layout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the modes supported up to a highest mode onto the cores of a layout, one core per
 * physical mode.
 * <p>
 * The fundamental LP01 mode goes to the centre core when the layout has one. The remaining
 * modes, in ranking order with {@code a} before {@code b}, go to the ring cores in layout
 * generation order.
 */
public class ModeAssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(ModeAssignmentEngine.class);

    public static final double DEFAULT_CLADDING_INDEX = 1.44692;

    private final LpModeRanking ranking;
    private final CutoffCalculator calculator;
    private final double claddingIndex;

    public ModeAssignmentEngine() {
        this(LpModeRanking.standard(), new CutoffCalculator(), DEFAULT_CLADDING_INDEX);
    }

    public ModeAssignmentEngine(LpModeRanking ranking, CutoffCalculator calculator, double claddingIndex) {
        this.ranking = ranking;
        this.calculator = calculator;
        this.claddingIndex = claddingIndex;
    }

    public LpModeRanking getRanking() {
        return ranking;
    }

    /** Number of cores needed to support every mode up to {@code highestMode}. */
    public int requiredCoreCount(String highestMode) {
        return supportedModes(highestMode).size();
    }

    public List<String> supportedModes(String highestMode) {
        LpMode highest = LpMode.parse(highestMode);
        if (!ranking.contains(highest.baseLabel())) {
            throw new ModeConfigurationException("Highest mode " + highestMode + " is not in the cutoff ranking");
        }
        return ranking.supportedModes(highest.baseLabel());
    }

    /**
     * Assigns modes to cores and labels the cores. Nothing is mutated unless every check
     * passes.
     */
    public ModeMap assignModes(String highestMode, String launchMode, Layout layout) {
        List<String> supported = supportedModes(highestMode);

        if (!isSupported(launchMode, supported)) {
            throw new ModeConfigurationException("Launch mode " + launchMode + " is not among the modes supported up to "
                    + highestMode + ": " + supported);
        }
        if (layout.getCoreCount() != supported.size()) {
            throw new ModeConfigurationException("Supporting modes up to " + highestMode + " needs "
                    + supported.size() + " cores " + supported + ", but the layout has " + layout.getCoreCount());
        }

        List<Core> order = coreOrder(layout);
        List<ModeAssignment> assignments = new ArrayList<>(supported.size());
        for (int i = 0; i < supported.size(); i++) {
            String label = supported.get(i);
            Core core = order.get(i);
            ModeCutoff cutoff = calculator.compute(ranking.cutoff(label), core.getDiameter(),
                    core.getIndex(), claddingIndex);
            assignments.add(new ModeAssignment(label, core.getId(), cutoff));
        }
        ModeMap modeMap = new ModeMap(LpMode.parse(highestMode).baseLabel(), launchMode, assignments);

        for (int i = 0; i < supported.size(); i++) {
            order.get(i).assignMode(supported.get(i));
        }
        log.debug("Assigned {} modes up to {}: {}", supported.size(), highestMode, supported);
        return modeMap;
    }

    private boolean isSupported(String launchMode, List<String> supported) {
        LpMode launch = LpMode.parse(launchMode);
        if (supported.contains(launch.label())) return true;
        // an orientation-less label of a degenerate mode stands for both orientations
        return !launch.hasOrientation() && supported.contains(launch.baseLabel() + "a");
    }

    private List<Core> coreOrder(Layout layout) {
        List<Core> order = new ArrayList<>(layout.getCoreCount());
        Core center = layout.getCenterCore();
        if (center != null) order.add(center);
        order.addAll(layout.getRingCores());
        return order;
    }
}
