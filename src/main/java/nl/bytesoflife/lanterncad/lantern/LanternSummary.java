package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.geometry.Layout;
import nl.bytesoflife.lanterncad.mode.ModeMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of {@link LanternBuilder#createLantern}.
 */
public record LanternSummary(Layout layout, ModeMap modeMap, Map<String, CoreInfo> cores,
                             double capillaryDiameter) {

    public LanternSummary {
        cores = Collections.unmodifiableMap(new LinkedHashMap<>(cores));
    }

    public int coreCount() {
        return cores.size();
    }
}
