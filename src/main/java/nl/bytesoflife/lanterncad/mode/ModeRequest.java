package nl.bytesoflife.lanterncad.mode;

/**
 * Modes a mode-selective lantern must support: every mode up to {@code highestMode} in the
 * cutoff ranking, with light launched into {@code launchMode}.
 */
public record ModeRequest(String highestMode, String launchMode) {

    public static final String DEFAULT_LAUNCH_MODE = "LP01";

    public static ModeRequest upTo(String highestMode) {
        return new ModeRequest(highestMode, DEFAULT_LAUNCH_MODE);
    }
}
