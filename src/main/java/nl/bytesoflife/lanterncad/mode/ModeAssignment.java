package nl.bytesoflife.lanterncad.mode;

/**
 * One mode mapped onto one physical core.
 */
public record ModeAssignment(String label, int coreId, ModeCutoff cutoff) {
}
