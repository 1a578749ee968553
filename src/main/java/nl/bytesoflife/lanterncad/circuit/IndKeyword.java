package nl.bytesoflife.lanterncad.circuit;

/**
 * A constant written as a bare keyword, e.g. {@code MONITOR_WG_POWER}.
 */
public interface IndKeyword {

    String keyword();
}
