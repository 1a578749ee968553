package nl.bytesoflife.lanterncad.lantern;

public enum LanternState {
    UNINITIALIZED,
    LAYOUT_COMPUTED,
    TAPERS_APPLIED,
    CIRCUIT_POPULATED,
    WRITTEN
}
