package nl.bytesoflife.lanterncad.geometry;

public enum CoreRole {
    CENTER,
    RING
}
