package nl.bytesoflife.lanterncad.lantern;

/** Structural layer of a lantern that can taper on its own profile and factor. */
public enum FiberLayer {
    CORE,
    CLADDING,
    CAPILLARY
}
