package nl.bytesoflife.lanterncad.circuit;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown when a frozen circuit is modified.
 */
public class CircuitStateException extends LanternCadException {

    public CircuitStateException(String message) {
        super(message);
    }
}
