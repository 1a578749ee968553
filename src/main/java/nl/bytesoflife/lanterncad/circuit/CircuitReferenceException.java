package nl.bytesoflife.lanterncad.circuit;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown when an entry refers to a segment or pathway that is not part of the circuit.
 */
public class CircuitReferenceException extends LanternCadException {

    public CircuitReferenceException(String message) {
        super(message);
    }
}
