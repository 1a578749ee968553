package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.circuit.CircuitStateException;

/**
 * Thrown when a builder operation is called in a state that does not allow it.
 */
public class LifecycleException extends CircuitStateException {

    public LifecycleException(String message) {
        super(message);
    }
}
