package nl.bytesoflife.lanterncad.circuit;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown for an out-of-range or unrepresentable property value.
 */
public class CircuitValidationException extends LanternCadException {

    public CircuitValidationException(String message) {
        super(message);
    }
}
