package nl.bytesoflife.lanterncad.ind;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown when a circuit entry holds a reference the writer cannot map to a written index.
 */
public class SerializationException extends LanternCadException {

    public SerializationException(String message) {
        super(message);
    }
}
