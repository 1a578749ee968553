package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown when a design without segments or launch fields is written.
 */
public class IncompleteDesignException extends LanternCadException {

    public IncompleteDesignException(String message) {
        super(message);
    }
}
