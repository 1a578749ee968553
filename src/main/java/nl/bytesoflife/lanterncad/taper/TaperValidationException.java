package nl.bytesoflife.lanterncad.taper;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown when a taper has an empty domain or a profile that does not meet its declared
 * start and end values.
 */
public class TaperValidationException extends LanternCadException {

    public TaperValidationException(String message) {
        super(message);
    }
}
