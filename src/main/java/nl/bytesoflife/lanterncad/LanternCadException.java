package nl.bytesoflife.lanterncad;

/**
 * Base type of every error raised while laying out, modelling or writing a lantern design.
 */
public class LanternCadException extends RuntimeException {

    public LanternCadException(String message) {
        super(message);
    }

    public LanternCadException(String message, Throwable cause) {
        super(message, cause);
    }
}
