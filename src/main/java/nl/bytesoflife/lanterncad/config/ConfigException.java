package nl.bytesoflife.lanterncad.config;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown for malformed configuration files, bad parameter paths and expressions that
 * cannot be evaluated.
 */
public class ConfigException extends LanternCadException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
