package nl.bytesoflife.lanterncad.mode;

import nl.bytesoflife.lanterncad.LanternCadException;

/**
 * Thrown for an unknown or unranked LP mode, a launch mode outside the supported set, or a
 * layout whose core count does not match the number of supported modes.
 */
public class ModeConfigurationException extends LanternCadException {

    public ModeConfigurationException(String message) {
        super(message);
    }
}
