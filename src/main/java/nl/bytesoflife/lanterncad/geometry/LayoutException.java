package nl.bytesoflife.lanterncad.geometry;

import nl.bytesoflife.lanterncad.LanternCadException;

public class LayoutException extends LanternCadException {

    public LayoutException(String message) {
        super(message);
    }
}
