package nl.bytesoflife.lanterncad.ind;

import nl.bytesoflife.lanterncad.circuit.CircuitView;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders a frozen circuit into a design file format.
 */
public interface DesignWriter {

    /** File extension without the dot. */
    String extension();

    String serialize(CircuitView circuit);

    /** @return number of bytes written */
    long write(CircuitView circuit, Path file) throws IOException;
}
