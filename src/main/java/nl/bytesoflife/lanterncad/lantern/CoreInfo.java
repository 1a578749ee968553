package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.geometry.CoreRole;

/**
 * Geometry and mode of one core at the start of the taper, as handed to downstream tools.
 *
 * @param mode assigned LP mode, or null for a plain photonic lantern
 */
public record CoreInfo(String label, CoreRole role, double x, double y,
                       double coreDiameter, double claddingDiameter, String mode) {
}
