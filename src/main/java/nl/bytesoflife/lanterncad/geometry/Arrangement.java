package nl.bytesoflife.lanterncad.geometry;

public enum Arrangement {
    CIRCULAR,
    HEXAGONAL;

    public static Arrangement fromName(String name) {
        return switch (name.toLowerCase()) {
            case "circular", "ring" -> CIRCULAR;
            case "hexagonal", "hex" -> HEXAGONAL;
            default -> throw new LayoutException("Unknown arrangement: " + name);
        };
    }
}
