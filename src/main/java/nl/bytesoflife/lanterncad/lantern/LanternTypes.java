package nl.bytesoflife.lanterncad.lantern;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Lantern builders by type tag.
 */
public final class LanternTypes {

    public static final String PHOTONIC = "photonic";
    public static final String MODE_SELECTIVE = "mode_selective";

    private static final Map<String, Supplier<LanternBuilder>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(PHOTONIC, LanternBuilder::photonic);
        FACTORIES.put(MODE_SELECTIVE, LanternBuilder::modeSelective);
    }

    private LanternTypes() {}

    /** A fresh builder of the given type. */
    public static LanternBuilder create(String tag) {
        Supplier<LanternBuilder> factory = FACTORIES.get(tag);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown lantern type '" + tag + "', known: " + FACTORIES.keySet());
        }
        return factory.get();
    }

    public static Set<String> tags() {
        return Set.copyOf(FACTORIES.keySet());
    }
}
