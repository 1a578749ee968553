package nl.bytesoflife.lanterncad.ind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Design writers by format tag.
 */
public final class DesignWriters {

    public static final String IND = "ind";

    private static final Map<String, DesignWriter> WRITERS = new LinkedHashMap<>();

    static {
        WRITERS.put(IND, new IndWriter());
    }

    private DesignWriters() {}

    public static DesignWriter get(String tag) {
        DesignWriter writer = WRITERS.get(tag);
        if (writer == null) {
            throw new IllegalArgumentException("Unknown design format '" + tag + "', known: " + WRITERS.keySet());
        }
        return writer;
    }

    public static Set<String> tags() {
        return Set.copyOf(WRITERS.keySet());
    }
}
