package nl.bytesoflife.lanterncad.lantern;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A written design: where it went and which cores it holds, keyed by core label in
 * generation order.
 */
public record DesignHandle(Path path, String fileName, Map<String, CoreInfo> cores) {

    public DesignHandle {
        cores = Collections.unmodifiableMap(new LinkedHashMap<>(cores));
    }

    public Path directory() {
        return path.getParent();
    }
}
