package nl.bytesoflife.lanterncad.config;

import java.io.IOException;
import java.io.InputStream;

/**
 * Provides the bundled default configurations.
 */
public class BuiltinConfigs {

    private static final String PHOTONIC_LANTERN = "/config/complete_pl_config.json";

    private static volatile LanternConfig cachedPhotonicLantern;

    /** A fresh copy of the default six-core photonic lantern configuration. */
    public static LanternConfig photonicLantern() {
        if (cachedPhotonicLantern == null) {
            synchronized (BuiltinConfigs.class) {
                if (cachedPhotonicLantern == null) {
                    cachedPhotonicLantern = load(PHOTONIC_LANTERN);
                }
            }
        }
        return cachedPhotonicLantern.copy();
    }

    private static LanternConfig load(String resource) {
        try (InputStream is = BuiltinConfigs.class.getResourceAsStream(resource)) {
            if (is == null) throw new ConfigException("Resource not found: " + resource);
            return LanternConfig.fromMap(new JsonParser().parseObject(is, resource));
        } catch (IOException e) {
            throw new ConfigException("Failed to load " + resource, e);
        }
    }
}
