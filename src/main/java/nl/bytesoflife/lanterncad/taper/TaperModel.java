package nl.bytesoflife.lanterncad.taper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named tapers of one lantern, in registration order. Each registration re-validates the
 * taper's profiles, so a discontinuous custom profile is rejected before any geometry is
 * derived from it.
 */
public class TaperModel {

    private static final Logger log = LoggerFactory.getLogger(TaperModel.class);

    private final Map<String, TaperSpec> tapers = new LinkedHashMap<>();
    private final Map<TaperProfile, TaperType> userTypes = new IdentityHashMap<>();

    public TaperModel register(TaperSpec spec) {
        if (tapers.containsKey(spec.getName())) {
            throw new TaperValidationException("A taper named '" + spec.getName() + "' is already registered");
        }
        spec.validate();
        tapers.put(spec.getName(), spec);
        log.debug("Registered taper {}", spec);
        return this;
    }

    /**
     * Tag for a caller-supplied profile. The same profile instance always gets the same
     * {@code TAPER_USER_n} number within this model.
     */
    public TaperType userTypeFor(TaperProfile profile) {
        return userTypes.computeIfAbsent(profile, p -> TaperType.user(userTypes.size() + 1));
    }

    public TaperSpec get(String name) {
        TaperSpec spec = tapers.get(name);
        if (spec == null) {
            throw new TaperValidationException("No taper named '" + name + "'");
        }
        return spec;
    }

    public boolean contains(String name) {
        return tapers.containsKey(name);
    }

    public List<TaperSpec> getTapers() {
        return Collections.unmodifiableList(new ArrayList<>(tapers.values()));
    }

    public int size() {
        return tapers.size();
    }
}
