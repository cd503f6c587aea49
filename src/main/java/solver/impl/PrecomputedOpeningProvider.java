package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.OpeningProvider;
import solver.errors.CacheUnavailableException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Openings read from the artifact written by {@link CacheBootstrapper}: a flat JSON
 * object mapping strategy key to word.
 */
public final class PrecomputedOpeningProvider implements OpeningProvider {

    private static final Logger log = LoggerFactory.getLogger(PrecomputedOpeningProvider.class);

    private final Map<String, String> openings;

    public PrecomputedOpeningProvider(Map<String, String> openings) {
        this.openings = Map.copyOf(openings);
    }

    public static PrecomputedOpeningProvider none() {
        return new PrecomputedOpeningProvider(Map.of());
    }

    /**
     * Reads the artifact. A missing or unreadable file yields an empty provider.
     */
    public static PrecomputedOpeningProvider load(Path path, ArtifactIO io) {
        if (!Files.exists(path)) {
            log.info("No first guess cache at {}", path);
            return none();
        }
        try {
            Map<?, ?> raw = io.read(path, Map.class);
            Map<String, String> openings = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                if (e.getKey() instanceof String k && e.getValue() instanceof String v
                        && Vocabulary.isWord(v.trim().toLowerCase(Locale.ROOT))) {
                    openings.put(k, v.trim().toLowerCase(Locale.ROOT));
                } else {
                    log.warn("Ignoring malformed first guess entry {} in {}", e, path);
                }
            }
            log.info("Loaded precomputed first guesses {} from {}", openings, path);
            return new PrecomputedOpeningProvider(openings);
        } catch (CacheUnavailableException e) {
            log.warn("Could not load first guess cache {}: {}", e.getPath(), e.getMessage());
            return none();
        }
    }

    public static void save(Path path, Map<String, String> openings, ArtifactIO io)
            throws CacheUnavailableException {
        io.write(path, new LinkedHashMap<>(openings));
    }

    @Override
    public Optional<String> opening(String strategyKey) {
        return Optional.ofNullable(openings.get(strategyKey));
    }

    public Map<String, String> openings() {
        return openings;
    }
}
