package de.bsommerfeld.tscache.aggregation.definition;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Historical definition lookup with an in-memory cache keyed by
 * {@code (definition id, resolved version)}. Versions are immutable once
 * published, so cached entries never go stale.
 */
@Singleton
public class DefinitionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionResolver.class);

    private record VersionKey(String definitionId, String version) {
    }

    private final DefinitionHistory history;
    private final Map<VersionKey, ContextDefinition> cache = new ConcurrentHashMap<>();

    @Inject
    public DefinitionResolver(DefinitionHistory history) {
        this.history = history;
    }

    /**
     * The definition of {@code definitionId} that was in force at
     * {@code asOf}; empty if none was.
     */
    public Optional<ContextDefinition> getDefinitionAsOf(String definitionId, Instant asOf) {
        Optional<String> version = history.resolveVersion(definitionId, asOf);
        if (version.isEmpty()) {
            LOG.debug("No version of '{}' in force at {}", definitionId, asOf);
            return Optional.empty();
        }

        VersionKey key = new VersionKey(definitionId, version.get());
        ContextDefinition cached = cache.get(key);
        if (cached != null)
            return Optional.of(cached);

        Optional<ContextDefinition> loaded = history.load(definitionId, version.get());
        loaded.ifPresent(def -> cache.putIfAbsent(key, def));
        return loaded;
    }

    int cachedVersions() {
        return cache.size();
    }
}
