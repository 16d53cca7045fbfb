package de.bsommerfeld.tscache.aggregation.definition;

import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** {@link DefinitionHistory} held in memory; definitions are registered in code. */
public class InMemoryDefinitionHistory implements DefinitionHistory {

    private final Map<String, NavigableMap<Instant, ContextDefinition>> byId = new ConcurrentHashMap<>();

    /** Publishes {@code definition} as in force from {@code effectiveFrom} on. */
    public synchronized InMemoryDefinitionHistory register(ContextDefinition definition, Instant effectiveFrom) {
        byId.computeIfAbsent(definition.id(), id -> new TreeMap<>()).put(effectiveFrom, definition);
        return this;
    }

    @Override
    public synchronized Optional<String> resolveVersion(String definitionId, Instant asOf) {
        NavigableMap<Instant, ContextDefinition> versions = byId.get(definitionId);
        if (versions == null)
            return Optional.empty();
        Map.Entry<Instant, ContextDefinition> entry = versions.floorEntry(asOf);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue().version());
    }

    @Override
    public synchronized Optional<ContextDefinition> load(String definitionId, String version) {
        NavigableMap<Instant, ContextDefinition> versions = byId.get(definitionId);
        if (versions == null)
            return Optional.empty();
        return versions.values().stream().filter(d -> d.version().equals(version)).findFirst();
    }
}
