package de.bsommerfeld.tscache.aggregation.definition;

import java.time.Instant;
import java.util.Optional;

/**
 * Versioned source of context definitions. Split into "which version was in
 * force" and "load that version" so loaded versions can be cached while the
 * version lookup stays cheap.
 */
public interface DefinitionHistory {

    /** The version of {@code definitionId} in force at {@code asOf}, if any. */
    Optional<String> resolveVersion(String definitionId, Instant asOf);

    Optional<ContextDefinition> load(String definitionId, String version);
}
