package de.bsommerfeld.tscache.retrieval;

import java.time.Instant;

/**
 * What the orchestrator hands to a {@link SliceExecutor}: the item, the batch
 * timestamp every row must carry, and whether cached windows must be refetched.
 */
public record SliceExecution(FetchPlanItem item, Instant retrievedAt, boolean bypassCache) {
}
