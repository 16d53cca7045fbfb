package de.bsommerfeld.tscache.retrieval;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one orchestrator run.
 *
 * <p>
 * {@code executed} counts successful executions, including items that were
 * run again because a rate limit discarded the batch they had finished in;
 * {@code refetched} counts those repeated executions.
 */
public record RetrievalReport(
        int items,
        int executed,
        int refetched,
        int cacheHits,
        int apiFetches,
        int daysFetched,
        int rateLimitRestarts,
        boolean aborted,
        Duration duration,
        List<ItemOutcome> outcomes) {

    public RetrievalReport {
        outcomes = List.copyOf(outcomes);
    }

    public long succeeded() {
        return outcomes.stream().filter(ItemOutcome::isSuccess).count();
    }
}
