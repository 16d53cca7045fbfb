package de.bsommerfeld.tscache.retrieval;

import java.time.Instant;

/**
 * Per-item entry of the {@link RetrievalReport}.
 *
 * @param itemKey     plan item key
 * @param status      what happened
 * @param retrievedAt batch timestamp the item's rows carry, {@code null} if not executed
 * @param attempts    executions including retries
 * @param result      counters of the successful execution, {@link SliceExecutionResult#NOTHING} otherwise
 */
public record ItemOutcome(String itemKey, Status status, Instant retrievedAt, int attempts,
        SliceExecutionResult result) {

    public enum Status {
        SUCCEEDED,
        SKIPPED_COVERED,
        SKIPPED_UNFETCHABLE,
        ABORTED
    }

    static ItemOutcome skipped(FetchPlanItem item, Status status) {
        return new ItemOutcome(item.itemKey(), status, null, 0, SliceExecutionResult.NOTHING);
    }

    /** Skipped items count as success. */
    public boolean isSuccess() {
        return status != Status.ABORTED;
    }
}
