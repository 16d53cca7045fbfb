package de.bsommerfeld.tscache.retrieval.provider;

/**
 * A rate limit hit after part of a batch was already persisted. The rows
 * that landed carry a batch timestamp that must not be reused.
 */
public class PartialBatchInterruptedException extends RateLimitedException {

    private final int persistedRows;
    private final int completedWindows;

    public PartialBatchInterruptedException(String message, int persistedRows, int completedWindows,
            Throwable cause) {
        super(message, cause);
        this.persistedRows = persistedRows;
        this.completedWindows = completedWindows;
    }

    public int getPersistedRows() {
        return persistedRows;
    }

    public int getCompletedWindows() {
        return completedWindows;
    }
}
