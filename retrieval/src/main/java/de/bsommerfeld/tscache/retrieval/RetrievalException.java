package de.bsommerfeld.tscache.retrieval;

/**
 * The orchestrator gave up on a plan item. Rows written before the failure
 * stay in the store; their batch is never resumed.
 */
public class RetrievalException extends Exception {

    private final String itemKey;

    public RetrievalException(String message, String itemKey, Throwable cause) {
        super(message, cause);
        this.itemKey = itemKey;
    }

    public String getItemKey() {
        return itemKey;
    }
}
