package de.bsommerfeld.tscache.retrieval;

/**
 * Counters of one successful slice execution.
 *
 * @param cacheHits    windows served from the store
 * @param apiFetches   provider calls made
 * @param daysFetched  daily points returned by the provider
 * @param rowsInserted rows that were new to the store
 */
public record SliceExecutionResult(int cacheHits, int apiFetches, int daysFetched, int rowsInserted) {

    public static final SliceExecutionResult NOTHING = new SliceExecutionResult(0, 0, 0, 0);
}
