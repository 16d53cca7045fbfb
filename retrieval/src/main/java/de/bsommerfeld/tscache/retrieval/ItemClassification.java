package de.bsommerfeld.tscache.retrieval;

/** Planner verdict on a single plan item. */
public enum ItemClassification {

    /** Needs a provider call. */
    FETCH,

    /** Already present in the cache; nothing to do. */
    COVERED,

    /** Cannot be fetched (e.g. the provider has no such event); skipped. */
    UNFETCHABLE
}
