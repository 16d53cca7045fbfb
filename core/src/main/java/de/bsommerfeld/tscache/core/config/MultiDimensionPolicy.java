package de.bsommerfeld.tscache.core.config;

/**
 * How the MECE aggregator treats rows that carry more than one context
 * dimension, or a row set in which more than one context key occurs.
 */
public enum MultiDimensionPolicy {

    /** Refuse the whole aggregation. */
    REFUSE,

    /**
     * Only consider single-dimension rows and pick the key with the most
     * distinct values among them.
     */
    BEST_SINGLE_KEY
}
