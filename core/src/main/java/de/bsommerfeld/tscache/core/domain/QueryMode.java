package de.bsommerfeld.tscache.core.domain;

import java.util.Locale;

/**
 * Aggregation mode of a time-series query. A point-in-time {@link #WINDOW}
 * and a {@link #COHORT} query over the same events are different series and
 * never share a retrieval batch.
 */
public enum QueryMode {

    WINDOW("window"),
    COHORT("cohort");

    private final String clause;

    QueryMode(String clause) {
        this.clause = clause;
    }

    /** The DSL clause name, e.g. {@code window}. */
    public String clause() {
        return clause;
    }

    /**
     * Resolves a DSL clause name ({@code window} / {@code cohort}) to its mode.
     *
     * @return the mode, or {@code null} if the name is not a mode clause
     */
    public static QueryMode fromClause(String name) {
        if (name == null)
            return null;
        String lower = name.toLowerCase(Locale.ROOT);
        for (QueryMode mode : values()) {
            if (mode.clause.equals(lower))
                return mode;
        }
        return null;
    }
}
