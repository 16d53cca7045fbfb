package de.bsommerfeld.tscache.aggregation;

/** Why an anchor day (or the whole row set) could not be summed. */
public enum RefusalReason {

    /** Rows of more than one query mode were supplied. */
    MIXED_MODES,

    /** Rows carry more than one context dimension or more than one key varies. */
    MULTIPLE_DIMENSIONS,

    /** No definition of the context key was in force when a row was retrieved. */
    UNKNOWN_DEFINITION,

    /** Rows of one day were produced under different definition versions. */
    MIXED_EPOCHS,

    /** Duplicate or unexpected values, or a definition that is never MECE. */
    NOT_MECE,

    /** At least one expected value is missing for the day. */
    INCOMPLETE_PARTITION,

    /** A contributing row lacks its denominator or numerator. */
    MISSING_COUNTS
}
