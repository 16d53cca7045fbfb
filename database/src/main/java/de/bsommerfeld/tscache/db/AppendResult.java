package de.bsommerfeld.tscache.db;

/** Outcome of appending a single row. */
public enum AppendResult {

    INSERTED,

    /** A row with the same natural key already existed; nothing was written. */
    DUPLICATE
}
