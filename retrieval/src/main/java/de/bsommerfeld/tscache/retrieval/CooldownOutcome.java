package de.bsommerfeld.tscache.retrieval;

public enum CooldownOutcome {
    COMPLETED,
    ABORTED
}
