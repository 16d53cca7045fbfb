package de.bsommerfeld.tscache.db;

/**
 * Counts of one {@link SnapshotStore#appendBatch(SnapshotWrite)} call.
 */
public record AppendSummary(int attempted, int inserted) {

    public static final AppendSummary EMPTY = new AppendSummary(0, 0);

    public int duplicates() {
        return attempted - inserted;
    }

    public AppendSummary plus(AppendSummary other) {
        return new AppendSummary(attempted + other.attempted, inserted + other.inserted);
    }
}
