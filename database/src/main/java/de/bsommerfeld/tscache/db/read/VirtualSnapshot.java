package de.bsommerfeld.tscache.db.read;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Result of {@link VirtualSnapshotReader#resolveLatest}: at most one row per
 * {@code (anchor day, slice family)}, ordered by anchor day then slice.
 *
 * @param rows                  selected rows
 * @param subjects              subjects that were read (the closure or just the seed)
 * @param latestRetrievedAtUsed newest {@code retrieved_at} among the selected
 *                              rows, {@code null} when empty
 * @param coversAnchorTo        whether a row exists for the requested upper
 *                              anchor bound; {@code false} if none was given
 */
public record VirtualSnapshot(
        List<SnapshotRow> rows,
        Set<SubjectRef> subjects,
        Instant latestRetrievedAtUsed,
        boolean coversAnchorTo) {

    public VirtualSnapshot {
        rows = List.copyOf(rows);
        subjects = Set.copyOf(subjects);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
