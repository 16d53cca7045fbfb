package de.bsommerfeld.tscache.db;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;

import java.time.Instant;
import java.util.List;

/**
 * View of one subject inside an exclusive unit of work. Changes become
 * visible to others only when the work returns normally.
 */
public interface SubjectEditor {

    String subjectId();

    /** All rows of the subject, across every hash and slice, as currently staged. */
    List<SnapshotRow> rows();

    /** Deletes the row with the given natural key. Returns {@code false} if it did not exist. */
    boolean delete(SnapshotRow row);

    /**
     * Moves a row to a new {@code retrieved_at}, keeping its values.
     *
     * @throws StoreException if the new key is already taken
     */
    void retime(SnapshotRow row, Instant newRetrievedAt);
}
