package de.bsommerfeld.tscache.core.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Immutable fact row of the snapshot store. The natural key is
 * {@code (subjectId, coreHash, sliceKey, anchorDay, retrievedAt)}; a
 * correction is a new row with a later {@code retrievedAt}, never an update.
 *
 * <p>
 * {@code retrievedAt} is truncated to milliseconds, the precision the store
 * persists, so that rows read back compare equal to the rows written.
 *
 * @param subjectId   subject the row was retrieved for
 * @param coreHash    canonical signature hash
 * @param sliceKey    full slice key including mode arguments
 * @param anchorDay   the day the values describe
 * @param retrievedAt batch timestamp of the retrieval that produced the row
 * @param metrics     counts and lag statistics
 */
public record SnapshotRow(
        String subjectId,
        String coreHash,
        SliceKey sliceKey,
        LocalDate anchorDay,
        Instant retrievedAt,
        SnapshotMetrics metrics) {

    public SnapshotRow {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(coreHash, "coreHash");
        Objects.requireNonNull(sliceKey, "sliceKey");
        Objects.requireNonNull(anchorDay, "anchorDay");
        Objects.requireNonNull(retrievedAt, "retrievedAt");
        Objects.requireNonNull(metrics, "metrics");
        retrievedAt = retrievedAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public static SnapshotRow of(SubjectRef ref, SliceKey sliceKey, Instant retrievedAt, DailyPoint point) {
        return new SnapshotRow(ref.subjectId(), ref.coreHash(), sliceKey, point.anchorDay(), retrievedAt,
                point.metrics());
    }

    public SubjectRef subjectRef() {
        return SubjectRef.of(subjectId, coreHash);
    }

    public SliceFamily family() {
        return sliceKey.family();
    }

    public Long numerator() {
        return metrics.numerator();
    }

    public Long denominator() {
        return metrics.denominator();
    }

    /** Returns a copy of this row carrying a different batch timestamp. */
    public SnapshotRow withRetrievedAt(Instant newRetrievedAt) {
        return new SnapshotRow(subjectId, coreHash, sliceKey, anchorDay, newRetrievedAt, metrics);
    }
}
