package de.bsommerfeld.tscache.db;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Append-only store of snapshot rows.
 *
 * <p>
 * Rows are keyed by {@code (subject, hash, slice key, anchor day,
 * retrieved_at)}. Appending a key that exists is a no-op, never an error, so
 * concurrent writers cannot corrupt each other. The store never mints
 * timestamps; {@code retrieved_at} always comes from the caller.
 *
 * @see SqlSnapshotStore
 * @see InMemorySnapshotStore
 */
public interface SnapshotStore {

    AppendResult append(SnapshotRow row);

    /**
     * Writes every row of the sub-write in one transaction and registers its
     * signature if one is given. Either all new rows land or none do.
     */
    AppendSummary appendBatch(SnapshotWrite write);

    /**
     * Returns matching rows without any collapsing, ordered by anchor day,
     * slice key, {@code retrieved_at} and subject.
     */
    List<SnapshotRow> queryRaw(SnapshotQuery query);

    /** Distinct {@code retrieved_at} values of a subject, newest first. */
    List<Instant> listRetrievals(SubjectRef subject);

    /**
     * Deletes rows of one subject.
     *
     * @param subjectId    the subject
     * @param coreHashes   restrict to these hashes; empty or {@code null} for all
     * @param retrievedAts restrict to these batches; empty or {@code null} for all
     * @return number of deleted rows
     */
    int deleteSnapshots(String subjectId, Set<String> coreHashes, Set<Instant> retrievedAts);

    /** Signature registry entries of a subject, newest first. */
    List<SignatureEntry> listSignatures(String subjectId);

    /** Subjects that own at least one row and whose id starts with {@code prefix}. */
    List<String> subjectIds(String prefix);

    /**
     * Runs {@code work} as an exclusive unit of work over one subject. Any
     * exception thrown by the work, or by the store while applying it, rolls
     * back every change made to the subject.
     */
    <T> T inSubjectTransaction(String subjectId, SubjectWork<T> work);
}
