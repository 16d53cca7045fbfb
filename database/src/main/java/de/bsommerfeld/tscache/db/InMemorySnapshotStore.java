package de.bsommerfeld.tscache.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SignatureHasher;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Non-persistent {@link SnapshotStore} for TEST mode and unit tests. Same
 * semantics as {@link SqlSnapshotStore}: natural-key idempotency, all-or-nothing
 * batches and units of work.
 *
 * <p>
 * All methods synchronise on the store, which makes every operation
 * trivially exclusive.
 */
@Singleton
public class InMemorySnapshotStore implements SnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    /** Natural key of a row. */
    private record Key(String subjectId, String coreHash, String sliceKey, LocalDate anchorDay, Instant retrievedAt) {

        static Key of(SnapshotRow row) {
            return new Key(row.subjectId(), row.coreHash(), row.sliceKey().toDsl(), row.anchorDay(),
                    row.retrievedAt());
        }
    }

    private final Map<Key, SnapshotRow> rows = new LinkedHashMap<>();
    private final Map<SubjectRef, SignatureEntry> signatures = new HashMap<>();
    private final Clock clock;

    @Inject
    public InMemorySnapshotStore(Clock clock) {
        this.clock = clock;
        LOG.info("[DB] Using in-memory snapshot store, nothing will be persisted.");
    }

    public InMemorySnapshotStore() {
        this(Clock.systemUTC());
    }

    @Override
    public synchronized AppendResult append(SnapshotRow row) {
        return rows.putIfAbsent(Key.of(row), row) == null ? AppendResult.INSERTED : AppendResult.DUPLICATE;
    }

    @Override
    public synchronized AppendSummary appendBatch(SnapshotWrite write) {
        if (write.canonicalSignature() != null) {
            String signature = write.canonicalSignature().trim();
            signatures.putIfAbsent(write.subject(), new SignatureEntry(write.subject().subjectId(),
                    write.subject().coreHash(), signature, SignatureHasher.fullHash(signature),
                    SignatureHasher.ALGORITHM, clock.instant()));
        }
        int inserted = 0;
        for (SnapshotRow row : write.rows()) {
            if (rows.putIfAbsent(Key.of(row), row) == null)
                inserted++;
        }
        return new AppendSummary(write.rows().size(), inserted);
    }

    @Override
    public synchronized List<SnapshotRow> queryRaw(SnapshotQuery query) {
        List<SnapshotRow> result = new ArrayList<>();
        for (SnapshotRow row : rows.values()) {
            if (matches(query, row))
                result.add(row);
        }
        result.sort(SqlSnapshotStore.RAW_ORDER);
        return result;
    }

    private static boolean matches(SnapshotQuery q, SnapshotRow row) {
        if (!q.subjects().contains(row.subjectRef()))
            return false;
        if (q.family() != null && !q.family().equals(row.family()))
            return false;
        if (q.anchorFrom() != null && row.anchorDay().isBefore(q.anchorFrom()))
            return false;
        if (q.anchorTo() != null && row.anchorDay().isAfter(q.anchorTo()))
            return false;
        return q.retrievedUpTo() == null || !row.retrievedAt().isAfter(q.retrievedUpTo());
    }

    @Override
    public synchronized List<Instant> listRetrievals(SubjectRef subject) {
        TreeSet<Instant> distinct = new TreeSet<>(Comparator.reverseOrder());
        for (SnapshotRow row : rows.values()) {
            if (row.subjectRef().equals(subject))
                distinct.add(row.retrievedAt());
        }
        return new ArrayList<>(distinct);
    }

    @Override
    public synchronized int deleteSnapshots(String subjectId, Set<String> coreHashes, Set<Instant> retrievedAts) {
        int before = rows.size();
        rows.values().removeIf(row -> row.subjectId().equals(subjectId)
                && (coreHashes == null || coreHashes.isEmpty() || coreHashes.contains(row.coreHash()))
                && (retrievedAts == null || retrievedAts.isEmpty() || retrievedAts.contains(row.retrievedAt())));
        return before - rows.size();
    }

    @Override
    public synchronized List<SignatureEntry> listSignatures(String subjectId) {
        List<SignatureEntry> result = new ArrayList<>();
        for (SignatureEntry entry : signatures.values()) {
            if (entry.subjectId().equals(subjectId))
                result.add(entry);
        }
        result.sort(Comparator.comparing(SignatureEntry::createdAt).reversed()
                .thenComparing(SignatureEntry::coreHash));
        return result;
    }

    @Override
    public synchronized List<String> subjectIds(String prefix) {
        String p = prefix == null ? "" : prefix;
        TreeSet<String> ids = new TreeSet<>();
        for (SnapshotRow row : rows.values()) {
            if (row.subjectId().startsWith(p))
                ids.add(row.subjectId());
        }
        return new ArrayList<>(ids);
    }

    /**
     * Stages all edits on a copy of the subject's rows and swaps them in only
     * when the work completes.
     */
    @Override
    public synchronized <T> T inSubjectTransaction(String subjectId, SubjectWork<T> work) {
        Map<Key, SnapshotRow> staged = new LinkedHashMap<>();
        rows.forEach((k, v) -> {
            if (k.subjectId().equals(subjectId))
                staged.put(k, v);
        });

        T result = work.run(new StagingEditor(subjectId, staged));

        rows.keySet().removeIf(k -> k.subjectId().equals(subjectId));
        rows.putAll(staged);
        return result;
    }

    private static final class StagingEditor implements SubjectEditor {

        private final String subjectId;
        private final Map<Key, SnapshotRow> staged;

        StagingEditor(String subjectId, Map<Key, SnapshotRow> staged) {
            this.subjectId = subjectId;
            this.staged = staged;
        }

        @Override
        public String subjectId() {
            return subjectId;
        }

        @Override
        public List<SnapshotRow> rows() {
            return new ArrayList<>(staged.values());
        }

        @Override
        public boolean delete(SnapshotRow row) {
            requireOwn(row);
            return staged.remove(Key.of(row)) != null;
        }

        @Override
        public void retime(SnapshotRow row, Instant newRetrievedAt) {
            requireOwn(row);
            SnapshotRow existing = staged.get(Key.of(row));
            if (existing == null)
                throw new StoreException("Row to retime does not exist: " + row);
            SnapshotRow moved = existing.withRetrievedAt(newRetrievedAt);
            Key target = Key.of(moved);
            if (!Objects.equals(target, Key.of(row)) && staged.containsKey(target))
                throw new StoreException("Cannot retime " + row + ": key already taken at " + newRetrievedAt);
            staged.remove(Key.of(row));
            staged.put(target, moved);
        }

        private void requireOwn(SnapshotRow row) {
            if (!subjectId.equals(row.subjectId()))
                throw new IllegalArgumentException("Row of " + row.subjectId() + " edited in unit of work of "
                        + subjectId);
        }
    }
}
