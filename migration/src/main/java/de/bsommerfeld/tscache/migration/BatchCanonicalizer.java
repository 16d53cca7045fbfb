package de.bsommerfeld.tscache.migration;

import de.bsommerfeld.tscache.core.config.MigrationConfig;
import de.bsommerfeld.tscache.core.domain.SliceFamily;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Works out how rows written before atomic batching collapse into batches.
 *
 * <p>
 * Rows are grouped by {@code (subject, hash, slice family)}. Within a group
 * the distinct timestamps are walked in order and a new batch starts wherever
 * the gap to the previous timestamp exceeds the window. Every row of a batch
 * moves to the batch's earliest timestamp. Rows that then share a natural key
 * form a collision group: the member written last survives, the others are
 * dropped, provided their content is identical.
 *
 * <p>
 * Planning is pure; nothing is written here.
 */
public class BatchCanonicalizer {

    private final Duration window;

    public BatchCanonicalizer(Duration window) {
        long seconds = window.getSeconds();
        if (seconds < MigrationConfig.MIN_WINDOW_SECONDS || seconds > MigrationConfig.MAX_WINDOW_SECONDS)
            throw new IllegalArgumentException("Window must be between " + MigrationConfig.MIN_WINDOW_SECONDS
                    + " and " + MigrationConfig.MAX_WINDOW_SECONDS + " seconds, got " + seconds);
        this.window = window;
    }

    public Duration window() {
        return window;
    }

    public SubjectPlan plan(String subjectId, List<SnapshotRow> rows) {
        Map<BatchScope, List<SnapshotRow>> scopes = new LinkedHashMap<>();
        for (SnapshotRow row : rows) {
            if (!row.subjectId().equals(subjectId))
                throw new IllegalArgumentException("Row of " + row.subjectId() + " planned for " + subjectId);
            scopes.computeIfAbsent(new BatchScope(row.coreHash(), row.family()), k -> new ArrayList<>()).add(row);
        }

        Map<CanonicalKey, List<SnapshotRow>> byKey = new LinkedHashMap<>();
        TreeSet<Instant> before = new TreeSet<>();
        int groupsTouched = 0;

        for (List<SnapshotRow> scopeRows : scopes.values()) {
            Map<Instant, Instant> canonical = new HashMap<>();
            TreeSet<Instant> stamps = new TreeSet<>();
            scopeRows.forEach(r -> stamps.add(r.retrievedAt()));
            before.addAll(stamps);

            Instant batchStart = null;
            Instant previous = null;
            int batchSize = 0;
            for (Instant ts : stamps) {
                if (previous == null || Duration.between(previous, ts).compareTo(window) > 0) {
                    if (batchSize > 1)
                        groupsTouched++;
                    batchStart = ts;
                    batchSize = 0;
                }
                canonical.put(ts, batchStart);
                batchSize++;
                previous = ts;
            }
            if (batchSize > 1)
                groupsTouched++;

            for (SnapshotRow row : scopeRows) {
                CanonicalKey key = new CanonicalKey(row.coreHash(), row.sliceKey().toDsl(), row.anchorDay(),
                        canonical.get(row.retrievedAt()));
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        List<SnapshotRow> deletions = new ArrayList<>();
        List<SubjectPlan.Retime> updates = new ArrayList<>();
        List<CollisionGroup> collisions = new ArrayList<>();
        TreeSet<Instant> after = new TreeSet<>();

        for (Map.Entry<CanonicalKey, List<SnapshotRow>> entry : byKey.entrySet()) {
            CanonicalKey key = entry.getKey();
            after.add(key.canonicalTs());

            SnapshotRow survivor;
            if (entry.getValue().size() > 1) {
                CollisionGroup group = new CollisionGroup(subjectId, key.coreHash(), key.sliceKey(), key.anchorDay(),
                        key.canonicalTs(), entry.getValue());
                collisions.add(group);
                deletions.addAll(group.redundant());
                survivor = group.survivor();
            } else {
                survivor = entry.getValue().get(0);
            }
            if (!survivor.retrievedAt().equals(key.canonicalTs()))
                updates.add(new SubjectPlan.Retime(survivor, key.canonicalTs()));
        }

        deletions.sort(ROW_ORDER);
        updates.sort(Comparator.comparing(SubjectPlan.Retime::row, ROW_ORDER));
        return new SubjectPlan(subjectId, rows.size(), groupsTouched, before.size(), after.size(), deletions,
                updates, collisions);
    }

    private static final Comparator<SnapshotRow> ROW_ORDER = Comparator
            .comparing(SnapshotRow::coreHash)
            .thenComparing(r -> r.sliceKey().toDsl())
            .thenComparing(SnapshotRow::anchorDay)
            .thenComparing(SnapshotRow::retrievedAt);

    private record BatchScope(String coreHash, SliceFamily family) {
    }

    private record CanonicalKey(String coreHash, String sliceKey, LocalDate anchorDay, Instant canonicalTs) {
    }
}
