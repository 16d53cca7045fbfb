package de.bsommerfeld.tscache.db.read;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SliceFamily;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import de.bsommerfeld.tscache.db.SnapshotQuery;
import de.bsommerfeld.tscache.db.SnapshotStore;
import de.bsommerfeld.tscache.db.equivalence.EquivalenceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers "latest known value as of T" across equivalent series.
 *
 * <p>
 * The reader unions the rows of every member of the seed's closure (or only
 * the seed when expansion is off), keeps rows with
 * {@code retrieved_at <= asOf}, and for each {@code (anchor day, slice family)}
 * picks the row with the greatest {@code retrieved_at}. Ties across subjects
 * go to the greater subject id, then the greater hash.
 *
 * <p>
 * When expansion is requested the query is never narrowed to the seed
 * subject: rows physically live under whichever closure member fetched them.
 * Missing data yields an empty result, never a fabricated one.
 */
@Singleton
public class VirtualSnapshotReader {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualSnapshotReader.class);

    private static final Comparator<SnapshotRow> PREFERENCE = Comparator
            .comparing(SnapshotRow::retrievedAt)
            .thenComparing(SnapshotRow::subjectId)
            .thenComparing(SnapshotRow::coreHash);

    private record GroupKey(LocalDate anchorDay, SliceFamily family) {
    }

    private final SnapshotStore store;
    private final EquivalenceRegistry registry;

    @Inject
    public VirtualSnapshotReader(SnapshotStore store, EquivalenceRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    public VirtualSnapshot resolveLatest(VirtualSnapshotRequest request) {
        Set<SubjectRef> subjects = subjectsFor(request.seed(), request.expandEquivalents());

        SnapshotQuery query = SnapshotQuery.of(subjects)
                .withFamily(request.family())
                .withAnchorRange(request.anchorFrom(), request.anchorTo())
                .withRetrievedUpTo(request.asOf());

        Map<GroupKey, SnapshotRow> latest = new LinkedHashMap<>();
        for (SnapshotRow row : store.queryRaw(query)) {
            latest.merge(new GroupKey(row.anchorDay(), row.family()), row,
                    (a, b) -> PREFERENCE.compare(a, b) >= 0 ? a : b);
        }

        List<SnapshotRow> rows = new ArrayList<>(latest.values());
        rows.sort(Comparator.comparing(SnapshotRow::anchorDay)
                .thenComparing(r -> r.family().canonical()));

        Instant newest = null;
        boolean coversAnchorTo = false;
        for (SnapshotRow row : rows) {
            if (newest == null || row.retrievedAt().isAfter(newest))
                newest = row.retrievedAt();
            if (row.anchorDay().equals(request.anchorTo()))
                coversAnchorTo = true;
        }

        LOG.debug("Resolved {} rows for {} as of {} across {} subject(s)", rows.size(), request.seed(),
                request.asOf(), subjects.size());
        return new VirtualSnapshot(rows, subjects, newest, coversAnchorTo);
    }

    /**
     * Uncollapsed rows of the seed, or of its whole closure when
     * {@code expandEquivalents} is set.
     */
    public List<SnapshotRow> queryRaw(SubjectRef seed, SliceFamily family, boolean expandEquivalents) {
        return store.queryRaw(SnapshotQuery.of(subjectsFor(seed, expandEquivalents)).withFamily(family));
    }

    private Set<SubjectRef> subjectsFor(SubjectRef seed, boolean expand) {
        return expand ? registry.resolveClosure(seed) : Set.of(seed);
    }
}
