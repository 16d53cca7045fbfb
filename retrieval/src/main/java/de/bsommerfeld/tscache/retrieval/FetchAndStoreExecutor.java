package de.bsommerfeld.tscache.retrieval;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.DailyPoint;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import de.bsommerfeld.tscache.db.AppendSummary;
import de.bsommerfeld.tscache.db.SnapshotQuery;
import de.bsommerfeld.tscache.db.SnapshotStore;
import de.bsommerfeld.tscache.db.SnapshotWrite;
import de.bsommerfeld.tscache.retrieval.provider.PartialBatchInterruptedException;
import de.bsommerfeld.tscache.retrieval.provider.ProviderClient;
import de.bsommerfeld.tscache.retrieval.provider.ProviderException;
import de.bsommerfeld.tscache.retrieval.provider.ProviderRequest;
import de.bsommerfeld.tscache.retrieval.provider.RateLimitClassifier;
import de.bsommerfeld.tscache.retrieval.provider.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default {@link SliceExecutor}: fetches each window of an item from the
 * {@link ProviderClient} and appends the returned points under the batch
 * timestamp chosen by the orchestrator. Each window is one sub-write.
 */
@Singleton
public class FetchAndStoreExecutor implements SliceExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(FetchAndStoreExecutor.class);

    private final ProviderClient provider;
    private final SnapshotStore store;

    @Inject
    public FetchAndStoreExecutor(ProviderClient provider, SnapshotStore store) {
        this.provider = provider;
        this.store = store;
    }

    @Override
    public SliceExecutionResult execute(SliceExecution execution) throws ProviderException {
        FetchPlanItem item = execution.item();
        SubjectRef subject = item.subjectRef();

        int cacheHits = 0;
        int apiFetches = 0;
        int daysFetched = 0;
        int inserted = 0;
        int persistedRows = 0;
        int completedWindows = 0;

        for (FetchWindow window : item.windows()) {
            if (!execution.bypassCache() && isCached(item, window)) {
                LOG.debug("[Retrieval] Cache hit for {} {}..{}", item.itemKey(), window.from(), window.to());
                cacheHits++;
                completedWindows++;
                continue;
            }

            List<DailyPoint> points;
            try {
                apiFetches++;
                points = fetch(new ProviderRequest(item.objectId(), item.coreHash(), item.sliceKey(), window));
            } catch (RateLimitedException e) {
                if (persistedRows > 0)
                    throw new PartialBatchInterruptedException("Rate limited on window " + window.from() + ".."
                            + window.to() + " of " + item.itemKey() + " after " + persistedRows
                            + " row(s) were written", persistedRows, completedWindows, e);
                throw e;
            }

            List<SnapshotRow> rows = new ArrayList<>(points.size());
            for (DailyPoint point : points)
                rows.add(SnapshotRow.of(subject, item.sliceKey(), execution.retrievedAt(), point));

            AppendSummary summary = store.appendBatch(new SnapshotWrite(subject, item.canonicalSignature(), rows));
            daysFetched += points.size();
            inserted += summary.inserted();
            persistedRows += summary.attempted();
            completedWindows++;
            LOG.debug("[Retrieval] Stored {} of {} row(s) for {} {}..{} at {}", summary.inserted(),
                    summary.attempted(), item.itemKey(), window.from(), window.to(), execution.retrievedAt());
        }

        return new SliceExecutionResult(cacheHits, apiFetches, daysFetched, inserted);
    }

    /** Types untyped provider failures so the orchestrator can react to rate limits. */
    private List<DailyPoint> fetch(ProviderRequest request) throws ProviderException {
        try {
            return provider.fetch(request);
        } catch (ProviderException e) {
            RateLimitedException rateLimit = RateLimitClassifier.asRateLimit(e);
            throw rateLimit != null ? rateLimit : e;
        } catch (RuntimeException e) {
            if (RateLimitClassifier.isRateLimit(e))
                throw new RateLimitedException(e.getMessage(), e);
            throw new ProviderException("Provider call failed for " + request.objectId(), e);
        }
    }

    private boolean isCached(FetchPlanItem item, FetchWindow window) {
        SnapshotQuery query = SnapshotQuery.of(item.subjectRef())
                .withFamily(item.sliceKey().family())
                .withAnchorRange(window.from(), window.to());
        Set<LocalDate> present = store.queryRaw(query).stream()
                .map(SnapshotRow::anchorDay)
                .collect(Collectors.toSet());
        return present.containsAll(window.days());
    }
}
