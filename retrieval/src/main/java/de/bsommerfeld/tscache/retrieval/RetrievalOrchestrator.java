package de.bsommerfeld.tscache.retrieval;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.config.RetrievalConfig;
import de.bsommerfeld.tscache.core.domain.SubjectIdentity;
import de.bsommerfeld.tscache.core.event.ApplicationEventBus;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.CooldownFinishedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.CooldownStartedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.ItemCompletedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.RunFinishedEvent;
import de.bsommerfeld.tscache.retrieval.provider.PartialBatchInterruptedException;
import de.bsommerfeld.tscache.retrieval.provider.ProviderException;
import de.bsommerfeld.tscache.retrieval.provider.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a {@link FetchPlan} item by item.
 *
 * <p>
 * Every item is executed under the batch timestamp of its
 * {@link SubjectIdentity}, minted once per run and shared by all items of
 * that identity. When an automated run hits a provider rate limit, the
 * orchestrator waits out a cooldown, discards the timestamp of the failing
 * identity only, and retries that item with the cache bypassed, so rows of
 * the interrupted batch are never extended under their old timestamp.
 * Items of the same identity that had already finished under the discarded
 * timestamp are queued again and refetched with the cache bypassed, so the
 * identity ends the run under a single timestamp. Other identities keep
 * their timestamps.
 */
@Singleton
public class RetrievalOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private final SliceExecutor executor;
    private final Cooldown cooldown;
    private final Clock clock;
    private final RetrievalConfig config;
    private final ApplicationEventBus eventBus;

    @Inject
    public RetrievalOrchestrator(SliceExecutor executor, Cooldown cooldown, Clock clock, RetrievalConfig config,
            ApplicationEventBus eventBus) {
        this.executor = executor;
        this.cooldown = cooldown;
        this.clock = clock;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Executes the plan in the mode configured by {@code retrieval.automated}. */
    public RetrievalReport execute(FetchPlan plan) throws RetrievalException {
        return execute(plan, RetrievalOptions.fromConfig(config));
    }

    /**
     * Executes the plan.
     *
     * @throws RetrievalException if an item fails with a non rate-limit
     *                            error, hits a rate limit in a manual run, or
     *                            exhausts its rate-limit retries
     */
    public RetrievalReport execute(FetchPlan plan, RetrievalOptions options) throws RetrievalException {
        Instant started = clock.instant();
        RetrievalRun run = new RetrievalRun(clock);
        Tally tally = new Tally();
        Deque<FetchPlanItem> pending = new ArrayDeque<>(plan.items());

        LOG.info("[Retrieval] Starting run: {} item(s), automated={}, bypassCache={}", plan.items().size(),
                options.automated(), options.bypassCache());

        while (!pending.isEmpty()) {
            FetchPlanItem item = pending.poll();
            if (options.shouldAbort().getAsBoolean()) {
                LOG.info("[Retrieval] Abort requested before {}", item.itemKey());
                tally.aborted = true;
                break;
            }

            switch (item.classification()) {
                case COVERED -> {
                    complete(tally, ItemOutcome.skipped(item, ItemOutcome.Status.SKIPPED_COVERED));
                    continue;
                }
                case UNFETCHABLE -> {
                    LOG.warn("[Retrieval] Skipping unfetchable item {}: {}", item.itemKey(),
                            item.note() == null ? "no reason given" : item.note());
                    complete(tally, ItemOutcome.skipped(item, ItemOutcome.Status.SKIPPED_UNFETCHABLE));
                    continue;
                }
                default -> {
                }
            }

            if (!executeItem(item, run, options, tally, pending)) {
                tally.aborted = true;
                break;
            }
        }

        RetrievalReport report = new RetrievalReport(plan.items().size(), tally.executed, tally.refetched,
                tally.cacheHits, tally.apiFetches, tally.daysFetched, tally.restarts, tally.aborted,
                Duration.between(started, clock.instant()), tally.outcomes);
        LOG.info("[Retrieval] Run finished: executed={}, refetched={}, cacheHits={}, apiFetches={}, days={}, "
                + "restarts={}, aborted={}", report.executed(), report.refetched(), report.cacheHits(),
                report.apiFetches(), report.daysFetched(), report.rateLimitRestarts(), report.aborted());
        eventBus.post(new RunFinishedEvent(report));
        return report;
    }

    /** Returns {@code false} if the run was aborted during a cooldown. */
    private boolean executeItem(FetchPlanItem item, RetrievalRun run, RetrievalOptions options, Tally tally,
            Deque<FetchPlanItem> pending) throws RetrievalException {
        SubjectIdentity identity = item.identity();
        boolean refetch = tally.refetch.remove(item);
        int attempts = 0;
        int restarts = 0;

        while (true) {
            Instant retrievedAt = run.batchTimestamp(identity);
            boolean bypass = options.bypassCache() || refetch || run.isForcedBypass(identity);
            attempts++;

            try {
                SliceExecutionResult result = executor.execute(new SliceExecution(item, retrievedAt, bypass));
                run.clearForcedBypass(identity);
                tally.executed++;
                if (refetch)
                    tally.refetched++;
                tally.finished.computeIfAbsent(identity, k -> new ArrayList<>()).add(item);
                tally.cacheHits += result.cacheHits();
                tally.apiFetches += result.apiFetches();
                tally.daysFetched += result.daysFetched();
                complete(tally, new ItemOutcome(item.itemKey(), ItemOutcome.Status.SUCCEEDED, retrievedAt, attempts,
                        result));
                return true;
            } catch (RateLimitedException e) {
                logRateLimit(item, retrievedAt, e);
                if (!options.automated())
                    throw new RetrievalException("Rate limited during manual retrieval of " + item.itemKey()
                            + "; retry later or run automated", item.itemKey(), e);
                if (restarts >= config.getMaxRateLimitRetries())
                    throw new RetrievalException("Rate limited again after " + restarts + " cooldown(s) for "
                            + item.itemKey(), item.itemKey(), e);

                restarts++;
                tally.restarts++;
                if (waitOut(item, identity, options) == CooldownOutcome.ABORTED) {
                    complete(tally, new ItemOutcome(item.itemKey(), ItemOutcome.Status.ABORTED, retrievedAt, attempts,
                            SliceExecutionResult.NOTHING));
                    return false;
                }
                run.invalidate(identity);
                run.forceBypass(identity);
                requeueFinished(identity, tally, pending);
                LOG.info("[Retrieval] Retrying {} under a fresh batch timestamp with cache bypass", item.itemKey());
            } catch (ProviderException e) {
                throw new RetrievalException("Retrieval of " + item.itemKey() + " failed: " + e.getMessage(),
                        item.itemKey(), e);
            }
        }
    }

    /**
     * Queues the items of {@code identity} that finished under the discarded
     * timestamp in front of the remaining plan, keeping their order, and
     * drops their stale outcomes.
     */
    private void requeueFinished(SubjectIdentity identity, Tally tally, Deque<FetchPlanItem> pending) {
        List<FetchPlanItem> stale = tally.finished.remove(identity);
        if (stale == null)
            return;

        for (int i = stale.size() - 1; i >= 0; i--) {
            FetchPlanItem item = stale.get(i);
            pending.addFirst(item);
            tally.refetch.add(item);
            tally.outcomes.removeIf(outcome -> outcome.itemKey().equals(item.itemKey())
                    && outcome.status() == ItemOutcome.Status.SUCCEEDED);
        }
        LOG.info("[Retrieval] Refetching {} finished item(s) of {} under the new batch timestamp", stale.size(),
                identity);
    }

    private CooldownOutcome waitOut(FetchPlanItem item, SubjectIdentity identity, RetrievalOptions options) {
        Duration duration = Duration.ofMinutes(config.getCooldownMinutes());
        eventBus.post(new CooldownStartedEvent(item.itemKey(), identity, duration, clock.instant().plus(duration)));
        CooldownOutcome outcome = cooldown.await(duration, options.shouldAbort());
        eventBus.post(new CooldownFinishedEvent(item.itemKey(), outcome));
        return outcome;
    }

    private void logRateLimit(FetchPlanItem item, Instant retrievedAt, RateLimitedException e) {
        if (e instanceof PartialBatchInterruptedException partial) {
            LOG.warn("[Retrieval] Rate limited on {} after {} row(s) in {} window(s) were written at {}. "
                    + "That batch is discarded", item.itemKey(), partial.getPersistedRows(),
                    partial.getCompletedWindows(), retrievedAt);
        } else {
            LOG.warn("[Retrieval] Rate limited on {}: {}", item.itemKey(), e.getMessage());
        }
    }

    private void complete(Tally tally, ItemOutcome outcome) {
        tally.outcomes.add(outcome);
        eventBus.post(new ItemCompletedEvent(outcome));
    }

    private static final class Tally {
        final List<ItemOutcome> outcomes = new ArrayList<>();
        // items that succeeded under the current timestamp of their identity
        final Map<SubjectIdentity, List<FetchPlanItem>> finished = new HashMap<>();
        final Set<FetchPlanItem> refetch = new HashSet<>();
        int executed;
        int refetched;
        int cacheHits;
        int apiFetches;
        int daysFetched;
        int restarts;
        boolean aborted;
    }
}
