package de.bsommerfeld.tscache.retrieval;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.tscache.core.config.RetrievalConfig;
import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.core.event.ApplicationEventBus;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.CooldownFinishedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.CooldownStartedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.ItemCompletedEvent;
import de.bsommerfeld.tscache.retrieval.RetrievalEvents.RunFinishedEvent;
import de.bsommerfeld.tscache.retrieval.provider.PartialBatchInterruptedException;
import de.bsommerfeld.tscache.retrieval.provider.ProviderException;
import de.bsommerfeld.tscache.retrieval.provider.RateLimitedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalOrchestratorTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final LocalDate D = LocalDate.of(2025, 2, 1);

    private final List<SliceExecution> executions = new ArrayList<>();
    private final List<Duration> cooldowns = new ArrayList<>();
    private final List<Object> events = new ArrayList<>();

    /** Item keys whose next execution fails with a rate limit. */
    private final Set<String> rateLimitOnce = new HashSet<>();
    private final Set<String> rateLimitAlways = new HashSet<>();

    private CooldownOutcome cooldownOutcome = CooldownOutcome.COMPLETED;
    private RetrievalConfig config;
    private RetrievalOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new RetrievalConfig();
        ApplicationEventBus bus = new ApplicationEventBus();
        bus.register(new Object() {
            @Subscribe
            public void on(Object event) {
                events.add(event);
            }
        });

        SliceExecutor executor = execution -> {
            executions.add(execution);
            String key = execution.item().itemKey();
            if (rateLimitAlways.contains(key) || rateLimitOnce.remove(key))
                throw new RateLimitedException("429 Too Many Requests");
            return new SliceExecutionResult(0, execution.item().windows().size(), 7, 7);
        };
        Cooldown cooldown = (duration, shouldAbort) -> {
            cooldowns.add(duration);
            return cooldownOutcome;
        };

        orchestrator = new RetrievalOrchestrator(executor, cooldown, new SteppingClock(T0, Duration.ofSeconds(1)),
                config, bus);
    }

    private static FetchPlanItem item(String key, String objectId, String slice) {
        return FetchPlanItem.fetch(key, objectId, "h1", SliceKey.parse(slice), List.of(FetchWindow.of(D, D.plusDays(6))));
    }

    private List<SliceExecution> executionsOf(String itemKey) {
        return executions.stream().filter(e -> e.item().itemKey().equals(itemKey)).toList();
    }

    @Test
    void execute_itemsOfSameIdentity_shouldShareOneBatchTimestamp() throws Exception {
        FetchPlan plan = FetchPlan.of(
                item("a-7d", "obj-a", "window(-7d:-1d)"),
                item("a-30d", "obj-a", "window(-30d:-1d)"),
                item("a-cohort", "obj-a", "cohort(-7d:-1d)"));

        RetrievalReport report = orchestrator.execute(plan, RetrievalOptions.automated());

        assertEquals(3, report.executed());
        assertEquals(executions.get(0).retrievedAt(), executions.get(1).retrievedAt());
        assertNotEquals(executions.get(0).retrievedAt(), executions.get(2).retrievedAt());
        assertTrue(executions.stream().noneMatch(SliceExecution::bypassCache));
    }

    @Test
    void execute_rateLimited_shouldCoolDownAndRetryUnderFreshTimestampWithBypass() throws Exception {
        rateLimitOnce.add("a");

        RetrievalReport report = orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                RetrievalOptions.automated());

        List<SliceExecution> attempts = executionsOf("a");
        assertEquals(2, attempts.size());
        assertFalse(attempts.get(0).bypassCache());
        assertTrue(attempts.get(1).bypassCache());
        assertTrue(attempts.get(1).retrievedAt().isAfter(attempts.get(0).retrievedAt()));

        assertEquals(List.of(Duration.ofMinutes(61)), cooldowns);
        assertEquals(1, report.rateLimitRestarts());
        assertFalse(report.aborted());

        ItemOutcome outcome = report.outcomes().get(0);
        assertEquals(ItemOutcome.Status.SUCCEEDED, outcome.status());
        assertEquals(2, outcome.attempts());
        assertEquals(attempts.get(1).retrievedAt(), outcome.retrievedAt());
    }

    @Test
    void execute_rateLimitOnOneSubject_shouldNotTouchOtherSubjects() throws Exception {
        rateLimitOnce.add("a");
        FetchPlan plan = FetchPlan.of(
                item("b-first", "obj-b", "window(-7d:-1d)"),
                item("a", "obj-a", "window(-7d:-1d)"),
                item("b-second", "obj-b", "window(-30d:-1d)"));

        orchestrator.execute(plan, RetrievalOptions.automated());

        SliceExecution bFirst = executionsOf("b-first").get(0);
        SliceExecution bSecond = executionsOf("b-second").get(0);
        assertEquals(bFirst.retrievedAt(), bSecond.retrievedAt());
        assertFalse(bSecond.bypassCache());
        assertEquals(1, executionsOf("b-first").size());
    }

    @Test
    void execute_rateLimitOnSecondOfFourSlices_shouldRefetchFinishedSlicesUnderNewTimestamp() throws Exception {
        rateLimitOnce.add("s2");
        FetchPlan plan = FetchPlan.of(
                item("s1", "obj-a", "window(-7d:-1d)"),
                item("s2", "obj-a", "window(-14d:-8d)"),
                item("s3", "obj-a", "window(-21d:-15d)"),
                item("s4", "obj-a", "window(-28d:-22d)"));

        RetrievalReport report = orchestrator.execute(plan, RetrievalOptions.automated());

        assertEquals(List.of("s1", "s2", "s2", "s1", "s3", "s4"),
                executions.stream().map(e -> e.item().itemKey()).toList());
        Instant discarded = executionsOf("s1").get(0).retrievedAt();
        Instant fresh = executionsOf("s2").get(1).retrievedAt();
        assertTrue(fresh.isAfter(discarded));
        assertEquals(fresh, executionsOf("s1").get(1).retrievedAt());
        assertTrue(executionsOf("s1").get(1).bypassCache());
        assertEquals(fresh, executionsOf("s3").get(0).retrievedAt());
        assertEquals(fresh, executionsOf("s4").get(0).retrievedAt());

        assertEquals(4, report.outcomes().size());
        assertTrue(report.outcomes().stream().allMatch(o -> o.status() == ItemOutcome.Status.SUCCEEDED));
        assertEquals(Set.of(fresh), report.outcomes().stream().map(ItemOutcome::retrievedAt)
                .collect(Collectors.toSet()));
        assertEquals(5, report.executed());
        assertEquals(1, report.refetched());
        assertEquals(1, report.rateLimitRestarts());
    }

    @Test
    void execute_afterSuccessfulRetry_shouldClearForcedBypassButKeepNewTimestamp() throws Exception {
        rateLimitOnce.add("a-7d");
        FetchPlan plan = FetchPlan.of(
                item("a-7d", "obj-a", "window(-7d:-1d)"),
                item("a-30d", "obj-a", "window(-30d:-1d)"));

        orchestrator.execute(plan, RetrievalOptions.automated());

        SliceExecution retry = executionsOf("a-7d").get(1);
        SliceExecution later = executionsOf("a-30d").get(0);
        assertTrue(retry.bypassCache());
        assertFalse(later.bypassCache());
        assertEquals(retry.retrievedAt(), later.retrievedAt());
    }

    @Test
    void execute_rateLimitedAgainAfterRetry_shouldThrowRetrievalException() {
        rateLimitAlways.add("a");

        RetrievalException e = assertThrows(RetrievalException.class,
                () -> orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                        RetrievalOptions.automated()));

        assertEquals("a", e.getItemKey());
        assertInstanceOf(RateLimitedException.class, e.getCause());
        assertEquals(2, executions.size());
        assertEquals(1, cooldowns.size());
    }

    @Test
    void execute_withMoreRetriesConfigured_shouldCoolDownEachTime() {
        config.setMaxRateLimitRetries(3);
        rateLimitAlways.add("a");

        assertThrows(RetrievalException.class,
                () -> orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                        RetrievalOptions.automated()));

        assertEquals(4, executions.size());
        assertEquals(3, cooldowns.size());
    }

    @Test
    void execute_manualRun_shouldFailOnFirstRateLimitWithoutCooldown() {
        rateLimitOnce.add("a");

        assertThrows(RetrievalException.class,
                () -> orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                        RetrievalOptions.manual()));

        assertEquals(1, executions.size());
        assertTrue(cooldowns.isEmpty());
    }

    @Test
    void execute_withConfiguredManualMode_shouldFailOnRateLimitWithoutCooldown() {
        config.setAutomated(false);
        rateLimitOnce.add("a");

        assertThrows(RetrievalException.class,
                () -> orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)"))));

        assertEquals(1, executions.size());
        assertTrue(cooldowns.isEmpty());
    }

    @Test
    void execute_withDefaultConfig_shouldRunAutomated() throws Exception {
        rateLimitOnce.add("a");

        RetrievalReport report = orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")));

        assertEquals(1, report.rateLimitRestarts());
        assertEquals(1, cooldowns.size());
    }

    @Test
    void execute_abortedCooldown_shouldEndRunWithoutFurtherItems() throws Exception {
        rateLimitOnce.add("a");
        cooldownOutcome = CooldownOutcome.ABORTED;
        FetchPlan plan = FetchPlan.of(
                item("a", "obj-a", "window(-7d:-1d)"),
                item("b", "obj-b", "window(-7d:-1d)"));

        RetrievalReport report = orchestrator.execute(plan, RetrievalOptions.automated());

        assertTrue(report.aborted());
        assertEquals(0, report.executed());
        assertEquals(1, report.outcomes().size());
        assertEquals(ItemOutcome.Status.ABORTED, report.outcomes().get(0).status());
        assertTrue(executionsOf("b").isEmpty());
    }

    @Test
    void execute_abortSignal_shouldStopBeforeNextItem() throws Exception {
        FetchPlan plan = FetchPlan.of(
                item("a", "obj-a", "window(-7d:-1d)"),
                item("b", "obj-b", "window(-7d:-1d)"));

        RetrievalReport report = orchestrator.execute(plan,
                RetrievalOptions.automated().withAbortSignal(() -> !executions.isEmpty()));

        assertTrue(report.aborted());
        assertEquals(1, report.executed());
        assertTrue(executionsOf("b").isEmpty());
    }

    @Test
    void execute_coveredAndUnfetchableItems_shouldBeSkippedAsSuccess() throws Exception {
        FetchPlan plan = FetchPlan.of(
                item("covered", "obj-a", "window(-7d:-1d)").classifiedAs(ItemClassification.COVERED, null),
                item("gone", "obj-b", "window(-7d:-1d)").classifiedAs(ItemClassification.UNFETCHABLE,
                        "event no longer exists"),
                item("fetch", "obj-c", "window(-7d:-1d)"));

        RetrievalReport report = orchestrator.execute(plan, RetrievalOptions.automated());

        assertEquals(List.of("fetch"), executions.stream().map(e -> e.item().itemKey()).toList());
        assertEquals(3, report.items());
        assertEquals(1, report.executed());
        assertEquals(3, report.succeeded());
        assertEquals(ItemOutcome.Status.SKIPPED_COVERED, report.outcomes().get(0).status());
        assertEquals(ItemOutcome.Status.SKIPPED_UNFETCHABLE, report.outcomes().get(1).status());
    }

    @Test
    void execute_otherProviderFailure_shouldPropagateWithoutRetry() {
        RetrievalOrchestrator failing = new RetrievalOrchestrator(execution -> {
            executions.add(execution);
            throw new ProviderException("unknown metric", 400, null);
        }, (d, abort) -> {
            cooldowns.add(d);
            return CooldownOutcome.COMPLETED;
        }, new SteppingClock(T0, Duration.ofSeconds(1)), config, new ApplicationEventBus());

        RetrievalException e = assertThrows(RetrievalException.class,
                () -> failing.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                        RetrievalOptions.automated()));

        assertEquals("a", e.getItemKey());
        assertEquals(1, executions.size());
        assertTrue(cooldowns.isEmpty());
    }

    @Test
    void execute_partialBatchInterruption_shouldBeRetriedLikeAnyRateLimit() throws Exception {
        List<SliceExecution> seen = new ArrayList<>();
        RetrievalOrchestrator partial = new RetrievalOrchestrator(execution -> {
            seen.add(execution);
            if (seen.size() == 1)
                throw new PartialBatchInterruptedException("window 2", 7, 1, null);
            return new SliceExecutionResult(0, 4, 28, 28);
        }, (d, abort) -> CooldownOutcome.COMPLETED, new SteppingClock(T0, Duration.ofSeconds(1)), config,
                new ApplicationEventBus());

        RetrievalReport report = partial.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")),
                RetrievalOptions.automated());

        assertEquals(1, report.rateLimitRestarts());
        assertTrue(seen.get(1).bypassCache());
        assertNotEquals(seen.get(0).retrievedAt(), seen.get(1).retrievedAt());
    }

    @Test
    void execute_shouldPublishProgressEvents() throws Exception {
        rateLimitOnce.add("a");

        orchestrator.execute(FetchPlan.of(item("a", "obj-a", "window(-7d:-1d)")), RetrievalOptions.automated());

        List<Class<?>> types = events.stream().<Class<?>>map(Object::getClass).toList();
        assertEquals(List.of(CooldownStartedEvent.class, CooldownFinishedEvent.class, ItemCompletedEvent.class,
                RunFinishedEvent.class), types);
        RunFinishedEvent finished = (RunFinishedEvent) events.get(3);
        assertEquals(1, finished.report().executed());
    }
}
