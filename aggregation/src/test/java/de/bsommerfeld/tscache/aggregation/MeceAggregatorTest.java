package de.bsommerfeld.tscache.aggregation;

import de.bsommerfeld.tscache.aggregation.definition.ContextDefinition;
import de.bsommerfeld.tscache.aggregation.definition.DefinitionResolver;
import de.bsommerfeld.tscache.aggregation.definition.InMemoryDefinitionHistory;
import de.bsommerfeld.tscache.aggregation.definition.OtherPolicy;
import de.bsommerfeld.tscache.core.config.MultiDimensionPolicy;
import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MeceAggregatorTest {

    private static final Instant V1_FROM = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant V2_FROM = Instant.parse("2025-02-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2025-01-10T08:00:00Z");
    private static final Instant T2 = Instant.parse("2025-02-10T08:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2025, 1, 5);

    private InMemoryDefinitionHistory history;
    private MeceAggregator aggregator;

    @BeforeEach
    void setUp() {
        history = new InMemoryDefinitionHistory()
                .register(new ContextDefinition("channel", "v1", List.of("x", "y"), OtherPolicy.NULL), V1_FROM)
                .register(new ContextDefinition("channel", "v2", List.of("x", "y", "z"), OtherPolicy.NULL), V2_FROM);
        aggregator = new MeceAggregator(new DefinitionResolver(history), MultiDimensionPolicy.REFUSE);
    }

    // -- Definition epochs --

    @Test
    void aggregate_completeUnderDefinitionInForce_shouldSumCounts() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 100, 10),
                row("context(channel:y).window()", DAY, T1, 50, 5)));

        DayAggregate day = result.day(DAY).orElseThrow();
        assertEquals(DayAggregate.Source.AGGREGATED, day.source());
        assertEquals(Long.valueOf(150), day.metrics().denominator());
        assertEquals(Long.valueOf(15), day.metrics().numerator());
        assertEquals("v1", day.definitionVersion());
        assertEquals("channel", result.contextKey());
        assertFalse(result.isRefused());
    }

    @Test
    void aggregate_dayMixingEpochs_shouldRefuse() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 100, 10),
                row("context(channel:y).window()", DAY, T2, 50, 5)));

        DayAggregate day = result.day(DAY).orElseThrow();
        assertEquals(RefusalReason.MIXED_EPOCHS, day.refusal());
        assertNull(day.metrics());
    }

    @Test
    void aggregate_newRowsMissingAddedValue_shouldBeIncomplete() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T2, 100, 10),
                row("context(channel:y).window()", DAY, T2, 50, 5)));

        DayAggregate day = result.day(DAY).orElseThrow();
        assertEquals(RefusalReason.INCOMPLETE_PARTITION, day.refusal());
        assertEquals(Set.of("z"), day.missingValues());
        assertEquals("v2", day.definitionVersion());
    }

    @Test
    void aggregate_rowsBeforeAnyDefinition_shouldRefuseAsUnknown() {
        Instant early = Instant.parse("2024-12-01T00:00:00Z");

        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, early, 1, 1),
                row("context(channel:y).window()", DAY, early, 1, 1)));

        assertEquals(RefusalReason.UNKNOWN_DEFINITION, result.day(DAY).orElseThrow().refusal());
    }

    // -- Partition checks --

    @Test
    void aggregate_unexpectedValue_shouldNotBeMece() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 1, 1),
                row("context(channel:y).window()", DAY, T1, 1, 1),
                row("context(channel:w).window()", DAY, T1, 1, 1)));

        assertEquals(RefusalReason.NOT_MECE, result.day(DAY).orElseThrow().refusal());
    }

    @Test
    void aggregate_duplicateValue_shouldNotBeMece() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window(-7d:)", DAY, T1, 1, 1),
                row("context(channel:x).window(-14d:)", DAY, T1, 1, 1),
                row("context(channel:y).window()", DAY, T1, 1, 1)));

        assertEquals(RefusalReason.NOT_MECE, result.day(DAY).orElseThrow().refusal());
    }

    @Test
    void aggregate_undefinedOtherPolicy_shouldNeverSum() {
        history.register(new ContextDefinition("device", "d1", List.of("desktop", "mobile"), OtherPolicy.UNDEFINED),
                V1_FROM);

        AggregationResult result = aggregator.aggregate(List.of(
                row("context(device:desktop).window()", DAY, T1, 1, 1),
                row("context(device:mobile).window()", DAY, T1, 1, 1)));

        assertEquals(RefusalReason.NOT_MECE, result.day(DAY).orElseThrow().refusal());
    }

    @Test
    void aggregate_computedOther_shouldRequireOtherBucket() {
        history.register(new ContextDefinition("device", "d1", List.of("desktop", "mobile"), OtherPolicy.COMPUTED),
                V1_FROM);

        AggregationResult without = aggregator.aggregate(List.of(
                row("context(device:desktop).window()", DAY, T1, 1, 1),
                row("context(device:mobile).window()", DAY, T1, 1, 1)));
        AggregationResult with = aggregator.aggregate(List.of(
                row("context(device:desktop).window()", DAY, T1, 1, 1),
                row("context(device:mobile).window()", DAY, T1, 1, 1),
                row("context(device:other).window()", DAY, T1, 1, 1)));

        assertEquals(Set.of("other"), without.day(DAY).orElseThrow().missingValues());
        assertEquals(Long.valueOf(3), with.day(DAY).orElseThrow().metrics().numerator());
    }

    // -- Explicit totals, modes, dimensions --

    @Test
    void aggregate_uncontextedRowPresent_shouldBeUsedDirectly() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("window()", DAY, T1, 999, 99),
                row("context(channel:x).window()", DAY, T1, 100, 10)));

        DayAggregate day = result.day(DAY).orElseThrow();
        assertEquals(DayAggregate.Source.EXPLICIT_UNCONTEXTED, day.source());
        assertEquals(Long.valueOf(99), day.metrics().numerator());
    }

    @Test
    void aggregate_mixedModes_shouldRefuseEverything() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 1, 1),
                row("context(channel:y).cohort()", DAY, T1, 1, 1)));

        assertEquals(RefusalReason.MIXED_MODES, result.refusal());
        assertEquals(RefusalReason.MIXED_MODES, result.day(DAY).orElseThrow().refusal());
    }

    @Test
    void aggregate_multipleKeys_shouldRefuseUnderDefaultPolicy() {
        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 1, 1),
                row("context(channel:y).window()", DAY, T1, 1, 1),
                row("context(device:mobile).window()", DAY, T1, 1, 1)));

        assertEquals(RefusalReason.MULTIPLE_DIMENSIONS, result.refusal());
        assertFalse(result.day(DAY).orElseThrow().hasValue());
    }

    @Test
    void aggregate_multipleKeys_bestSingleKey_shouldSumDominantKey() {
        var lenient = new MeceAggregator(new DefinitionResolver(history), MultiDimensionPolicy.BEST_SINGLE_KEY);

        AggregationResult result = lenient.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 10, 1),
                row("context(channel:y).window()", DAY, T1, 20, 2),
                row("context(channel:x).context(device:mobile).window()", DAY, T1, 5, 1),
                row("context(device:mobile).window()", DAY, T1, 7, 1)));

        assertEquals("channel", result.contextKey());
        assertEquals(Long.valueOf(30), result.day(DAY).orElseThrow().metrics().denominator());
    }

    @Test
    void aggregate_shouldSumAnchorEntrantsOnlyWhenAllRowsHaveThem() {
        var cohortA = new SnapshotRow("p", "h", SliceKey.parse("context(channel:x).cohort()"), DAY, T1,
                SnapshotMetrics.cohortCounts(40, 30, 3));
        var cohortB = new SnapshotRow("p", "h", SliceKey.parse("context(channel:y).cohort()"), DAY, T1,
                SnapshotMetrics.cohortCounts(60, 50, 5));

        DayAggregate day = aggregator.aggregate(List.of(cohortA, cohortB)).day(DAY).orElseThrow();

        assertEquals(Long.valueOf(100), day.metrics().anchorEntrants());
        assertNull(day.metrics().medianLagDays());
    }

    @Test
    void aggregate_rowWithoutNumerator_shouldRefuseInsteadOfSummingZero() {
        var withoutNumerator = new SnapshotRow("param-a", "hash-1", SliceKey.parse("context(channel:x).window()"), DAY,
                T1, new SnapshotMetrics(null, 100L, null, null, null, null, null, null));

        DayAggregate day = aggregator.aggregate(List.of(withoutNumerator,
                row("context(channel:y).window()", DAY, T1, 50, 5))).day(DAY).orElseThrow();

        assertEquals(DayAggregate.Source.REFUSED, day.source());
        assertEquals(RefusalReason.MISSING_COUNTS, day.refusal());
        assertNull(day.metrics());
    }

    @Test
    void aggregate_rowWithoutDenominator_shouldRefuseOnlyThatDay() {
        LocalDate next = DAY.plusDays(1);
        var withoutDenominator = new SnapshotRow("param-a", "hash-1", SliceKey.parse("context(channel:y).window()"),
                next, T1, new SnapshotMetrics(null, null, 4L, null, null, null, null, null));

        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 10, 1),
                row("context(channel:y).window()", DAY, T1, 20, 2),
                row("context(channel:x).window()", next, T1, 10, 1),
                withoutDenominator));

        assertEquals(Long.valueOf(30), result.day(DAY).orElseThrow().metrics().denominator());
        assertEquals(RefusalReason.MISSING_COUNTS, result.day(next).orElseThrow().refusal());
    }

    @Test
    void aggregate_shouldJudgeEachDayIndependently() {
        LocalDate next = DAY.plusDays(1);

        AggregationResult result = aggregator.aggregate(List.of(
                row("context(channel:x).window()", DAY, T1, 1, 1),
                row("context(channel:y).window()", DAY, T1, 1, 1),
                row("context(channel:x).window()", next, T1, 1, 1)));

        assertTrue(result.day(DAY).orElseThrow().hasValue());
        assertEquals(RefusalReason.INCOMPLETE_PARTITION, result.day(next).orElseThrow().refusal());
        assertEquals(1, result.valuedDays().size());
    }

    @Test
    void aggregate_emptyInput_shouldYieldNoDays() {
        assertTrue(aggregator.aggregate(List.of()).days().isEmpty());
    }

    private static SnapshotRow row(String slice, LocalDate day, Instant at, long x, long y) {
        return new SnapshotRow("param-a", "hash-1", SliceKey.parse(slice), day, at, SnapshotMetrics.counts(x, y));
    }
}
