package de.bsommerfeld.tscache.migration;

import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchCanonicalizerTest {

    static final Instant T0 = Instant.parse("2025-01-10T06:00:00Z");
    static final LocalDate D1 = LocalDate.of(2025, 1, 8);
    static final LocalDate D2 = LocalDate.of(2025, 1, 9);

    private final BatchCanonicalizer canonicalizer = new BatchCanonicalizer(Duration.ofSeconds(120));

    static SnapshotRow row(String slice, LocalDate day, Instant at, long x, long y) {
        return new SnapshotRow("obj-a", "h1", SliceKey.parse(slice), day, at, SnapshotMetrics.counts(x, y));
    }

    @Test
    void plan_rowsWithinWindow_shouldMoveToEarliestTimestamp() {
        List<SnapshotRow> rows = List.of(
                row("window()", D1, T0, 100, 10),
                row("window()", D2, T0.plusSeconds(45), 100, 12));

        SubjectPlan plan = canonicalizer.plan("obj-a", rows);

        assertEquals(1, plan.updates().size());
        assertEquals(T0, plan.updates().get(0).canonicalTs());
        assertEquals(D2, plan.updates().get(0).row().anchorDay());
        assertTrue(plan.deletions().isEmpty());
        assertEquals(2, plan.distinctBefore());
        assertEquals(1, plan.distinctAfter());
        assertEquals(1, plan.groupsTouched());
    }

    @Test
    void plan_gapsAreMeasuredToPreviousTimestamp() {
        // 0s, 100s, 200s chain into one batch although 200s is beyond the window from the start
        List<SnapshotRow> rows = List.of(
                row("window()", D1, T0, 1, 1),
                row("window()", D2, T0.plusSeconds(100), 1, 1),
                row("cohort()", D1, T0.plusSeconds(200), 1, 1),
                row("window()", D1.minusDays(1), T0.plusSeconds(200), 1, 1));

        SubjectPlan plan = canonicalizer.plan("obj-a", rows);

        assertTrue(plan.updates().stream()
                .filter(r -> r.row().sliceKey().toDsl().startsWith("window"))
                .allMatch(r -> r.canonicalTs().equals(T0)));
        assertTrue(plan.updates().stream().noneMatch(r -> r.row().sliceKey().toDsl().startsWith("cohort")),
                "a lone row of another family is its own batch");
    }

    @Test
    void plan_gapBeyondWindow_shouldStartNewBatch() {
        List<SnapshotRow> rows = List.of(
                row("window()", D1, T0, 1, 1),
                row("window()", D1, T0.plusSeconds(121), 1, 2));

        SubjectPlan plan = canonicalizer.plan("obj-a", rows);

        assertTrue(plan.isCanonical());
        assertTrue(plan.collisions().isEmpty());
        assertEquals(0, plan.groupsTouched());
    }

    @Test
    void plan_identicalCopies_shouldKeepLatestAndDropRest() {
        SnapshotRow first = row("window()", D1, T0, 100, 10);
        SnapshotRow copy = row("window()", D1, T0.plusSeconds(30), 100, 10);
        SnapshotRow other = row("window()", D2, T0.plusSeconds(30), 100, 11);

        SubjectPlan plan = canonicalizer.plan("obj-a", List.of(first, copy, other));

        assertEquals(List.of(first), plan.deletions());
        assertEquals(2, plan.updates().size());
        assertTrue(plan.updates().stream().allMatch(u -> u.canonicalTs().equals(T0)));
        assertEquals(1, plan.collisions().size());
        assertTrue(plan.ambiguous().isEmpty());
    }

    @Test
    void plan_differingCopies_shouldBeReportedAsAmbiguous() {
        SubjectPlan plan = canonicalizer.plan("obj-a", List.of(
                row("window()", D1, T0, 100, 10),
                row("window()", D1, T0.plusSeconds(30), 100, 11)));

        assertEquals(1, plan.ambiguous().size());
        CollisionGroup group = plan.ambiguous().get(0);
        assertEquals(T0, group.canonicalTs());
        assertEquals(3, group.describe().size());
        assertTrue(group.describe().get(0).contains("day=2025-01-08"));
    }

    @Test
    void plan_differentContextValues_shouldBatchSeparately() {
        SubjectPlan plan = canonicalizer.plan("obj-a", List.of(
                row("context(channel:x).window()", D1, T0, 50, 5),
                row("context(channel:x).window()", D2, T0.plusSeconds(10), 50, 6),
                row("context(channel:y).window()", D1, T0.plusSeconds(90), 40, 4)));

        assertEquals(1, plan.updates().size());
        SubjectPlan.Retime only = plan.updates().get(0);
        assertEquals("context(channel:x).window()", only.row().sliceKey().toDsl());
        assertEquals(T0, only.canonicalTs());
    }

    @Test
    void plan_rowOfOtherSubject_shouldBeRejected() {
        SnapshotRow foreign = new SnapshotRow("obj-b", "h1", SliceKey.parse("window()"), D1, T0,
                SnapshotMetrics.counts(1, 1));

        assertThrows(IllegalArgumentException.class, () -> canonicalizer.plan("obj-a", List.of(foreign)));
    }

    @Test
    void constructor_windowOutOfRange_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BatchCanonicalizer(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new BatchCanonicalizer(Duration.ofSeconds(3601)));
    }

    @Test
    void fingerprint_shouldIgnoreTimestampOnly() {
        SnapshotRow a = row("window()", D1, T0, 100, 10);

        assertEquals(ContentFingerprint.of(a), ContentFingerprint.of(a.withRetrievedAt(T0.plusSeconds(5))));
        assertNotEquals(ContentFingerprint.of(a), ContentFingerprint.of(row("window()", D1, T0, 100, 11)));
        assertNotEquals(ContentFingerprint.of(a), ContentFingerprint.of(row("window(-7d:-1d)", D1, T0, 100, 10)));
    }
}
