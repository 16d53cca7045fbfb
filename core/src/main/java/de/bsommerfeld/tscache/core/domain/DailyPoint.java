package de.bsommerfeld.tscache.core.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of provider output before it is bound to a subject, slice and batch
 * timestamp.
 */
public record DailyPoint(LocalDate anchorDay, SnapshotMetrics metrics) {

    public DailyPoint {
        Objects.requireNonNull(anchorDay, "anchorDay");
        Objects.requireNonNull(metrics, "metrics");
    }

    public static DailyPoint of(LocalDate anchorDay, long denominator, long numerator) {
        return new DailyPoint(anchorDay, SnapshotMetrics.counts(denominator, numerator));
    }
}
