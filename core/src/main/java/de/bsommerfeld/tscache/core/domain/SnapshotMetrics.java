package de.bsommerfeld.tscache.core.domain;

/**
 * Value part of a snapshot row. All fields are nullable: window-mode queries
 * have no anchor entrants and lag statistics are only present for
 * latency-tracked series.
 *
 * @param anchorEntrants      cohort anchor entrants ({@code A})
 * @param denominator         from-step count ({@code X})
 * @param numerator           to-step count / conversions ({@code Y})
 * @param medianLagDays       median conversion lag in days
 * @param meanLagDays         mean conversion lag in days
 * @param anchorMedianLagDays anchor-relative median lag in days
 * @param anchorMeanLagDays   anchor-relative mean lag in days
 * @param onsetDeltaDays      onset delay derived from the lag histogram
 */
public record SnapshotMetrics(
        Long anchorEntrants,
        Long denominator,
        Long numerator,
        Double medianLagDays,
        Double meanLagDays,
        Double anchorMedianLagDays,
        Double anchorMeanLagDays,
        Double onsetDeltaDays) {

    /** Metrics with only the two counts set. */
    public static SnapshotMetrics counts(long denominator, long numerator) {
        return new SnapshotMetrics(null, denominator, numerator, null, null, null, null, null);
    }

    /** Cohort metrics: anchor entrants plus the two counts. */
    public static SnapshotMetrics cohortCounts(long anchorEntrants, long denominator, long numerator) {
        return new SnapshotMetrics(anchorEntrants, denominator, numerator, null, null, null, null, null);
    }

    public boolean hasLatency() {
        return medianLagDays != null || meanLagDays != null;
    }
}
