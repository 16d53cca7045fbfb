package de.bsommerfeld.tscache.aggregation;

import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Uncontexted value of one anchor day, or the reason there is none.
 *
 * @param anchorDay         the day
 * @param source            where the value came from
 * @param metrics           summed (or explicit) metrics; {@code null} when refused
 * @param refusal           refusal reason; {@code null} unless refused
 * @param detail            human readable explanation of a refusal
 * @param missingValues     expected values absent on the day, for
 *                          {@link RefusalReason#INCOMPLETE_PARTITION}
 * @param definitionVersion definition version the day was judged by, if any
 */
public record DayAggregate(
        LocalDate anchorDay,
        Source source,
        SnapshotMetrics metrics,
        RefusalReason refusal,
        String detail,
        Set<String> missingValues,
        String definitionVersion) {

    public enum Source {
        /** An uncontexted row existed and was used as is. */
        EXPLICIT_UNCONTEXTED,
        /** Summed from a complete partition. */
        AGGREGATED,
        REFUSED
    }

    public DayAggregate {
        Objects.requireNonNull(anchorDay, "anchorDay");
        Objects.requireNonNull(source, "source");
        missingValues = missingValues == null ? Set.of() : Set.copyOf(missingValues);
    }

    static DayAggregate explicit(LocalDate day, SnapshotMetrics metrics) {
        return new DayAggregate(day, Source.EXPLICIT_UNCONTEXTED, metrics, null, null, Set.of(), null);
    }

    static DayAggregate aggregated(LocalDate day, SnapshotMetrics metrics, String version) {
        return new DayAggregate(day, Source.AGGREGATED, metrics, null, null, Set.of(), version);
    }

    static DayAggregate refused(LocalDate day, RefusalReason reason, String detail) {
        return new DayAggregate(day, Source.REFUSED, null, reason, detail, Set.of(), null);
    }

    static DayAggregate incomplete(LocalDate day, Set<String> missing, String version) {
        return new DayAggregate(day, Source.REFUSED, null, RefusalReason.INCOMPLETE_PARTITION,
                "missing values " + missing, missing, version);
    }

    public boolean hasValue() {
        return source != Source.REFUSED;
    }
}
