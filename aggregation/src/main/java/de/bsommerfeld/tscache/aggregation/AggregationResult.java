package de.bsommerfeld.tscache.aggregation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link MeceAggregator#aggregate}: one entry per anchor day,
 * ordered by day.
 *
 * @param days       per-day results
 * @param contextKey the context key that was summed over, {@code null} if none
 * @param refusal    set when the row set as a whole could not be summed
 */
public record AggregationResult(List<DayAggregate> days, String contextKey, RefusalReason refusal) {

    public AggregationResult {
        days = List.copyOf(days);
    }

    public Optional<DayAggregate> day(LocalDate anchorDay) {
        return days.stream().filter(d -> d.anchorDay().equals(anchorDay)).findFirst();
    }

    /** Days that carry a value, explicit or summed. */
    public List<DayAggregate> valuedDays() {
        return days.stream().filter(DayAggregate::hasValue).toList();
    }

    public boolean isRefused() {
        return refusal != null;
    }
}
