package de.bsommerfeld.tscache.retrieval;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of anchor days requested from the provider in one call.
 */
public record FetchWindow(LocalDate from, LocalDate to) {

    public FetchWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to))
            throw new IllegalArgumentException("window starts after it ends: " + from + " > " + to);
    }

    public static FetchWindow of(LocalDate from, LocalDate to) {
        return new FetchWindow(from, to);
    }

    public static FetchWindow day(LocalDate day) {
        return new FetchWindow(day, day);
    }

    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1))
            days.add(d);
        return days;
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(from) && !day.isAfter(to);
    }
}
