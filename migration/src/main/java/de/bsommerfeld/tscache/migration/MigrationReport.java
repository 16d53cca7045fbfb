package de.bsommerfeld.tscache.migration;

import java.time.Duration;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Outcome of a migration run, one entry per selected subject.
 */
public record MigrationReport(Duration window, boolean committed, List<SubjectReport> subjects) {

    public MigrationReport {
        subjects = List.copyOf(subjects);
    }

    public int totalRows() {
        return sum(s -> s.plan().rowsInScope());
    }

    public int totalGroupsTouched() {
        return sum(s -> s.plan().groupsTouched());
    }

    public int totalToDelete() {
        return sum(s -> s.plan().deletions().size());
    }

    public int totalToUpdate() {
        return sum(s -> s.plan().updates().size());
    }

    public int totalDeleted() {
        return sum(SubjectReport::deleted);
    }

    public int totalUpdated() {
        return sum(SubjectReport::updated);
    }

    private int sum(ToIntFunction<SubjectReport> field) {
        return subjects.stream().mapToInt(field).sum();
    }
}
