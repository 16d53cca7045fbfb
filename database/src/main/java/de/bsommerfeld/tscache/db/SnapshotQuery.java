package de.bsommerfeld.tscache.db;

import de.bsommerfeld.tscache.core.domain.SliceFamily;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filter of {@link SnapshotStore#queryRaw(SnapshotQuery)}. Every field except
 * the subject set is optional ({@code null} means unrestricted).
 *
 * @param subjects      subjects to read, typically an equivalence closure
 * @param family        only rows of this slice family
 * @param anchorFrom    inclusive lower anchor bound
 * @param anchorTo      inclusive upper anchor bound
 * @param retrievedUpTo inclusive upper bound on {@code retrieved_at}
 */
public record SnapshotQuery(
        Set<SubjectRef> subjects,
        SliceFamily family,
        LocalDate anchorFrom,
        LocalDate anchorTo,
        Instant retrievedUpTo) {

    public SnapshotQuery {
        Objects.requireNonNull(subjects, "subjects");
        if (subjects.isEmpty())
            throw new IllegalArgumentException("query needs at least one subject");
        subjects = Collections.unmodifiableSortedSet(new TreeSet<>(subjects));
    }

    public static SnapshotQuery of(SubjectRef subject) {
        return new SnapshotQuery(Set.of(subject), null, null, null, null);
    }

    public static SnapshotQuery of(Set<SubjectRef> subjects) {
        return new SnapshotQuery(subjects, null, null, null, null);
    }

    public SnapshotQuery withFamily(SliceFamily newFamily) {
        return new SnapshotQuery(subjects, newFamily, anchorFrom, anchorTo, retrievedUpTo);
    }

    public SnapshotQuery withAnchorRange(LocalDate from, LocalDate to) {
        return new SnapshotQuery(subjects, family, from, to, retrievedUpTo);
    }

    public SnapshotQuery withRetrievedUpTo(Instant upTo) {
        return new SnapshotQuery(subjects, family, anchorFrom, anchorTo, upTo);
    }
}
