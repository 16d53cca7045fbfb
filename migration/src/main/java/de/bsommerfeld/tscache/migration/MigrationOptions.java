package de.bsommerfeld.tscache.migration;

import java.time.Duration;
import java.time.Instant;

/**
 * Parameters of one migration run. Exactly one of {@code subjectId} and
 * {@code subjectPrefix} is set.
 *
 * @param subjectId            migrate this subject only
 * @param subjectPrefix        migrate every subject whose id starts with this
 * @param retrievedFrom        only select subjects with a row retrieved at or after this, may be {@code null}
 * @param retrievedTo          only select subjects with a row retrieved at or before this, may be {@code null}
 * @param window               maximum gap between timestamps of one batch
 * @param commit               apply the plan; otherwise only report it
 * @param allowDeleteIdentical permit dropping redundant identical copies
 */
public record MigrationOptions(
        String subjectId,
        String subjectPrefix,
        Instant retrievedFrom,
        Instant retrievedTo,
        Duration window,
        boolean commit,
        boolean allowDeleteIdentical) {

    public MigrationOptions {
        if ((subjectId == null) == (subjectPrefix == null))
            throw new IllegalArgumentException("Exactly one of subject and subject prefix is required");
        if (subjectId != null && subjectId.isBlank())
            throw new IllegalArgumentException("Subject must not be blank");
        if (subjectPrefix != null && subjectPrefix.isBlank())
            throw new IllegalArgumentException("Subject prefix must not be blank");
        if (retrievedFrom != null && retrievedTo != null && retrievedFrom.isAfter(retrievedTo))
            throw new IllegalArgumentException("retrieved-from is after retrieved-to");
        if (window == null)
            throw new IllegalArgumentException("Window is required");
    }

    public static MigrationOptions forSubject(String subjectId, Duration window) {
        return new MigrationOptions(subjectId, null, null, null, window, false, false);
    }

    public static MigrationOptions forPrefix(String prefix, Duration window) {
        return new MigrationOptions(null, prefix, null, null, window, false, false);
    }

    public MigrationOptions committing(boolean allowDelete) {
        return new MigrationOptions(subjectId, subjectPrefix, retrievedFrom, retrievedTo, window, true, allowDelete);
    }

    public MigrationOptions retrievedBetween(Instant from, Instant to) {
        return new MigrationOptions(subjectId, subjectPrefix, from, to, window, commit, allowDeleteIdentical);
    }

    boolean selects(Instant retrievedAt) {
        return (retrievedFrom == null || !retrievedAt.isBefore(retrievedFrom))
                && (retrievedTo == null || !retrievedAt.isAfter(retrievedTo));
    }
}
