package de.bsommerfeld.tscache.db;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.util.List;
import java.util.Objects;

/**
 * One sub-write of a retrieval batch: rows of a single subject and hash,
 * written in one transaction.
 *
 * @param subject            subject and core hash every row must carry
 * @param canonicalSignature signature text registered for the hash, or
 *                           {@code null} to skip registration
 * @param rows               rows to append
 */
public record SnapshotWrite(SubjectRef subject, String canonicalSignature, List<SnapshotRow> rows) {

    public SnapshotWrite {
        Objects.requireNonNull(subject, "subject");
        rows = List.copyOf(rows);
        for (SnapshotRow row : rows) {
            if (!row.subjectRef().equals(subject))
                throw new IllegalArgumentException("Row " + row.subjectRef() + " does not belong to " + subject);
        }
    }

    public static SnapshotWrite of(SubjectRef subject, List<SnapshotRow> rows) {
        return new SnapshotWrite(subject, null, rows);
    }
}
