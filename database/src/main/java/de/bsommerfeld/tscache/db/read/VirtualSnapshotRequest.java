package de.bsommerfeld.tscache.db.read;

import de.bsommerfeld.tscache.core.domain.SliceFamily;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * "What was known about {@code seed} as of {@code asOf}?"
 *
 * <p>
 * Inverted anchor bounds are swapped rather than rejected.
 *
 * @param seed              subject and hash the caller asks about
 * @param asOf              inclusive cutoff on {@code retrieved_at}
 * @param family            restrict to one slice family, or {@code null}
 * @param anchorFrom        inclusive lower anchor bound, or {@code null}
 * @param anchorTo          inclusive upper anchor bound, or {@code null}
 * @param expandEquivalents read across the equivalence closure of the seed
 */
public record VirtualSnapshotRequest(
        SubjectRef seed,
        Instant asOf,
        SliceFamily family,
        LocalDate anchorFrom,
        LocalDate anchorTo,
        boolean expandEquivalents) {

    public VirtualSnapshotRequest {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(asOf, "asOf");
        if (anchorFrom != null && anchorTo != null && anchorFrom.isAfter(anchorTo)) {
            LocalDate swap = anchorFrom;
            anchorFrom = anchorTo;
            anchorTo = swap;
        }
    }

    /** Closure-expanded request without slice or anchor restrictions. */
    public static VirtualSnapshotRequest of(SubjectRef seed, Instant asOf) {
        return new VirtualSnapshotRequest(seed, asOf, null, null, null, true);
    }

    public VirtualSnapshotRequest withFamily(SliceFamily newFamily) {
        return new VirtualSnapshotRequest(seed, asOf, newFamily, anchorFrom, anchorTo, expandEquivalents);
    }

    public VirtualSnapshotRequest withAnchorRange(LocalDate from, LocalDate to) {
        return new VirtualSnapshotRequest(seed, asOf, family, from, to, expandEquivalents);
    }

    public VirtualSnapshotRequest withExpansion(boolean expand) {
        return new VirtualSnapshotRequest(seed, asOf, family, anchorFrom, anchorTo, expand);
    }
}
