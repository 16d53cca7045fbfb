package de.bsommerfeld.tscache.db.equivalence;

import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;

/**
 * Operator-asserted statement that two differently keyed series describe the
 * same underlying data. Stored directed, traversed in both directions.
 *
 * <p>
 * Deactivated links stay in the store with the {@code deactivated*} fields
 * set; they no longer contribute to any closure. Re-activation fills the
 * {@code reactivated*} fields and leaves the creator and the last
 * deactivation untouched.
 */
public record EquivalenceLink(
        long linkId,
        SubjectRef seed,
        SubjectRef target,
        boolean active,
        String createdBy,
        String reason,
        Instant createdAt,
        String deactivatedBy,
        String deactivatedReason,
        Instant deactivatedAt,
        String reactivatedBy,
        String reactivatedReason,
        Instant reactivatedAt) {

    static EquivalenceLink created(long linkId, SubjectRef seed, SubjectRef target, String createdBy, String reason,
            Instant at) {
        return new EquivalenceLink(linkId, seed, target, true, createdBy, reason, at, null, null, null, null, null,
                null);
    }

    EquivalenceLink deactivated(String by, String why, Instant at) {
        return new EquivalenceLink(linkId, seed, target, false, createdBy, reason, createdAt, by, why, at,
                reactivatedBy, reactivatedReason, reactivatedAt);
    }

    EquivalenceLink reactivated(String by, String why, Instant at) {
        return new EquivalenceLink(linkId, seed, target, true, createdBy, reason, createdAt, deactivatedBy,
                deactivatedReason, deactivatedAt, by, why, at);
    }

    public boolean touches(SubjectRef ref) {
        return seed.equals(ref) || target.equals(ref);
    }

    /** The endpoint opposite to {@code ref}. */
    public SubjectRef otherEnd(SubjectRef ref) {
        return seed.equals(ref) ? target : seed;
    }
}
