package de.bsommerfeld.tscache.db.equivalence;

import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.util.List;

/**
 * Persistence of equivalence links. Implementations do not validate link
 * semantics; {@link EquivalenceRegistry} does.
 */
public interface LinkStore {

    /**
     * Inserts the link or re-activates an existing one with the same
     * endpoints. Re-activation records {@code createdBy}, {@code reason} and
     * {@code at} as the re-activation and keeps the original creation and the
     * last deactivation. Activating an active link changes nothing.
     *
     * @return the id of the (re-)activated link
     */
    long activate(SubjectRef seed, SubjectRef target, String createdBy, String reason, Instant at);

    /** Soft-deletes an active link. Returns {@code false} if no active link matched. */
    boolean deactivate(SubjectRef seed, SubjectRef target, String deactivatedBy, String reason, Instant at);

    /** Links touching {@code ref} at either end. */
    List<EquivalenceLink> linksTouching(SubjectRef ref, boolean includeInactive);

    List<EquivalenceLink> allLinks(boolean includeInactive);
}
