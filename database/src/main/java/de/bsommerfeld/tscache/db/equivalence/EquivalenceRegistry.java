package de.bsommerfeld.tscache.db.equivalence;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Operator-facing registry of equivalence links and their transitive closure.
 *
 * <h3>Closure</h3>
 * {@link #resolveClosure(SubjectRef)} walks active links in both directions
 * with an explicit worklist and a visited set, so cycles ({@code A-B-C-A})
 * terminate and no link chain can overflow the stack. The seed is always a
 * member, even when it has no links at all.
 *
 * <p>
 * Links are never inferred; only {@link #createLink} adds them.
 */
@Singleton
public class EquivalenceRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EquivalenceRegistry.class);

    private final LinkStore linkStore;
    private final Clock clock;

    @Inject
    public EquivalenceRegistry(LinkStore linkStore, Clock clock) {
        this.linkStore = linkStore;
        this.clock = clock;
    }

    /**
     * Declares {@code seed} and {@code target} equivalent. Re-creating an
     * existing link re-activates it and returns the same id; the original
     * author is kept and {@code createdBy} is recorded as the re-activator.
     *
     * @throws IllegalArgumentException for a self link or a blank author
     */
    public long createLink(SubjectRef seed, SubjectRef target, String createdBy, String reason) {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(target, "target");
        if (seed.equals(target))
            throw new IllegalArgumentException("Refusing self link on " + seed);
        if (createdBy == null || createdBy.isBlank())
            throw new IllegalArgumentException("createdBy must be given");

        long id = linkStore.activate(seed, target, createdBy.trim(), reason, clock.instant());
        LOG.info("Equivalence link {} active: {} <-> {} ({})", id, seed, target, createdBy);
        return id;
    }

    /**
     * Soft-deletes the link from {@code seed} to {@code target}.
     *
     * @return {@code false} if there was no active link to deactivate
     */
    public boolean deactivateLink(SubjectRef seed, SubjectRef target, String deactivatedBy, String reason) {
        boolean changed = linkStore.deactivate(seed, target, deactivatedBy, reason, clock.instant());
        if (changed) {
            LOG.info("Equivalence link deactivated: {} -> {} ({})", seed, target, deactivatedBy);
        } else {
            LOG.debug("No active link {} -> {} to deactivate", seed, target);
        }
        return changed;
    }

    /**
     * Lists links touching {@code ref}, or all links when {@code ref} is
     * {@code null}.
     */
    public List<EquivalenceLink> listLinks(SubjectRef ref, boolean includeInactive) {
        return ref == null
                ? linkStore.allLinks(includeInactive)
                : linkStore.linksTouching(ref, includeInactive);
    }

    /**
     * Every {@link SubjectRef} reachable from {@code seed} over active links,
     * the seed included.
     */
    public Set<SubjectRef> resolveClosure(SubjectRef seed) {
        Objects.requireNonNull(seed, "seed");
        Set<SubjectRef> visited = new TreeSet<>();
        Deque<SubjectRef> worklist = new ArrayDeque<>();
        visited.add(seed);
        worklist.add(seed);

        while (!worklist.isEmpty()) {
            SubjectRef current = worklist.poll();
            for (EquivalenceLink link : linkStore.linksTouching(current, false)) {
                SubjectRef next = link.otherEnd(current);
                if (visited.add(next))
                    worklist.add(next);
            }
        }

        if (visited.size() > 1)
            LOG.debug("Closure of {} has {} members", seed, visited.size());
        return Collections.unmodifiableSet(visited);
    }
}
