package de.bsommerfeld.tscache.retrieval;

import de.bsommerfeld.tscache.core.domain.SubjectIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State of one {@link RetrievalOrchestrator#execute} call: the batch
 * timestamp of every identity seen so far and the identities that must
 * bypass the cache on their next execution.
 *
 * <p>
 * Timestamps are minted lazily on first use and shared by every item of the
 * same identity. After {@link #invalidate} the next mint is guaranteed to be
 * strictly later than the discarded one, even if the clock has not advanced,
 * so a retried batch never shares its identity with the interrupted one.
 */
public class RetrievalRun {

    private static final Logger LOG = LoggerFactory.getLogger(RetrievalRun.class);

    private final Clock clock;
    private final Map<SubjectIdentity, Instant> timestamps = new HashMap<>();
    private final Map<SubjectIdentity, Instant> discarded = new HashMap<>();
    private final Set<SubjectIdentity> forcedBypass = new HashSet<>();

    public RetrievalRun(Clock clock) {
        this.clock = clock;
    }

    public Instant batchTimestamp(SubjectIdentity identity) {
        return timestamps.computeIfAbsent(identity, this::mint);
    }

    private Instant mint(SubjectIdentity identity) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant previous = discarded.get(identity);
        if (previous != null && !now.isAfter(previous))
            now = previous.plusMillis(1);
        LOG.debug("[Retrieval] Minted batch timestamp {} for {}", now, identity);
        return now;
    }

    /** Discards the timestamp of {@code identity} only; other identities keep theirs. */
    public void invalidate(SubjectIdentity identity) {
        Instant old = timestamps.remove(identity);
        if (old != null)
            discarded.put(identity, old);
    }

    public void forceBypass(SubjectIdentity identity) {
        forcedBypass.add(identity);
    }

    public boolean isForcedBypass(SubjectIdentity identity) {
        return forcedBypass.contains(identity);
    }

    public void clearForcedBypass(SubjectIdentity identity) {
        forcedBypass.remove(identity);
    }

    /** Timestamp currently assigned to {@code identity}, or {@code null}. */
    public Instant peek(SubjectIdentity identity) {
        return timestamps.get(identity);
    }
}
