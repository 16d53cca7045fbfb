package de.bsommerfeld.tscache.retrieval;

import de.bsommerfeld.tscache.core.domain.SubjectIdentity;

import java.time.Duration;
import java.time.Instant;

/**
 * Progress events the orchestrator posts on the application event bus.
 */
public class RetrievalEvents {

    private RetrievalEvents() {
    }

    public record CooldownStartedEvent(String itemKey, SubjectIdentity identity, Duration duration,
            Instant resumesAt) {
    }

    public record CooldownFinishedEvent(String itemKey, CooldownOutcome outcome) {
    }

    public record ItemCompletedEvent(ItemOutcome outcome) {
    }

    public record RunFinishedEvent(RetrievalReport report) {
    }
}
