package de.bsommerfeld.tscache.retrieval;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Waits out a provider rate limit. Injected so tests can replace the wait.
 */
public interface Cooldown {

    /**
     * Blocks for {@code duration} unless {@code shouldAbort} turns true first.
     */
    CooldownOutcome await(Duration duration, BooleanSupplier shouldAbort);
}
