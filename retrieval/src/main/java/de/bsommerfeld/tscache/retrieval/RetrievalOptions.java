package de.bsommerfeld.tscache.retrieval;

import de.bsommerfeld.tscache.core.config.RetrievalConfig;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Per-run switches.
 *
 * @param automated   unattended run: rate limits trigger a cooldown and retry
 *                    instead of failing the run
 * @param bypassCache refetch every window even when cached rows exist
 * @param shouldAbort polled between items and during cooldowns
 */
public record RetrievalOptions(boolean automated, boolean bypassCache, BooleanSupplier shouldAbort) {

    private static final BooleanSupplier NEVER = () -> false;

    public RetrievalOptions {
        Objects.requireNonNull(shouldAbort, "shouldAbort");
    }

    public static RetrievalOptions automated() {
        return new RetrievalOptions(true, false, NEVER);
    }

    public static RetrievalOptions manual() {
        return new RetrievalOptions(false, false, NEVER);
    }

    /** Mode as configured by {@code retrieval.automated}. */
    public static RetrievalOptions fromConfig(RetrievalConfig config) {
        return config.isAutomated() ? automated() : manual();
    }

    public RetrievalOptions withBypassCache(boolean bypass) {
        return new RetrievalOptions(automated, bypass, shouldAbort);
    }

    public RetrievalOptions withAbortSignal(BooleanSupplier abort) {
        return new RetrievalOptions(automated, bypassCache, abort);
    }
}
