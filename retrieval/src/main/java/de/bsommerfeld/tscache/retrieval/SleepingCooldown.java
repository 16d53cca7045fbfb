package de.bsommerfeld.tscache.retrieval;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Blocks the calling thread, checking the abort signal once per second.
 * Interruption counts as an abort; the interrupt flag is restored.
 */
@Singleton
public class SleepingCooldown implements Cooldown {

    private static final Logger LOG = LoggerFactory.getLogger(SleepingCooldown.class);

    private static final long POLL_MILLIS = 1000L;

    @Override
    public CooldownOutcome await(Duration duration, BooleanSupplier shouldAbort) {
        long deadline = System.nanoTime() + duration.toNanos();
        LOG.warn("[Retrieval] Rate limited. Cooling down for {} minute(s)", duration.toMinutes());

        while (true) {
            if (shouldAbort.getAsBoolean()) {
                LOG.info("[Retrieval] Cooldown aborted");
                return CooldownOutcome.ABORTED;
            }
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0)
                return CooldownOutcome.COMPLETED;
            try {
                Thread.sleep(Math.min(POLL_MILLIS, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("[Retrieval] Cooldown interrupted");
                return CooldownOutcome.ABORTED;
            }
        }
    }
}
