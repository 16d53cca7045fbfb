package de.bsommerfeld.tscache.retrieval;

import de.bsommerfeld.tscache.retrieval.provider.PartialBatchInterruptedException;
import de.bsommerfeld.tscache.retrieval.provider.ProviderException;
import de.bsommerfeld.tscache.retrieval.provider.RateLimitedException;

/**
 * Executes one plan item under the batch timestamp chosen by the
 * orchestrator. Implementations never mint timestamps themselves.
 */
public interface SliceExecutor {

    /**
     * @throws RateLimitedException              if the provider quota ran out before anything was written
     * @throws PartialBatchInterruptedException  if it ran out after some rows were written
     * @throws ProviderException                 on any other provider failure
     */
    SliceExecutionResult execute(SliceExecution execution) throws ProviderException;
}
