package de.bsommerfeld.tscache.retrieval.provider;

import de.bsommerfeld.tscache.core.domain.DailyPoint;

import java.util.List;

/**
 * Provider-specific request translation lives behind this port. The host
 * application binds an implementation.
 */
public interface ProviderClient {

    /**
     * Fetches the daily points of one request.
     *
     * @throws RateLimitedException if the provider quota is exhausted
     * @throws ProviderException    on any other provider failure
     */
    List<DailyPoint> fetch(ProviderRequest request) throws ProviderException;
}
