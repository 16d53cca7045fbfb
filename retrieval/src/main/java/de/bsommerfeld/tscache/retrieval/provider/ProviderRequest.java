package de.bsommerfeld.tscache.retrieval.provider;

import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.retrieval.FetchWindow;

/**
 * One provider call: the daily series of {@code objectId} under
 * {@code sliceKey} for the days of {@code window}.
 */
public record ProviderRequest(String objectId, String coreHash, SliceKey sliceKey, FetchWindow window) {
}
