package de.bsommerfeld.tscache.retrieval.provider;

/**
 * The provider refused the request because its quota is exhausted. Retrying
 * only makes sense after a cooldown.
 */
public class RateLimitedException extends ProviderException {

    public RateLimitedException(String message) {
        super(message, 429, null);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
