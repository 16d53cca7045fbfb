package de.bsommerfeld.tscache.retrieval.provider;

import java.util.Locale;

/**
 * Recognises rate-limit failures that providers report as generic errors:
 * HTTP 429, or a message mentioning "rate limit" or "too many requests"
 * anywhere in the cause chain.
 */
public final class RateLimitClassifier {

    private RateLimitClassifier() {
    }

    public static boolean isRateLimit(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RateLimitedException)
                return true;
            if (t instanceof ProviderException pe && pe.getStatusCode() == 429)
                return true;
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("rate limit") || lower.contains("ratelimit")
                        || lower.contains("too many requests") || lower.contains("429"))
                    return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code error} typed as {@link RateLimitedException} when it is
     * one, {@code null} otherwise.
     */
    public static RateLimitedException asRateLimit(ProviderException error) {
        if (error instanceof RateLimitedException rle)
            return rle;
        return isRateLimit(error) ? new RateLimitedException(error.getMessage(), error) : null;
    }
}
