package de.bsommerfeld.tscache.retrieval.provider;

/**
 * Failure reported by an analytics provider. Carries the HTTP status when the
 * provider exposed one, {@code -1} otherwise.
 */
public class ProviderException extends Exception {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public ProviderException(String message) {
        this(message, NO_STATUS, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
