package de.bsommerfeld.tscache.db;

/**
 * Unchecked failure of the snapshot or link store. The unit of work that
 * raised it has already been rolled back.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
