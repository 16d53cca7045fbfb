package de.bsommerfeld.tscache.migration;

/**
 * The migration declined to write. Thrown before the first subject is
 * touched.
 */
public class MigrationRefusedException extends Exception {

    public MigrationRefusedException(String message) {
        super(message);
    }
}
