package de.bsommerfeld.tscache.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the cache. {@link #TEST} swaps the SQLite stores for
 * in-memory ones so nothing is persisted.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current mode from the {@code app.mode} system property or
     * the {@code APP_MODE} environment variable. Defaults to PROD if neither is
     * set or the value is unknown.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
