package de.bsommerfeld.tscache.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.config.ApplicationMode;
import de.bsommerfeld.tscache.core.config.ConfigLoader;
import de.bsommerfeld.tscache.core.config.GlobalConfig;
import de.bsommerfeld.tscache.db.equivalence.InMemoryLinkStore;
import de.bsommerfeld.tscache.db.equivalence.LinkStore;
import de.bsommerfeld.tscache.db.equivalence.SqlLinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring of the snapshot and link stores. {@link ApplicationMode#TEST}
 * binds the in-memory implementations, PROD the SQLite ones.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final ApplicationMode mode;

    public DatabaseModule() {
        this(ApplicationMode.get());
    }

    public DatabaseModule(ApplicationMode mode) {
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Database mode: {}", mode);
        if (mode.isTest()) {
            bind(SnapshotStore.class).to(InMemorySnapshotStore.class);
            bind(LinkStore.class).to(InMemoryLinkStore.class);
        } else {
            bind(SnapshotStore.class).to(SqlSnapshotStore.class);
            bind(LinkStore.class).to(SqlLinkStore.class);
        }
    }

    @Provides
    @Singleton
    SqliteDatabase sqliteDatabase(GlobalConfig config) {
        return new SqliteDatabase(ConfigLoader.resolveDatabasePath(config));
    }
}
